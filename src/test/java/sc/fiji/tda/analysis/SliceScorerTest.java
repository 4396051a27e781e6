/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.tda.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;

import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/**
 * Tests for {@link SliceScorer}
 */
public class SliceScorerTest {

	static ImageProcessor noise(final int seed, final int mean, final int amplitude) {
		final Random random = new Random(seed);
		final ByteProcessor bp = new ByteProcessor(64, 64);
		for (int i = 0; i < bp.getPixelCount(); i++)
			bp.set(i, Math.max(0, Math.min(255, mean + (int) Math.round(random.nextGaussian() * amplitude))));
		return bp;
	}

	/* noisy background crossed by bright lines */
	static ImageProcessor structured(final int seed) {
		final ImageProcessor ip = noise(seed, 20, 3);
		for (int x = 0; x < ip.getWidth(); x++) {
			for (int dy = -1; dy <= 1; dy++) {
				ip.set(x, 20 + dy, 200);
				ip.set(x, 44 + dy, 200);
			}
		}
		for (int y = 0; y < ip.getHeight(); y++)
			ip.set(32, y, 200);
		return ip;
	}

	@Test
	public void testConstantSliceNoiseFloor() {
		final ShortProcessor sp = new ShortProcessor(16, 16);
		sp.setValue(500);
		sp.fill();
		final SliceScore score = new SliceScorer(0, 20, 1).score(sp, 3);
		assertEquals("Index", 3, score.getIndex());
		assertEquals("Noise", SliceScorer.NOISE_FLOOR, score.getNoise(), 0);
		assertEquals("Background", 500, score.getBackground(), 0);
		assertEquals("Signal falls back to mean", 500, score.getSignal(), 0);
		assertEquals("SNR", 0, score.getSNR(), 0);
		assertEquals("Empty skeleton", 0, score.getSkeletonLength());

		final SliceScore blurred = new SliceScorer().score(sp, 0);
		assertTrue("Noise floor", blurred.getNoise() >= SliceScorer.NOISE_FLOOR);
		assertTrue("Noise", blurred.getNoise() < 1e-2);
		assertEquals("Background", 500, blurred.getBackground(), 1e-2);
	}

	@Test
	public void testStructureOutscoresNoise() {
		final SliceScorer scorer = new SliceScorer(1, 20, 1);
		final SliceScore structured = scorer.score(structured(1), 0);
		final SliceScore flat = scorer.score(noise(1, 20, 3), 1);
		assertTrue("SNR", structured.getSNR() > flat.getSNR());
		assertTrue("Skeleton", structured.getSkeletonLength() > 0);
		assertTrue("Composite", structured.getComposite() > flat.getComposite());
		assertEquals("Composite", structured.getSNR() + structured.getSkeletonDensity(), structured.getComposite(),
				1e-9);
	}

	@Test
	public void testStructuralWeight() {
		final ImageProcessor ip = structured(7);
		final SliceScore unweighted = new SliceScorer(1, 20, 0).score(ip, 0);
		final SliceScore weighted = new SliceScorer(1, 20, 100).score(ip, 0);
		assertEquals(unweighted.getSNR(), weighted.getSNR(), 1e-9);
		assertEquals(weighted.getSNR() + 100 * weighted.getSkeletonDensity(), weighted.getComposite(), 1e-9);
	}

	@Test
	public void testBasicScore() {
		final ByteProcessor bp = new ByteProcessor(2, 2);
		bp.set(0, 10);
		bp.set(1, 10);
		bp.set(2, 30);
		bp.set(3, 30);
		final SliceScore score = new SliceScorer().scoreBasic(bp, 0);
		assertEquals("mean/std", 20d / 10d, score.getSNR(), 1e-9);
		assertEquals(score.getSNR(), score.getComposite(), 0);

		final ByteProcessor flat = new ByteProcessor(4, 4);
		assertEquals("Flat slice", 0, new SliceScorer().scoreBasic(flat, 0).getSNR(), 0);
	}

	@Test
	public void testSkeletonOfEmptyMask() {
		assertEquals(0, SliceScorer.skeletonLength(new ByteProcessor(5, 5)));
	}

	@Test
	public void testThickBarIsThinned() {
		final int w = 20, h = 9;
		final ByteProcessor mask = new ByteProcessor(w, h);
		for (int y = 3; y <= 5; y++)
			for (int x = 2; x <= 17; x++)
				mask.set(x, y, 255);
		final int length = SliceScorer.skeletonLength(mask);
		assertTrue("Skeleton not empty", length > 0);
		assertTrue("Skeleton thinner than bar: " + length, length < 16 * 3 / 2);
		for (int y = 0; y < h; y++) {
			for (int x = 0; x < w; x++) {
				if (mask.get(x, y) == 255)
					assertTrue("Skeleton pixel outside bar at " + x + "," + y, y >= 3 && y <= 5 && x >= 2 && x <= 17);
			}
		}
		for (int x = 5; x <= 14; x++) {
			int n = 0;
			for (int y = 0; y < h; y++) {
				if (mask.get(x, y) == 255) n++;
			}
			assertEquals("One pixel wide at x=" + x, 1, n);
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidPercentile() {
		new SliceScorer(1, 0, 1);
	}

}
