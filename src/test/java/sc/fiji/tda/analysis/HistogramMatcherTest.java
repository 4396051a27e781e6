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

import org.junit.Test;

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ShortProcessor;

/**
 * Tests for {@link HistogramMatcher}
 */
public class HistogramMatcherTest {

	@Test
	public void testMatchToSelfIsIdentity() {
		final ByteProcessor bp = new ByteProcessor(3, 2, new byte[] { 1, 5, 5, 9, 20, 100 });
		final FloatProcessor matched = HistogramMatcher.match(bp, bp);
		for (int i = 0; i < bp.getPixelCount(); i++)
			assertEquals("Pixel " + i, bp.get(i), matched.getf(i), 1e-6);
	}

	@Test
	public void testMatchShiftedReference() {
		final short[] src = new short[100];
		final short[] ref = new short[100];
		for (int i = 0; i < src.length; i++) {
			src[i] = (short) i;
			ref[i] = (short) (1000 + 2 * i);
		}
		final FloatProcessor matched = HistogramMatcher.match(new ShortProcessor(10, 10, src, null),
				new ShortProcessor(10, 10, ref, null));
		for (int i = 0; i < src.length; i++)
			assertEquals("Pixel " + i, 1000 + 2 * i, matched.getf(i), 1e-3);
	}

	@Test
	public void testInterpolatesBetweenReferenceLevels() {
		// source: two equally frequent levels; reference: four equally frequent levels
		final ByteProcessor src = new ByteProcessor(4, 1, new byte[] { 0, 0, 50, 50 });
		final ByteProcessor ref = new ByteProcessor(4, 1, new byte[] { 10, 20, 30, 40 });
		final FloatProcessor matched = HistogramMatcher.match(src, ref);
		// source quantiles 0.5 and 1.0 map onto reference levels 20 and 40
		assertEquals(20, matched.getf(0), 1e-6);
		assertEquals(40, matched.getf(3), 1e-6);
	}

	@Test
	public void testInterpolate() {
		final double[] xp = { 0.25, 0.5, 1.0 };
		final int[] fp = { 10, 20, 40 };
		assertEquals("Below range", 10, HistogramMatcher.interpolate(0.1, xp, fp), 0);
		assertEquals("Exact", 20, HistogramMatcher.interpolate(0.5, xp, fp), 0);
		assertEquals("Between", 30, HistogramMatcher.interpolate(0.75, xp, fp), 1e-9);
		assertEquals("Above range", 40, HistogramMatcher.interpolate(2, xp, fp), 0);
	}

}
