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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import ij.ImageStack;
import ij.process.ByteProcessor;
import sc.fiji.tda.ProcessingOptions;

/**
 * Tests for {@link ReferenceSelector}
 */
public class ReferenceSelectorTest {

	private static ImageStack stackWithStructureAt(final int nSlices, final int structuredSlice) {
		final ImageStack stack = new ImageStack(64, 64);
		for (int z = 0; z < nSlices; z++) {
			stack.addSlice((z == structuredSlice) ? SliceScorerTest.structured(z)
					: SliceScorerTest.noise(z, 20, 3));
		}
		return stack;
	}

	@Test
	public void testEmptyStack() {
		final ReferenceSelector selector = new ReferenceSelector(new ProcessingOptions());
		assertEquals(ReferenceSelector.NO_REFERENCE, selector.select(new ImageStack(8, 8)));
	}

	@Test
	public void testSelectsStructuredSlice() {
		final ReferenceSelector selector = new ReferenceSelector(new ProcessingOptions());
		final ImageStack stack = stackWithStructureAt(5, 3);
		assertEquals(3, selector.select(stack));
		final List<SliceScore> scores = selector.selectScores(stack);
		assertEquals(5, scores.size());
		for (int i = 0; i < scores.size(); i++)
			assertEquals("Score order", i, scores.get(i).getIndex());
	}

	@Test
	public void testIndexAlwaysInRange() {
		final ReferenceSelector selector = new ReferenceSelector(new ProcessingOptions());
		for (int n = 1; n <= 4; n++) {
			final int index = selector.select(stackWithStructureAt(n, -1));
			assertTrue("n=" + n, index >= 0 && index < n);
		}
	}

	@Test
	public void testFirstIndexWinsTies() {
		final ImageStack stack = new ImageStack(16, 16);
		for (int z = 0; z < 4; z++) {
			final ByteProcessor bp = new ByteProcessor(16, 16);
			bp.setValue(42);
			bp.fill();
			stack.addSlice(bp);
		}
		assertEquals(0, new ReferenceSelector(new ProcessingOptions()).select(stack));
		final ProcessingOptions options = new ProcessingOptions();
		options.setPolicy(ReferenceSelector.Policy.FALLBACK);
		assertEquals(0, new ReferenceSelector(options).select(stack));
	}

	@Test
	public void testFallbackPolicy() {
		final ProcessingOptions options = new ProcessingOptions();
		options.setPolicy(ReferenceSelector.Policy.FALLBACK);
		final ReferenceSelector selector = new ReferenceSelector(options);
		assertSame(ReferenceSelector.Policy.FALLBACK, selector.getPolicy());
		final ImageStack stack = new ImageStack(2, 2);
		stack.addSlice(new ByteProcessor(2, 2, new byte[] { 10, 10, 30, 30 })); // mean/std = 2
		stack.addSlice(new ByteProcessor(2, 2, new byte[] { 40, 40, 60, 60 })); // mean/std = 5
		stack.addSlice(new ByteProcessor(2, 2, new byte[] { 0, 0, 20, 20 })); // mean/std = 1
		assertEquals(1, selector.select(stack));
	}

	@Test
	public void testPolicyFromString() {
		assertSame(ReferenceSelector.Policy.COMPOSITE, ReferenceSelector.Policy.fromString("composite"));
		assertSame(ReferenceSelector.Policy.FALLBACK,
				ReferenceSelector.Policy.fromString(ReferenceSelector.Policy.FALLBACK.getLabel()));
	}

	@Test
	public void testPolicyLabels() {
		assertArrayEquals(new String[] { "Robust SNR + structure", "Mean/std SNR (fast)" },
				ReferenceSelector.Policy.labels());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownPolicy() {
		ReferenceSelector.Policy.fromString("best");
	}

}
