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

package sc.fiji.tda.processing;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.IJ;
import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ShortProcessor;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.io.ScalingParams;
import sc.fiji.tda.io.VendorVariant;

/**
 * Tests for {@link VolumeAssembler}
 */
public class VolumeAssemblerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static ImageStack constantStack(final int value, final int nSlices) {
		final ImageStack stack = new ImageStack(4, 3);
		for (int z = 0; z < nSlices; z++) {
			final ShortProcessor sp = new ShortProcessor(4, 3);
			sp.setValue(value);
			sp.fill();
			stack.addSlice(sp);
		}
		return stack;
	}

	private static ProcessingResult result(final int... values) {
		final ProcessingResult result = new ProcessingResult(values.length);
		for (int c = 0; c < values.length; c++)
			result.put(c, constantStack(values[c], 2));
		return result;
	}

	private static ScalingParams params(final VendorVariant variant, final int[] order, final boolean fromColors) {
		return new ScalingParams(0.5, 0.5, 2, (variant == null) ? null : Collections.singleton(variant), order,
				fromColors, "test");
	}

	@Test
	public void testAssembleReorders() throws Exception {
		final VolumeAssembler assembler = new VolumeAssembler(new ProcessingOptions());
		final ImageStack[] planes = assembler.assemble(result(10, 20, 30), new int[] { 1, 0, 2 });
		assertEquals(3, planes.length);
		assertEquals("Plane 0", 20, planes[0].getProcessor(1).get(0));
		assertEquals("Plane 1", 10, planes[1].getProcessor(2).get(5));
		assertEquals("Plane 2", 30, planes[2].getProcessor(1).get(11));
		assertEquals("Bit depth", 16, planes[0].getBitDepth());
	}

	@Test(expected = ChannelCountMismatchException.class)
	public void testRepeatedChannel() throws Exception {
		new VolumeAssembler(new ProcessingOptions()).assemble(result(10, 20), new int[] { 0, 1, 0 });
	}

	@Test
	public void testResolveOrder() throws Exception {
		assertArrayEquals("Padding", new int[] { 1, 0, 2 }, VolumeAssembler.resolveOrder(new int[] { 1 }, 3));
		assertArrayEquals("Identity", new int[] { 0, 1 }, VolumeAssembler.resolveOrder(null, 2));
		assertArrayEquals("Complete", new int[] { 2, 0, 1 }, VolumeAssembler.resolveOrder(new int[] { 2, 0, 1 }, 3));
		try {
			VolumeAssembler.resolveOrder(new int[] { 0, 3 }, 3);
			throw new AssertionError("Missing channel accepted");
		} catch (final ChannelCountMismatchException expected) {
			assertTrue(expected.getMessage().contains("does not exist"));
		}
	}

	@Test
	public void testLegacyReordering() throws Exception {
		final ProcessingOptions options = new ProcessingOptions();
		final VolumeAssembler assembler = new VolumeAssembler(options);
		assertArrayEquals("LSM 510", new int[] { 1, 0, 2 },
				assembler.effectiveOrder(params(VendorVariant.LSM510, null, false), 3));
		assertArrayEquals("LSM 880", new int[] { 2, 1, 0 },
				assembler.effectiveOrder(params(VendorVariant.LSM880, null, false), 3));
		assertArrayEquals("LSM 880, two channels", new int[] { 0, 1 },
				assembler.effectiveOrder(params(VendorVariant.LSM880, null, false), 2));
		assertArrayEquals("No variant", new int[] { 0, 1, 2 }, assembler.effectiveOrder(params(null, null, false), 3));
		assertArrayEquals("Color-derived order", new int[] { 1, 0 },
				assembler.effectiveOrder(params(VendorVariant.LSM510, new int[] { 1, 0 }, true), 2));

		options.setLegacyVariantReordering(false);
		assertArrayEquals("Disabled", new int[] { 0, 1, 2 },
				assembler.effectiveOrder(params(VendorVariant.LSM510, null, false), 3));
	}

	@Test
	public void testColorPlanes() {
		assertArrayEquals(new int[] { 1, 2, 0 }, VolumeAssembler.colorPlanes(new int[] { 2, 0, 1 }));
		assertArrayEquals(new int[] { 0, 1 }, VolumeAssembler.colorPlanes(new int[] { 0, 1 }));
	}

	@Test
	public void testOutputBitDepthSaturates() throws Exception {
		final ProcessingOptions options = new ProcessingOptions();
		options.setOutputBitDepth(8);
		final ImageStack[] planes = new VolumeAssembler(options).assemble(result(100, 4000), new int[] { 0, 1 });
		assertEquals(8, planes[0].getBitDepth());
		assertEquals(100, planes[0].getProcessor(1).get(0));
		assertEquals("Saturated", 255, planes[1].getProcessor(1).get(0));
	}

	@Test
	public void testOutputFile() throws Exception {
		final ProcessingOptions options = new ProcessingOptions();
		final VolumeAssembler assembler = new VolumeAssembler(options);
		final File input = new File(folder.getRoot(), "cell 1.lsm");
		assertEquals(new File(folder.getRoot(), "cell 1_PROCESSED.tiff").getAbsolutePath(),
				assembler.outputFileFor(input, null).getAbsolutePath());
		options.setOutputSuffix("_norm");
		final File out = folder.newFolder("out");
		assertEquals(new File(out, "cell 1_norm.tiff"), assembler.outputFileFor(input, out));
	}

	@Test
	public void testSave() throws Exception {
		final VolumeAssembler assembler = new VolumeAssembler(new ProcessingOptions());
		final ImageStack[] planes = assembler.assemble(result(10, 20), new int[] { 1, 0 });
		final File saved = assembler.save(new File(folder.getRoot(), "vol.czi"), new File(folder.getRoot(), "sub"),
				planes, params(null, null, false));
		assertTrue(saved.exists());
		assertEquals("vol_PROCESSED.tiff", saved.getName());
		final ImagePlus imp = IJ.openImage(saved.getAbsolutePath());
		assertEquals("# Channels", 2, imp.getNChannels());
		assertEquals("# Slices", 2, imp.getNSlices());
		assertEquals("Voxel depth", 2, imp.getCalibration().pixelDepth, 1e-6);
		assertEquals("Pixel size", 0.5, imp.getCalibration().pixelWidth, 1e-6);
		assertEquals("First plane", 20, imp.getStack().getProcessor(imp.getStackIndex(1, 1, 1)).get(0));
		assertEquals("Second plane", 10, imp.getStack().getProcessor(imp.getStackIndex(2, 2, 1)).get(0));
	}

}
