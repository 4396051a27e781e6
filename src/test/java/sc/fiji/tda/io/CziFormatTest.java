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

package sc.fiji.tda.io;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.file.Files;
import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImageStack;

/**
 * Tests for {@link CziFormat}
 */
public class CziFormatTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final CziFormat format = new CziFormat();

	private SyntheticVolumes.Meta meta() {
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.voxelX = 2e-7;
		meta.voxelY = 2e-7;
		meta.voxelZ = 1.5e-6;
		meta.colors = Arrays.asList(new int[] { 0, 0, 255 }, new int[] { 255, 0, 0 }, new int[] { 0, 255, 0 });
		return meta;
	}

	@Test
	public void testReadVolume() throws Exception {
		final File file = folder.newFile("volume.czi");
		SyntheticVolumes.writeCzi(file, SyntheticVolumes.constantVolume(new int[] { 100, 2000, 30000 }, 3, 20), 5,
				4, 16, meta());
		final VolumeHeader header = format.readHeader(file);
		assertEquals("Width", 5, header.getWidth());
		assertEquals("Height", 4, header.getHeight());
		assertEquals("# Slices", 3, header.getNSlices());
		assertEquals("# Channels", 3, header.getNChannels());
		assertEquals("Bit depth", 16, header.getBitDepth());
		final ImageStack stack = format.readChannel(file, 2);
		assertEquals(3, stack.getSize());
		assertEquals(30000, stack.getProcessor(1).get(4, 3));
		assertEquals(30002, stack.getProcessor(3).get(0, 0));
	}

	@Test
	public void testScaling() throws Exception {
		final File file = folder.newFile("scaled.czi");
		SyntheticVolumes.writeCzi(file, SyntheticVolumes.constantVolume(new int[] { 1, 2, 3 }, 2, 4), 2, 2, 8,
				meta());
		final ScalingParams params = format.readScaling(file);
		assertEquals("Voxel width", 0.2, params.getVoxelWidth(), 1e-9);
		assertEquals("Voxel depth", 1.5, params.getVoxelDepth(), 1e-9);
		assertEquals("Resolution", 5, params.getResolution(), 1e-9);
		assertTrue(params.getVariants().isEmpty());
		// red is channel 1, green channel 2, blue channel 0
		assertArrayEquals("Order", new int[] { 1, 2, 0 }, params.getChannelOrder());
		assertTrue(params.isColorDerivedOrder());
	}

	@Test
	public void testColorsFromDimensions() throws Exception {
		final SyntheticVolumes.Meta meta = meta();
		meta.colors = Arrays.asList(new int[] { 0, 255, 0 }, new int[] { 255, 0, 0 });
		final ScalingParams params = format.parseScaling(SyntheticVolumes.metadataXml(meta, false));
		assertArrayEquals(new int[] { 1, 0 }, params.getChannelOrder());
	}

	@Test
	public void testUnrecognizedColors() throws Exception {
		final SyntheticVolumes.Meta meta = meta();
		meta.colors = Arrays.asList(new int[] { 255, 0, 255 }, new int[] { 255, 255, 255 });
		final ScalingParams params = format.parseScaling(SyntheticVolumes.metadataXml(meta, true));
		assertEquals(0, params.getChannelOrder().length);
		assertFalse(params.isColorDerivedOrder());
	}

	@Test
	public void testParseColor() throws Exception {
		assertArrayEquals(new int[] { 255, 0, 0 }, CziFormat.parseColor("#FFFF0000"));
		assertArrayEquals(new int[] { 0, 255, 0 }, CziFormat.parseColor("#00FF00"));
	}

	@Test(expected = MetadataParseException.class)
	public void testMissingScaling() throws Exception {
		format.parseScaling("<ImageDocument><Metadata></Metadata></ImageDocument>");
	}

	@Test(expected = MetadataParseException.class)
	public void testNotCzi() throws Exception {
		final File file = folder.newFile("bogus.czi");
		Files.write(file.toPath(), "not a czi file at all".getBytes("UTF-8"));
		format.readScaling(file);
	}

	@Test
	public void testDirectoryCountBeyondFileSize() throws Exception {
		final File file = folder.newFile("huge.czi");
		SyntheticVolumes.writeCziDirectoryOnly(file, Integer.MAX_VALUE);
		try {
			format.readHeader(file);
			fail("Directory count accepted");
		} catch (final java.io.IOException ex) {
			assertTrue(ex.getMessage(), ex.getMessage().startsWith("Invalid sub-block count"));
		}
	}

}
