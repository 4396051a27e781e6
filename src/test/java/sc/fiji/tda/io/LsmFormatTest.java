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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImageStack;

/**
 * Tests for {@link LsmFormat}
 */
public class LsmFormatTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final LsmFormat format = new LsmFormat();

	@Test
	public void testHeaderSkipsThumbnails() throws Exception {
		final File file = folder.newFile("stack.lsm");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 10, 50, 90 }, 5, 12), 4, 3, 8,
				new SyntheticVolumes.Meta());
		final VolumeHeader header = format.readHeader(file);
		assertEquals("Width", 4, header.getWidth());
		assertEquals("Height", 3, header.getHeight());
		assertEquals("# Slices", 5, header.getNSlices());
		assertEquals("# Channels", 3, header.getNChannels());
		assertEquals("Bit depth", 8, header.getBitDepth());
	}

	@Test
	public void testReadChannel() throws Exception {
		final File file = folder.newFile("stack16.lsm");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1000, 3000 }, 4, 16), 4, 4, 16,
				new SyntheticVolumes.Meta());
		final ImageStack ch1 = format.readChannel(file, 1);
		assertEquals("# Slices", 4, ch1.getSize());
		assertEquals("Bit depth", 16, ch1.getBitDepth());
		for (int z = 0; z < 4; z++)
			assertEquals("Slice " + z, 3000 + z, ch1.getProcessor(z + 1).get(2, 3));
		final ImageStack ch0 = format.readChannel(file, 0);
		assertEquals(1000, ch0.getProcessor(1).get(0, 0));
	}

	@Test(expected = java.io.IOException.class)
	public void testInvalidChannel() throws Exception {
		final File file = folder.newFile("single.lsm");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1 }, 2, 4), 2, 2, 8,
				new SyntheticVolumes.Meta());
		format.readChannel(file, 1);
	}

	@Test
	public void testScaling() throws Exception {
		final File file = folder.newFile("scaled.lsm");
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.voxelX = 0.5e-6;
		meta.voxelY = 0.25e-6;
		meta.voxelZ = 2e-6;
		meta.tracks = Arrays.asList("LSM510 Track 1", "Track 2");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1, 2 }, 2, 4), 2, 2, 8, meta);
		final ScalingParams params = format.readScaling(file);
		assertEquals("Voxel width", 0.5, params.getVoxelWidth(), 1e-9);
		assertEquals("Voxel height", 0.25, params.getVoxelHeight(), 1e-9);
		assertEquals("Voxel depth", 2, params.getVoxelDepth(), 1e-9);
		assertEquals("Resolution", 3, params.getResolution(), 1e-9);
		assertTrue("LSM510", params.has(VendorVariant.LSM510));
		assertFalse("LSM880", params.has(VendorVariant.LSM880));
		assertFalse("Order from colors", params.isColorDerivedOrder());
		assertEquals("Order", 0, params.getChannelOrder().length);
	}

	@Test
	public void testChannelOrderFromColors() throws Exception {
		final File file = folder.newFile("colors.lsm");
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.colors = Arrays.asList(new int[] { 0, 255, 0 }, new int[] { 255, 0, 0 });
		meta.tracks = Collections.singletonList("lsm880 track");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1, 2 }, 2, 4), 2, 2, 8, meta);
		final ScalingParams params = format.readScaling(file);
		assertArrayEquals("Order", new int[] { 1, 0 }, params.getChannelOrder());
		assertTrue("Order from colors", params.isColorDerivedOrder());
		assertTrue("LSM880", params.has(VendorVariant.LSM880));
	}

	@Test
	public void testVariantAnywhereInTrackName() throws Exception {
		final File file = folder.newFile("track.lsm");
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.tracks = Arrays.asList("Track1 LSM510", "Track2");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1, 2 }, 2, 4), 2, 2, 8, meta);
		final ScalingParams params = format.readScaling(file);
		assertTrue("LSM510", params.has(VendorVariant.LSM510));
		assertFalse("LSM880", params.has(VendorVariant.LSM880));
		assertEquals(VendorVariant.LSM880, VendorVariant.fromTrackName("Confocal lsm880 Airyscan"));
		assertNull(VendorVariant.fromTrackName("Track 2"));
	}

	@Test
	public void testReadPackBitsChannel() throws Exception {
		final File file = folder.newFile("packed.lsm");
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.packBits = true;
		final short[][][] data = SyntheticVolumes.constantVolume(new int[] { 1000, 3000 }, 3, 100);
		data[1][2][57] = 4321;
		SyntheticVolumes.writeLsm(file, data, 10, 10, 16, meta);
		assertEquals(2, format.readHeader(file).getNChannels());
		final ImageStack ch1 = format.readChannel(file, 1);
		assertEquals("# Slices", 3, ch1.getSize());
		for (int z = 0; z < 3; z++)
			assertEquals("Slice " + z, 3000 + z, ch1.getProcessor(z + 1).get(0, 0));
		assertEquals(4321, ch1.getProcessor(3).get(7, 5));
		assertEquals(1001, format.readChannel(file, 0).getProcessor(2).get(9, 9));
	}

	@Test(expected = java.io.IOException.class)
	public void testTruncatedStrips() throws Exception {
		final File file = folder.newFile("truncated.lsm");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1, 2 }, 3, 64), 8, 8, 16,
				new SyntheticVolumes.Meta());
		final byte[] bytes = Files.readAllBytes(file.toPath());
		Files.write(file.toPath(), Arrays.copyOf(bytes, bytes.length - 200));
		format.readChannel(file, 1);
	}

	@Test(expected = java.io.IOException.class)
	public void testOversizedStripTable() throws Exception {
		final File file = folder.newFile("oversized.lsm");
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1, 2 }, 2, 4), 2, 2, 8,
				new SyntheticVolumes.Meta());
		final ByteBuffer bytes = ByteBuffer.wrap(Files.readAllBytes(file.toPath())).order(ByteOrder.LITTLE_ENDIAN);
		final int ifd = bytes.getInt(4);
		final int nEntries = bytes.getShort(ifd) & 0xffff;
		for (int e = ifd + 2; e < ifd + 2 + nEntries * 12; e += 12) {
			if ((bytes.getShort(e) & 0xffff) == TiffDirectory.STRIP_OFFSETS) bytes.putInt(e + 4, 0x10000000);
		}
		Files.write(file.toPath(), bytes.array());
		format.readHeader(file);
	}

	@Test(expected = MetadataParseException.class)
	public void testMissingLsmInfo() throws Exception {
		final File file = folder.newFile("plain.lsm");
		final SyntheticVolumes.Meta meta = new SyntheticVolumes.Meta();
		meta.lsmInfo = false;
		SyntheticVolumes.writeLsm(file, SyntheticVolumes.constantVolume(new int[] { 1 }, 2, 4), 2, 2, 8, meta);
		format.readScaling(file);
	}

}
