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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The Zeiss {@code CZ_LSMINFO} block of an LSM file, with the channel colors
 * and the acquisition track names it points to. All LSM structures are
 * little-endian.
 */
public class LsmInfo {

	static final int MAGIC_V1 = 0x0300494C;
	static final int MAGIC_V2 = 0x0400494C;
	static final int HEADER_SIZE = 128;

	static final int SCAN_RECORDING = 0x10000000;
	static final int SCAN_TRACK = 0x40000000;
	static final int SCAN_TRACK_NAME = 0x4000000C;
	static final int SCAN_END = 0xFFFFFFFF;
	static final int TYPE_SUBBLOCK = 0;
	static final int TYPE_ASCII = 2;

	private static final int MAX_SCAN_ENTRIES = 1 << 20;

	private int dimensionX;
	private int dimensionY;
	private int dimensionZ;
	private int dimensionChannels;
	private int dimensionTime;
	private double voxelSizeX;
	private double voxelSizeY;
	private double voxelSizeZ;
	private int scanType;
	private final List<int[]> channelColors = new ArrayList<>();
	private final List<String> channelNames = new ArrayList<>();
	private final List<String> trackNames = new ArrayList<>();

	private LsmInfo() {}

	/**
	 * Parses the block at the specified offset.
	 *
	 * @throws MetadataParseException if the block is not a valid LSM info block
	 * @throws IOException            if the file cannot be read
	 */
	public static LsmInfo read(final FileChannel channel, final long offset) throws IOException {
		if (offset < 0) throw new MetadataParseException("File has no CZ_LSMINFO block");
		final ByteBuffer buf = FileChannels.read(channel, offset, HEADER_SIZE, ByteOrder.LITTLE_ENDIAN);
		final int magic = buf.getInt(0);
		if (magic != MAGIC_V1 && magic != MAGIC_V2)
			throw new MetadataParseException(String.format("Invalid CZ_LSMINFO magic number: 0x%08X", magic));
		final LsmInfo info = new LsmInfo();
		info.dimensionX = buf.getInt(8);
		info.dimensionY = buf.getInt(12);
		info.dimensionZ = buf.getInt(16);
		info.dimensionChannels = buf.getInt(20);
		info.dimensionTime = buf.getInt(24);
		info.voxelSizeX = buf.getDouble(40);
		info.voxelSizeY = buf.getDouble(48);
		info.voxelSizeZ = buf.getDouble(56);
		info.scanType = buf.getShort(88) & 0xffff;
		if (info.dimensionChannels < 1)
			throw new MetadataParseException("Invalid number of channels: " + info.dimensionChannels);
		final long colorsOffset = Integer.toUnsignedLong(buf.getInt(108));
		final long scanInfoOffset = Integer.toUnsignedLong(buf.getInt(124));
		if (colorsOffset > 0) info.readChannelColors(channel, colorsOffset);
		if (scanInfoOffset > 0) info.readScanInformation(channel, scanInfoOffset);
		return info;
	}

	private void readChannelColors(final FileChannel channel, final long offset) throws IOException {
		final ByteBuffer header = FileChannels.read(channel, offset, 24, ByteOrder.LITTLE_ENDIAN);
		final int blockSize = header.getInt(0);
		final int nColors = header.getInt(4);
		final int nNames = header.getInt(8);
		final int colorsStart = header.getInt(12);
		final int namesStart = header.getInt(16);
		if (nColors < 0 || nColors > 4096 || colorsStart < 0)
			throw new MetadataParseException("Invalid channel colors block");
		final ByteBuffer colors = FileChannels.read(channel, offset + colorsStart, nColors * 4,
				ByteOrder.LITTLE_ENDIAN);
		for (int i = 0; i < nColors; i++) {
			channelColors.add(new int[] { colors.get() & 0xff, colors.get() & 0xff, colors.get() & 0xff });
			colors.get(); // alpha
		}

		if (nNames > 0 && namesStart > 0 && blockSize > namesStart) {
			final ByteBuffer names = FileChannels.read(channel, offset + namesStart, blockSize - namesStart,
					ByteOrder.LITTLE_ENDIAN);
			while (names.remaining() > 4 && channelNames.size() < nNames) {
				final int length = names.getInt();
				if (length < 0 || length > names.remaining()) break;
				channelNames.add(FileChannels.readString(names, length));
			}
		}
	}

	private void readScanInformation(final FileChannel channel, final long offset) throws IOException {
		long pos = offset;
		int depth = 0;
		for (int i = 0; i < MAX_SCAN_ENTRIES; i++) {
			final ByteBuffer entry = FileChannels.read(channel, pos, 12, ByteOrder.LITTLE_ENDIAN);
			final int tag = entry.getInt(0);
			final int type = entry.getInt(4);
			final int size = entry.getInt(8);
			if (size < 0) throw new MetadataParseException("Invalid scan information entry at " + pos);
			pos += 12;
			if (i == 0) {
				if (tag != SCAN_RECORDING)
					throw new MetadataParseException(String.format("Unexpected scan information block: 0x%08X", tag));
				depth = 1;
			} else if (tag == SCAN_END) {
				if (--depth <= 0) return;
			} else if (type == TYPE_SUBBLOCK) {
				depth++;
			} else if (tag == SCAN_TRACK_NAME && type == TYPE_ASCII) {
				trackNames.add(FileChannels.readString(
						FileChannels.read(channel, pos, size, ByteOrder.LITTLE_ENDIAN), size));
			}
			pos += size;
		}
		throw new MetadataParseException("Unterminated scan information block");
	}

	public int getDimensionX() {
		return dimensionX;
	}

	public int getDimensionY() {
		return dimensionY;
	}

	public int getDimensionZ() {
		return dimensionZ;
	}

	public int getDimensionChannels() {
		return dimensionChannels;
	}

	public int getDimensionTime() {
		return dimensionTime;
	}

	/** @return the voxel width in meters */
	public double getVoxelSizeX() {
		return voxelSizeX;
	}

	/** @return the voxel height in meters */
	public double getVoxelSizeY() {
		return voxelSizeY;
	}

	/** @return the voxel depth in meters */
	public double getVoxelSizeZ() {
		return voxelSizeZ;
	}

	public int getScanType() {
		return scanType;
	}

	/** @return the display color {r, g, b} of each channel */
	public List<int[]> getChannelColors() {
		return Collections.unmodifiableList(channelColors);
	}

	public List<String> getChannelNames() {
		return Collections.unmodifiableList(channelNames);
	}

	public List<String> getTrackNames() {
		return Collections.unmodifiableList(trackNames);
	}

}
