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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Low-level access to the segments of a Zeiss ZISRAW (CZI) file: the file
 * header, the sub-block directory and the XML metadata. All structures are
 * little-endian.
 */
public class CziFile implements Closeable {

	static final String FILE_HEADER_ID = "ZISRAWFILE";
	static final String DIRECTORY_ID = "ZISRAWDIRECTORY";
	static final String METADATA_ID = "ZISRAWMETADATA";
	static final String SUBBLOCK_ID = "ZISRAWSUBBLOCK";

	static final int SEGMENT_HEADER_SIZE = 32;
	static final int DIRECTORY_ENTRIES_START = 128;
	static final int ENTRY_FIXED_SIZE = 32;
	static final int DIMENSION_ENTRY_SIZE = 20;
	static final int SUBBLOCK_HEADER_MIN_SIZE = 256;
	static final int METADATA_HEADER_SIZE = 256;

	public static final int PIXEL_GRAY8 = 0;
	public static final int PIXEL_GRAY16 = 1;

	private static final ByteOrder LE = ByteOrder.LITTLE_ENDIAN;

	private final FileChannel channel;
	private final long directoryPosition;
	private final long metadataPosition;
	private List<Entry> entries;

	/** A sub-block directory entry */
	public static class Entry {

		private int pixelType;
		private long filePosition;
		private int compression;
		private int pyramidType;
		private final Map<String, int[]> dimensions = new HashMap<>();

		public int getPixelType() {
			return pixelType;
		}

		public long getFilePosition() {
			return filePosition;
		}

		public int getCompression() {
			return compression;
		}

		public int getPyramidType() {
			return pyramidType;
		}

		public boolean has(final String dimension) {
			return dimensions.containsKey(dimension);
		}

		/** @return the start index of the dimension, or 0 if absent */
		public int start(final String dimension) {
			final int[] dim = dimensions.get(dimension);
			return (dim == null) ? 0 : dim[0];
		}

		/** @return the size of the dimension, or 1 if absent */
		public int size(final String dimension) {
			final int[] dim = dimensions.get(dimension);
			return (dim == null) ? 1 : dim[1];
		}

		/** @return the stored (possibly subsampled) size of the dimension */
		public int storedSize(final String dimension) {
			final int[] dim = dimensions.get(dimension);
			return (dim == null) ? 1 : dim[2];
		}
	}

	private CziFile(final FileChannel channel) throws IOException {
		this.channel = channel;
		final ByteBuffer header = segment(0, FILE_HEADER_ID, 80);
		directoryPosition = header.getLong(SEGMENT_HEADER_SIZE + 52);
		metadataPosition = header.getLong(SEGMENT_HEADER_SIZE + 60);
	}

	/**
	 * Opens a CZI file.
	 *
	 * @throws IOException if the file cannot be read or is not a ZISRAW file
	 */
	public static CziFile open(final File file) throws IOException {
		final FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ);
		try {
			return new CziFile(channel);
		} catch (final IOException | RuntimeException ex) {
			channel.close();
			throw ex;
		}
	}

	/* Reads the segment header at position and the first dataLength bytes of its data */
	private ByteBuffer segment(final long position, final String expectedId, final int dataLength)
			throws IOException {
		final ByteBuffer buf = FileChannels.read(channel, position, SEGMENT_HEADER_SIZE + dataLength, LE);
		final String id = FileChannels.readString(buf, 16);
		if (!expectedId.equals(id))
			throw new IOException("Expected " + expectedId + " segment at offset " + position + " but found '"
					+ id + "'");
		buf.rewind();
		return buf;
	}

	/**
	 * @return the entries of the sub-block directory, in file order
	 */
	public synchronized List<Entry> getEntries() throws IOException {
		if (entries != null) return entries;
		if (directoryPosition <= 0) throw new IOException("File has no sub-block directory");
		final ByteBuffer header = segment(directoryPosition, DIRECTORY_ID, 4);
		final int count = header.getInt(SEGMENT_HEADER_SIZE);
		long pos = directoryPosition + SEGMENT_HEADER_SIZE + DIRECTORY_ENTRIES_START;
		if (count < 0 || (long) count * ENTRY_FIXED_SIZE > channel.size() - pos)
			throw new IOException("Invalid sub-block count: " + count);
		final List<Entry> list = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			final Entry entry = new Entry();
			pos += readEntry(FileChannels.read(channel, pos, ENTRY_FIXED_SIZE, LE), pos, entry);
			list.add(entry);
		}
		entries = Collections.unmodifiableList(list);
		return entries;
	}

	/* returns the size of the entry */
	private int readEntry(final ByteBuffer fixed, final long pos, final Entry entry) throws IOException {
		if (fixed.get(0) != 'D' || fixed.get(1) != 'V')
			throw new IOException("Invalid directory entry at offset " + pos);
		entry.pixelType = fixed.getInt(2);
		entry.filePosition = fixed.getLong(6);
		entry.compression = fixed.getInt(18);
		entry.pyramidType = fixed.get(22) & 0xff;
		final int nDims = fixed.getInt(28);
		if (nDims < 0 || nDims > 64) throw new IOException("Invalid dimension count: " + nDims);
		final ByteBuffer dims = FileChannels.read(channel, pos + ENTRY_FIXED_SIZE, nDims * DIMENSION_ENTRY_SIZE, LE);
		for (int d = 0; d < nDims; d++) {
			final int base = d * DIMENSION_ENTRY_SIZE;
			dims.position(base);
			final String name = FileChannels.readString(dims, 4).trim();
			entry.dimensions.put(name,
					new int[] { dims.getInt(base + 4), dims.getInt(base + 8), dims.getInt(base + 16) });
		}
		return ENTRY_FIXED_SIZE + nDims * DIMENSION_ENTRY_SIZE;
	}

	/**
	 * @return the XML metadata document
	 * @throws IOException if the file has no metadata segment
	 */
	public synchronized String readMetadataXml() throws IOException {
		if (metadataPosition <= 0) throw new IOException("File has no metadata segment");
		final ByteBuffer header = segment(metadataPosition, METADATA_ID, 4);
		final int xmlSize = header.getInt(SEGMENT_HEADER_SIZE);
		if (xmlSize <= 0) throw new IOException("Empty metadata segment");
		if (xmlSize > channel.size() - metadataPosition)
			throw new IOException("Invalid metadata size: " + xmlSize);
		final ByteBuffer xml = FileChannels.read(channel,
				metadataPosition + SEGMENT_HEADER_SIZE + METADATA_HEADER_SIZE, xmlSize, LE);
		return new String(xml.array(), 0, xmlSize, StandardCharsets.UTF_8).trim();
	}

	/**
	 * Reads the raw (uncompressed) pixel data of a sub-block.
	 */
	public synchronized ByteBuffer readPixels(final Entry entry) throws IOException {
		final ByteBuffer header = segment(entry.filePosition, SUBBLOCK_ID, 16 + ENTRY_FIXED_SIZE);
		final int metadataSize = header.getInt(SEGMENT_HEADER_SIZE);
		final long dataSize = header.getLong(SEGMENT_HEADER_SIZE + 8);
		final int nDims = header.getInt(SEGMENT_HEADER_SIZE + 16 + 28);
		final int entrySize = ENTRY_FIXED_SIZE + nDims * DIMENSION_ENTRY_SIZE;
		if (dataSize < 0 || dataSize > Integer.MAX_VALUE || dataSize > channel.size() - entry.filePosition
				|| metadataSize < 0)
			throw new IOException("Invalid sub-block at offset " + entry.filePosition);
		final long dataStart = entry.filePosition + SEGMENT_HEADER_SIZE
				+ Math.max(SUBBLOCK_HEADER_MIN_SIZE, 16 + entrySize) + metadataSize;
		return FileChannels.read(channel, dataStart, (int) dataSize, LE);
	}

	@Override
	public void close() throws IOException {
		channel.close();
	}

}
