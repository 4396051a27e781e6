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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A TIFF image file directory (IFD). Only the fields required to locate the
 * strips of each channel and the LSM private tag are decoded. Multi-valued
 * tags are decoded inline when they fit the 4-byte value field (e.g., the
 * {@code BitsPerSample} of two-channel LSM files).
 */
public class TiffDirectory {

	public static final int NEW_SUBFILE_TYPE = 254;
	public static final int IMAGE_WIDTH = 256;
	public static final int IMAGE_LENGTH = 257;
	public static final int BITS_PER_SAMPLE = 258;
	public static final int COMPRESSION = 259;
	public static final int STRIP_OFFSETS = 273;
	public static final int SAMPLES_PER_PIXEL = 277;
	public static final int ROWS_PER_STRIP = 278;
	public static final int STRIP_BYTE_COUNTS = 279;
	public static final int PLANAR_CONFIGURATION = 284;
	public static final int PREDICTOR = 317;
	/** Zeiss LSM private tag */
	public static final int CZ_LSMINFO = 34412;

	private static final int MAX_DIRECTORIES = 1 << 20;

	private final ByteOrder order;
	private final Map<Integer, Entry> entries = new HashMap<>();

	private static class Entry {
		int type;
		long count;
		long offset; // offset field, or -1 if values were stored inline
		long[] values;
	}

	private TiffDirectory(final ByteOrder order) {
		this.order = order;
	}

	/**
	 * Reads all the directories of a TIFF file, in file order.
	 *
	 * @throws IOException if the file is not a (classic) TIFF file or a
	 *                     directory is truncated
	 */
	public static List<TiffDirectory> readAll(final FileChannel channel) throws IOException {
		final ByteBuffer header = FileChannels.read(channel, 0, 8, ByteOrder.LITTLE_ENDIAN);
		final ByteOrder order;
		if (header.get(0) == 'I' && header.get(1) == 'I')
			order = ByteOrder.LITTLE_ENDIAN;
		else if (header.get(0) == 'M' && header.get(1) == 'M')
			order = ByteOrder.BIG_ENDIAN;
		else
			throw new IOException("Not a TIFF file");
		header.order(order);
		if (header.getShort(2) != 42) throw new IOException("Not a classic TIFF file");

		final List<TiffDirectory> dirs = new ArrayList<>();
		final Set<Long> visited = new HashSet<>();
		long offset = Integer.toUnsignedLong(header.getInt(4));
		while (offset != 0) {
			if (!visited.add(offset) || dirs.size() > MAX_DIRECTORIES)
				throw new IOException("Circular or excessive directory chain at offset " + offset);
			final TiffDirectory dir = new TiffDirectory(order);
			offset = dir.read(channel, offset);
			dirs.add(dir);
		}
		return dirs;
	}

	/* returns the offset of the next directory */
	private long read(final FileChannel channel, final long offset) throws IOException {
		final int nEntries = FileChannels.read(channel, offset, 2, order).getShort() & 0xffff;
		final ByteBuffer buf = FileChannels.read(channel, offset + 2, nEntries * 12 + 4, order);
		for (int i = 0; i < nEntries; i++) {
			final int pos = i * 12;
			final int tag = buf.getShort(pos) & 0xffff;
			final Entry entry = new Entry();
			entry.type = buf.getShort(pos + 2) & 0xffff;
			entry.count = Integer.toUnsignedLong(buf.getInt(pos + 4));
			final int size = typeSize(entry.type);
			final long nBytes = size * entry.count;
			if (nBytes <= 4) {
				entry.offset = -1;
				entry.values = decode(buf, pos + 8, entry.type, (int) entry.count);
			} else {
				entry.offset = Integer.toUnsignedLong(buf.getInt(pos + 8));
				if (isInteger(entry.type) && size > 1 && nBytes < Integer.MAX_VALUE) {
					final ByteBuffer data = FileChannels.read(channel, entry.offset, (int) nBytes, order);
					entry.values = decode(data, 0, entry.type, (int) entry.count);
				}
			}
			entries.put(tag, entry);
		}
		return Integer.toUnsignedLong(buf.getInt(nEntries * 12));
	}

	private static long[] decode(final ByteBuffer buf, final int start, final int type, final int count) {
		if (!isInteger(type)) return null;
		final long[] values = new long[count];
		final int size = typeSize(type);
		for (int i = 0; i < count; i++) {
			final int pos = start + i * size;
			switch (size) {
			case 1:
				values[i] = buf.get(pos) & 0xff;
				break;
			case 2:
				values[i] = buf.getShort(pos) & 0xffff;
				break;
			default:
				values[i] = Integer.toUnsignedLong(buf.getInt(pos));
			}
		}
		return values;
	}

	private static boolean isInteger(final int type) {
		return type == 1 || type == 3 || type == 4 || type == 7;
	}

	private static int typeSize(final int type) {
		switch (type) {
		case 3: // SHORT
		case 8: // SSHORT
			return 2;
		case 4: // LONG
		case 9: // SLONG
		case 11: // FLOAT
		case 13: // IFD
			return 4;
		case 5: // RATIONAL
		case 10: // SRATIONAL
		case 12: // DOUBLE
			return 8;
		default:
			return 1;
		}
	}

	public ByteOrder getByteOrder() {
		return order;
	}

	public boolean has(final int tag) {
		return entries.containsKey(tag);
	}

	/**
	 * @return the first value of the specified tag, or {@code defaultValue} if
	 *         the tag is absent or not an integer field
	 */
	public long get(final int tag, final long defaultValue) {
		final Entry entry = entries.get(tag);
		return (entry == null || entry.values == null || entry.values.length == 0) ? defaultValue
				: entry.values[0];
	}

	/**
	 * @return all the values of an integer tag
	 * @throws IOException if the tag is missing
	 */
	public long[] getAll(final int tag) throws IOException {
		final Entry entry = entries.get(tag);
		if (entry == null || entry.values == null)
			throw new IOException("Missing TIFF tag " + tag);
		return entry.values;
	}

	/**
	 * @return the file offset of the values of an out-of-line tag (e.g.,
	 *         {@link #CZ_LSMINFO}), or -1 if the tag is absent or inline
	 */
	public long getOffset(final int tag) {
		final Entry entry = entries.get(tag);
		return (entry == null) ? -1 : entry.offset;
	}

	/** @return true if this directory holds a reduced-resolution image */
	public boolean isThumbnail() {
		return (get(NEW_SUBFILE_TYPE, 0) & 1) != 0;
	}

}
