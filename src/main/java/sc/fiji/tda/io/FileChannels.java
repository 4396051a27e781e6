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

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;

/** Positional read helpers shared by the vendor readers. */
class FileChannels {

	private FileChannels() {} // prevent class instantiation

	/**
	 * Reads exactly {@code length} bytes at the specified position.
	 *
	 * @return a buffer of the read bytes, positioned at 0, in the specified
	 *         order
	 * @throws EOFException if the file ends before {@code length} bytes could be
	 *                      read. Lengths are checked against the file size before
	 *                      any allocation
	 */
	static ByteBuffer read(final FileChannel channel, final long position, final int length,
			final ByteOrder order) throws IOException {
		if (position < 0 || length < 0)
			throw new IOException("Invalid read request: " + length + " bytes at " + position);
		if (position + length > channel.size())
			throw new EOFException("Cannot read " + length + " bytes at offset " + position + ": file size is "
					+ channel.size());
		final ByteBuffer buffer = ByteBuffer.allocate(length).order(order);
		long pos = position;
		while (buffer.hasRemaining()) {
			final int n = channel.read(buffer, pos);
			if (n < 0) throw new EOFException("Unexpected end of file at offset " + pos);
			pos += n;
		}
		buffer.flip();
		return buffer;
	}

	static String readString(final ByteBuffer buffer, final int length) {
		final byte[] bytes = new byte[length];
		buffer.get(bytes);
		int end = 0;
		while (end < length && bytes[end] != 0)
			end++;
		return new String(bytes, 0, end, StandardCharsets.ISO_8859_1);
	}

}
