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

/**
 * Dimensions and sample type of a multi-channel volume.
 */
public class VolumeHeader {

	private final int width;
	private final int height;
	private final int nSlices;
	private final int nChannels;
	private final int bitDepth;

	public VolumeHeader(final int width, final int height, final int nSlices, final int nChannels,
			final int bitDepth) {
		if (width < 1 || height < 1 || nSlices < 1 || nChannels < 1)
			throw new IllegalArgumentException("Invalid volume dimensions: " + width + "x" + height + "x"
					+ nSlices + " (" + nChannels + " channels)");
		if (bitDepth != 8 && bitDepth != 16)
			throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth);
		this.width = width;
		this.height = height;
		this.nSlices = nSlices;
		this.nChannels = nChannels;
		this.bitDepth = bitDepth;
	}

	public int getWidth() {
		return width;
	}

	public int getHeight() {
		return height;
	}

	public int getNSlices() {
		return nSlices;
	}

	public int getNChannels() {
		return nChannels;
	}

	public int getBitDepth() {
		return bitDepth;
	}

	@Override
	public String toString() {
		return width + "x" + height + "x" + nSlices + ", " + nChannels + " channel(s), " + bitDepth + "-bit";
	}

}
