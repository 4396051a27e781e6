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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ij.ImageStack;
import sc.fiji.tda.TDAUtils;

/**
 * Entry point to vendor volumes: selects the {@link VolumeFormat} of a file by
 * its extension and resolves its canonical {@link ScalingParams}.
 */
public class MetadataResolver {

	/** Canonical output color planes of display colors: red, green, blue */
	private static final int[][] PLANE_COLORS = { { 255, 0, 0 }, { 0, 255, 0 }, { 0, 0, 255 } };

	private final List<VolumeFormat> formats;

	public MetadataResolver() {
		this(Arrays.asList(new LsmFormat(), new CziFormat()));
	}

	public MetadataResolver(final List<VolumeFormat> formats) {
		this.formats = Collections.unmodifiableList(new ArrayList<>(formats));
	}

	/**
	 * @return the format handling the file
	 * @throws IllegalArgumentException if the file extension is not recognized
	 */
	public VolumeFormat getFormat(final File file) {
		final String ext = TDAUtils.getExtension(file);
		for (final VolumeFormat format : formats) {
			if (Arrays.asList(format.getExtensions()).contains(ext)) return format;
		}
		throw new IllegalArgumentException("Unsupported file format: " + file.getName());
	}

	public boolean isSupported(final File file) {
		final String ext = TDAUtils.getExtension(file);
		return formats.stream().anyMatch(f -> Arrays.asList(f.getExtensions()).contains(ext));
	}

	/**
	 * Resolves the scaling record of a volume.
	 *
	 * @throws MetadataParseException if the file format is not supported or its
	 *                                metadata cannot be parsed
	 */
	public ScalingParams resolve(final File file) throws MetadataParseException {
		final VolumeFormat format;
		try {
			format = getFormat(file);
		} catch (final IllegalArgumentException iae) {
			throw new MetadataParseException(iae.getMessage(), iae);
		}
		final ScalingParams params = format.readScaling(file);
		TDAUtils.log(file.getName() + ": " + params);
		return params;
	}

	/**
	 * Resolves the scaling record of a volume, falling back to
	 * {@link ScalingParams#defaults()} if metadata cannot be parsed.
	 */
	public ScalingParams resolveOrDefaults(final File file) {
		try {
			return resolve(file);
		} catch (final MetadataParseException mpe) {
			TDAUtils.warn(file.getName() + ": " + mpe.getMessage() + ". Using unit scale defaults");
			return ScalingParams.defaults();
		}
	}

	public VolumeHeader readHeader(final File file) throws IOException {
		return getFormat(file).readHeader(file);
	}

	public ImageStack readChannel(final File file, final int channel) throws IOException {
		return getFormat(file).readChannel(file, channel);
	}

	/**
	 * Maps a display color to its canonical output plane.
	 *
	 * @param rgb the {r, g, b} color
	 * @return 0 (red), 1 (green), 2 (blue), or -1 for any other color
	 */
	public static int planeOf(final int[] rgb) {
		for (int p = 0; p < PLANE_COLORS.length; p++) {
			if (Arrays.equals(PLANE_COLORS[p], rgb)) return p;
		}
		return -1;
	}

	/**
	 * Derives the channel order from the display colors of channels. The
	 * returned array lists, for each output plane, the source channel to be
	 * placed in it: channels displayed in red come first, then green, then
	 * blue. Channels with any other color are skipped.
	 *
	 * @param colors the {r, g, b} display color of each channel, in channel
	 *               order
	 * @return the channel order. Empty if no color was recognized
	 */
	public static int[] orderFromColors(final List<int[]> colors) {
		if (colors == null) return new int[0];
		final List<Integer> order = new ArrayList<>();
		for (int plane = 0; plane < PLANE_COLORS.length; plane++) {
			for (int channel = 0; channel < colors.size(); channel++) {
				if (planeOf(colors.get(channel)) == plane) order.add(channel);
			}
		}
		return order.stream().mapToInt(Integer::intValue).toArray();
	}

}
