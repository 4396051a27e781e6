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

package sc.fiji.tda.util;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/**
 * Static utilities for handling and manipulation of ImageJ processors and
 * stacks.
 */
public class ImpUtils {

	/** Red, green and blue color plane indices of RGB previews */
	public static final int RED = 0, GREEN = 1, BLUE = 2;

	private ImpUtils() {} // prevent class instantiation

	/**
	 * @param bitDepth 8 or 16
	 * @return the largest sample value that can be stored at the specified depth
	 */
	public static int maxValue(final int bitDepth) {
		switch (bitDepth) {
		case 8:
			return 255;
		case 16:
			return 65535;
		default:
			throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth);
		}
	}

	/**
	 * Creates an unsigned integer processor of the specified bit depth.
	 */
	public static ImageProcessor createProcessor(final int width, final int height, final int bitDepth) {
		switch (bitDepth) {
		case 8:
			return new ByteProcessor(width, height);
		case 16:
			return new ShortProcessor(width, height);
		default:
			throw new IllegalArgumentException("Unsupported bit depth: " + bitDepth);
		}
	}

	/**
	 * Converts a processor to the specified bit depth. Values that do not fit
	 * are clipped (saturated), no scaling takes place.
	 *
	 * @param ip       the 8-bit or 16-bit processor to convert
	 * @param bitDepth the target bit depth (8 or 16)
	 * @return a new processor, or the input itself if no conversion was required
	 */
	public static ImageProcessor convertBitDepth(final ImageProcessor ip, final int bitDepth) {
		if (ip.getBitDepth() == bitDepth) return ip;
		final int max = maxValue(bitDepth);
		final ImageProcessor result = createProcessor(ip.getWidth(), ip.getHeight(), bitDepth);
		final int n = ip.getPixelCount();
		for (int i = 0; i < n; i++)
			result.set(i, Math.min(max, ip.get(i)));
		return result;
	}

	/**
	 * Converts all slices of a stack to the specified bit depth.
	 *
	 * @see #convertBitDepth(ImageProcessor, int)
	 */
	public static ImageStack convertBitDepth(final ImageStack stack, final int bitDepth) {
		if (stack.getBitDepth() == bitDepth) return stack;
		final ImageStack result = new ImageStack(stack.getWidth(), stack.getHeight());
		for (int i = 1; i <= stack.getSize(); i++)
			result.addSlice(stack.getSliceLabel(i), convertBitDepth(stack.getProcessor(i), bitDepth));
		return result;
	}

	/**
	 * Computes the dimensions of an image scaled to fit within a square box,
	 * preserving its aspect ratio.
	 *
	 * @return the {width, height} of the scaled image (each at least 1)
	 */
	public static int[] fitWithin(final int width, final int height, final int boxSize) {
		if (width >= height) {
			return new int[] { boxSize, Math.max(1, (int) Math.round((double) height * boxSize / width)) };
		}
		return new int[] { Math.max(1, (int) Math.round((double) width * boxSize / height)), boxSize };
	}

	/**
	 * Creates an RGB thumbnail of a grayscale slice, with intensities placed in a
	 * single color plane. 16-bit data is scaled to its min-max range, 8-bit data
	 * is used as is.
	 *
	 * @param ip         the 8-bit or 16-bit slice
	 * @param colorPlane {@link #RED}, {@link #GREEN} or {@link #BLUE}. Other
	 *                   values wrap around
	 * @param size       the size of the square box the thumbnail must fit in
	 * @return the thumbnail
	 */
	public static ColorProcessor thumbnail(final ImageProcessor ip, final int colorPlane, final int size) {
		ByteProcessor bp;
		if (ip instanceof ByteProcessor) {
			bp = (ByteProcessor) ip.duplicate();
		} else {
			final ImageProcessor dup = ip.duplicate();
			dup.resetMinAndMax();
			bp = dup.convertToByteProcessor(true);
		}
		final int[] dims = fitWithin(bp.getWidth(), bp.getHeight(), size);
		bp.setInterpolationMethod(ImageProcessor.BILINEAR);
		final ImageProcessor scaled = bp.resize(dims[0], dims[1], true);
		final ColorProcessor cp = new ColorProcessor(dims[0], dims[1]);
		final int shift = 16 - 8 * Math.floorMod(colorPlane, 3);
		final int[] rgb = (int[]) cp.getPixels();
		for (int i = 0; i < rgb.length; i++)
			rgb[i] = 0xff000000 | (scaled.get(i) & 0xff) << shift;
		return cp;
	}

	/**
	 * @return true if both stacks have the same width, height and number of
	 *         slices
	 */
	public static boolean sameDimensions(final ImageStack s1, final ImageStack s2) {
		return s1.getWidth() == s2.getWidth() && s1.getHeight() == s2.getHeight()
				&& s1.getSize() == s2.getSize();
	}

}
