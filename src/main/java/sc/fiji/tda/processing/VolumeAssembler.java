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

import java.io.File;
import java.util.Arrays;

import ij.ImageStack;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.TDAUtils;
import sc.fiji.tda.io.SaveException;
import sc.fiji.tda.io.ScalingParams;
import sc.fiji.tda.io.TiffVolumeWriter;
import sc.fiji.tda.io.VendorVariant;
import sc.fiji.tda.util.ImpUtils;

/**
 * Reorders the normalized channels of a file into output color planes,
 * converts them to the output bit depth and saves them as a single volume.
 */
public class VolumeAssembler {

	private final ProcessingOptions options;

	public VolumeAssembler(final ProcessingOptions options) {
		this.options = options;
	}

	/**
	 * Validates a channel order against the number of available channels.
	 * Orders shorter than the number of channels are padded with the unused
	 * channel indices, in ascending order.
	 *
	 * @param order     the source channel of each output plane. Null or empty
	 *                  means identity
	 * @param nChannels the number of available channels
	 * @return the complete order (a permutation of 0..nChannels-1)
	 * @throws ChannelCountMismatchException if the order is longer than the
	 *                                       number of channels, repeats a
	 *                                       channel, or refers to a missing one
	 */
	public static int[] resolveOrder(final int[] order, final int nChannels) throws ChannelCountMismatchException {
		final int[] src = (order == null) ? new int[0] : order;
		if (src.length > nChannels)
			throw new ChannelCountMismatchException(src, nChannels, "too many entries");
		final boolean[] used = new boolean[nChannels];
		for (final int c : src) {
			if (c < 0 || c >= nChannels)
				throw new ChannelCountMismatchException(src, nChannels, "channel " + c + " does not exist");
			if (used[c]) throw new ChannelCountMismatchException(src, nChannels, "channel " + c + " is repeated");
			used[c] = true;
		}
		final int[] resolved = Arrays.copyOf(src, nChannels);
		int next = src.length;
		for (int c = 0; c < nChannels; c++) {
			if (!used[c]) resolved[next++] = c;
		}
		return resolved;
	}

	/**
	 * Computes the order in which channels are saved. If the order was not
	 * derived from channel colors and legacy reordering is enabled, LSM 510
	 * acquisitions have their first two planes swapped, and LSM 880
	 * acquisitions (with at least three channels) their first and third.
	 *
	 * @throws ChannelCountMismatchException if the resolved order does not fit
	 *                                       the channels
	 */
	public int[] effectiveOrder(final ScalingParams params, final int nChannels)
			throws ChannelCountMismatchException {
		final int[] order = resolveOrder(params.getChannelOrder(), nChannels);
		if (params.isColorDerivedOrder() || !options.isLegacyVariantReordering()) return order;
		if (params.has(VendorVariant.LSM510) && nChannels >= 2) {
			swap(order, 0, 1);
		} else if (params.has(VendorVariant.LSM880) && nChannels >= 3) {
			swap(order, 0, 2);
		}
		return order;
	}

	private static void swap(final int[] array, final int i, final int j) {
		final int tmp = array[i];
		array[i] = array[j];
		array[j] = tmp;
	}

	/**
	 * @param order a complete channel order
	 * @return the output plane of each channel (the inverse of {@code order})
	 */
	public static int[] colorPlanes(final int[] order) {
		final int[] planes = new int[order.length];
		for (int p = 0; p < order.length; p++)
			planes[order[p]] = p;
		return planes;
	}

	/**
	 * Reorders and converts the channels of a complete result.
	 *
	 * @param result the channels of the file. Must be complete
	 * @param order  a complete channel order, as returned by
	 *               {@link #effectiveOrder(ScalingParams, int)}
	 * @return the output planes
	 * @throws ChannelCountMismatchException if the order does not fit the result
	 */
	public ImageStack[] assemble(final ProcessingResult result, final int[] order)
			throws ChannelCountMismatchException {
		if (!result.isComplete())
			throw new IllegalStateException(result.getFilledCount() + "/" + result.getExpectedCount()
					+ " channels delivered");
		final int[] resolved = resolveOrder(order, result.getExpectedCount());
		final ImageStack[] planes = new ImageStack[resolved.length];
		for (int p = 0; p < resolved.length; p++) {
			final ImageStack stack = result.get(resolved[p]);
			if (p > 0 && !ImpUtils.sameDimensions(planes[0], stack))
				throw new IllegalArgumentException("Channel stacks differ in dimensions");
			planes[p] = stack;
		}
		final int bitDepth = (options.getOutputBitDepth() == 0) ? planes[0].getBitDepth()
				: options.getOutputBitDepth();
		for (int p = 0; p < planes.length; p++)
			planes[p] = ImpUtils.convertBitDepth(planes[p], bitDepth);
		TDAUtils.log("Assembled " + planes.length + " plane(s) with order " + Arrays.toString(resolved) + " at "
				+ bitDepth + "-bit");
		return planes;
	}

	/**
	 * @return the file the processed version of {@code input} is saved to
	 */
	public File outputFileFor(final File input, final File outputDir) {
		final File dir = (outputDir == null) ? input.getAbsoluteFile().getParentFile() : outputDir;
		return new File(dir, TDAUtils.getBaseName(input) + options.getOutputSuffix()
				+ ProcessingOptions.DEF_OUTPUT_EXTENSION);
	}

	/**
	 * Saves assembled planes.
	 *
	 * @return the saved file
	 * @throws SaveException if the volume could not be written
	 */
	public File save(final File input, final File outputDir, final ImageStack[] planes, final ScalingParams params)
			throws SaveException {
		final File output = outputFileFor(input, outputDir);
		TiffVolumeWriter.save(output, planes, params);
		return output;
	}

}
