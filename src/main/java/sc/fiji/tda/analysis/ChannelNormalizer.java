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

package sc.fiji.tda.analysis;

import java.util.concurrent.CancellationException;

import ij.ImageStack;
import ij.plugin.filter.RankFilters;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.util.ImpUtils;

/**
 * Normalizes the slices of a channel stack against its reference slice:
 * each slice is histogram-matched to the reference and then median filtered
 * (3x3) to suppress the shot noise introduced by the matching.
 */
public class ChannelNormalizer {

	/** Radius of the median filter. In ImageJ, radius 1 is a 3x3 kernel */
	public static final double MEDIAN_RADIUS = 1;

	private final int thumbnailSize;

	public ChannelNormalizer(final int thumbnailSize) {
		if (thumbnailSize < 1) throw new IllegalArgumentException("Thumbnail size must be > 0");
		this.thumbnailSize = thumbnailSize;
	}

	public ChannelNormalizer() {
		this(ProcessingOptions.DEF_THUMBNAIL_SIZE);
	}

	/**
	 * Normalizes a channel stack.
	 *
	 * @param stack          the 8-bit or 16-bit channel stack
	 * @param referenceIndex the 0-based index of the reference slice
	 * @param channel        the channel index, passed on to the callback
	 * @param colorPlane     the color plane of previews ({@link ImpUtils#RED},
	 *                       {@link ImpUtils#GREEN} or {@link ImpUtils#BLUE})
	 * @param callback       the progress callback. May be null
	 * @return the normalized stack, with the dimensions and bit depth of the
	 *         input
	 * @throws CancellationException if the calling thread is interrupted
	 */
	public ImageStack normalize(final ImageStack stack, final int referenceIndex, final int channel,
			final int colorPlane, final NormalizationCallback callback) {
		if (referenceIndex < 0 || referenceIndex >= stack.getSize())
			throw new IllegalArgumentException("Invalid reference slice: " + referenceIndex);
		final ImageProcessor reference = stack.getProcessor(referenceIndex + 1);
		if (callback != null)
			callback.referenceReady(channel, ImpUtils.thumbnail(reference, colorPlane, thumbnailSize));
		final ImageStack result = new ImageStack(stack.getWidth(), stack.getHeight());
		for (int i = 1; i <= stack.getSize(); i++) {
			if (Thread.currentThread().isInterrupted())
				throw new CancellationException("Normalization of channel " + channel + " interrupted");
			final ImageProcessor normalized = normalizeSlice(stack.getProcessor(i), reference);
			result.addSlice(stack.getSliceLabel(i), normalized);
			if (callback != null)
				callback.sliceNormalized(channel, i - 1, ImpUtils.thumbnail(normalized, colorPlane, thumbnailSize));
		}
		return result;
	}

	/**
	 * Normalizes a single slice against a reference slice.
	 *
	 * @return a new processor of the same type as {@code slice}
	 */
	public ImageProcessor normalizeSlice(final ImageProcessor slice, final ImageProcessor reference) {
		final FloatProcessor matched = HistogramMatcher.match(slice, reference);
		new RankFilters().rank(matched, MEDIAN_RADIUS, RankFilters.MEDIAN);
		final int bitDepth = slice.getBitDepth();
		final int max = ImpUtils.maxValue(bitDepth);
		final ImageProcessor out = ImpUtils.createProcessor(slice.getWidth(), slice.getHeight(), bitDepth);
		final int n = out.getPixelCount();
		for (int i = 0; i < n; i++) {
			final long v = Math.round(matched.getf(i));
			out.set(i, (int) Math.max(0, Math.min(max, v)));
		}
		return out;
	}

	public int getThumbnailSize() {
		return thumbnailSize;
	}

}
