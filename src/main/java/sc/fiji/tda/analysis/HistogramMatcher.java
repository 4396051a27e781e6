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

import java.util.Arrays;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Histogram matching of unsigned integer images: every intensity of the
 * source is mapped onto the reference intensity sharing its cumulative
 * frequency. Quantiles falling between two reference levels are linearly
 * interpolated; quantiles outside the reference range are clamped to its
 * extremes.
 */
public class HistogramMatcher {

	private HistogramMatcher() {} // prevent class instantiation

	/**
	 * Matches the histogram of a slice to that of a reference slice.
	 *
	 * @param source    the 8-bit or 16-bit slice to be transformed
	 * @param reference the 8-bit or 16-bit reference slice
	 * @return the (unrounded) matched intensities
	 */
	public static FloatProcessor match(final ImageProcessor source, final ImageProcessor reference) {
		final Levels src = new Levels(source);
		final Levels ref = new Levels(reference);
		final float[] lut = new float[src.maxLevel + 1];
		for (int i = 0; i < src.values.length; i++)
			lut[src.values[i]] = (float) interpolate(src.quantiles[i], ref.quantiles, ref.values);

		final int n = source.getPixelCount();
		final float[] matched = new float[n];
		for (int i = 0; i < n; i++)
			matched[i] = lut[source.get(i)];
		return new FloatProcessor(source.getWidth(), source.getHeight(), matched);
	}

	/**
	 * Piecewise linear interpolation of (xp, fp) at x. xp must be increasing.
	 * Values of x outside xp map to the first/last fp value.
	 */
	static double interpolate(final double x, final double[] xp, final int[] fp) {
		if (x <= xp[0]) return fp[0];
		final int last = xp.length - 1;
		if (x >= xp[last]) return fp[last];
		int idx = Arrays.binarySearch(xp, x);
		if (idx >= 0) return fp[idx];
		idx = -idx - 2; // xp[idx] < x < xp[idx+1]
		final double t = (x - xp[idx]) / (xp[idx + 1] - xp[idx]);
		return fp[idx] + t * (fp[idx + 1] - fp[idx]);
	}

	/** Occupied intensity levels of an image and their cumulative frequencies */
	private static class Levels {

		final int[] values;
		final double[] quantiles;
		final int maxLevel;

		Levels(final ImageProcessor ip) {
			final int n = ip.getPixelCount();
			int max = 0;
			for (int i = 0; i < n; i++)
				max = Math.max(max, ip.get(i));
			final int[] counts = new int[max + 1];
			int nLevels = 0;
			for (int i = 0; i < n; i++) {
				if (counts[ip.get(i)]++ == 0) nLevels++;
			}
			values = new int[nLevels];
			quantiles = new double[nLevels];
			long cumsum = 0;
			int j = 0;
			for (int v = 0; v <= max; v++) {
				if (counts[v] == 0) continue;
				cumsum += counts[v];
				values[j] = v;
				quantiles[j] = (double) cumsum / n;
				j++;
			}
			maxLevel = max;
		}
	}

}
