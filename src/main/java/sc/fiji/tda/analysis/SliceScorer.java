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

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import ij.plugin.filter.GaussianBlur;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import sc.fiji.tda.ProcessingOptions;

/**
 * Scores individual z-slices for signal quality and structural content. The
 * composite score combines a robust signal-to-noise ratio with the density of
 * the skeleton of the slice foreground. Instances are stateless and can be
 * shared across threads.
 */
public class SliceScorer {

	/** Scales the median absolute deviation to a standard deviation estimate */
	public static final double MAD_TO_SIGMA = 1.4826;
	/** Lower bound of the noise estimate */
	public static final double NOISE_FLOOR = 1e-6;

	private static final double BLUR_ACCURACY = 0.002;
	private static final int FOREGROUND = 255;

	private final double sigma;
	private final double percentile;
	private final double structuralWeight;

	/**
	 * @param sigma            the Gaussian sigma (in pixels) used for denoising.
	 *                         0 disables denoising
	 * @param percentile       the percentile (0, 100] of denoised intensities
	 *                         taken as background
	 * @param structuralWeight the weight of the skeleton density term
	 */
	public SliceScorer(final double sigma, final double percentile, final double structuralWeight) {
		if (sigma < 0) throw new IllegalArgumentException("Sigma must be >= 0");
		if (!(percentile > 0 && percentile <= 100))
			throw new IllegalArgumentException("Percentile must be in ]0, 100]");
		this.sigma = sigma;
		this.percentile = percentile;
		this.structuralWeight = structuralWeight;
	}

	public SliceScorer(final ProcessingOptions options) {
		this(options.getSigma(), options.getBackgroundPercentile(), options.getStructuralWeight());
	}

	public SliceScorer() {
		this(ProcessingOptions.DEF_SIGMA, ProcessingOptions.DEF_BACKGROUND_PERCENTILE,
				ProcessingOptions.DEF_STRUCTURAL_WEIGHT);
	}

	/**
	 * Computes the composite score of a slice.
	 *
	 * @param ip    the slice
	 * @param index the z-position of the slice, stored in the returned score
	 * @return the slice score
	 */
	public SliceScore score(final ImageProcessor ip, final int index) {
		final FloatProcessor fp = denoise(ip);
		final double[] values = toDoubles(fp);

		final Percentile stats = new Percentile().withEstimationType(EstimationType.R_7);
		stats.setData(values);
		final double background = stats.evaluate(percentile);
		final double median = stats.evaluate(50);
		final double[] deviations = new double[values.length];
		for (int i = 0; i < values.length; i++)
			deviations[i] = Math.abs(values[i] - median);
		final double mad = new Percentile().withEstimationType(EstimationType.R_7).evaluate(deviations, 50);
		final double noise = Math.max(NOISE_FLOOR, MAD_TO_SIGMA * mad);

		double sum = 0;
		int nAbove = 0;
		for (final double v : values) {
			if (v > background) {
				sum += v;
				nAbove++;
			}
		}
		final double signal = (nAbove > 0) ? sum / nAbove : StatUtils.mean(values);
		final double snr = (signal - background) / noise;

		final double threshold = background + noise;
		final ByteProcessor mask = new ByteProcessor(fp.getWidth(), fp.getHeight());
		for (int i = 0; i < values.length; i++) {
			if (values[i] > threshold) mask.set(i, FOREGROUND);
		}
		final int skeletonLength = skeletonLength(mask);
		final double density = (double) skeletonLength / values.length;

		return new SliceScore(index, background, noise, signal, snr, skeletonLength, density,
				snr + structuralWeight * density);
	}

	/**
	 * Computes a lightweight score (mean over standard deviation of raw
	 * intensities) without structural term.
	 *
	 * @param ip    the slice
	 * @param index the z-position of the slice, stored in the returned score
	 * @return the slice score. Its SNR is 0 if the slice is flat
	 */
	public SliceScore scoreBasic(final ImageProcessor ip, final int index) {
		final double[] values = toDoubles(ip);
		final double mean = StatUtils.mean(values);
		final double std = new StandardDeviation(false).evaluate(values);
		final double snr = (std == 0) ? 0 : mean / std;
		return new SliceScore(index, Double.NaN, std, mean, snr, 0, 0, snr);
	}

	/**
	 * Thins a binary mask in place and counts the remaining foreground pixels.
	 *
	 * @param mask a binary mask, foreground = 255
	 * @return the number of skeleton pixels
	 */
	static int skeletonLength(final ByteProcessor mask) {
		mask.skeletonize(FOREGROUND);
		final byte[] pixels = (byte[]) mask.getPixels();
		int n = 0;
		for (final byte p : pixels) {
			if ((p & 0xff) == FOREGROUND) n++;
		}
		return n;
	}

	private FloatProcessor denoise(final ImageProcessor ip) {
		final FloatProcessor fp = (FloatProcessor) ip.duplicate().convertToFloat();
		if (sigma > 0) new GaussianBlur().blurGaussian(fp, sigma, sigma, BLUR_ACCURACY);
		return fp;
	}

	private static double[] toDoubles(final ImageProcessor ip) {
		final int n = ip.getPixelCount();
		final double[] values = new double[n];
		for (int i = 0; i < n; i++)
			values[i] = ip.getf(i);
		return values;
	}

	public double getSigma() {
		return sigma;
	}

	public double getPercentile() {
		return percentile;
	}

	public double getStructuralWeight() {
		return structuralWeight;
	}

}
