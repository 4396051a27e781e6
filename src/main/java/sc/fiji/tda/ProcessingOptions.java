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

package sc.fiji.tda;

import sc.fiji.tda.analysis.ReferenceSelector;

/**
 * Tunable parameters of the normalization pipeline. Instances are plain,
 * mutable holders: use {@link TDAPrefs} to load or persist them.
 *
 * @see TDAPrefs
 */
public class ProcessingOptions {

	/* DEFAULTS */
	public final static double DEF_SIGMA = 1.0;
	public final static double DEF_BACKGROUND_PERCENTILE = 20;
	public final static double DEF_STRUCTURAL_WEIGHT = 1.0;
	public final static ReferenceSelector.Policy DEF_POLICY = ReferenceSelector.Policy.COMPOSITE;
	public final static int DEF_THUMBNAIL_SIZE = 180;
	public final static int DEF_OUTPUT_BIT_DEPTH = 0;
	public final static String DEF_OUTPUT_SUFFIX = "_PROCESSED";
	public final static String DEF_OUTPUT_EXTENSION = ".tiff";
	public final static boolean DEF_SKIP_ON_METADATA_ERROR = false;
	public final static boolean DEF_LEGACY_VARIANT_REORDERING = true;
	public final static boolean DEF_DEBUG_MODE = false;

	private double sigma = DEF_SIGMA;
	private double backgroundPercentile = DEF_BACKGROUND_PERCENTILE;
	private double structuralWeight = DEF_STRUCTURAL_WEIGHT;
	private ReferenceSelector.Policy policy = DEF_POLICY;
	private int thumbnailSize = DEF_THUMBNAIL_SIZE;
	private int outputBitDepth = DEF_OUTPUT_BIT_DEPTH;
	private String outputSuffix = DEF_OUTPUT_SUFFIX;
	private boolean skipOnMetadataError = DEF_SKIP_ON_METADATA_ERROR;
	private boolean legacyVariantReordering = DEF_LEGACY_VARIANT_REORDERING;
	private boolean debugMode = DEF_DEBUG_MODE;

	public double getSigma() {
		return sigma;
	}

	/**
	 * @param sigma the standard deviation (pixels) of the Gaussian used to denoise
	 *              slices before scoring. 0 disables denoising
	 */
	public void setSigma(final double sigma) {
		if (sigma < 0 || Double.isNaN(sigma))
			throw new IllegalArgumentException("Sigma must be >= 0");
		this.sigma = sigma;
	}

	public double getBackgroundPercentile() {
		return backgroundPercentile;
	}

	/**
	 * @param percentile the percentile (0, 100] of denoised intensities taken as
	 *                   background
	 */
	public void setBackgroundPercentile(final double percentile) {
		if (!(percentile > 0 && percentile <= 100))
			throw new IllegalArgumentException("Background percentile must be in ]0, 100]");
		this.backgroundPercentile = percentile;
	}

	public double getStructuralWeight() {
		return structuralWeight;
	}

	public void setStructuralWeight(final double structuralWeight) {
		if (Double.isNaN(structuralWeight))
			throw new IllegalArgumentException("Structural weight is NaN");
		this.structuralWeight = structuralWeight;
	}

	public ReferenceSelector.Policy getPolicy() {
		return policy;
	}

	public void setPolicy(final ReferenceSelector.Policy policy) {
		this.policy = (policy == null) ? DEF_POLICY : policy;
	}

	public int getThumbnailSize() {
		return thumbnailSize;
	}

	public void setThumbnailSize(final int thumbnailSize) {
		if (thumbnailSize < 1)
			throw new IllegalArgumentException("Thumbnail size must be > 0");
		this.thumbnailSize = thumbnailSize;
	}

	/**
	 * @return the bit depth of saved volumes: 8, 16, or 0 (same as input)
	 */
	public int getOutputBitDepth() {
		return outputBitDepth;
	}

	public void setOutputBitDepth(final int outputBitDepth) {
		if (outputBitDepth != 0 && outputBitDepth != 8 && outputBitDepth != 16)
			throw new IllegalArgumentException("Output bit depth must be 0, 8 or 16");
		this.outputBitDepth = outputBitDepth;
	}

	public String getOutputSuffix() {
		return outputSuffix;
	}

	public void setOutputSuffix(final String outputSuffix) {
		this.outputSuffix = (outputSuffix == null) ? "" : outputSuffix;
	}

	/**
	 * @return whether files with unreadable metadata are skipped. If false, they
	 *         are processed with unit-scale defaults
	 */
	public boolean isSkipOnMetadataError() {
		return skipOnMetadataError;
	}

	public void setSkipOnMetadataError(final boolean skipOnMetadataError) {
		this.skipOnMetadataError = skipOnMetadataError;
	}

	/**
	 * @return whether LSM 510/880 acquisitions without recorded channel colors
	 *         have their color planes swapped as older releases did
	 */
	public boolean isLegacyVariantReordering() {
		return legacyVariantReordering;
	}

	public void setLegacyVariantReordering(final boolean legacyVariantReordering) {
		this.legacyVariantReordering = legacyVariantReordering;
	}

	public boolean isDebugMode() {
		return debugMode;
	}

	public void setDebugMode(final boolean debugMode) {
		this.debugMode = debugMode;
	}

	@Override
	public String toString() {
		return "sigma=" + sigma + ", percentile=" + backgroundPercentile + ", weight=" + structuralWeight
				+ ", policy=" + policy + ", thumbnail=" + thumbnailSize + ", bitDepth=" + outputBitDepth
				+ ", suffix=" + outputSuffix + ", skipOnMetadataError=" + skipOnMetadataError
				+ ", legacyReordering=" + legacyVariantReordering;
	}

}
