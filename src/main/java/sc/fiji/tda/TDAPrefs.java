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

import org.scijava.Context;
import org.scijava.prefs.PrefService;

import sc.fiji.tda.analysis.ReferenceSelector;

/**
 * Class handling TDA Processing preferences.
 */
public class TDAPrefs {

	private static final String SIGMA = "tda.sigma";
	private static final String PERCENTILE = "tda.percentile";
	private static final String WEIGHT = "tda.weight";
	private static final String POLICY = "tda.policy";
	private static final String THUMBNAIL_SIZE = "tda.thumbnail";
	private static final String BIT_DEPTH = "tda.bitdepth";
	private static final String SUFFIX = "tda.suffix";
	private static final String SKIP_ON_METADATA_ERROR = "tda.skipmetaerr";
	private static final String LEGACY_REORDERING = "tda.legacyorder";
	static final String DEBUG_MODE = "debugMode";

	private final PrefService prefService;

	/**
	 * Constructs a new TDAPrefs instance backed by the PrefService of the
	 * specified context.
	 *
	 * @param context the SciJava context providing {@link PrefService}
	 */
	public TDAPrefs(final Context context) {
		prefService = context.getService(PrefService.class);
		if (prefService == null)
			throw new IllegalArgumentException("Context does not provide a PrefService");
	}

	/**
	 * Loads stored preferences. Invalid stored values are replaced by defaults.
	 *
	 * @return the stored options
	 */
	public ProcessingOptions load() {
		final ProcessingOptions options = new ProcessingOptions();
		try {
			options.setSigma(prefService.getDouble(TDAPrefs.class, SIGMA, ProcessingOptions.DEF_SIGMA));
			options.setBackgroundPercentile(prefService.getDouble(TDAPrefs.class, PERCENTILE,
					ProcessingOptions.DEF_BACKGROUND_PERCENTILE));
			options.setStructuralWeight(prefService.getDouble(TDAPrefs.class, WEIGHT,
					ProcessingOptions.DEF_STRUCTURAL_WEIGHT));
			options.setPolicy(ReferenceSelector.Policy.fromString(prefService.get(TDAPrefs.class, POLICY,
					ProcessingOptions.DEF_POLICY.toString())));
			options.setThumbnailSize(prefService.getInt(TDAPrefs.class, THUMBNAIL_SIZE,
					ProcessingOptions.DEF_THUMBNAIL_SIZE));
			options.setOutputBitDepth(prefService.getInt(TDAPrefs.class, BIT_DEPTH,
					ProcessingOptions.DEF_OUTPUT_BIT_DEPTH));
		} catch (final IllegalArgumentException ex) {
			TDAUtils.warn("Invalid preferences were reset to defaults: " + ex.getMessage());
			clear();
			return new ProcessingOptions();
		}
		options.setOutputSuffix(prefService.get(TDAPrefs.class, SUFFIX, ProcessingOptions.DEF_OUTPUT_SUFFIX));
		options.setSkipOnMetadataError(prefService.getBoolean(TDAPrefs.class, SKIP_ON_METADATA_ERROR,
				ProcessingOptions.DEF_SKIP_ON_METADATA_ERROR));
		options.setLegacyVariantReordering(prefService.getBoolean(TDAPrefs.class, LEGACY_REORDERING,
				ProcessingOptions.DEF_LEGACY_VARIANT_REORDERING));
		options.setDebugMode(prefService.getBoolean(TDAPrefs.class, DEBUG_MODE,
				ProcessingOptions.DEF_DEBUG_MODE));
		return options;
	}

	/**
	 * Persists the specified options.
	 *
	 * @param options the options to be stored
	 */
	public void save(final ProcessingOptions options) {
		prefService.put(TDAPrefs.class, SIGMA, options.getSigma());
		prefService.put(TDAPrefs.class, PERCENTILE, options.getBackgroundPercentile());
		prefService.put(TDAPrefs.class, WEIGHT, options.getStructuralWeight());
		prefService.put(TDAPrefs.class, POLICY, options.getPolicy().toString());
		prefService.put(TDAPrefs.class, THUMBNAIL_SIZE, options.getThumbnailSize());
		prefService.put(TDAPrefs.class, BIT_DEPTH, options.getOutputBitDepth());
		prefService.put(TDAPrefs.class, SUFFIX, options.getOutputSuffix());
		prefService.put(TDAPrefs.class, SKIP_ON_METADATA_ERROR, options.isSkipOnMetadataError());
		prefService.put(TDAPrefs.class, LEGACY_REORDERING, options.isLegacyVariantReordering());
		prefService.put(TDAPrefs.class, DEBUG_MODE, options.isDebugMode());
	}

	/** Resets all preferences to their defaults. */
	public void clear() {
		prefService.clear(TDAPrefs.class);
	}

}
