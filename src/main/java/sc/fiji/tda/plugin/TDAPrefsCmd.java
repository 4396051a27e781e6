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

package sc.fiji.tda.plugin;

import org.scijava.ItemVisibility;
import org.scijava.command.Command;
import org.scijava.command.ContextCommand;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;

import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.TDAPrefs;
import sc.fiji.tda.TDAUtils;
import sc.fiji.tda.analysis.ReferenceSelector;

/**
 * Implements the "TDA Processing Options" command.
 */
@Plugin(type = Command.class, label = "TDA Processing Options",
		menuPath = "Plugins>TDA Processing>Options...", initializer = "init")
public class TDAPrefsCmd extends ContextCommand {

	protected static final String HEADER_HTML = "<html><body><div style='font-weight:bold;'>";
	protected static final String DESCRIPTION_HTML = "<html><body><div style='width:500px'>";

	@Parameter(required = false, visibility = ItemVisibility.MESSAGE,
			label = HEADER_HTML + "Reference Slice Selection:")
	private String HEADER1;

	@Parameter(label = "Scoring", choices = { "Robust SNR + structure", "Mean/std SNR (fast)" },
			description = DESCRIPTION_HTML + "How z-slices are scored. The fast option ignores "
					+ "structural content")
	private String policyChoice;

	@Parameter(label = "Denoising sigma (px)", min = "0", stepSize = "0.1")
	private double sigma;

	@Parameter(label = "Background percentile", min = "0.1", max = "100", stepSize = "1",
			description = DESCRIPTION_HTML + "The percentile of denoised intensities taken as background")
	private double percentile;

	@Parameter(label = "Structural weight", stepSize = "0.1",
			description = DESCRIPTION_HTML + "Weight of skeleton density in the composite score")
	private double weight;

	@Parameter(required = false, visibility = ItemVisibility.MESSAGE, label = HEADER_HTML + "<br>Output:")
	private String HEADER2;

	@Parameter(label = "Filename suffix")
	private String suffix;

	@Parameter(label = "Preview size (px)", min = "16", max = "1024")
	private int thumbnailSize;

	@Parameter(label = "Skip files with unreadable metadata",
			description = DESCRIPTION_HTML + "If unchecked, such files are processed assuming 1 micron voxels "
					+ "and unsorted channels")
	private boolean skipOnMetadataError;

	@Parameter(label = "Legacy LSM 510/880 channel order",
			description = DESCRIPTION_HTML + "Swap color planes of LSM 510/880 acquisitions that do not "
					+ "record channel colors, as done by earlier releases")
	private boolean legacyReordering;

	@Parameter(required = false, visibility = ItemVisibility.MESSAGE, label = HEADER_HTML + "<br>Advanced:")
	private String HEADER3;

	@Parameter(label = "Debug mode")
	private boolean debugMode;

	@Parameter(label = "Reset all options")
	private boolean reset;

	private ProcessingOptions options;

	protected void init() {
		options = new TDAPrefs(getContext()).load();
		policyChoice = options.getPolicy().getLabel();
		sigma = options.getSigma();
		percentile = options.getBackgroundPercentile();
		weight = options.getStructuralWeight();
		suffix = options.getOutputSuffix();
		thumbnailSize = options.getThumbnailSize();
		skipOnMetadataError = options.isSkipOnMetadataError();
		legacyReordering = options.isLegacyVariantReordering();
		debugMode = options.isDebugMode();
	}

	@Override
	public void run() {
		final TDAPrefs prefs = new TDAPrefs(getContext());
		if (reset) {
			prefs.clear();
			TDAUtils.setDebugMode(ProcessingOptions.DEF_DEBUG_MODE);
			return;
		}
		if (options == null) options = prefs.load();
		try {
			options.setPolicy(ReferenceSelector.Policy.fromString(policyChoice));
			options.setSigma(sigma);
			options.setBackgroundPercentile(percentile);
			options.setStructuralWeight(weight);
			options.setThumbnailSize(thumbnailSize);
		} catch (final IllegalArgumentException iae) {
			cancel(iae.getMessage());
			return;
		}
		options.setOutputSuffix(suffix);
		options.setSkipOnMetadataError(skipOnMetadataError);
		options.setLegacyVariantReordering(legacyReordering);
		options.setDebugMode(debugMode);
		prefs.save(options);
		TDAUtils.setDebugMode(debugMode);
	}

}
