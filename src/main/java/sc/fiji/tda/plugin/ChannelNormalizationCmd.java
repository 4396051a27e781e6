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

import java.io.File;
import java.util.List;

import org.scijava.ItemIO;
import org.scijava.ItemVisibility;
import org.scijava.app.StatusService;
import org.scijava.command.Command;
import org.scijava.command.CommandService;
import org.scijava.command.DynamicCommand;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.widget.Button;
import org.scijava.widget.FileWidget;

import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.TDAPrefs;
import sc.fiji.tda.TDAUtils;
import sc.fiji.tda.event.ProcessingEvent;
import sc.fiji.tda.event.ProcessingListener;
import sc.fiji.tda.processing.FileCoordinator;
import sc.fiji.tda.util.Logger;

/**
 * Implements the "Normalize Channels (Batch)" command: every LSM/CZI volume of
 * a directory is normalized and saved as a composite TIFF.
 */
@Plugin(type = Command.class, menuPath = "Plugins>TDA Processing>Normalize Channels (Batch)...",
		initializer = "init")
public class ChannelNormalizationCmd extends DynamicCommand implements ProcessingListener {

	protected static final String HEADER_HTML = "<html><body><div style='font-weight:bold;'>";

	@Parameter
	private StatusService statusService;
	@Parameter
	private CommandService cmdService;

	@Parameter(required = false, visibility = ItemVisibility.MESSAGE, label = HEADER_HTML + "Input:")
	private String HEADER0;

	@Parameter(required = false, label = "Directory", style = FileWidget.DIRECTORY_STYLE,
			description = "Input folder containing .lsm and/or .czi volumes.")
	private File directory;

	@Parameter(required = false, label = "Filename filter",
			description = "Only filenames matching this string (case sensitive) will be considered. "
					+ "Regex patterns accepted. Leave empty to disable filtering.")
	private String filenamePattern;

	@Parameter(required = false, visibility = ItemVisibility.MESSAGE, label = HEADER_HTML + "<br>Output:")
	private String HEADER1;

	@Parameter(required = false, label = "Destination", style = FileWidget.DIRECTORY_STYLE,
			description = "Destination directory. Leave empty to save next to input files. "
					+ "NB: Files are overwritten on re-runs.")
	private File outputDir;

	@Parameter(label = "Bit depth", required = false, choices = { "Same as input", "8-bit", "16-bit" })
	private String bitDepthChoice;

	@Parameter(label = "Further Options...", callback = "runOptions")
	private Button optionsButton;

	@Parameter(required = false)
	private List<File> fileList;

	@Parameter(type = ItemIO.OUTPUT, label = "Processed files")
	private List<File> savedFiles;

	private Logger logger;
	private FileCoordinator coordinator;

	protected void init() {
		logger = new Logger(getContext(), "ChannelNormalizationCmd");
		if (bitDepthChoice == null) bitDepthChoice = "Same as input";
	}

	@SuppressWarnings("unused")
	private void runOptions() {
		cmdService.run(TDAPrefsCmd.class, true);
	}

	@Override
	public void run() {
		if (logger == null) init();
		if (fileList == null || fileList.isEmpty()) {
			if (directory == null || !directory.isDirectory()) {
				cancel("<HTML>Input directory is not valid.");
				return;
			}
			try {
				fileList = TDAUtils.listSupportedFiles(directory, filenamePattern);
			} catch (final IllegalArgumentException iae) {
				cancel("<HTML>" + iae.getMessage());
				return;
			}
			logger.info("Found " + fileList.size() + " volume(s) in " + directory.getAbsolutePath());
		}
		if (fileList.isEmpty()) {
			final String msg = (filenamePattern == null || filenamePattern.isEmpty())
					? "No .lsm or .czi files found in directory."
					: "No .lsm or .czi files matching '" + filenamePattern + "' found in directory.";
			cancel("<HTML>" + msg);
			return;
		}
		final ProcessingOptions options = new TDAPrefs(getContext()).load();
		options.setOutputBitDepth(bitDepth());
		logger.debug("Options: " + options);
		coordinator = new FileCoordinator(getContext(), options, outputDir);
		coordinator.addListener(this);
		coordinator.enqueue(fileList);
		try {
			savedFiles = coordinator.run();
		} finally {
			coordinator.dispose();
			statusService.clearStatus();
		}
	}

	private int bitDepth() {
		if ("8-bit".equals(bitDepthChoice)) return 8;
		if ("16-bit".equals(bitDepthChoice)) return 16;
		return 0;
	}

	@Override
	public void processingEvent(final ProcessingEvent event) {
		switch (event.getType()) {
		case ProcessingEvent.FILE_STARTED:
		case ProcessingEvent.SAVE_FINISHED:
		case ProcessingEvent.BATCH_FINISHED:
			statusService.showStatus(event.getMessage());
			break;
		case ProcessingEvent.PROGRESS:
			statusService.showStatus((int) Math.round(event.getProgress()), 100, event.getFile().getName());
			break;
		default:
			if (event.isError()) statusService.warn(event.getMessage());
		}
	}

	@Override
	public void cancel(final String reason) {
		if (coordinator != null) coordinator.cancel();
		super.cancel(reason);
	}

}
