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

import java.io.File;
import java.util.Collection;
import java.util.List;

import org.scijava.Priority;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.plugin.Plugin;
import org.scijava.service.AbstractService;
import org.scijava.service.SciJavaService;
import org.scijava.service.Service;

import sc.fiji.tda.event.ProcessingListener;
import sc.fiji.tda.io.MetadataParseException;
import sc.fiji.tda.io.MetadataResolver;
import sc.fiji.tda.io.ScalingParams;
import sc.fiji.tda.processing.FileCoordinator;

/**
 * Service giving scripts access to the channel normalization pipeline.
 * <p>
 * Example (Groovy):
 * </p>
 * <pre>
 * #@TDAService tda
 * saved = tda.process(new File("/data/raw"), ".*\\.lsm", new File("/data/processed"))
 * </pre>
 */
@Plugin(type = Service.class, priority = Priority.NORMAL)
public class TDAService extends AbstractService implements SciJavaService {

	@Parameter
	private LogService logService;

	private final MetadataResolver resolver = new MetadataResolver();

	/**
	 * @return the processing options stored in preferences
	 */
	public ProcessingOptions getOptions() {
		return new TDAPrefs(getContext()).load();
	}

	/**
	 * Stores processing options as preferences.
	 */
	public void setOptions(final ProcessingOptions options) {
		new TDAPrefs(getContext()).save(options);
	}

	/**
	 * Reads the scaling record of a vendor volume.
	 *
	 * @throws MetadataParseException if metadata could not be parsed
	 */
	public ScalingParams getScaling(final File file) throws MetadataParseException {
		return resolver.resolve(file);
	}

	/**
	 * Creates a coordinator for the specified files. Callers are responsible
	 * for calling {@link FileCoordinator#run()} and
	 * {@link FileCoordinator#dispose()}.
	 */
	public FileCoordinator newCoordinator(final Collection<File> files, final ProcessingOptions options,
			final File outputDir) {
		final FileCoordinator coordinator = new FileCoordinator(getContext(), options, outputDir, resolver);
		coordinator.enqueue(files);
		return coordinator;
	}

	/**
	 * Processes the vendor volumes of a directory using stored preferences.
	 *
	 * @param dir             the input directory
	 * @param filenamePattern regex filtering file names. Null or empty to
	 *                        disable filtering
	 * @param outputDir       the output directory
	 * @return the list of saved files
	 */
	public List<File> process(final File dir, final String filenamePattern, final File outputDir) {
		return process(TDAUtils.listSupportedFiles(dir, filenamePattern), getOptions(), outputDir, null);
	}

	/**
	 * Processes a list of vendor volumes.
	 *
	 * @param files     the files to process
	 * @param options   the processing options
	 * @param outputDir the output directory
	 * @param listener  an optional listener of processing events. May be null
	 * @return the list of saved files
	 */
	public List<File> process(final Collection<File> files, final ProcessingOptions options, final File outputDir,
			final ProcessingListener listener) {
		logService.info("[TDA] " + TDAUtils.getReadableVersion() + ": processing " + files.size() + " file(s) using " + options);
		final FileCoordinator coordinator = newCoordinator(files, options, outputDir);
		if (listener != null) coordinator.addListener(listener);
		try {
			return coordinator.run();
		} finally {
			coordinator.dispose();
		}
	}

}
