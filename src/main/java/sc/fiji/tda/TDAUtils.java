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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.lang3.StringUtils;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;
import org.scijava.thread.ThreadService;
import org.scijava.util.VersionUtils;

/** Static utilities for TDA Processing **/
public class TDAUtils {

	/** Extensions (lower case, no dot) of the vendor volumes that can be processed */
	public static final String[] SUPPORTED_EXTENSIONS = { "lsm", "czi" };

	private static Context context;
	private static LogService logService;
	private static boolean initialized;
	private static volatile boolean verbose;

	public static final String VERSION = getVersion();

	private TDAUtils() {}

	private static synchronized void initialize() {
		if (initialized) return;
		if (context == null) getContext();
		if (logService == null) logService = context.getService(LogService.class);
		initialized = true;
	}

	public static String getReadableVersion() {
		return "TDA Processing " + VERSION;
	}

	/**
	 * Retrieves the version of this library
	 *
	 * @return the version or a non-empty place holder string if version could
	 *         not be retrieved.
	 */
	private static String getVersion() {
		try {
			final String version = VersionUtils.getVersion(TDAUtils.class);
			return (version == null) ? "N/A" : version;
		} catch (final Throwable ignored) {
			return "N/A";
		}
	}

	public static synchronized void error(final String string) {
		if (!initialized) initialize();
		logService.error("[TDA] " + string);
	}

	public static synchronized void error(final String string, final Throwable t) {
		if (!initialized) initialize();
		if (t == null)
			logService.error("[TDA] " + string);
		else
			logService.error("[TDA] " + string, t);
	}

	public static synchronized void log(final String string) {
		if (!isDebugMode()) return;
		if (!initialized) initialize();
		logService.info("[TDA] " + string);
	}

	public static synchronized void warn(final String string) {
		if (!initialized) initialize();
		logService.warn("[TDA] " + string);
	}

	/**
	 * Assesses if debug mode is enabled.
	 *
	 * @return the debug flag
	 */
	public static boolean isDebugMode() {
		return verbose;
	}

	/**
	 * Enables/disables debug mode
	 *
	 * @param b verbose flag
	 */
	public static void setDebugMode(final boolean b) {
		if (isDebugMode() && !b) {
			log("Exiting debug mode...");
		}
		verbose = b;
		if (isDebugMode()) {
			log("Entering debug mode...");
		}
	}

	public static synchronized Context getContext() {
		if (context == null) {
			context = new Context(LogService.class, PrefService.class, ThreadService.class,
					StatusService.class, TDAService.class);
		}
		return context;
	}

	public static synchronized void setContext(final Context context) {
		if (TDAUtils.context == null || context == null) {
			TDAUtils.context = context;
			logService = null;
			initialized = false;
		}
	}

	/**
	 * Checks whether a file has one of the {@link #SUPPORTED_EXTENSIONS}.
	 *
	 * @param file the file to be checked
	 * @return true if the file extension is recognized (case-insensitive)
	 */
	public static boolean isSupported(final File file) {
		if (file == null) return false;
		final String ext = getExtension(file);
		return Arrays.asList(SUPPORTED_EXTENSIONS).contains(ext);
	}

	/**
	 * @return the lower case extension of the file name (without the dot), or
	 *         an empty string if the name has no extension
	 */
	public static String getExtension(final File file) {
		final String name = file.getName();
		final int dot = name.lastIndexOf('.');
		return (dot < 0) ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
	}

	/**
	 * @return the file name stripped of its last extension
	 */
	public static String getBaseName(final File file) {
		final String name = file.getName();
		return (name.lastIndexOf('.') < 1) ? name : StringUtils.substringBeforeLast(name, ".");
	}

	/**
	 * Retrieves the vendor volumes in a directory (non-recursively), sorted by
	 * name.
	 *
	 * @param dir             the input directory
	 * @param filenamePattern only file names matching this regex are retrieved.
	 *                        Ignored if null or empty
	 * @return the list of supported files. Empty if none was found
	 * @throws IllegalArgumentException if the pattern is not a valid regex
	 */
	public static List<File> listSupportedFiles(final File dir, final String filenamePattern) {
		final List<File> list = new ArrayList<>();
		if (dir == null || !dir.isDirectory()) return list;
		final Pattern pattern;
		try {
			pattern = (filenamePattern == null || filenamePattern.isEmpty()) ? null
					: Pattern.compile(filenamePattern);
		} catch (final PatternSyntaxException pse) {
			throw new IllegalArgumentException("Invalid filename filter: " + pse.getMessage(), pse);
		}
		final File[] files = dir.listFiles(f -> f.isFile() && isSupported(f)
				&& (pattern == null || pattern.matcher(f.getName()).find()));
		if (files != null) {
			Arrays.sort(files);
			list.addAll(Arrays.asList(files));
		}
		return list;
	}

}
