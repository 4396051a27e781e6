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

package sc.fiji.tda.util;

import java.io.File;

import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;
import org.scijava.prefs.PrefService;

import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.TDAPrefs;
import sc.fiji.tda.TDAUtils;

/**
 * Logs batch messages through the {@link LogService}, prefixed with the
 * emitting component and, for loggers obtained through
 * {@link #forFile(File)}, with the name of the volume being processed.
 * <p>
 * Debug messages are only logged if the global debug flag
 * ({@link TDAUtils#isDebugMode()}), the {@code debugMode} preference or the
 * debug level of the LogService is set.
 * </p>
 */
public class Logger {

	@Parameter
	private LogService logService;

	@Parameter
	private PrefService prefService;

	private boolean debug;
	private final String prefix;

	/**
	 * @param context   the SciJava context providing the log and pref services
	 * @param component the name of the logging component
	 */
	public Logger(final Context context, final String component) {
		context.inject(this);
		debug = TDAUtils.isDebugMode() || logService.isDebug()
				|| prefService.getBoolean(TDAPrefs.class, "debugMode", ProcessingOptions.DEF_DEBUG_MODE);
		prefix = component + ": ";
	}

	private Logger(final Logger parent, final String prefix) {
		logService = parent.logService;
		prefService = parent.prefService;
		debug = parent.debug;
		this.prefix = prefix;
	}

	/**
	 * @param file the volume being processed
	 * @return a logger sharing the debug state of this one (at the time of the
	 *         call) whose messages also name {@code file}
	 */
	public Logger forFile(final File file) {
		return new Logger(this, prefix + file.getName() + ": ");
	}

	public void info(final Object msg) {
		logService.info(prefix + msg);
	}

	public void debug(final Object msg) {
		if (debug) logService.info(prefix + msg);
	}

	public void warn(final String msg) {
		logService.warn(prefix + msg);
	}

	/**
	 * Logs an error. The stack trace of {@code cause} is only logged in debug
	 * mode.
	 */
	public void error(final String msg, final Throwable cause) {
		if (debug && cause != null)
			logService.error(prefix + msg, cause);
		else
			logService.error(prefix + msg);
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(final boolean debug) {
		this.debug = debug;
	}

}
