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

package sc.fiji.tda.event;

import java.io.File;

import ij.process.ColorProcessor;

/**
 * Event describing the progress (or failure) of a file being processed.
 * Errors are never thrown at listeners: they are delivered as events of one
 * of the error types, each carrying a human-readable message.
 */
public class ProcessingEvent extends TDAEvent {

	/** A file was dequeued */
	public final static int FILE_STARTED = 10;
	/** Aggregate progress of the current file changed */
	public final static int PROGRESS = 11;
	/** A normalized slice preview is available */
	public final static int PREVIEW = 12;
	/** The preview of a channel's reference slice is available */
	public final static int REFERENCE = 13;
	/** The composite volume was saved */
	public final static int SAVE_FINISHED = 14;
	/** The queue was exhausted */
	public final static int BATCH_FINISHED = 15;

	/** Vendor metadata could not be parsed (recoverable) */
	public final static int METADATA_ERROR = 20;
	/** The volume could not be read */
	public final static int EXTRACTION_ERROR = 21;
	/** A channel failed to be read, scored or normalized */
	public final static int CHANNEL_ERROR = 22;
	/** Channel order does not match the processed channels */
	public final static int CHANNEL_COUNT_MISMATCH = 23;
	/** The composite volume could not be saved */
	public final static int SAVE_ERROR = 24;

	private final File file;
	private final int channel;
	private final double progress;
	private final ColorProcessor thumbnail;
	private final String message;
	private final File outputFile;

	private ProcessingEvent(final int type, final File file, final int channel, final double progress,
			final ColorProcessor thumbnail, final String message, final File outputFile) {
		super(type);
		this.file = file;
		this.channel = channel;
		this.progress = progress;
		this.thumbnail = thumbnail;
		this.message = message;
		this.outputFile = outputFile;
	}

	public static ProcessingEvent fileStarted(final File file, final int remaining) {
		return new ProcessingEvent(FILE_STARTED, file, -1, 0, null,
				"Processing " + file.getName() + " (" + remaining + " file(s) remaining in queue)", null);
	}

	public static ProcessingEvent progress(final File file, final double percentage) {
		return new ProcessingEvent(PROGRESS, file, -1, percentage, null, null, null);
	}

	public static ProcessingEvent preview(final File file, final int channel, final ColorProcessor thumbnail) {
		return new ProcessingEvent(PREVIEW, file, channel, 0, thumbnail, null, null);
	}

	public static ProcessingEvent reference(final File file, final int channel, final ColorProcessor thumbnail) {
		return new ProcessingEvent(REFERENCE, file, channel, 0, thumbnail, null, null);
	}

	public static ProcessingEvent saveFinished(final File file, final File outputFile) {
		return new ProcessingEvent(SAVE_FINISHED, file, -1, 100, null, "Saved " + outputFile.getAbsolutePath(),
				outputFile);
	}

	public static ProcessingEvent batchFinished(final int nSaved, final int nFiles) {
		return new ProcessingEvent(BATCH_FINISHED, null, -1, 100, null,
				nSaved + " of " + nFiles + " file(s) processed", null);
	}

	public static ProcessingEvent cancelled() {
		return new ProcessingEvent(QUIT, null, -1, 0, null, "Processing cancelled", null);
	}

	/**
	 * Creates an error event.
	 *
	 * @param type    one of the error types (e.g., {@link #SAVE_ERROR})
	 * @param file    the input file
	 * @param channel the channel the error relates to, or -1
	 * @param message the error message. It is prefixed with the error label
	 * @return the event
	 */
	public static ProcessingEvent error(final int type, final File file, final int channel, final String message) {
		if (!isErrorType(type))
			throw new IllegalArgumentException("Not an error type: " + type);
		final StringBuilder sb = new StringBuilder(label(type));
		if (channel > -1) sb.append(" [channel ").append(channel).append("]");
		if (file != null) sb.append(" (").append(file.getName()).append(")");
		sb.append(": ").append(message);
		return new ProcessingEvent(type, file, channel, 0, null, sb.toString(), null);
	}

	public static boolean isErrorType(final int type) {
		return type >= METADATA_ERROR && type <= SAVE_ERROR;
	}

	/**
	 * @return a short description of the specified event type
	 */
	public static String label(final int type) {
		switch (type) {
		case FILE_STARTED:
			return "File started";
		case PROGRESS:
			return "Progress";
		case PREVIEW:
			return "Preview";
		case REFERENCE:
			return "Reference";
		case SAVE_FINISHED:
			return "Save complete";
		case BATCH_FINISHED:
			return "Batch complete";
		case METADATA_ERROR:
			return "Metadata error";
		case EXTRACTION_ERROR:
			return "Extraction error";
		case CHANNEL_ERROR:
			return "Channel processing error";
		case CHANNEL_COUNT_MISMATCH:
			return "Channel count mismatch";
		case SAVE_ERROR:
			return "Save error";
		case QUIT:
			return "Aborted";
		default:
			return "Event";
		}
	}

	public boolean isError() {
		return isErrorType(type);
	}

	public File getFile() {
		return file;
	}

	/**
	 * @return the channel this event relates to, or -1 if it relates to the
	 *         whole file
	 */
	public int getChannel() {
		return channel;
	}

	/**
	 * @return the aggregate progress of the file as a percentage in [0, 100]
	 */
	public double getProgress() {
		return progress;
	}

	public ColorProcessor getThumbnail() {
		return thumbnail;
	}

	public String getMessage() {
		return message;
	}

	public File getOutputFile() {
		return outputFile;
	}

	@Override
	public String toString() {
		if (message != null) return message;
		if (type == PROGRESS) return label(type) + ": " + String.format("%.1f%%", progress);
		return label(type) + ((channel > -1) ? " [channel " + channel + "]" : "");
	}

}
