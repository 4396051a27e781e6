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

package sc.fiji.tda.processing;

import java.io.File;

import ij.ImageStack;
import ij.process.ColorProcessor;

/**
 * Messages posted to the {@link FileCoordinator} queue by channel workers and
 * by the saving task. Every message carries the id of the file session it
 * belongs to.
 */
public class WorkerMessage {

	public enum Type {
		REFERENCE, PREVIEW, PROGRESS, CHANNEL_DONE, CHANNEL_ERROR, SAVE_DONE, SAVE_FAILED, CANCEL
	}

	private final Type type;
	private final long session;
	private final int channel;
	private final int slice;
	private final ColorProcessor thumbnail;
	private final ImageStack stack;
	private final String message;
	private final File outputFile;
	private final Throwable cause;

	private WorkerMessage(final Type type, final long session, final int channel, final int slice,
			final ColorProcessor thumbnail, final ImageStack stack, final String message, final File outputFile,
			final Throwable cause) {
		this.type = type;
		this.session = session;
		this.channel = channel;
		this.slice = slice;
		this.thumbnail = thumbnail;
		this.stack = stack;
		this.message = message;
		this.outputFile = outputFile;
		this.cause = cause;
	}

	public static WorkerMessage reference(final long session, final int channel, final ColorProcessor thumbnail) {
		return new WorkerMessage(Type.REFERENCE, session, channel, -1, thumbnail, null, null, null, null);
	}

	public static WorkerMessage preview(final long session, final int channel, final int slice,
			final ColorProcessor thumbnail) {
		return new WorkerMessage(Type.PREVIEW, session, channel, slice, thumbnail, null, null, null, null);
	}

	public static WorkerMessage progress(final long session, final int channel, final int slice) {
		return new WorkerMessage(Type.PROGRESS, session, channel, slice, null, null, null, null, null);
	}

	public static WorkerMessage done(final long session, final int channel, final ImageStack stack) {
		return new WorkerMessage(Type.CHANNEL_DONE, session, channel, -1, null, stack, null, null, null);
	}

	public static WorkerMessage error(final long session, final int channel, final String message,
			final Throwable cause) {
		return new WorkerMessage(Type.CHANNEL_ERROR, session, channel, -1, null, null, message, null, cause);
	}

	public static WorkerMessage saved(final long session, final File outputFile) {
		return new WorkerMessage(Type.SAVE_DONE, session, -1, -1, null, null, null, outputFile, null);
	}

	public static WorkerMessage saveFailed(final long session, final String message, final Throwable cause) {
		return new WorkerMessage(Type.SAVE_FAILED, session, -1, -1, null, null, message, null, cause);
	}

	public static WorkerMessage cancel() {
		return new WorkerMessage(Type.CANCEL, -1, -1, -1, null, null, "Cancelled", null, null);
	}

	public Type getType() {
		return type;
	}

	public long getSession() {
		return session;
	}

	public int getChannel() {
		return channel;
	}

	public int getSlice() {
		return slice;
	}

	public ColorProcessor getThumbnail() {
		return thumbnail;
	}

	public ImageStack getStack() {
		return stack;
	}

	public String getMessage() {
		return message;
	}

	public File getOutputFile() {
		return outputFile;
	}

	public Throwable getCause() {
		return cause;
	}

	@Override
	public String toString() {
		return type + " [session=" + session + ", channel=" + channel + ", slice=" + slice + "]";
	}

}
