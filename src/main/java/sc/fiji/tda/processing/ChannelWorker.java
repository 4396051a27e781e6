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
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;

import ij.ImageStack;
import ij.process.ColorProcessor;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.analysis.ChannelNormalizer;
import sc.fiji.tda.analysis.NormalizationCallback;
import sc.fiji.tda.analysis.ReferenceSelector;
import sc.fiji.tda.io.VolumeFormat;

/**
 * Processes one channel of one file: reads the channel stack, selects its
 * reference slice and normalizes it. Everything the worker produces is posted
 * to the coordinator queue, ending with exactly one
 * {@link WorkerMessage.Type#CHANNEL_DONE} or
 * {@link WorkerMessage.Type#CHANNEL_ERROR} message. Interrupted workers exit
 * without posting a terminal message.
 */
public class ChannelWorker implements Runnable, NormalizationCallback {

	private final VolumeFormat format;
	private final File file;
	private final int channel;
	private final int colorPlane;
	private final long session;
	private final BlockingQueue<WorkerMessage> queue;
	private final ReferenceSelector selector;
	private final ChannelNormalizer normalizer;

	/**
	 * @param format     the format of the file
	 * @param file       the volume file
	 * @param channel    the channel to process
	 * @param colorPlane the output color plane of the channel, used for previews
	 * @param session    the file session id stamped on messages
	 * @param queue      the coordinator queue
	 * @param options    the processing options
	 */
	public ChannelWorker(final VolumeFormat format, final File file, final int channel, final int colorPlane,
			final long session, final BlockingQueue<WorkerMessage> queue, final ProcessingOptions options) {
		this.format = format;
		this.file = file;
		this.channel = channel;
		this.colorPlane = colorPlane;
		this.session = session;
		this.queue = queue;
		this.selector = new ReferenceSelector(options);
		this.normalizer = new ChannelNormalizer(options.getThumbnailSize());
	}

	@Override
	public void run() {
		try {
			final ImageStack normalized = process();
			if (!Thread.currentThread().isInterrupted()) queue.offer(WorkerMessage.done(session, channel, normalized));
		} catch (final CancellationException ce) {
			Thread.currentThread().interrupt();
		} catch (final ChannelProcessingException cpe) {
			queue.offer(WorkerMessage.error(session, channel, cpe.getMessage(), cpe.getCause()));
		} catch (final RuntimeException | OutOfMemoryError ex) {
			queue.offer(WorkerMessage.error(session, channel, ex.toString(), ex));
		}
	}

	/**
	 * Reads, scores and normalizes the channel.
	 *
	 * @return the normalized channel stack
	 * @throws ChannelProcessingException if the channel could not be read or has
	 *                                    no slices
	 */
	public ImageStack process() throws ChannelProcessingException {
		final ImageStack stack;
		try {
			stack = format.readChannel(file, channel);
		} catch (final IOException ex) {
			throw new ChannelProcessingException(channel, "Could not read channel: " + ex.getMessage(), ex);
		}
		final int reference = selector.select(stack);
		if (reference == ReferenceSelector.NO_REFERENCE)
			throw new ChannelProcessingException(channel, "Channel has no slices");
		return normalizer.normalize(stack, reference, channel, colorPlane, this);
	}

	@Override
	public void referenceReady(final int channel, final ColorProcessor thumbnail) {
		queue.offer(WorkerMessage.reference(session, channel, thumbnail));
	}

	@Override
	public void sliceNormalized(final int channel, final int sliceIndex, final ColorProcessor thumbnail) {
		queue.offer(WorkerMessage.preview(session, channel, sliceIndex, thumbnail));
		queue.offer(WorkerMessage.progress(session, channel, sliceIndex));
	}

	public int getChannel() {
		return channel;
	}

}
