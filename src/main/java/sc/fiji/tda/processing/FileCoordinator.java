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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.scijava.Context;

import ij.ImageStack;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.event.ProcessingEvent;
import sc.fiji.tda.event.ProcessingListener;
import sc.fiji.tda.io.MetadataParseException;
import sc.fiji.tda.io.MetadataResolver;
import sc.fiji.tda.io.SaveException;
import sc.fiji.tda.io.ScalingParams;
import sc.fiji.tda.io.VolumeFormat;
import sc.fiji.tda.io.VolumeHeader;
import sc.fiji.tda.util.Logger;

/**
 * Drives the processing of a queue of volumes, strictly one file at a time:
 * metadata is resolved, one {@link ChannelWorker} is launched per channel, and
 * once every worker has reported back the channels are assembled and saved on
 * a dedicated thread. The thread calling {@link #run()} is the single consumer
 * of the message queue shared by workers and the saving task, and the only
 * thread touching the file session ({@link ProcessingResult},
 * {@link ProgressTracker}). A failed file never stops the batch.
 * <p>
 * Progress and errors are reported to {@link ProcessingListener}s on the
 * thread calling {@link #run()}.
 * </p>
 */
public class FileCoordinator {

	/** The states of the file being processed */
	public enum State {
		IDLE, METADATA_RESOLVED, CHANNELS_RUNNING, ASSEMBLING, SAVED, FAILED
	}

	private final MetadataResolver resolver;
	private final ProcessingOptions options;
	private final VolumeAssembler assembler;
	private final File outputDir;
	private final Logger logger;
	private final ConcurrentLinkedQueue<File> files = new ConcurrentLinkedQueue<>();
	private final BlockingQueue<WorkerMessage> messages = new LinkedBlockingQueue<>();
	private final List<ProcessingListener> listeners = new CopyOnWriteArrayList<>();
	private final ExecutorService saveExecutor;

	private volatile State state = State.IDLE;
	private volatile ExecutorService workerPool;
	private volatile boolean cancelled;
	private volatile boolean running;
	private long session;

	/**
	 * @param context   the SciJava context providing logging services
	 * @param options   the processing options
	 * @param outputDir the directory processed volumes are saved to. If null,
	 *                  volumes are saved next to their input file
	 */
	public FileCoordinator(final Context context, final ProcessingOptions options, final File outputDir) {
		this(context, options, outputDir, new MetadataResolver());
	}

	public FileCoordinator(final Context context, final ProcessingOptions options, final File outputDir,
			final MetadataResolver resolver) {
		this.options = options;
		this.outputDir = outputDir;
		this.resolver = resolver;
		this.assembler = new VolumeAssembler(options);
		this.logger = new Logger(context, "FileCoordinator");
		if (options.isDebugMode()) logger.setDebug(true);
		saveExecutor = Executors.newSingleThreadExecutor(threadFactory("TDA-Saver"));
	}

	private static ThreadFactory threadFactory(final String prefix) {
		final AtomicInteger counter = new AtomicInteger();
		return r -> {
			final Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
			t.setDaemon(true);
			return t;
		};
	}

	public void addListener(final ProcessingListener listener) {
		listeners.add(listener);
	}

	public void removeListener(final ProcessingListener listener) {
		listeners.remove(listener);
	}

	public void enqueue(final File file) {
		files.add(file);
	}

	public void enqueue(final Collection<File> files) {
		this.files.addAll(files);
	}

	/** @return the number of files waiting to be processed */
	public int getQueueSize() {
		return files.size();
	}

	public State getState() {
		return state;
	}

	public boolean isRunning() {
		return running;
	}

	/**
	 * Processes all queued files, blocking until the queue is exhausted or
	 * {@link #cancel()} is called.
	 *
	 * @return the list of saved files
	 */
	public List<File> run() {
		final List<File> saved = new ArrayList<>();
		if (cancelled) return saved;
		running = true;
		int nFiles = 0;
		try {
			File file;
			while (!cancelled && (file = files.poll()) != null) {
				nFiles++;
				final File output = process(file);
				if (output != null) saved.add(output);
				if (!cancelled) state = State.IDLE;
			}
		} finally {
			running = false;
		}
		if (cancelled) {
			logger.info("Processing cancelled");
			fire(ProcessingEvent.cancelled());
		} else {
			logger.info(ProcessingEvent.batchFinished(saved.size(), nFiles).getMessage());
			fire(ProcessingEvent.batchFinished(saved.size(), nFiles));
		}
		return saved;
	}

	/* Returns the saved file, or null if processing failed */
	private File process(final File file) {
		session++;
		state = State.IDLE;
		final Logger fileLogger = logger.forFile(file);
		fileLogger.info("Processing " + file.getAbsolutePath());
		fire(ProcessingEvent.fileStarted(file, files.size()));

		final VolumeFormat format;
		final VolumeHeader header;
		try {
			format = resolver.getFormat(file);
			header = format.readHeader(file);
		} catch (final IOException | RuntimeException ex) {
			return fail(ProcessingEvent.EXTRACTION_ERROR, file, -1, ex.getMessage(), ex);
		}

		ScalingParams params;
		try {
			params = resolver.resolve(file);
		} catch (final MetadataParseException | RuntimeException ex) {
			if (options.isSkipOnMetadataError()) {
				return fail(ProcessingEvent.METADATA_ERROR, file, -1, ex.getMessage() + ". File skipped", ex);
			}
			error(ProcessingEvent.METADATA_ERROR, file, -1, ex.getMessage() + ". Using unit scale defaults", ex);
			params = ScalingParams.defaults();
		}
		state = State.METADATA_RESOLVED;
		fileLogger.debug(header + "; " + params);

		final int nChannels = header.getNChannels();
		final int[] order;
		try {
			order = assembler.effectiveOrder(params, nChannels);
		} catch (final ChannelCountMismatchException ex) {
			return fail(ProcessingEvent.CHANNEL_COUNT_MISMATCH, file, -1, ex.getMessage(), ex);
		}

		final ProcessingResult result = new ProcessingResult(nChannels);
		final ProgressTracker tracker = new ProgressTracker(nChannels, header.getNSlices());
		if (!collectChannels(file, fileLogger, format, VolumeAssembler.colorPlanes(order), result, tracker)) {
			return (cancelled) ? null : fail(ProcessingEvent.CHANNEL_ERROR, file, -1,
					(nChannels - result.getFilledCount()) + " of " + nChannels + " channel(s) failed", null);
		}

		state = State.ASSEMBLING;
		final ImageStack[] assembled;
		try {
			assembled = assembler.assemble(result, order);
		} catch (final ChannelCountMismatchException ex) {
			return fail(ProcessingEvent.CHANNEL_COUNT_MISMATCH, file, -1, ex.getMessage(), ex);
		} catch (final RuntimeException ex) {
			return fail(ProcessingEvent.SAVE_ERROR, file, -1, ex.toString(), ex);
		} finally {
			result.clear();
		}
		return save(file, assembled, params);
	}

	/* Launches one worker per channel and waits for all of them to terminate */
	private boolean collectChannels(final File file, final Logger fileLogger, final VolumeFormat format,
			final int[] planes, final ProcessingResult result, final ProgressTracker tracker) {
		final int nChannels = planes.length;
		final ExecutorService pool = Executors.newFixedThreadPool(nChannels, threadFactory("TDA-Channel"));
		workerPool = pool;
		try {
			for (int c = 0; c < nChannels; c++) {
				pool.execute(new ChannelWorker(format, file, c, planes[c], session, messages, options));
			}
			pool.shutdown();
			state = State.CHANNELS_RUNNING;
			int terminated = 0;
			boolean failed = false;
			while (terminated < nChannels) {
				final WorkerMessage msg = messages.take();
				if (msg.getType() == WorkerMessage.Type.CANCEL) return false;
				if (msg.getSession() != session) continue;
				switch (msg.getType()) {
				case REFERENCE:
					fire(ProcessingEvent.reference(file, msg.getChannel(), msg.getThumbnail()));
					break;
				case PREVIEW:
					fire(ProcessingEvent.preview(file, msg.getChannel(), msg.getThumbnail()));
					break;
				case PROGRESS:
					fire(ProcessingEvent.progress(file, tracker.tick(msg.getChannel())));
					break;
				case CHANNEL_DONE:
					result.put(msg.getChannel(), msg.getStack());
					terminated++;
					fileLogger.debug("channel " + msg.getChannel() + " done ("
							+ result.getFilledCount() + "/" + nChannels + ")");
					break;
				case CHANNEL_ERROR:
					error(ProcessingEvent.CHANNEL_ERROR, file, msg.getChannel(), msg.getMessage(), msg.getCause());
					terminated++;
					failed = true;
					break;
				default:
					logger.warn("Unexpected message " + msg);
				}
			}
			return !failed && result.isComplete();
		} catch (final InterruptedException ie) {
			Thread.currentThread().interrupt();
			cancel();
			return false;
		} finally {
			pool.shutdownNow();
			workerPool = null;
		}
	}

	private File save(final File file, final ImageStack[] planes, final ScalingParams params) {
		final long saveSession = session;
		saveExecutor.execute(() -> {
			try {
				messages.offer(WorkerMessage.saved(saveSession, assembler.save(file, outputDir, planes, params)));
			} catch (final SaveException | RuntimeException ex) {
				messages.offer(WorkerMessage.saveFailed(saveSession, ex.getMessage(), ex));
			}
		});
		try {
			while (true) {
				final WorkerMessage msg = messages.take();
				if (msg.getType() == WorkerMessage.Type.CANCEL) return null;
				if (msg.getSession() != saveSession) continue;
				if (msg.getType() == WorkerMessage.Type.SAVE_DONE) {
					state = State.SAVED;
					logger.info("Saved " + msg.getOutputFile().getAbsolutePath());
					fire(ProcessingEvent.saveFinished(file, msg.getOutputFile()));
					return msg.getOutputFile();
				}
				if (msg.getType() == WorkerMessage.Type.SAVE_FAILED) {
					return fail(ProcessingEvent.SAVE_ERROR, file, -1, msg.getMessage(), msg.getCause());
				}
			}
		} catch (final InterruptedException ie) {
			Thread.currentThread().interrupt();
			cancel();
			return null;
		}
	}

	private File fail(final int type, final File file, final int channel, final String message,
			final Throwable cause) {
		state = State.FAILED;
		error(type, file, channel, message, cause);
		return null;
	}

	private void error(final int type, final File file, final int channel, final String message,
			final Throwable cause) {
		final ProcessingEvent event = ProcessingEvent.error(type, file, channel, message);
		if (type == ProcessingEvent.METADATA_ERROR && !options.isSkipOnMetadataError())
			logger.warn(event.getMessage());
		else
			logger.error(event.getMessage(), cause);
		fire(event);
	}

	private void fire(final ProcessingEvent event) {
		for (final ProcessingListener listener : listeners) {
			try {
				listener.processingEvent(event);
			} catch (final RuntimeException ex) {
				logger.error("Listener failed on " + event, ex);
			}
		}
	}

	/**
	 * Aborts processing: outstanding workers are interrupted and queued files
	 * are discarded. The file being processed is not saved unless its saving
	 * had already started. A cancelled coordinator cannot be restarted.
	 */
	public void cancel() {
		cancelled = true;
		files.clear();
		final ExecutorService pool = workerPool;
		if (pool != null) pool.shutdownNow();
		messages.offer(WorkerMessage.cancel());
	}

	public boolean isCancelled() {
		return cancelled;
	}

	/** Releases the saving thread. */
	public void dispose() {
		saveExecutor.shutdown();
	}

}
