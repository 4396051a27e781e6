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

/**
 * Aggregates the per-channel slice counts of a file into a single percentage.
 * Not thread-safe: only the coordinator thread updates it.
 */
public class ProgressTracker {

	private final int[] processed;
	private final long expected;
	private long total;

	/**
	 * @param nChannels the number of channels of the file
	 * @param nSlices   the number of slices per channel
	 */
	public ProgressTracker(final int nChannels, final int nSlices) {
		if (nChannels < 1 || nSlices < 1)
			throw new IllegalArgumentException("Channels and slices must be > 0");
		processed = new int[nChannels];
		expected = (long) nChannels * nSlices;
	}

	/**
	 * Records one processed slice.
	 *
	 * @param channel the channel the slice belongs to
	 * @return the updated percentage
	 */
	public double tick(final int channel) {
		processed[channel]++;
		total++;
		return getPercentage();
	}

	/** @return the completed percentage, clamped to [0, 100] */
	public double getPercentage() {
		return Math.min(100d, 100d * total / expected);
	}

	public int getProcessed(final int channel) {
		return processed[channel];
	}

	public boolean isComplete() {
		return total >= expected;
	}

}
