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

import ij.ImageStack;

/**
 * The normalized channel stacks of the file being processed, indexed by
 * channel. Not thread-safe: only the coordinator thread, which receives the
 * stacks from workers through its message queue, fills and reads it.
 */
public class ProcessingResult {

	private ImageStack[] stacks;
	private int filled;

	public ProcessingResult(final int nChannels) {
		if (nChannels < 1) throw new IllegalArgumentException("Number of channels must be > 0");
		stacks = new ImageStack[nChannels];
	}

	/**
	 * Stores the normalized stack of a channel.
	 *
	 * @throws IllegalStateException if the channel was already stored
	 */
	public void put(final int channel, final ImageStack stack) {
		if (stack == null) throw new IllegalArgumentException("Stack is null");
		if (stacks[channel] != null)
			throw new IllegalStateException("Channel " + channel + " was already delivered");
		stacks[channel] = stack;
		filled++;
	}

	public ImageStack get(final int channel) {
		return stacks[channel];
	}

	/** @return the number of channels delivered so far */
	public int getFilledCount() {
		return filled;
	}

	public int getExpectedCount() {
		return stacks.length;
	}

	public boolean isComplete() {
		return filled == stacks.length;
	}

	/** Releases all delivered stacks. */
	public void clear() {
		stacks = new ImageStack[stacks.length];
		filled = 0;
	}

}
