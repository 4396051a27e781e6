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

package sc.fiji.tda.analysis;

import java.util.Locale;

/**
 * Quality metrics of a single z-slice, as computed by {@link SliceScorer}.
 * Instances are immutable.
 */
public class SliceScore {

	private final int index;
	private final double background;
	private final double noise;
	private final double signal;
	private final double snr;
	private final int skeletonLength;
	private final double skeletonDensity;
	private final double composite;

	public SliceScore(final int index, final double background, final double noise, final double signal,
			final double snr, final int skeletonLength, final double skeletonDensity, final double composite) {
		this.index = index;
		this.background = background;
		this.noise = noise;
		this.signal = signal;
		this.snr = snr;
		this.skeletonLength = skeletonLength;
		this.skeletonDensity = skeletonDensity;
		this.composite = composite;
	}

	/** @return the (0-based) z-position of the scored slice */
	public int getIndex() {
		return index;
	}

	public double getBackground() {
		return background;
	}

	public double getNoise() {
		return noise;
	}

	public double getSignal() {
		return signal;
	}

	public double getSNR() {
		return snr;
	}

	/** @return the number of skeleton pixels of the foreground mask */
	public int getSkeletonLength() {
		return skeletonLength;
	}

	/** @return the skeleton length normalized by the slice area */
	public double getSkeletonDensity() {
		return skeletonDensity;
	}

	public double getComposite() {
		return composite;
	}

	@Override
	public String toString() {
		return String.format(Locale.US,
				"Slice %d: bg=%.3f noise=%.3f signal=%.3f SNR=%.3f skeleton=%d (%.5f) score=%.4f", index,
				background, noise, signal, snr, skeletonLength, skeletonDensity, composite);
	}

}
