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

import ij.process.ColorProcessor;

/**
 * Callback interface for monitoring the normalization of a channel stack.
 * Methods are called from the normalizing thread.
 */
public interface NormalizationCallback {

	/**
	 * Called once, before any slice is normalized.
	 *
	 * @param channel   the channel being normalized
	 * @param thumbnail the preview of the unmodified reference slice
	 */
	void referenceReady(int channel, ColorProcessor thumbnail);

	/**
	 * Called after each slice is normalized, in slice order.
	 *
	 * @param channel    the channel being normalized
	 * @param sliceIndex the 0-based index of the slice
	 * @param thumbnail  the preview of the normalized slice
	 */
	void sliceNormalized(int channel, int sliceIndex, ColorProcessor thumbnail);

}
