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

package sc.fiji.tda.io;

import java.util.Locale;

/**
 * Microscope sub-variants recognized from acquisition track names. Their only
 * use is the legacy channel reordering of acquisitions without recorded
 * channel colors.
 */
public enum VendorVariant {

	LSM510("lsm510"), LSM880("lsm880");

	private final String token;

	VendorVariant(final String token) {
		this.token = token;
	}

	/**
	 * @param trackName an acquisition track name
	 * @return the variant named anywhere in the track name (case-insensitive),
	 *         or null
	 */
	public static VendorVariant fromTrackName(final String trackName) {
		if (trackName == null) return null;
		final String name = trackName.toLowerCase(Locale.ROOT);
		for (final VendorVariant v : values()) {
			if (name.contains(v.token)) return v;
		}
		return null;
	}

}
