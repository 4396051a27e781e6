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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Canonical physical-scale and channel-order record of a volume, independent
 * of its vendor format. Instances are immutable.
 */
public class ScalingParams {

	private final double voxelWidth;
	private final double voxelHeight;
	private final double voxelDepth;
	private final double resolution;
	private final Set<VendorVariant> variants;
	private final int[] channelOrder;
	private final boolean colorDerivedOrder;
	private final String source;

	/**
	 * @param voxelWidth        the voxel width in microns
	 * @param voxelHeight       the voxel height in microns
	 * @param voxelDepth        the voxel depth (z-step) in microns
	 * @param variants          the detected vendor sub-variants. May be null
	 * @param channelOrder      the source channel of each output color plane
	 *                          (red, green, blue). Empty means identity
	 * @param colorDerivedOrder whether {@code channelOrder} was derived from
	 *                          recorded channel colors
	 * @param source            the name of the format the record was read from
	 */
	public ScalingParams(final double voxelWidth, final double voxelHeight, final double voxelDepth,
			final Collection<VendorVariant> variants, final int[] channelOrder, final boolean colorDerivedOrder,
			final String source) {
		this.voxelWidth = voxelWidth;
		this.voxelHeight = voxelHeight;
		this.voxelDepth = voxelDepth;
		this.resolution = resolutionOf(voxelWidth, voxelHeight);
		this.variants = (variants == null || variants.isEmpty()) ? Collections.emptySet()
				: Collections.unmodifiableSet(EnumSet.copyOf(variants));
		this.channelOrder = (channelOrder == null) ? new int[0] : channelOrder.clone();
		this.colorDerivedOrder = colorDerivedOrder && this.channelOrder.length > 0;
		this.source = source;
	}

	/**
	 * @return the unit-scale record: 1 micron voxels, resolution of 1 pixel per
	 *         micron, identity channel order and no variants
	 */
	public static ScalingParams defaults() {
		return new ScalingParams(1, 1, 1, null, null, false, "defaults");
	}

	/**
	 * Computes the lateral resolution as the mean of the reciprocals of voxel
	 * width and height. A non-positive voxel size contributes 0.
	 *
	 * @return the resolution in pixels per micron
	 */
	public static double resolutionOf(final double voxelWidth, final double voxelHeight) {
		final double rx = (voxelWidth > 0) ? 1d / voxelWidth : 0;
		final double ry = (voxelHeight > 0) ? 1d / voxelHeight : 0;
		return (rx + ry) / 2;
	}

	public double getVoxelWidth() {
		return voxelWidth;
	}

	public double getVoxelHeight() {
		return voxelHeight;
	}

	public double getVoxelDepth() {
		return voxelDepth;
	}

	/** @return the resolution in pixels per micron */
	public double getResolution() {
		return resolution;
	}

	public Set<VendorVariant> getVariants() {
		return variants;
	}

	public boolean has(final VendorVariant variant) {
		return variants.contains(variant);
	}

	public int[] getChannelOrder() {
		return channelOrder.clone();
	}

	public boolean isColorDerivedOrder() {
		return colorDerivedOrder;
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return String.format(Locale.US, "%s: voxel=%.4fx%.4fx%.4f um, resolution=%.4f px/um, variants=%s, order=%s%s",
				source, voxelWidth, voxelHeight, voxelDepth, resolution, variants, Arrays.toString(channelOrder),
				(colorDerivedOrder) ? " (from colors)" : "");
	}

}
