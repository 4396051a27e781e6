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

import java.awt.Color;
import java.io.File;

import ij.CompositeImage;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.measure.Calibration;
import ij.process.LUT;
import sc.fiji.tda.util.ImpUtils;

/**
 * Writes multi-channel volumes as ImageJ hyperstack TIFFs (axes ZCYX,
 * color display mode) calibrated in microns.
 */
public class TiffVolumeWriter {

	/** Spatial unit of saved volumes */
	public static final String UNIT = "micron";

	private static final Color[] PLANE_COLORS = { Color.RED, Color.GREEN, Color.BLUE };

	private TiffVolumeWriter() {} // prevent class instantiation

	/**
	 * Assembles channel stacks into a calibrated hyperstack.
	 *
	 * @param title    the image title
	 * @param channels the channel stacks, in output plane order. All stacks
	 *                 must share dimensions and bit depth
	 * @param params   the scaling record providing z-spacing and resolution
	 * @return the hyperstack
	 */
	public static ImagePlus toHyperstack(final String title, final ImageStack[] channels,
			final ScalingParams params) {
		if (channels.length == 0) throw new IllegalArgumentException("No channels to assemble");
		final ImageStack first = channels[0];
		for (final ImageStack stack : channels) {
			if (!ImpUtils.sameDimensions(first, stack) || stack.getBitDepth() != first.getBitDepth())
				throw new IllegalArgumentException("Channel stacks differ in dimensions or bit depth");
		}
		final int nChannels = channels.length;
		final int nSlices = first.getSize();
		final ImageStack hyperstack = new ImageStack(first.getWidth(), first.getHeight());
		for (int z = 1; z <= nSlices; z++) {
			for (int c = 0; c < nChannels; c++)
				hyperstack.addSlice("c" + (c + 1) + "-z" + z, channels[c].getProcessor(z));
		}
		ImagePlus imp = new ImagePlus(title, hyperstack);
		imp.setDimensions(nChannels, nSlices, 1);
		imp.setOpenAsHyperStack(true);
		if (nChannels > 1) {
			final CompositeImage ci = new CompositeImage(imp, CompositeImage.COLOR);
			for (int c = 0; c < nChannels; c++) {
				ci.setChannelLut(LUT.createLutFromColor(PLANE_COLORS[c % PLANE_COLORS.length]), c + 1);
			}
			imp = ci;
		}
		final Calibration cal = imp.getCalibration();
		cal.setUnit(UNIT);
		final double pixelSize = (params.getResolution() > 0) ? 1d / params.getResolution() : 1d;
		cal.pixelWidth = pixelSize;
		cal.pixelHeight = pixelSize;
		cal.pixelDepth = (params.getVoxelDepth() > 0) ? params.getVoxelDepth() : 1d;
		return imp;
	}

	/**
	 * Saves channel stacks as a single hyperstack TIFF.
	 *
	 * @param file     the destination file. Its parent directory is created if
	 *                 missing. Existing files are overwritten
	 * @param channels the channel stacks, in output plane order
	 * @param params   the scaling record providing z-spacing and resolution
	 * @throws SaveException if the file could not be written
	 */
	public static void save(final File file, final ImageStack[] channels, final ScalingParams params)
			throws SaveException {
		final File dir = file.getAbsoluteFile().getParentFile();
		if (dir != null && !dir.isDirectory() && !dir.mkdirs())
			throw new SaveException("Could not create directory " + dir);
		final ImagePlus imp;
		try {
			imp = toHyperstack(file.getName(), channels, params);
		} catch (final IllegalArgumentException iae) {
			throw new SaveException(iae.getMessage(), iae);
		}
		final FileSaver saver = new FileSaver(imp);
		final boolean saved = (imp.getStackSize() > 1) ? saver.saveAsTiffStack(file.getAbsolutePath())
				: saver.saveAsTiff(file.getAbsolutePath());
		if (!saved) throw new SaveException("Could not write " + file.getAbsolutePath());
	}

}
