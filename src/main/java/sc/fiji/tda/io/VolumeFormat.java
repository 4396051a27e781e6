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

import java.io.File;
import java.io.IOException;

import ij.ImageStack;

/**
 * A vendor volume format. Implementations translate their own metadata schema
 * into the canonical {@link ScalingParams} record and give access to
 * individual channel stacks. Implementations must be thread-safe: channels of
 * the same file are read concurrently.
 */
public interface VolumeFormat {

	/** @return a descriptive name of the format */
	String getName();

	/** @return the recognized file extensions (lower case, no dot) */
	String[] getExtensions();

	/**
	 * Reads the physical scale and channel order of a volume.
	 *
	 * @throws MetadataParseException if metadata is missing, malformed or
	 *                                unsupported
	 */
	ScalingParams readScaling(File file) throws MetadataParseException;

	/**
	 * Reads the dimensions of a volume.
	 *
	 * @throws IOException if the file cannot be read or its layout is not
	 *                     supported
	 */
	VolumeHeader readHeader(File file) throws IOException;

	/**
	 * Reads all the z-slices of one channel.
	 *
	 * @param file    the volume file
	 * @param channel the 0-based channel index
	 * @return the channel stack (8-bit or 16-bit)
	 * @throws IOException if the file cannot be read or its layout is not
	 *                     supported
	 */
	ImageStack readChannel(File file, int channel) throws IOException;

}
