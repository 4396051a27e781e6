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

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import ij.ImageStack;
import ij.io.FileInfo;
import ij.io.ImageReader;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;
import sc.fiji.tda.TDAUtils;

/**
 * Zeiss LSM volumes: TIFF containers in which every full-resolution directory
 * holds one z-slice of all channels. Reduced-resolution (thumbnail)
 * directories are skipped. Strips of 8-bit and 16-bit data, uncompressed or
 * compressed with LZW, PackBits or Deflate, are decoded by ImageJ's
 * {@link ImageReader}.
 */
public class LsmFormat implements VolumeFormat {

	private static final double METERS_TO_MICRONS = 1e6;

	@Override
	public String getName() {
		return "Zeiss LSM";
	}

	@Override
	public String[] getExtensions() {
		return new String[] { "lsm" };
	}

	@Override
	public ScalingParams readScaling(final File file) throws MetadataParseException {
		try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
			final List<TiffDirectory> dirs = TiffDirectory.readAll(channel);
			if (dirs.isEmpty()) throw new MetadataParseException("No image directories");
			final LsmInfo info = LsmInfo.read(channel, dirs.get(0).getOffset(TiffDirectory.CZ_LSMINFO));
			TDAUtils.log(file.getName() + ": channels " + info.getChannelNames() + ", tracks " + info.getTrackNames());
			final Set<VendorVariant> variants = EnumSet.noneOf(VendorVariant.class);
			for (final String track : info.getTrackNames()) {
				final VendorVariant variant = VendorVariant.fromTrackName(track);
				if (variant != null) variants.add(variant);
			}
			final int[] order = MetadataResolver.orderFromColors(info.getChannelColors());
			return new ScalingParams(info.getVoxelSizeX() * METERS_TO_MICRONS,
					info.getVoxelSizeY() * METERS_TO_MICRONS, info.getVoxelSizeZ() * METERS_TO_MICRONS, variants,
					order, order.length > 0, getName());
		} catch (final MetadataParseException mpe) {
			throw mpe;
		} catch (final IOException | RuntimeException ex) {
			throw new MetadataParseException("Unreadable LSM metadata: " + ex.getMessage(), ex);
		}
	}

	@Override
	public VolumeHeader readHeader(final File file) throws IOException {
		try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
			return header(imageDirectories(channel));
		}
	}

	@Override
	public ImageStack readChannel(final File file, final int channelIndex) throws IOException {
		try (FileChannel channel = FileChannel.open(file.toPath(), StandardOpenOption.READ)) {
			final List<TiffDirectory> dirs = imageDirectories(channel);
			final VolumeHeader header = header(dirs);
			if (channelIndex < 0 || channelIndex >= header.getNChannels())
				throw new IOException("Channel " + channelIndex + " does not exist");
			final ImageStack stack = new ImageStack(header.getWidth(), header.getHeight());
			for (final TiffDirectory dir : dirs) {
				stack.addSlice("z" + (stack.getSize() + 1), readPlane(file, channel, dir, header, channelIndex));
			}
			return stack;
		}
	}

	private static List<TiffDirectory> imageDirectories(final FileChannel channel) throws IOException {
		final List<TiffDirectory> dirs = new ArrayList<>();
		for (final TiffDirectory dir : TiffDirectory.readAll(channel)) {
			if (!dir.isThumbnail()) dirs.add(dir);
		}
		if (dirs.isEmpty()) throw new IOException("No image directories");
		return dirs;
	}

	private static VolumeHeader header(final List<TiffDirectory> dirs) throws IOException {
		final TiffDirectory first = dirs.get(0);
		final int width = (int) first.get(TiffDirectory.IMAGE_WIDTH, 0);
		final int height = (int) first.get(TiffDirectory.IMAGE_LENGTH, 0);
		final int samples = (int) first.get(TiffDirectory.SAMPLES_PER_PIXEL, 1);
		final int bits = (int) first.get(TiffDirectory.BITS_PER_SAMPLE, 8);
		try {
			return new VolumeHeader(width, height, dirs.size(), samples, bits);
		} catch (final IllegalArgumentException iae) {
			throw new IOException(iae.getMessage(), iae);
		}
	}

	private static ImageProcessor readPlane(final File file, final FileChannel channel, final TiffDirectory dir,
			final VolumeHeader header, final int channelIndex) throws IOException {
		if ((int) dir.get(TiffDirectory.IMAGE_WIDTH, 0) != header.getWidth()
				|| (int) dir.get(TiffDirectory.IMAGE_LENGTH, 0) != header.getHeight())
			throw new IOException("Slices of unequal dimensions");
		final long[] offsets = dir.getAll(TiffDirectory.STRIP_OFFSETS);
		final long[] counts = dir.getAll(TiffDirectory.STRIP_BYTE_COUNTS);
		if (offsets.length != counts.length) throw new IOException("Inconsistent strip tables");
		final int nChannels = header.getNChannels();
		final boolean planar = nChannels == 1 || dir.get(TiffDirectory.PLANAR_CONFIGURATION, 1) == 2;
		final int samplesPerRow = (planar) ? header.getWidth() : header.getWidth() * nChannels;

		final FileInfo fi = new FileInfo();
		fi.fileType = (header.getBitDepth() == 8) ? FileInfo.GRAY8 : FileInfo.GRAY16_UNSIGNED;
		fi.width = samplesPerRow;
		fi.height = header.getHeight();
		fi.intelByteOrder = dir.getByteOrder() == ByteOrder.LITTLE_ENDIAN;
		fi.compression = compression(dir);
		fi.rowsPerStrip = (int) Math.min(header.getHeight(),
				Math.max(1, dir.get(TiffDirectory.ROWS_PER_STRIP, header.getHeight())));
		int first = 0;
		int nStrips = offsets.length;
		if (planar) {
			if (offsets.length % nChannels != 0) throw new IOException("Unexpected number of strips");
			nStrips = offsets.length / nChannels;
			first = channelIndex * nStrips;
		}
		fi.stripOffsets = new int[nStrips];
		fi.stripLengths = new int[nStrips];
		long stored = 0;
		for (int s = 0; s < nStrips; s++) {
			final long offset = offsets[first + s];
			final long length = counts[first + s];
			if (offset + length > channel.size()) throw new IOException("Truncated image data");
			final boolean contiguous = s == 0 || offset == offsets[first + s - 1] + counts[first + s - 1];
			if (!contiguous && fi.compression == FileInfo.COMPRESSION_NONE)
				throw new IOException("Non-contiguous uncompressed strips are not supported");
			fi.stripOffsets[s] = (int) offset;
			fi.stripLengths[s] = (int) length;
			stored += length;
		}
		final long expected = (long) samplesPerRow * header.getHeight() * fi.getBytesPerPixel();
		if (fi.compression == FileInfo.COMPRESSION_NONE && stored < expected)
			throw new IOException("Truncated image data");
		if (expected > Integer.MAX_VALUE) throw new IOException("Slice too large: " + expected + " bytes");

		final Object pixels;
		try (InputStream in = new BufferedInputStream(new FileInputStream(file))) {
			pixels = new ImageReader(fi).readPixels(in, offsets[first]);
		}
		if (pixels == null) throw new IOException("Could not decode strips at offset " + offsets[first]);
		return toProcessor(pixels, header, (planar) ? 1 : nChannels, (planar) ? 0 : channelIndex);
	}

	/* Extracts one channel from (possibly interleaved) decoded samples */
	private static ImageProcessor toProcessor(final Object samples, final VolumeHeader header, final int stride,
			final int channelIndex) {
		final int nPixels = header.getWidth() * header.getHeight();
		if (samples instanceof byte[]) {
			final byte[] src = (byte[]) samples;
			final byte[] pixels = (stride == 1) ? src : new byte[nPixels];
			if (stride > 1) {
				for (int i = 0; i < nPixels; i++)
					pixels[i] = src[i * stride + channelIndex];
			}
			return new ByteProcessor(header.getWidth(), header.getHeight(), pixels);
		}
		final short[] src = (short[]) samples;
		final short[] pixels = (stride == 1) ? src : new short[nPixels];
		if (stride > 1) {
			for (int i = 0; i < nPixels; i++)
				pixels[i] = src[i * stride + channelIndex];
		}
		return new ShortProcessor(header.getWidth(), header.getHeight(), pixels, null);
	}

	/* Maps the TIFF compression scheme of a directory to its ImageJ counterpart */
	private static int compression(final TiffDirectory dir) throws IOException {
		final long scheme = dir.get(TiffDirectory.COMPRESSION, 1);
		final boolean differencing = dir.get(TiffDirectory.PREDICTOR, 1) == 2;
		if (scheme == 1) return FileInfo.COMPRESSION_NONE;
		if (scheme == 5) return (differencing) ? FileInfo.LZW_WITH_DIFFERENCING : FileInfo.LZW;
		if (scheme == 32773) return FileInfo.PACK_BITS;
		if ((scheme == 8 || scheme == 32946) && !differencing) return FileInfo.ZIP;
		throw new IOException("Unsupported LSM compression scheme: " + scheme);
	}

}
