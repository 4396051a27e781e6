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
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/**
 * Zeiss CZI (ZISRAW) volumes. Each full-resolution sub-block holds one
 * (channel, z) plane. Only uncompressed Gray8 and Gray16 sub-blocks of
 * non-tiled acquisitions are supported. Physical scale and channel colors are
 * read from the XML metadata segment.
 */
public class CziFormat implements VolumeFormat {

	private static final double METERS_TO_MICRONS = 1e6;

	@Override
	public String getName() {
		return "Zeiss CZI";
	}

	@Override
	public String[] getExtensions() {
		return new String[] { "czi" };
	}

	@Override
	public ScalingParams readScaling(final File file) throws MetadataParseException {
		final String xml;
		try (CziFile czi = CziFile.open(file)) {
			xml = czi.readMetadataXml();
		} catch (final IOException | RuntimeException ex) {
			throw new MetadataParseException("Unreadable CZI metadata: " + ex.getMessage(), ex);
		}
		return parseScaling(xml);
	}

	/**
	 * Extracts the scaling record from a CZI metadata document.
	 *
	 * @throws MetadataParseException if the document is not valid XML or lacks
	 *                                lateral scaling
	 */
	ScalingParams parseScaling(final String xml) throws MetadataParseException {
		final Document doc;
		try {
			final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setExpandEntityReferences(false);
			final DocumentBuilder builder = factory.newDocumentBuilder();
			doc = builder.parse(new InputSource(new StringReader(xml)));
		} catch (final ParserConfigurationException | SAXException | IOException ex) {
			throw new MetadataParseException("Invalid CZI metadata XML: " + ex.getMessage(), ex);
		}
		final Map<String, Double> distances = new HashMap<>();
		final NodeList distanceNodes = doc.getElementsByTagName("Distance");
		for (int i = 0; i < distanceNodes.getLength(); i++) {
			final Element distance = (Element) distanceNodes.item(i);
			final String id = distance.getAttribute("Id");
			final String value = childText(distance, "Value");
			if (id.isEmpty() || value == null) continue;
			try {
				distances.putIfAbsent(id.toUpperCase(), Double.parseDouble(value));
			} catch (final NumberFormatException nfe) {
				throw new MetadataParseException("Invalid scaling value for " + id + ": " + value, nfe);
			}
		}
		if (!distances.containsKey("X") || !distances.containsKey("Y"))
			throw new MetadataParseException("CZI metadata has no lateral scaling");
		final double vx = distances.get("X") * METERS_TO_MICRONS;
		final double vy = distances.get("Y") * METERS_TO_MICRONS;
		final double vz = distances.containsKey("Z") ? distances.get("Z") * METERS_TO_MICRONS : 1d;
		final int[] order = MetadataResolver.orderFromColors(channelColors(doc));
		return new ScalingParams(vx, vy, vz, null, order, order.length > 0, getName());
	}

	/* Display colors of DisplaySetting channels or, if absent, of Dimensions channels */
	private static List<int[]> channelColors(final Document doc) throws MetadataParseException {
		List<int[]> colors = colorsUnder(doc, "DisplaySetting");
		if (colors.isEmpty()) colors = colorsUnder(doc, "Dimensions");
		return colors;
	}

	private static List<int[]> colorsUnder(final Document doc, final String sectionName)
			throws MetadataParseException {
		final List<int[]> colors = new ArrayList<>();
		final NodeList sections = doc.getElementsByTagName(sectionName);
		for (int s = 0; s < sections.getLength() && colors.isEmpty(); s++) {
			final Element channels = firstChild((Element) sections.item(s), "Channels");
			if (channels == null) continue;
			final NodeList children = channels.getChildNodes();
			for (int i = 0; i < children.getLength(); i++) {
				final Node node = children.item(i);
				if (node.getNodeType() != Node.ELEMENT_NODE || !"Channel".equals(node.getNodeName())) continue;
				final String color = childText((Element) node, "Color");
				colors.add((color == null) ? new int[] { -1, -1, -1 } : parseColor(color));
			}
		}
		return colors;
	}

	/**
	 * Parses a {@code #AARRGGBB} or {@code #RRGGBB} color.
	 *
	 * @return the {r, g, b} components
	 */
	static int[] parseColor(final String color) throws MetadataParseException {
		String hex = color.trim();
		if (hex.startsWith("#")) hex = hex.substring(1);
		if (hex.length() != 6 && hex.length() != 8)
			throw new MetadataParseException("Invalid channel color: " + color);
		try {
			final long argb = Long.parseLong(hex, 16);
			return new int[] { (int) (argb >> 16) & 0xff, (int) (argb >> 8) & 0xff, (int) argb & 0xff };
		} catch (final NumberFormatException nfe) {
			throw new MetadataParseException("Invalid channel color: " + color, nfe);
		}
	}

	private static Element firstChild(final Element parent, final String name) {
		final NodeList children = parent.getChildNodes();
		for (int i = 0; i < children.getLength(); i++) {
			final Node node = children.item(i);
			if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(node.getNodeName())) return (Element) node;
		}
		return null;
	}

	private static String childText(final Element parent, final String name) {
		final Element child = firstChild(parent, name);
		return (child == null) ? null : child.getTextContent().trim();
	}

	@Override
	public VolumeHeader readHeader(final File file) throws IOException {
		try (CziFile czi = CziFile.open(file)) {
			return new Layout(czi.getEntries()).header;
		}
	}

	@Override
	public ImageStack readChannel(final File file, final int channel) throws IOException {
		try (CziFile czi = CziFile.open(file)) {
			final Layout layout = new Layout(czi.getEntries());
			final VolumeHeader header = layout.header;
			if (channel < 0 || channel >= header.getNChannels())
				throw new IOException("Channel " + channel + " does not exist");
			final ImageStack stack = new ImageStack(header.getWidth(), header.getHeight());
			for (int z = 0; z < header.getNSlices(); z++) {
				final CziFile.Entry entry = layout.planes[channel][z];
				if (entry == null) throw new IOException("Missing plane c=" + channel + ", z=" + z);
				stack.addSlice("z" + (z + 1), toProcessor(czi.readPixels(entry), header));
			}
			return stack;
		}
	}

	private static ImageProcessor toProcessor(final ByteBuffer data, final VolumeHeader header)
			throws IOException {
		final int nPixels = header.getWidth() * header.getHeight();
		if (data.remaining() < nPixels * header.getBitDepth() / 8)
			throw new IOException("Truncated sub-block data");
		if (header.getBitDepth() == 8) {
			final byte[] pixels = new byte[nPixels];
			data.get(pixels);
			return new ByteProcessor(header.getWidth(), header.getHeight(), pixels);
		}
		final short[] pixels = new short[nPixels];
		data.asShortBuffer().get(pixels);
		return new ShortProcessor(header.getWidth(), header.getHeight(), pixels, null);
	}

	/** Maps full-resolution sub-blocks to (channel, z) planes */
	private static class Layout {

		final VolumeHeader header;
		final CziFile.Entry[][] planes;

		Layout(final List<CziFile.Entry> entries) throws IOException {
			final List<CziFile.Entry> full = new ArrayList<>();
			for (final CziFile.Entry e : entries) {
				if (e.getPyramidType() == 0 && e.storedSize("X") == e.size("X") && e.storedSize("Y") == e.size("Y"))
					full.add(e);
			}
			if (full.isEmpty()) throw new IOException("No full-resolution sub-blocks");
			final CziFile.Entry first = full.get(0);
			int minC = Integer.MAX_VALUE, maxC = Integer.MIN_VALUE;
			int minZ = Integer.MAX_VALUE, maxZ = Integer.MIN_VALUE;
			for (final CziFile.Entry e : full) {
				if (e.getCompression() != 0)
					throw new IOException("Compressed CZI data is not supported (scheme " + e.getCompression() + ")");
				if (e.getPixelType() != first.getPixelType())
					throw new IOException("Mixed pixel types are not supported");
				if (e.start("X") != first.start("X") || e.start("Y") != first.start("Y")
						|| e.size("X") != first.size("X") || e.size("Y") != first.size("Y"))
					throw new IOException("Tiled (mosaic) CZI files are not supported");
				minC = Math.min(minC, e.start("C"));
				maxC = Math.max(maxC, e.start("C"));
				minZ = Math.min(minZ, e.start("Z"));
				maxZ = Math.max(maxZ, e.start("Z"));
			}
			final int bitDepth;
			switch (first.getPixelType()) {
			case CziFile.PIXEL_GRAY8:
				bitDepth = 8;
				break;
			case CziFile.PIXEL_GRAY16:
				bitDepth = 16;
				break;
			default:
				throw new IOException("Unsupported CZI pixel type: " + first.getPixelType());
			}
			final long nPlanes = ((long) maxZ - minZ + 1) * ((long) maxC - minC + 1);
			if (nPlanes > full.size())
				throw new IOException("Incomplete volume: " + full.size() + " sub-blocks for " + nPlanes + " planes");
			try {
				header = new VolumeHeader(first.size("X"), first.size("Y"), maxZ - minZ + 1, maxC - minC + 1,
						bitDepth);
			} catch (final IllegalArgumentException iae) {
				throw new IOException(iae.getMessage(), iae);
			}
			planes = new CziFile.Entry[header.getNChannels()][header.getNSlices()];
			for (final CziFile.Entry e : full) {
				final int c = e.start("C") - minC;
				final int z = e.start("Z") - minZ;
				if (planes[c][z] == null) planes[c][z] = e; // first time point/scene only
			}
		}
	}

}
