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

package sc.fiji.tda;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests for {@link TDAUtils}
 */
public class TDAUtilsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testListSupportedFiles() throws Exception {
		folder.newFile("b_cell.CZI");
		folder.newFile("a_cell.lsm");
		folder.newFile("notes.txt");
		folder.newFile("cell.tif");
		folder.newFolder("sub.lsm");
		final List<File> files = TDAUtils.listSupportedFiles(folder.getRoot(), null);
		assertEquals(2, files.size());
		assertEquals("a_cell.lsm", files.get(0).getName());
		assertEquals("b_cell.CZI", files.get(1).getName());

		final List<File> filtered = TDAUtils.listSupportedFiles(folder.getRoot(), "^b_");
		assertEquals(1, filtered.size());
		assertEquals("b_cell.CZI", filtered.get(0).getName());

		assertTrue(TDAUtils.listSupportedFiles(new File(folder.getRoot(), "missing"), "").isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidPattern() {
		TDAUtils.listSupportedFiles(folder.getRoot(), "[unclosed");
	}

	@Test
	public void testFileNames() {
		assertEquals("czi", TDAUtils.getExtension(new File("Stack.CZI")));
		assertEquals("", TDAUtils.getExtension(new File("README")));
		assertEquals("cell.01", TDAUtils.getBaseName(new File("cell.01.lsm")));
		assertEquals(".hidden", TDAUtils.getBaseName(new File(".hidden")));
		assertTrue(TDAUtils.isSupported(new File("x.Lsm")));
		assertFalse(TDAUtils.isSupported(new File("x.tiff")));
		assertFalse(TDAUtils.isSupported(null));
	}

}
