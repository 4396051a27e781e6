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
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.scijava.Context;
import org.scijava.log.LogService;
import org.scijava.prefs.PrefService;

import sc.fiji.tda.analysis.ReferenceSelector;

/**
 * Tests for {@link TDAPrefs} and {@link ProcessingOptions}
 */
public class TDAPrefsTest {

	private Context context;
	private TDAPrefs prefs;

	@Before
	public void setUp() {
		context = new Context(LogService.class, PrefService.class);
		prefs = new TDAPrefs(context);
		prefs.clear();
	}

	@After
	public void tearDown() {
		prefs.clear();
		context.dispose();
	}

	@Test
	public void testDefaults() {
		final ProcessingOptions options = prefs.load();
		assertEquals(ProcessingOptions.DEF_SIGMA, options.getSigma(), 0);
		assertSame(ProcessingOptions.DEF_POLICY, options.getPolicy());
		assertEquals(ProcessingOptions.DEF_OUTPUT_SUFFIX, options.getOutputSuffix());
		assertEquals(ProcessingOptions.DEF_LEGACY_VARIANT_REORDERING, options.isLegacyVariantReordering());
	}

	@Test
	public void testSaveAndLoad() {
		final ProcessingOptions options = new ProcessingOptions();
		options.setSigma(2.5);
		options.setBackgroundPercentile(10);
		options.setStructuralWeight(0.5);
		options.setPolicy(ReferenceSelector.Policy.FALLBACK);
		options.setThumbnailSize(120);
		options.setOutputBitDepth(8);
		options.setOutputSuffix("_norm");
		options.setSkipOnMetadataError(true);
		options.setLegacyVariantReordering(false);
		prefs.save(options);

		final ProcessingOptions loaded = prefs.load();
		assertEquals(2.5, loaded.getSigma(), 0);
		assertEquals(10, loaded.getBackgroundPercentile(), 0);
		assertEquals(0.5, loaded.getStructuralWeight(), 0);
		assertSame(ReferenceSelector.Policy.FALLBACK, loaded.getPolicy());
		assertEquals(120, loaded.getThumbnailSize());
		assertEquals(8, loaded.getOutputBitDepth());
		assertEquals("_norm", loaded.getOutputSuffix());
		assertTrue(loaded.isSkipOnMetadataError());
		assertFalse(loaded.isLegacyVariantReordering());

		prefs.clear();
		assertEquals(ProcessingOptions.DEF_OUTPUT_BIT_DEPTH, prefs.load().getOutputBitDepth());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidPercentile() {
		new ProcessingOptions().setBackgroundPercentile(101);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidBitDepth() {
		new ProcessingOptions().setOutputBitDepth(12);
	}

}
