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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import ij.ImageStack;
import sc.fiji.tda.ProcessingOptions;
import sc.fiji.tda.TDAUtils;

/**
 * Selects the reference slice of a channel, i.e., the z-slice with the highest
 * {@link SliceScore#getComposite() composite score}. The first slice wins ties.
 */
public class ReferenceSelector {

	/** Returned by {@link #select(ImageStack)} when the stack has no slices */
	public static final int NO_REFERENCE = -1;

	/** The scoring strategies of slices */
	public enum Policy {
		/** Robust SNR plus skeleton density */
		COMPOSITE("Robust SNR + structure"),
		/** Mean/std SNR only */
		FALLBACK("Mean/std SNR (fast)");

		private final String label;

		Policy(final String label) {
			this.label = label;
		}

		public String getLabel() {
			return label;
		}

		/**
		 * Parses a policy from its name or its label (case-insensitive).
		 *
		 * @throws IllegalArgumentException if the string matches no policy
		 */
		public static Policy fromString(final String string) {
			if (string != null) {
				final String s = string.trim();
				for (final Policy p : values()) {
					if (p.name().equalsIgnoreCase(s) || p.label.equalsIgnoreCase(s)) return p;
				}
			}
			throw new IllegalArgumentException("Unrecognized selection policy: " + string);
		}

		public static String[] labels() {
			final Policy[] values = values();
			final String[] labels = new String[values.length];
			for (int i = 0; i < values.length; i++)
				labels[i] = values[i].label;
			return labels;
		}
	}

	private final SliceScorer scorer;
	private final Policy policy;

	public ReferenceSelector(final SliceScorer scorer, final Policy policy) {
		this.scorer = scorer;
		this.policy = (policy == null) ? ProcessingOptions.DEF_POLICY : policy;
	}

	public ReferenceSelector(final ProcessingOptions options) {
		this(new SliceScorer(options), options.getPolicy());
	}

	/**
	 * Selects the reference slice of a channel stack.
	 *
	 * @param stack the channel stack
	 * @return the 0-based index of the reference slice, or {@link #NO_REFERENCE}
	 *         if the stack is empty
	 */
	public int select(final ImageStack stack) {
		return best(selectScores(stack));
	}

	/**
	 * Scores all the slices of a channel stack using the current {@link Policy}.
	 *
	 * @param stack the channel stack
	 * @return the list of scores, in slice order
	 */
	public List<SliceScore> selectScores(final ImageStack stack) {
		final int n = (stack == null) ? 0 : stack.getSize();
		final List<SliceScore> scores = new ArrayList<>(n);
		for (int i = 0; i < n; i++) {
			final SliceScore score = (policy == Policy.FALLBACK) ? scorer.scoreBasic(stack.getProcessor(i + 1), i)
					: scorer.score(stack.getProcessor(i + 1), i);
			TDAUtils.log(score.toString());
			scores.add(score);
		}
		return scores;
	}

	/**
	 * @return the index of the highest composite score in the list (first
	 *         occurrence), or {@link #NO_REFERENCE} if the list is empty
	 */
	public static int best(final List<SliceScore> scores) {
		int best = NO_REFERENCE;
		double max = Double.NEGATIVE_INFINITY;
		for (final SliceScore score : scores) {
			if (best == NO_REFERENCE || score.getComposite() > max) {
				max = score.getComposite();
				best = score.getIndex();
			}
		}
		if (best != NO_REFERENCE)
			TDAUtils.log(String.format(Locale.US, "Reference slice: %d (score=%.4f)", best, max));
		return best;
	}

	public Policy getPolicy() {
		return policy;
	}

}
