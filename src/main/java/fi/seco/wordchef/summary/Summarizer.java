package fi.seco.wordchef.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import fi.seco.wordchef.analysis.ITextAnalysis;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.ScoredSentence;

/**
 * Extractive summarizer: picks the best scoring sentences and emits them in
 * reading order.
 */
public class Summarizer {

	private static final Comparator<ScoredSentence> BY_SCORE = new Comparator<ScoredSentence>() {
		@Override
		public int compare(ScoredSentence o1, ScoredSentence o2) {
			int c = Double.compare(o2.getScore(), o1.getScore());
			if (c != 0) return c;
			return Integer.compare(o1.getSentenceIndex(), o2.getSentenceIndex());
		}
	};

	private final SentenceScorer scorer;

	public Summarizer(SentenceScorer scorer) {
		this.scorer = scorer;
	}

	/**
	 * @param text the text {@code doc} was segmented from, returned as is
	 *            when it has at most {@code maxSentences} sentences
	 */
	public Summary summarize(String text, Document doc, int maxSentences, ITextAnalysis analysis) {
		if (maxSentences < 1) throw new IllegalArgumentException("maxSentences must be at least 1, was " + maxSentences);
		if (doc.size() <= maxSentences) {
			List<Integer> all = new ArrayList<Integer>(doc.size());
			for (int i = 0; i < doc.size(); i++)
				all.add(i);
			return new Summary(text, all, true, analysis.getMode());
		}
		List<ScoredSentence> scored = scorer.score(doc, analysis);
		Collections.sort(scored, BY_SCORE);
		List<Integer> selected = new ArrayList<Integer>(maxSentences);
		for (int i = 0; i < maxSentences; i++)
			selected.add(scored.get(i).getSentenceIndex());
		Collections.sort(selected);
		StringBuilder sb = new StringBuilder();
		for (int i : selected) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(doc.getSentences().get(i).getText().trim());
		}
		return new Summary(sb.toString(), selected, false, analysis.getMode());
	}
}
