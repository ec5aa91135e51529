package fi.seco.wordchef.keywords;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import com.carrotsearch.hppc.ObjectIntHashMap;

import fi.seco.wordchef.TextUtil;
import fi.seco.wordchef.analysis.AnalysisMode;
import fi.seco.wordchef.lexicon.StopwordSet;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Token;

/**
 * Frequency-based keywords. Ties keep the order of first occurrence.
 */
public class KeywordExtractor {

	private static final int MIN_WORD_LENGTH = 3;

	private final int count;

	public KeywordExtractor(int count) {
		if (count < 1) throw new IllegalArgumentException("count must be at least 1, was " + count);
		this.count = count;
	}

	/**
	 * @param doc the annotated text, or null when only the raw text is
	 *            available
	 */
	public Keywords extract(String text, Document doc, StopwordSet stopwords, Locale lang, AnalysisMode mode) {
		List<String> words = new ArrayList<String>();
		for (String w : TextUtil.dataWords(text.toLowerCase(lang)))
			if (w.length() >= MIN_WORD_LENGTH && !stopwords.contains(w)) words.add(w);
		List<Keyword> nouns = Collections.emptyList();
		List<Keyword> verbs = Collections.emptyList();
		if (doc != null && mode == AnalysisMode.FULL_ANNOTATION) {
			nouns = mostCommon(surfaceForms(doc, PartOfSpeech.NOUN));
			verbs = mostCommon(surfaceForms(doc, PartOfSpeech.VERB));
		}
		return new Keywords(mostCommon(words), nouns, verbs, mode);
	}

	private static List<String> surfaceForms(Document doc, PartOfSpeech pos) {
		List<String> ret = new ArrayList<String>();
		for (Token t : doc.getTokens())
			if (t.getPos() == pos) ret.add(t.getText());
		return ret;
	}

	List<Keyword> mostCommon(List<String> words) {
		ObjectIntHashMap<String> counts = new ObjectIntHashMap<String>();
		List<String> order = new ArrayList<String>();
		for (String w : words)
			if (counts.putOrAdd(w, 1, 1) == 1) order.add(w);
		List<Keyword> ret = new ArrayList<Keyword>(order.size());
		for (String w : order)
			ret.add(new Keyword(w, counts.get(w)));
		Collections.sort(ret, new Comparator<Keyword>() {
			@Override
			public int compare(Keyword o1, Keyword o2) {
				return Integer.compare(o2.getCount(), o1.getCount());
			}
		});
		return ret.size() > count ? ret.subList(0, count) : ret;
	}
}
