package fi.seco.wordchef.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.tartarus.snowball.ext.SpanishStemmer;

import fi.seco.wordchef.TextUtil;

/**
 * Approximates Spanish baseforms by Snowball stemming. Stems are not
 * dictionary words ("niños" becomes "niñ"); this is only used when no
 * annotator can lemmatize. Text in other languages is returned as is.
 */
public class SnowballBaseformer {

	private static final String SPANISH = "es";

	private final SpanishStemmer stemmer = new SpanishStemmer();

	public String baseform(String text, Locale lang) {
		if (lang == null || !SPANISH.equals(lang.getLanguage())) return text;
		List<String> stems = new ArrayList<String>();
		// the stemmer keeps its current word as state
		synchronized (stemmer) {
			for (String w : TextUtil.dataWords(text)) {
				stemmer.setCurrent(w.toLowerCase(lang));
				stemmer.stem();
				stems.add(stemmer.getCurrent());
			}
		}
		return String.join(" ", stems);
	}
}
