package fi.seco.wordchef.lexicon;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lemma of a non-neuter noun to the article-qualified phrase that replaces a
 * neuter article in front of it, e.g. {@code casa -> la casa}.
 */
public final class GenderedNounTable {

	private final Map<String, String> phrases;

	public GenderedNounTable(Map<String, String> phrases, Locale lang) {
		Map<String, String> m = new HashMap<String, String>();
		for (Map.Entry<String, String> e : phrases.entrySet())
			m.put(e.getKey().toLowerCase(lang), e.getValue());
		this.phrases = Collections.unmodifiableMap(m);
	}

	public String get(String lowercasedLemma) {
		return phrases.get(lowercasedLemma);
	}

	public int size() {
		return phrases.size();
	}
}
