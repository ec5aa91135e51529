package fi.seco.wordchef.lexicon;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Misspelled word form to replacement text. Keys are case-folded.
 */
public final class CorrectionTable {

	private final Map<String, String> corrections;

	public CorrectionTable(Map<String, String> corrections, Locale lang) {
		Map<String, String> m = new HashMap<String, String>();
		for (Map.Entry<String, String> e : corrections.entrySet())
			m.put(e.getKey().toLowerCase(lang), e.getValue());
		this.corrections = Collections.unmodifiableMap(m);
	}

	/**
	 * @return the replacement for a lowercased form, or null
	 */
	public String get(String lowercased) {
		return corrections.get(lowercased);
	}

	public int size() {
		return corrections.size();
	}

	public Map<String, String> asMap() {
		return corrections;
	}
}
