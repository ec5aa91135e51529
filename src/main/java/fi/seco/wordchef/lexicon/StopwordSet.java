package fi.seco.wordchef.lexicon;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class StopwordSet {

	private final Set<String> words;

	public StopwordSet(Collection<String> words, Locale lang) {
		Set<String> s = new HashSet<String>();
		for (String w : words)
			s.add(w.toLowerCase(lang));
		this.words = Collections.unmodifiableSet(s);
	}

	public boolean contains(String lowercased) {
		return words.contains(lowercased);
	}

	public boolean isEmpty() {
		return words.isEmpty();
	}

	public int size() {
		return words.size();
	}
}
