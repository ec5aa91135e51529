package fi.seco.wordchef.keywords;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import fi.seco.wordchef.analysis.AnalysisMode;

public final class Keywords {

	private final List<Keyword> topWords;
	private final List<Keyword> nouns;
	private final List<Keyword> verbs;
	private final AnalysisMode mode;

	public Keywords(List<Keyword> topWords, List<Keyword> nouns, List<Keyword> verbs, AnalysisMode mode) {
		this.topWords = Collections.unmodifiableList(new ArrayList<Keyword>(topWords));
		this.nouns = Collections.unmodifiableList(new ArrayList<Keyword>(nouns));
		this.verbs = Collections.unmodifiableList(new ArrayList<Keyword>(verbs));
		this.mode = mode;
	}

	/**
	 * @return the most frequent content words, lowercased
	 */
	public List<Keyword> getTopWords() {
		return topWords;
	}

	/**
	 * @return the most frequent nouns as written; empty without annotation
	 */
	public List<Keyword> getNouns() {
		return nouns;
	}

	/**
	 * @return the most frequent verbs as written; empty without annotation
	 */
	public List<Keyword> getVerbs() {
		return verbs;
	}

	public AnalysisMode getMode() {
		return mode;
	}

	@Override
	public String toString() {
		return "words=" + topWords + ", nouns=" + nouns + ", verbs=" + verbs + " (" + mode + ")";
	}
}
