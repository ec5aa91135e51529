package fi.seco.wordchef.model;

import java.util.Locale;

/**
 * The part-of-speech categories the correction and scoring rules distinguish.
 * Finer tag sets are collapsed with {@link #fromTag(String)}.
 */
public enum PartOfSpeech {
	NOUN, VERB, DETERMINER, OTHER;

	/**
	 * Maps a tagger tag to a category. Understands Universal Dependencies tags
	 * (NOUN, VERB, DET), EAGLES/AnCora tags (NC.., V.., D..) and Penn tags
	 * (NN.., VB.., DT). Proper nouns and anything unrecognized are
	 * {@link #OTHER}.
	 */
	public static PartOfSpeech fromTag(String tag) {
		if (tag == null || tag.isEmpty()) return OTHER;
		String t = tag.toUpperCase(Locale.ROOT);
		switch (t) {
		case "NOUN":
			return NOUN;
		case "VERB":
			return VERB;
		case "DET":
		case "DT":
			return DETERMINER;
		case "PROPN":
		case "NNP":
		case "NNPS":
			return OTHER;
		}
		if (t.startsWith("NC") || t.startsWith("NN")) return NOUN;
		if (t.charAt(0) == 'V') return VERB;
		if (t.charAt(0) == 'D') return DETERMINER;
		return OTHER;
	}
}
