package fi.seco.wordchef.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An annotated text: sentences in reading order. Owned by the call that
 * produced it and never modified afterwards.
 */
public final class Document {

	private final List<Sentence> sentences;

	public Document(List<Sentence> sentences) {
		this.sentences = Collections.unmodifiableList(new ArrayList<Sentence>(sentences));
	}

	public List<Sentence> getSentences() {
		return sentences;
	}

	public int size() {
		return sentences.size();
	}

	/**
	 * @return every token of every sentence, in reading order
	 */
	public List<Token> getTokens() {
		List<Token> ret = new ArrayList<Token>();
		for (Sentence s : sentences)
			ret.addAll(s.getTokens());
		return ret;
	}

	@Override
	public String toString() {
		return sentences.toString();
	}
}
