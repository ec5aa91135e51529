package fi.seco.wordchef.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Sentence {

	private final List<Token> tokens;
	private final String text;
	private final int index;

	public Sentence(List<Token> tokens, String text, int index) {
		if (text == null) throw new NullPointerException("text");
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(tokens));
		this.text = text;
		this.index = index;
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return zero-based position within the owning document
	 */
	public int getIndex() {
		return index;
	}

	public int countTokens(PartOfSpeech pos) {
		int c = 0;
		for (Token t : tokens)
			if (t.getPos() == pos) c++;
		return c;
	}

	@Override
	public String toString() {
		return index + ": " + text;
	}
}
