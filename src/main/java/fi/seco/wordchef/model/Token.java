package fi.seco.wordchef.model;

public final class Token {

	private final String text;
	private final String lemma;
	private final PartOfSpeech pos;
	private final int index;

	public Token(String text, String lemma, PartOfSpeech pos, int index) {
		if (text == null) throw new NullPointerException("text");
		this.text = text;
		this.lemma = lemma != null ? lemma : text;
		this.pos = pos != null ? pos : PartOfSpeech.OTHER;
		this.index = index;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the dictionary form, or the surface form when the annotator had
	 *         nothing better
	 */
	public String getLemma() {
		return lemma;
	}

	public PartOfSpeech getPos() {
		return pos;
	}

	/**
	 * @return zero-based position within the owning sentence
	 */
	public int getIndex() {
		return index;
	}

	@Override
	public String toString() {
		return text + "(" + lemma + "/" + pos + ")";
	}

	@Override
	public int hashCode() {
		return text.hashCode() + 31 * lemma.hashCode() + 37 * pos.hashCode() + index;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Token)) return false;
		Token o = (Token) obj;
		return o.index == index && o.pos == pos && o.text.equals(text) && o.lemma.equals(lemma);
	}
}
