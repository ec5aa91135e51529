package fi.seco.wordchef.keywords;

public final class Keyword {

	private final String word;
	private final int count;

	public Keyword(String word, int count) {
		this.word = word;
		this.count = count;
	}

	public String getWord() {
		return word;
	}

	public int getCount() {
		return count;
	}

	@Override
	public String toString() {
		return word + ": " + count;
	}

	@Override
	public int hashCode() {
		return word.hashCode() + 31 * count;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Keyword)) return false;
		Keyword o = (Keyword) obj;
		return o.count == count && o.word.equals(word);
	}
}
