package fi.seco.wordchef.model;

public final class ScoredSentence {

	private final int sentenceIndex;
	private final double score;

	public ScoredSentence(int sentenceIndex, double score) {
		this.sentenceIndex = sentenceIndex;
		this.score = score;
	}

	public int getSentenceIndex() {
		return sentenceIndex;
	}

	public double getScore() {
		return score;
	}

	@Override
	public String toString() {
		return sentenceIndex + ":" + score;
	}
}
