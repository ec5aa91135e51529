package fi.seco.wordchef.summary;

import java.util.ArrayList;
import java.util.List;

import fi.seco.wordchef.analysis.ITextAnalysis;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.ScoredSentence;
import fi.seco.wordchef.model.Sentence;

/**
 * Scores sentences by content word count, penalized by length, with a fixed
 * bonus for the first sentence.
 */
public class SentenceScorer {

	static final double LENGTH_DIVISOR = 200.0;
	static final double FIRST_SENTENCE_BONUS = 1.0;

	public static double score(int sentenceIndex, int contentWords, int length) {
		double score = contentWords - length / LENGTH_DIVISOR;
		if (sentenceIndex == 0) score += FIRST_SENTENCE_BONUS;
		return score;
	}

	public List<ScoredSentence> score(Document doc, ITextAnalysis analysis) {
		List<ScoredSentence> ret = new ArrayList<ScoredSentence>(doc.size());
		for (Sentence s : doc.getSentences())
			ret.add(new ScoredSentence(s.getIndex(), score(s.getIndex(), analysis.countContentWords(s), s.getText().length())));
		return ret;
	}
}
