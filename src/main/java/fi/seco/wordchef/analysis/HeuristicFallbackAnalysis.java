package fi.seco.wordchef.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import fi.seco.wordchef.TextUtil;
import fi.seco.wordchef.correction.RepetitionFilter;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;

/**
 * Works on raw text alone. Sentences are period-separated fragments (the
 * periods are dropped), every word is tagged {@link PartOfSpeech#OTHER}, a
 * word longer than two characters stands in for a noun, correction is limited
 * to removing repeated words and lemmas are Snowball stems. Deliberately
 * cruder than annotation and always reported as
 * {@link AnalysisMode#HEURISTIC_FALLBACK}.
 */
public class HeuristicFallbackAnalysis implements ITextAnalysis {

	private static final int MIN_CONTENT_WORD_LENGTH = 3;

	private final SnowballBaseformer baseformer;

	public HeuristicFallbackAnalysis(SnowballBaseformer baseformer) {
		this.baseformer = baseformer;
	}

	@Override
	public AnalysisMode getMode() {
		return AnalysisMode.HEURISTIC_FALLBACK;
	}

	@Override
	public Document segment(String text, Locale lang) {
		List<Sentence> sentences = new ArrayList<Sentence>();
		for (String fragment : TextUtil.periodFragments(text)) {
			List<Token> tokens = new ArrayList<Token>();
			for (String w : TextUtil.words(fragment))
				tokens.add(new Token(w, w, PartOfSpeech.OTHER, tokens.size()));
			sentences.add(new Sentence(tokens, fragment, sentences.size()));
		}
		return new Document(sentences);
	}

	@Override
	public int countContentWords(Sentence sentence) {
		int c = 0;
		for (Token t : sentence.getTokens())
			if (t.getText().length() >= MIN_CONTENT_WORD_LENGTH) c++;
		return c;
	}

	@Override
	public String correct(Document doc, String text, Locale lang) {
		return new RepetitionFilter(lang).filter(text);
	}

	@Override
	public String lemmatize(Document doc, String text, Locale lang) {
		return baseformer.baseform(text, lang);
	}

}
