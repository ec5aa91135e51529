package fi.seco.wordchef.analysis;

import java.util.Locale;
import java.util.Map;

import fi.seco.wordchef.annotation.AnnotationValidator;
import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.annotation.IAnnotator;
import fi.seco.wordchef.correction.CorrectionEngine;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;

public class FullAnnotationAnalysis implements ITextAnalysis {

	private final IAnnotator annotator;
	private final Map<Locale, CorrectionEngine> engines;

	public FullAnnotationAnalysis(IAnnotator annotator, Map<Locale, CorrectionEngine> engines) {
		this.annotator = annotator;
		this.engines = engines;
	}

	@Override
	public AnalysisMode getMode() {
		return AnalysisMode.FULL_ANNOTATION;
	}

	@Override
	public Document segment(String text, Locale lang) throws AnnotatorUnavailableException {
		return AnnotationValidator.validate(annotator.annotate(text, lang));
	}

	@Override
	public int countContentWords(Sentence sentence) {
		return sentence.countTokens(PartOfSpeech.NOUN);
	}

	@Override
	public String correct(Document doc, String text, Locale lang) {
		CorrectionEngine engine = engines.get(lang);
		if (engine == null) engine = engines.get(new Locale(lang.getLanguage()));
		if (engine == null) throw new IllegalArgumentException("No correction resources loaded for " + lang);
		return engine.correct(doc);
	}

	@Override
	public String lemmatize(Document doc, String text, Locale lang) {
		StringBuilder sb = new StringBuilder();
		for (Token t : doc.getTokens()) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(t.getLemma());
		}
		return sb.toString();
	}

}
