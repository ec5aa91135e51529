package fi.seco.wordchef.analysis;

import java.util.Locale;

import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.Sentence;

/**
 * One way of turning raw text into the pieces normalization and summarization
 * need. Selected once per request.
 */
public interface ITextAnalysis {

	public AnalysisMode getMode();

	public Document segment(String text, Locale lang) throws AnnotatorUnavailableException;

	/**
	 * @return the number of words in the sentence that count towards its
	 *         topical weight
	 */
	public int countContentWords(Sentence sentence);

	public String correct(Document doc, String text, Locale lang);

	public String lemmatize(Document doc, String text, Locale lang);

}
