package fi.seco.wordchef.annotation;

import java.util.Collection;
import java.util.Locale;

import fi.seco.wordchef.model.Document;

/**
 * Tokenizes, tags, lemmatizes and sentence-splits text.
 * <p>
 * Implementations must return sentences that are non-empty and in reading
 * order, with tokens in reading order and indices starting at 0. Every token
 * carries a lemma, falling back to its surface form.
 */
public interface IAnnotator {

	public Document annotate(String text, Locale lang) throws AnnotatorUnavailableException;

	public Collection<Locale> getSupportedAnnotationLocales();

}
