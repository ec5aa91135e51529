package fi.seco.wordchef.annotation;

import java.util.Locale;

/**
 * The annotator cannot serve a request. Callers degrade to heuristic
 * processing.
 */
public class AnnotatorUnavailableException extends Exception {

	private static final long serialVersionUID = 1L;

	public AnnotatorUnavailableException(String message) {
		super(message);
	}

	public AnnotatorUnavailableException(String message, Throwable cause) {
		super(message, cause);
	}

	public static AnnotatorUnavailableException unsupported(Locale lang) {
		return new AnnotatorUnavailableException("No annotator available for locale " + lang);
	}
}
