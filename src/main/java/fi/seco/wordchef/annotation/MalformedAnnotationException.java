package fi.seco.wordchef.annotation;

/**
 * An annotator returned a document that breaks the annotation contract.
 */
public class MalformedAnnotationException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	public MalformedAnnotationException(String message) {
		super(message);
	}
}
