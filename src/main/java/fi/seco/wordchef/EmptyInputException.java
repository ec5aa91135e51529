package fi.seco.wordchef;

/**
 * Thrown when the text to process is null, empty or only whitespace.
 */
public class EmptyInputException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public EmptyInputException() {
		super("Input text is empty");
	}

	public static String requireText(String text) {
		if (TextUtil.isBlank(text)) throw new EmptyInputException();
		return text;
	}
}
