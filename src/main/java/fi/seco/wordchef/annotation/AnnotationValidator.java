package fi.seco.wordchef.annotation;

import java.util.List;

import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;

public class AnnotationValidator {

	/**
	 * @throws MalformedAnnotationException if sentence or token indices do not
	 *             start at 0 and increase by one, or a sentence has no tokens
	 */
	public static Document validate(Document doc) {
		if (doc == null) throw new MalformedAnnotationException("Annotator returned no document");
		List<Sentence> sentences = doc.getSentences();
		for (int i = 0; i < sentences.size(); i++) {
			Sentence s = sentences.get(i);
			if (s.getIndex() != i) throw new MalformedAnnotationException("Sentence at position " + i + " has index " + s.getIndex());
			List<Token> tokens = s.getTokens();
			if (tokens.isEmpty()) throw new MalformedAnnotationException("Sentence " + i + " has no tokens");
			for (int j = 0; j < tokens.size(); j++)
				if (tokens.get(j).getIndex() != j) throw new MalformedAnnotationException("Token at position " + j + " of sentence " + i + " has index " + tokens.get(j).getIndex());
		}
		return doc;
	}
}
