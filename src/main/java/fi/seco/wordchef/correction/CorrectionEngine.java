package fi.seco.wordchef.correction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import fi.seco.wordchef.lexicon.CorrectionTable;
import fi.seco.wordchef.lexicon.GenderedNounTable;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Token;

/**
 * Rewrites a token stream into corrected text. Tokens are visited left to
 * right and each gets exactly one decision, the first of these that applies:
 * <ol>
 * <li>a token repeating the preceding source token (ignoring case) is
 * dropped</li>
 * <li>a form in the correction table is replaced</li>
 * <li>the determiner "lo" becomes the article-qualified phrase for the next
 * token's lemma, or "el"</li>
 * <li>"haber" after an exhortative form of ir/querer becomes "a ver"</li>
 * <li>the token is kept as written</li>
 * </ol>
 * Replacements are never corrected again, and tokens are never reordered.
 * Instances are immutable and may be shared between threads.
 */
public class CorrectionEngine {

	static final String NEUTER_ARTICLE = "lo";
	static final String DEFAULT_ARTICLE = "el";
	static final String HOMOPHONE = "haber";
	static final String HOMOPHONE_REPLACEMENT = "a ver";

	private static final Set<String> EXHORTATIVE_FORMS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList("vamos", "voy", "van", "vas", "quiera")));

	private final CorrectionTable corrections;
	private final GenderedNounTable genderedNouns;
	private final NeuterArticlePolicy policy;
	private final Locale lang;

	public CorrectionEngine(CorrectionTable corrections, GenderedNounTable genderedNouns, NeuterArticlePolicy policy, Locale lang) {
		this.corrections = corrections;
		this.genderedNouns = genderedNouns;
		this.policy = policy;
		this.lang = lang;
	}

	public String correct(Document doc) {
		return correct(doc.getTokens());
	}

	public String correct(List<Token> tokens) {
		List<String> out = new ArrayList<String>(tokens.size());
		for (int i = 0; i < tokens.size(); i++) {
			Token token = tokens.get(i);
			String lower = token.getText().toLowerCase(lang);
			String previous = i > 0 ? tokens.get(i - 1).getText().toLowerCase(lang) : null;

			if (lower.equals(previous)) continue;

			String replacement = corrections.get(lower);
			if (replacement != null) {
				out.add(replacement);
				continue;
			}

			if (NEUTER_ARTICLE.equals(lower) && token.getPos() == PartOfSpeech.DETERMINER) {
				String phrase = i + 1 < tokens.size() ? genderedNouns.get(tokens.get(i + 1).getLemma().toLowerCase(lang)) : null;
				if (phrase == null) out.add(DEFAULT_ARTICLE);
				else {
					out.add(phrase);
					if (policy == NeuterArticlePolicy.CONSUME_NOUN) i++;
				}
				continue;
			}

			if (HOMOPHONE.equals(lower) && EXHORTATIVE_FORMS.contains(previous)) {
				out.add(HOMOPHONE_REPLACEMENT);
				continue;
			}

			out.add(token.getText());
		}
		return RepetitionFilter.join(out);
	}
}
