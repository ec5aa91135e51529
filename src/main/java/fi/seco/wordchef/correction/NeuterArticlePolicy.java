package fi.seco.wordchef.correction;

/**
 * What happens to the noun after a neuter article that is rewritten to an
 * article-qualified phrase.
 */
public enum NeuterArticlePolicy {
	/** The phrase stands for article and noun: "lo niño" becomes "el niño". */
	CONSUME_NOUN,
	/** The phrase only supplies the article: "lo niño" becomes "el niño niño". */
	PREFIX_NOUN
}
