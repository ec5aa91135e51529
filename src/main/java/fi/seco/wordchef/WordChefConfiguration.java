package fi.seco.wordchef;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.correction.NeuterArticlePolicy;

/**
 * Settings read from {@code wordchef.properties} on the classpath. A system
 * property with the same key wins over the file.
 */
public class WordChefConfiguration {

	private static final Logger log = LoggerFactory.getLogger(WordChefConfiguration.class);

	public static final String LOCALE = "wordchef.locale";
	public static final String SUMMARY_SENTENCES = "wordchef.summary.sentences";
	public static final String KEYWORD_COUNT = "wordchef.keywords.count";
	public static final String NEUTER_ARTICLE_POLICY = "wordchef.correction.neuterArticle";
	public static final String ANNOTATOR_TIMEOUT = "wordchef.annotator.timeoutMillis";

	private final Properties properties;

	public WordChefConfiguration(Properties properties) {
		this.properties = properties;
	}

	public static WordChefConfiguration load() {
		return load("/wordchef.properties");
	}

	public static WordChefConfiguration load(String resource) {
		Properties p = new Properties();
		InputStream in = WordChefConfiguration.class.getResourceAsStream(resource);
		if (in == null) log.warn("Couldn't find {}. Using defaults", resource);
		else try {
			try {
				p.load(new InputStreamReader(in, StandardCharsets.UTF_8));
			} finally {
				in.close();
			}
		} catch (IOException e) {
			log.error("Couldn't read " + resource + ". Using defaults", e);
		}
		for (String key : System.getProperties().stringPropertyNames())
			if (key.startsWith("wordchef.")) p.setProperty(key, System.getProperty(key));
		return new WordChefConfiguration(p);
	}

	private String get(String key, String def) {
		String v = properties.getProperty(key);
		return v == null || v.trim().isEmpty() ? def : v.trim();
	}

	private int getInt(String key, int def) {
		String v = get(key, null);
		if (v == null) return def;
		try {
			return Integer.parseInt(v);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, e);
		}
	}

	/**
	 * @return the default locale, given as a language tag such as {@code es}
	 *         or {@code es-ES} ({@code es_ES} is accepted too)
	 */
	public Locale getLocale() {
		return Locale.forLanguageTag(get(LOCALE, "es").replace('_', '-'));
	}

	public int getSummarySentences() {
		return getInt(SUMMARY_SENTENCES, 3);
	}

	public int getKeywordCount() {
		return getInt(KEYWORD_COUNT, 5);
	}

	public NeuterArticlePolicy getNeuterArticlePolicy() {
		String v = get(NEUTER_ARTICLE_POLICY, NeuterArticlePolicy.CONSUME_NOUN.name());
		try {
			return NeuterArticlePolicy.valueOf(v.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Invalid value for " + NEUTER_ARTICLE_POLICY + ": " + v, e);
		}
	}

	public long getAnnotatorTimeoutMillis() {
		return getInt(ANNOTATOR_TIMEOUT, 10000);
	}
}
