package fi.seco.wordchef;

import static org.junit.Assert.*;

import java.util.Locale;
import java.util.Properties;

import org.junit.Test;

import fi.seco.wordchef.correction.NeuterArticlePolicy;

public class TestWordChefConfiguration {

	@Test
	public void testDefaults() {
		WordChefConfiguration c = new WordChefConfiguration(new Properties());
		assertEquals(new Locale("es"), c.getLocale());
		assertEquals(3, c.getSummarySentences());
		assertEquals(5, c.getKeywordCount());
		assertEquals(NeuterArticlePolicy.CONSUME_NOUN, c.getNeuterArticlePolicy());
		assertEquals(10000, c.getAnnotatorTimeoutMillis());
	}

	@Test
	public void testExplicitValues() {
		Properties p = new Properties();
		p.setProperty(WordChefConfiguration.LOCALE, "ca");
		p.setProperty(WordChefConfiguration.SUMMARY_SENTENCES, " 2 ");
		p.setProperty(WordChefConfiguration.NEUTER_ARTICLE_POLICY, "prefix_noun");
		p.setProperty(WordChefConfiguration.ANNOTATOR_TIMEOUT, "0");
		WordChefConfiguration c = new WordChefConfiguration(p);
		assertEquals(new Locale("ca"), c.getLocale());
		assertEquals(2, c.getSummarySentences());
		assertEquals(NeuterArticlePolicy.PREFIX_NOUN, c.getNeuterArticlePolicy());
		assertEquals(0, c.getAnnotatorTimeoutMillis());
	}

	@Test
	public void testRegionalLocale() {
		Properties p = new Properties();
		p.setProperty(WordChefConfiguration.LOCALE, "es-ES");
		assertEquals(new Locale("es", "ES"), new WordChefConfiguration(p).getLocale());
		p.setProperty(WordChefConfiguration.LOCALE, "es_MX");
		assertEquals(new Locale("es", "MX"), new WordChefConfiguration(p).getLocale());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownPolicyIsRejected() {
		Properties p = new Properties();
		p.setProperty(WordChefConfiguration.NEUTER_ARTICLE_POLICY, "guess");
		new WordChefConfiguration(p).getNeuterArticlePolicy();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBadNumberIsRejected() {
		Properties p = new Properties();
		p.setProperty(WordChefConfiguration.KEYWORD_COUNT, "many");
		new WordChefConfiguration(p).getKeywordCount();
	}

	@Test
	public void testLoadFromClasspath() {
		WordChefConfiguration c = WordChefConfiguration.load();
		assertEquals(new Locale("es"), c.getLocale());
		assertEquals(NeuterArticlePolicy.CONSUME_NOUN, c.getNeuterArticlePolicy());
	}

	@Test
	public void testMissingResourceGivesDefaults() {
		assertEquals(5, WordChefConfiguration.load("/no-such-wordchef.properties").getKeywordCount());
	}

	@Test
	public void testSystemPropertyWins() {
		System.setProperty(WordChefConfiguration.KEYWORD_COUNT, "7");
		try {
			assertEquals(7, WordChefConfiguration.load().getKeywordCount());
		} finally {
			System.clearProperty(WordChefConfiguration.KEYWORD_COUNT);
		}
	}
}
