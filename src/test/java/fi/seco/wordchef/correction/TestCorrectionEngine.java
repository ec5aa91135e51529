package fi.seco.wordchef.correction;

import static fi.seco.wordchef.annotation.StaticAnnotator.plain;
import static fi.seco.wordchef.annotation.StaticAnnotator.token;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.junit.Test;

import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.annotation.StaticAnnotator;
import fi.seco.wordchef.lexicon.CorrectionTable;
import fi.seco.wordchef.lexicon.LexicalResources;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;

public class TestCorrectionEngine {

	static final Locale es = new Locale("es");
	static final LexicalResources resources = LexicalResources.load(es);

	final CorrectionEngine engine = new CorrectionEngine(resources.getCorrections(), resources.getGenderedNouns(), NeuterArticlePolicy.CONSUME_NOUN, es);
	final CorrectionEngine prefixing = new CorrectionEngine(resources.getCorrections(), resources.getGenderedNouns(), NeuterArticlePolicy.PREFIX_NOUN, es);

	@Test
	public void testTableCorrections() {
		assertEquals("no vino nadie", engine.correct(plain("no", "vino", "naiden")));
		assertEquals("lo dije en serio", engine.correct(plain("lo", "dije", "enserio")));
	}

	@Test
	public void testLookupIgnoresCaseButKeepsUnmatchedCasing() {
		assertEquals("Ojalá haya Sol", engine.correct(plain("Ojalá", "HAIGA", "Sol")));
	}

	@Test
	public void testReplacementsAreNotCorrectedAgain() {
		Map<String, String> chain = new HashMap<String, String>();
		chain.put("a", "b");
		chain.put("b", "c");
		CorrectionEngine e = new CorrectionEngine(new CorrectionTable(chain, es), resources.getGenderedNouns(), NeuterArticlePolicy.CONSUME_NOUN, es);
		assertEquals("b x", e.correct(plain("a", "x")));
	}

	@Test
	public void testRepeatedTableWordIsCorrectedExactlyOnce() {
		assertEquals("haya", engine.correct(plain("haiga", "haiga")));
		assertEquals("que haya paz", engine.correct(plain("que", "haiga", "Haiga", "paz")));
	}

	@Test
	public void testNeuterArticleConsumingNoun() {
		List<Token> tokens = Arrays.asList(token("lo", PartOfSpeech.DETERMINER, 0), token("niño", PartOfSpeech.NOUN, "niño", 1));
		assertEquals("el niño", engine.correct(tokens));
	}

	@Test
	public void testNeuterArticlePrefixingNoun() {
		List<Token> tokens = Arrays.asList(token("lo", PartOfSpeech.DETERMINER, 0), token("niño", PartOfSpeech.NOUN, "niño", 1));
		assertEquals("el niño niño", prefixing.correct(tokens));
	}

	@Test
	public void testNeuterArticleLooksAtLemma() {
		List<Token> tokens = Arrays.asList(token("vi", PartOfSpeech.VERB, 0), token("lo", PartOfSpeech.DETERMINER, 1), token("casas", PartOfSpeech.NOUN, "casa", 2), token("rojas", PartOfSpeech.OTHER, 3));
		assertEquals("vi la casa rojas", engine.correct(tokens));
		assertEquals("vi la casa casas rojas", prefixing.correct(tokens));
	}

	@Test
	public void testNeuterArticleDefaultsToMasculine() {
		assertEquals("el perro", engine.correct(Arrays.asList(token("lo", PartOfSpeech.DETERMINER, 0), token("perro", PartOfSpeech.NOUN, 1))));
		assertEquals("es el", engine.correct(Arrays.asList(token("es", PartOfSpeech.VERB, 0), token("lo", PartOfSpeech.DETERMINER, 1))));
	}

	@Test
	public void testPronounLoIsKept() {
		assertEquals("lo casa", engine.correct(Arrays.asList(token("lo", PartOfSpeech.OTHER, 0), token("casa", PartOfSpeech.NOUN, 1))));
	}

	@Test
	public void testHaberAfterExhortativeForm() {
		assertEquals("vamos a ver si funciona", engine.correct(plain("vamos", "haber", "si", "funciona")));
		assertEquals("Voy a ver", engine.correct(plain("Voy", "haber")));
		assertEquals("quiera a ver", engine.correct(plain("quiera", "haber")));
	}

	@Test
	public void testHaberElsewhereIsKept() {
		assertEquals("puede haber problemas", engine.correct(plain("puede", "haber", "problemas")));
		assertEquals("haber", engine.correct(plain("haber")));
	}

	@Test
	public void testAdjacentDuplicatesAreDroppedCaseInsensitively() {
		assertEquals("El perro ladra", engine.correct(plain("El", "el", "perro", "ladra", "ladra")));
	}

	@Test
	public void testDuplicateCheckUsesSourceTokens() {
		// "haiga" follows "haya" in the source, so it is not a repetition of the corrected text
		assertEquals("haya haya", engine.correct(plain("haya", "haiga")));
	}

	@Test
	public void testLookbehindCrossesSentences() {
		Sentence first = new Sentence(plain("Bien"), "Bien", 0);
		Sentence second = new Sentence(plain("bien", "hecho"), "bien hecho", 1);
		assertEquals("Bien hecho", engine.correct(new Document(Arrays.asList(first, second))));
	}

	@Test
	public void testCorrectionIsDeterministic() throws AnnotatorUnavailableException {
		StaticAnnotator a = new StaticAnnotator(es).tag(PartOfSpeech.DETERMINER, "lo").tag(PartOfSpeech.NOUN, "niño", "casa");
		Document doc = a.annotate("Vamos haber lo niño y lo casa. Haiga paz paz.", es);
		String first = engine.correct(doc);
		assertEquals("Vamos a ver el niño y la casa . haya paz .", first);
		for (int i = 0; i < 10; i++)
			assertEquals(first, engine.correct(doc));
	}

	@Test
	public void testDuplicateSuppressionOfOutputIsIdempotent() {
		String corrected = engine.correct(plain("yo", "yo", "iva", "a", "a", "casa"));
		RepetitionFilter f = new RepetitionFilter(es);
		assertEquals(f.filter(corrected), f.filter(f.filter(corrected)));
	}
}
