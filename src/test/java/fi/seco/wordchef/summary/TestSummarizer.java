package fi.seco.wordchef.summary;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import org.junit.Test;

import fi.seco.wordchef.analysis.AnalysisMode;
import fi.seco.wordchef.analysis.FullAnnotationAnalysis;
import fi.seco.wordchef.analysis.HeuristicFallbackAnalysis;
import fi.seco.wordchef.analysis.SnowballBaseformer;
import fi.seco.wordchef.annotation.StaticAnnotator;
import fi.seco.wordchef.correction.CorrectionEngine;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;

public class TestSummarizer {

	final Summarizer summarizer = new Summarizer(new SentenceScorer());
	final FullAnnotationAnalysis full = new FullAnnotationAnalysis(new StaticAnnotator(new Locale("es")), Collections.<Locale, CorrectionEngine> emptyMap());
	final HeuristicFallbackAnalysis fallback = new HeuristicFallbackAnalysis(new SnowballBaseformer());

	/**
	 * A sentence of {@code nouns} nouns followed by {@code others} other words.
	 */
	private static Sentence sentence(int index, int nouns, int others) {
		List<Token> tokens = new ArrayList<Token>();
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < nouns + others; i++) {
			String w = (i < nouns ? "n" : "o") + index + "x" + i;
			tokens.add(new Token(w, w, i < nouns ? PartOfSpeech.NOUN : PartOfSpeech.OTHER, i));
			if (sb.length() > 0) sb.append(' ');
			sb.append(w);
		}
		sb.append('.');
		return new Sentence(tokens, sb.toString(), index);
	}

	private static String join(Document doc) {
		StringBuilder sb = new StringBuilder();
		for (Sentence s : doc.getSentences()) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(s.getText());
		}
		return sb.toString();
	}

	@Test
	public void testShortDocumentIsReturnedUnchanged() {
		Document doc = new Document(Arrays.asList(sentence(0, 1, 1), sentence(1, 2, 0)));
		String text = "  " + join(doc) + "\n";
		Summary s = summarizer.summarize(text, doc, 3, full);
		assertEquals(text, s.getText());
		assertTrue(s.isComplete());
		assertEquals(Arrays.asList(0, 1), s.getSentenceIndices());
	}

	@Test
	public void testExactlyAsManySentencesAsRequestedIsReturnedUnchanged() {
		Document doc = new Document(Arrays.asList(sentence(0, 1, 1), sentence(1, 2, 0)));
		assertEquals(join(doc), summarizer.summarize(join(doc), doc, 2, full).getText());
	}

	@Test
	public void testSelectionIsEmittedInReadingOrder() {
		// sentence 3 scores highest, sentence 0 second thanks to its bonus, sentence 1 third
		Document doc = new Document(Arrays.asList(sentence(0, 2, 1), sentence(1, 2, 0), sentence(2, 1, 3), sentence(3, 4, 0), sentence(4, 0, 2)));
		Summary s = summarizer.summarize(join(doc), doc, 2, full);
		assertFalse(s.isComplete());
		assertEquals(Arrays.asList(0, 3), s.getSentenceIndices());
		assertEquals(doc.getSentences().get(0).getText() + " " + doc.getSentences().get(3).getText(), s.getText());
		assertEquals(AnalysisMode.FULL_ANNOTATION, s.getMode());
	}

	@Test
	public void testTiesPreferEarlierSentences() {
		Document doc = new Document(Arrays.asList(sentence(0, 0, 2), sentence(1, 1, 0), sentence(2, 1, 0), sentence(3, 1, 0)));
		Summary s = summarizer.summarize(join(doc), doc, 2, full);
		assertEquals(Arrays.asList(1, 2), s.getSentenceIndices());
	}

	@Test
	public void testLengthIsPenalized() {
		// same noun count, sentence 2 is much longer
		Document doc = new Document(Arrays.asList(sentence(0, 0, 1), sentence(1, 0, 1), sentence(2, 2, 60), sentence(3, 2, 0)));
		Summary s = summarizer.summarize(join(doc), doc, 1, full);
		assertEquals(Collections.singletonList(3), s.getSentenceIndices());
	}

	@Test
	public void testFallbackSummaryJoinsTrimmedFragments() {
		String text = "La casa es grande. El sol brilla mucho hoy en la ciudad. Sí. No. Bien.";
		Document doc = fallback.segment(text, new Locale("es"));
		Summary s = summarizer.summarize(text, doc, 2, fallback);
		assertEquals(Arrays.asList(0, 1), s.getSentenceIndices());
		assertEquals("La casa es grande El sol brilla mucho hoy en la ciudad", s.getText());
		assertEquals(AnalysisMode.HEURISTIC_FALLBACK, s.getMode());
	}

	@Test
	public void testOrderAndLengthBoundHoldForRandomDocuments() {
		Random r = new Random(42);
		for (int round = 0; round < 200; round++) {
			int n = 1 + r.nextInt(12);
			List<Sentence> sentences = new ArrayList<Sentence>();
			for (int i = 0; i < n; i++)
				sentences.add(sentence(i, r.nextInt(6), r.nextInt(20)));
			Document doc = new Document(sentences);
			int max = 1 + r.nextInt(8);
			Summary s = summarizer.summarize(join(doc), doc, max, full);
			List<Integer> indices = s.getSentenceIndices();
			assertEquals(Math.min(max, n), indices.size());
			for (int i = 1; i < indices.size(); i++)
				assertTrue(indices.get(i - 1) < indices.get(i));
			if (n <= max) assertEquals(join(doc), s.getText());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testAtLeastOneSentenceMustBeRequested() {
		Document doc = new Document(Arrays.asList(sentence(0, 1, 1)));
		summarizer.summarize(join(doc), doc, 0, full);
	}
}
