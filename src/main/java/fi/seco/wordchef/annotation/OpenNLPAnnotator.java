package fi.seco.wordchef.annotation;

import java.io.BufferedReader;
import java.io.IOError;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.PartOfSpeech;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;
import opennlp.tools.lemmatizer.DictionaryLemmatizer;
import opennlp.tools.postag.POSModel;
import opennlp.tools.postag.POSTagger;
import opennlp.tools.postag.POSTaggerME;
import opennlp.tools.sentdetect.SentenceDetector;
import opennlp.tools.sentdetect.SentenceDetectorME;
import opennlp.tools.sentdetect.SentenceModel;
import opennlp.tools.tokenize.Tokenizer;
import opennlp.tools.tokenize.TokenizerME;
import opennlp.tools.tokenize.TokenizerModel;
import opennlp.tools.util.Span;

/**
 * Annotates with Apache OpenNLP models found on the classpath next to this
 * class: {@code <lang>-sent.bin}, {@code <lang>-token.bin},
 * {@code <lang>-pos.bin} and optionally a {@code <lang>-lemmas.dict}
 * dictionary. Candidate languages are listed in {@code annotation-locales}; a
 * language is only claimed if its three models are present.
 */
public class OpenNLPAnnotator implements IAnnotator {

	private static final Logger log = LoggerFactory.getLogger(OpenNLPAnnotator.class);

	private static final String UNKNOWN_LEMMA = "O";

	private final Map<Locale, SentenceModel> sdMap = new HashMap<Locale, SentenceModel>();
	private final Map<Locale, TokenizerModel> tMap = new HashMap<Locale, TokenizerModel>();
	private final Map<Locale, POSModel> pMap = new HashMap<Locale, POSModel>();
	private final Map<Locale, DictionaryLemmatizer> lMap = new HashMap<Locale, DictionaryLemmatizer>();
	private final Set<Locale> noLemmatizer = new HashSet<Locale>();

	private final Set<Locale> supportedLocales = new HashSet<Locale>();

	public OpenNLPAnnotator() {
		InputStream in = OpenNLPAnnotator.class.getResourceAsStream("annotation-locales");
		if (in == null) {
			log.error("Couldn't read locale information. Claiming to support no annotation languages");
			return;
		}
		try {
			BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			try {
				String line;
				while ((line = r.readLine()) != null) {
					line = line.trim();
					if (line.isEmpty() || line.startsWith("#")) continue;
					if (hasModels(line)) supportedLocales.add(new Locale(line));
					else log.info("OpenNLP models for {} not on classpath, not annotating it", line);
				}
			} finally {
				r.close();
			}
		} catch (IOException e) {
			log.error("Couldn't read locale information. Claiming to support no annotation languages", e);
		}
	}

	private static boolean hasModels(String lang) {
		return OpenNLPAnnotator.class.getResource(lang + "-sent.bin") != null && OpenNLPAnnotator.class.getResource(lang + "-token.bin") != null && OpenNLPAnnotator.class.getResource(lang + "-pos.bin") != null;
	}

	private synchronized SentenceDetector getSentenceDetector(Locale lang) {
		SentenceModel sd = sdMap.get(lang);
		if (sd != null) return new SentenceDetectorME(sd);
		InputStream modelIn = OpenNLPAnnotator.class.getResourceAsStream(lang + "-sent.bin");
		try {
			sd = new SentenceModel(modelIn);
			sdMap.put(lang, sd);
			return new SentenceDetectorME(sd);
		} catch (IOException e) {
			throw new IOError(e);
		} finally {
			close(modelIn);
		}
	}

	private synchronized Tokenizer getTokenizer(Locale lang) {
		TokenizerModel t = tMap.get(lang);
		if (t != null) return new TokenizerME(t);
		InputStream modelIn = OpenNLPAnnotator.class.getResourceAsStream(lang + "-token.bin");
		try {
			t = new TokenizerModel(modelIn);
			tMap.put(lang, t);
			return new TokenizerME(t);
		} catch (IOException e) {
			throw new IOError(e);
		} finally {
			close(modelIn);
		}
	}

	private synchronized POSTagger getTagger(Locale lang) {
		POSModel p = pMap.get(lang);
		if (p != null) return new POSTaggerME(p);
		InputStream modelIn = OpenNLPAnnotator.class.getResourceAsStream(lang + "-pos.bin");
		try {
			p = new POSModel(modelIn);
			pMap.put(lang, p);
			return new POSTaggerME(p);
		} catch (IOException e) {
			throw new IOError(e);
		} finally {
			close(modelIn);
		}
	}

	// DictionaryLemmatizer only reads its map after loading, so one instance is shared
	private synchronized DictionaryLemmatizer getLemmatizer(Locale lang) {
		if (noLemmatizer.contains(lang)) return null;
		DictionaryLemmatizer l = lMap.get(lang);
		if (l != null) return l;
		InputStream dictIn = OpenNLPAnnotator.class.getResourceAsStream(lang + "-lemmas.dict");
		if (dictIn == null) {
			log.info("No lemma dictionary for {}, using surface forms as lemmas", lang);
			noLemmatizer.add(lang);
			return null;
		}
		try {
			l = new DictionaryLemmatizer(dictIn);
			lMap.put(lang, l);
			return l;
		} catch (IOException e) {
			throw new IOError(e);
		} finally {
			close(dictIn);
		}
	}

	private static void close(InputStream in) {
		if (in != null) try {
			in.close();
		} catch (IOException e) {
			log.debug("Couldn't close model stream", e);
		}
	}

	@Override
	public Document annotate(String text, Locale lang) throws AnnotatorUnavailableException {
		if (!supportedLocales.contains(lang)) throw AnnotatorUnavailableException.unsupported(lang);
		SentenceDetector sd = getSentenceDetector(lang);
		Tokenizer t = getTokenizer(lang);
		POSTagger tagger = getTagger(lang);
		DictionaryLemmatizer lemmatizer = getLemmatizer(lang);
		List<Sentence> sentences = new ArrayList<Sentence>();
		for (Span span : sd.sentPosDetect(text)) {
			String sentence = span.getCoveredText(text).toString().trim();
			String[] words = t.tokenize(sentence);
			if (words.length == 0) continue;
			String[] tags = tagger.tag(words);
			String[] lemmas = lemmatizer != null ? lemmatizer.lemmatize(words, tags) : null;
			List<Token> tokens = new ArrayList<Token>(words.length);
			for (int i = 0; i < words.length; i++) {
				String lemma = lemmas == null || UNKNOWN_LEMMA.equals(lemmas[i]) ? words[i] : lemmas[i];
				tokens.add(new Token(words[i], lemma, PartOfSpeech.fromTag(tags[i]), i));
			}
			sentences.add(new Sentence(tokens, sentence, sentences.size()));
		}
		return new Document(sentences);
	}

	@Override
	public Collection<Locale> getSupportedAnnotationLocales() {
		return supportedLocales;
	}

}
