package fi.seco.wordchef;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.analysis.AnalysisMode;
import fi.seco.wordchef.analysis.FullAnnotationAnalysis;
import fi.seco.wordchef.analysis.HeuristicFallbackAnalysis;
import fi.seco.wordchef.analysis.ITextAnalysis;
import fi.seco.wordchef.analysis.SnowballBaseformer;
import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.annotation.CompoundAnnotator;
import fi.seco.wordchef.annotation.IAnnotator;
import fi.seco.wordchef.annotation.OpenNLPAnnotator;
import fi.seco.wordchef.annotation.TimeLimitedAnnotator;
import fi.seco.wordchef.correction.CorrectionEngine;
import fi.seco.wordchef.correction.RepetitionFilter;
import fi.seco.wordchef.entities.Entities;
import fi.seco.wordchef.entities.IEntityFinder;
import fi.seco.wordchef.entities.OpenNLPEntityFinder;
import fi.seco.wordchef.keywords.KeywordExtractor;
import fi.seco.wordchef.keywords.Keywords;
import fi.seco.wordchef.lexicon.CorrectionTable;
import fi.seco.wordchef.lexicon.GenderedNounTable;
import fi.seco.wordchef.lexicon.LexicalResources;
import fi.seco.wordchef.lexicon.StopwordSet;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.patterns.PatternFinder;
import fi.seco.wordchef.patterns.PatternMatches;
import fi.seco.wordchef.summary.SentenceScorer;
import fi.seco.wordchef.summary.Summarizer;
import fi.seco.wordchef.summary.Summary;

/**
 * Entry point for normalization, summarization, keyword and named entity
 * extraction, and pattern search.
 * <p>
 * Each request picks its processing path once: annotated text when the
 * annotator serves the language, otherwise the heuristic fallback. Results
 * report which path ran. Lexical resources are loaded in the constructor and
 * never change, so one instance can serve any number of threads.
 */
public class WordChefService {

	private static final Logger log = LoggerFactory.getLogger(WordChefService.class);

	private final WordChefConfiguration config;
	private final IAnnotator annotator;
	private final IEntityFinder entityFinder;
	private final Map<Locale, LexicalResources> resources = new HashMap<Locale, LexicalResources>();
	private final ITextAnalysis fullAnalysis;
	private final HeuristicFallbackAnalysis fallbackAnalysis = new HeuristicFallbackAnalysis(new SnowballBaseformer());
	private final Summarizer summarizer = new Summarizer(new SentenceScorer());
	private final KeywordExtractor keywordExtractor;
	private final PatternFinder patternFinder = new PatternFinder();

	public WordChefService() {
		this(WordChefConfiguration.load());
	}

	public WordChefService(WordChefConfiguration config) {
		this(new TimeLimitedAnnotator(new CompoundAnnotator(new OpenNLPAnnotator()), config.getAnnotatorTimeoutMillis()), new OpenNLPEntityFinder(), config);
	}

	public WordChefService(IAnnotator annotator, WordChefConfiguration config) {
		this(annotator, new OpenNLPEntityFinder(), config);
	}

	public WordChefService(IAnnotator annotator, IEntityFinder entityFinder, WordChefConfiguration config) {
		this.config = config;
		this.annotator = annotator;
		this.entityFinder = entityFinder;
		Set<Locale> languages = new LinkedHashSet<Locale>();
		languages.add(language(config.getLocale()));
		for (Locale l : annotator.getSupportedAnnotationLocales())
			languages.add(language(l));
		Map<Locale, CorrectionEngine> engines = new HashMap<Locale, CorrectionEngine>();
		for (Locale l : languages) {
			LexicalResources r = LexicalResources.load(l);
			resources.put(l, r);
			engines.put(l, new CorrectionEngine(r.getCorrections(), r.getGenderedNouns(), config.getNeuterArticlePolicy(), l));
			if (!isAnnotated(l)) log.warn("No annotator for {}. Only repetition removal and heuristic summaries are available", l);
		}
		this.fullAnalysis = new FullAnnotationAnalysis(annotator, Collections.unmodifiableMap(engines));
		this.keywordExtractor = new KeywordExtractor(config.getKeywordCount());
	}

	private static Locale language(Locale lang) {
		return new Locale(lang.getLanguage());
	}

	private boolean isAnnotated(Locale lang) {
		return annotationLocale(lang) != null;
	}

	/**
	 * @return the locale the annotator knows {@code lang} by: itself, its
	 *         language, or null
	 */
	private Locale annotationLocale(Locale lang) {
		Collection<Locale> supported = annotator.getSupportedAnnotationLocales();
		if (supported.contains(lang)) return lang;
		if (supported.contains(language(lang))) return language(lang);
		return null;
	}

	private LexicalResources getResources(Locale lang) {
		LexicalResources r = resources.get(language(lang));
		if (r != null) return r;
		return new LexicalResources(lang, new CorrectionTable(Collections.<String, String> emptyMap(), lang), new GenderedNounTable(Collections.<String, String> emptyMap(), lang), new StopwordSet(Collections.<String> emptyList(), lang));
	}

	private static final class Analyzed {
		final ITextAnalysis analysis;
		final Document doc;
		final Locale lang;

		Analyzed(ITextAnalysis analysis, Document doc, Locale lang) {
			this.analysis = analysis;
			this.doc = doc;
			this.lang = lang;
		}
	}

	private Analyzed analyze(String text, Locale lang) {
		Locale annotated = resources.containsKey(language(lang)) ? annotationLocale(lang) : null;
		if (annotated != null) {
			try {
				return new Analyzed(fullAnalysis, fullAnalysis.segment(text, annotated), annotated);
			} catch (AnnotatorUnavailableException e) {
				log.warn("Annotation failed for {}, degrading to heuristic processing: {}", lang, e.getMessage());
			}
		} else log.debug("No annotation for {}, using heuristic processing", lang);
		return new Analyzed(fallbackAnalysis, fallbackAnalysis.segment(text, lang), lang);
	}

	public NormalizationResult normalize(String text) {
		return normalize(text, config.getLocale());
	}

	public NormalizationResult normalize(String text, Locale lang) {
		EmptyInputException.requireText(text);
		Analyzed a = analyze(text, lang);
		String withoutRepetitions = new RepetitionFilter(lang).filter(text);
		return new NormalizationResult(text, a.analysis.lemmatize(a.doc, text, lang), withoutRepetitions, a.analysis.correct(a.doc, text, lang), a.analysis.getMode());
	}

	public Summary summarize(String text) {
		return summarize(text, config.getSummarySentences(), config.getLocale());
	}

	public Summary summarize(String text, int maxSentences) {
		return summarize(text, maxSentences, config.getLocale());
	}

	public Summary summarize(String text, int maxSentences, Locale lang) {
		EmptyInputException.requireText(text);
		if (maxSentences < 1) throw new IllegalArgumentException("maxSentences must be at least 1, was " + maxSentences);
		Analyzed a = analyze(text, lang);
		return summarizer.summarize(text, a.doc, maxSentences, a.analysis);
	}

	public Keywords extractKeywords(String text) {
		return extractKeywords(text, config.getLocale());
	}

	public Keywords extractKeywords(String text, Locale lang) {
		EmptyInputException.requireText(text);
		Analyzed a = analyze(text, lang);
		return keywordExtractor.extract(text, a.doc, getResources(lang).getStopwords(), lang, a.analysis.getMode());
	}

	public Entities extractEntities(String text) {
		return extractEntities(text, config.getLocale());
	}

	/**
	 * Named entities need both an annotated document and entity models for
	 * the language. Without either the result is
	 * {@linkplain Entities#isAvailable() unavailable}.
	 */
	public Entities extractEntities(String text, Locale lang) {
		EmptyInputException.requireText(text);
		Analyzed a = analyze(text, lang);
		if (a.analysis.getMode() != AnalysisMode.FULL_ANNOTATION) {
			log.warn("Named entities need annotation, which is not available for {}", lang);
			return Entities.unavailable();
		}
		Collection<Locale> supported = entityFinder.getSupportedEntityLocales();
		Locale entityLang = supported.contains(a.lang) || !supported.contains(language(a.lang)) ? a.lang : language(a.lang);
		try {
			return entityFinder.find(a.doc, entityLang);
		} catch (AnnotatorUnavailableException e) {
			log.warn("Named entity recognition failed for {}: {}", lang, e.getMessage());
			return Entities.unavailable();
		}
	}

	public PatternMatches findPatterns(String text) {
		return patternFinder.find(text == null ? "" : text);
	}

	/**
	 * Normalizes each text independently, in parallel.
	 */
	public List<NormalizationResult> normalizeAll(List<String> texts, final Locale lang) {
		return texts.parallelStream().map(t -> normalize(t, lang)).collect(Collectors.toList());
	}

	/**
	 * Summarizes each text independently, in parallel.
	 */
	public List<Summary> summarizeAll(List<String> texts, final int maxSentences, final Locale lang) {
		return texts.parallelStream().map(t -> summarize(t, maxSentences, lang)).collect(Collectors.toList());
	}

	public Collection<Locale> getSupportedCorrectionLocales() {
		Set<Locale> ret = new LinkedHashSet<Locale>();
		for (Locale l : resources.keySet())
			if (isAnnotated(l)) ret.add(l);
		return ret;
	}

	public WordChefConfiguration getConfiguration() {
		return config;
	}
}
