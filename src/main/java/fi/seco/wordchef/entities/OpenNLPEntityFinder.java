package fi.seco.wordchef.entities;

import java.io.BufferedReader;
import java.io.IOError;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.Sentence;
import fi.seco.wordchef.model.Token;
import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.util.Span;

/**
 * Finds named entities with OpenNLP name finder models found on the classpath
 * next to this class, one {@code <lang>-ner-<type>.bin} per
 * {@link EntityType}. Candidate languages are listed in
 * {@code entity-locales}; a language is claimed if at least one of its models
 * is present, and only the types with a model are reported.
 */
public class OpenNLPEntityFinder implements IEntityFinder {

	private static final Logger log = LoggerFactory.getLogger(OpenNLPEntityFinder.class);

	private final Map<Locale, Set<EntityType>> supported = new HashMap<Locale, Set<EntityType>>();
	private final Map<Locale, Map<EntityType, TokenNameFinderModel>> models = new HashMap<Locale, Map<EntityType, TokenNameFinderModel>>();

	public OpenNLPEntityFinder() {
		InputStream in = OpenNLPEntityFinder.class.getResourceAsStream("entity-locales");
		if (in == null) {
			log.error("Couldn't read locale information. Claiming to support no entity languages");
			return;
		}
		try {
			BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			try {
				String line;
				while ((line = r.readLine()) != null) {
					line = line.trim();
					if (line.isEmpty() || line.startsWith("#")) continue;
					Set<EntityType> types = EnumSet.noneOf(EntityType.class);
					for (EntityType t : EntityType.values())
						if (OpenNLPEntityFinder.class.getResource(modelResource(line, t)) != null) types.add(t);
					if (types.isEmpty()) log.info("No OpenNLP name finder models for {} on classpath, not recognizing entities in it", line);
					else supported.put(new Locale(line), types);
				}
			} finally {
				r.close();
			}
		} catch (IOException e) {
			log.error("Couldn't read locale information. Claiming to support no entity languages", e);
		}
	}

	private static String modelResource(String lang, EntityType type) {
		return lang + "-ner-" + type.getModelName() + ".bin";
	}

	private synchronized TokenNameFinderModel getModel(Locale lang, EntityType type) {
		Map<EntityType, TokenNameFinderModel> m = models.get(lang);
		if (m == null) {
			m = new EnumMap<EntityType, TokenNameFinderModel>(EntityType.class);
			models.put(lang, m);
		}
		TokenNameFinderModel model = m.get(type);
		if (model != null) return model;
		InputStream modelIn = OpenNLPEntityFinder.class.getResourceAsStream(modelResource(lang.toString(), type));
		try {
			model = new TokenNameFinderModel(modelIn);
			m.put(type, model);
			return model;
		} catch (IOException e) {
			throw new IOError(e);
		} finally {
			try {
				modelIn.close();
			} catch (IOException e) {
				log.debug("Couldn't close model stream", e);
			}
		}
	}

	@Override
	public Entities find(Document doc, Locale lang) throws AnnotatorUnavailableException {
		Set<EntityType> types = supported.get(lang);
		if (types == null) throw new AnnotatorUnavailableException("No entity models available for locale " + lang);
		Map<EntityType, Set<String>> ret = new EnumMap<EntityType, Set<String>>(EntityType.class);
		for (EntityType type : types) {
			NameFinderME finder = new NameFinderME(getModel(lang, type));
			Set<String> found = new LinkedHashSet<String>();
			for (Sentence s : doc.getSentences()) {
				List<Token> tokens = s.getTokens();
				String[] words = new String[tokens.size()];
				for (int i = 0; i < words.length; i++)
					words[i] = tokens.get(i).getText();
				for (String mention : Span.spansToStrings(finder.find(words), words))
					found.add(mention);
			}
			finder.clearAdaptiveData();
			ret.put(type, found);
		}
		return new Entities(ret);
	}

	@Override
	public Collection<Locale> getSupportedEntityLocales() {
		return supported.keySet();
	}

}
