package fi.seco.wordchef.lexicon;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The read-only tables for one language, loaded from classpath resources next
 * to this class:
 * <ul>
 * <li>{@code <lang>-corrections.txt}: {@code misspelling<TAB>replacement}</li>
 * <li>{@code <lang>-gendered-nouns.txt}: {@code lemma<TAB>article noun}</li>
 * <li>{@code <lang>-stopwords.txt}: one word per line</li>
 * </ul>
 * Lines starting with {@code #} are ignored. A missing file yields an empty
 * table.
 */
public final class LexicalResources {

	private static final Logger log = LoggerFactory.getLogger(LexicalResources.class);

	private final Locale lang;
	private final CorrectionTable corrections;
	private final GenderedNounTable genderedNouns;
	private final StopwordSet stopwords;

	public LexicalResources(Locale lang, CorrectionTable corrections, GenderedNounTable genderedNouns, StopwordSet stopwords) {
		this.lang = lang;
		this.corrections = corrections;
		this.genderedNouns = genderedNouns;
		this.stopwords = stopwords;
	}

	public static LexicalResources load(Locale lang) {
		String l = lang.getLanguage();
		List<String> lines = readLines(l + "-corrections.txt");
		if (lines == null) {
			log.error("Couldn't read correction table for {}. Claiming to know no corrections", lang);
			lines = new ArrayList<String>();
		}
		CorrectionTable ct = new CorrectionTable(toMap(lines, l + "-corrections.txt"), lang);
		lines = readLines(l + "-gendered-nouns.txt");
		if (lines == null) {
			log.error("Couldn't read gendered noun table for {}. Neuter articles will always become the default article", lang);
			lines = new ArrayList<String>();
		}
		GenderedNounTable gt = new GenderedNounTable(toMap(lines, l + "-gendered-nouns.txt"), lang);
		lines = readLines(l + "-stopwords.txt");
		if (lines == null) {
			log.warn("Couldn't read stopwords for {}. Keyword frequencies will include function words", lang);
			lines = new ArrayList<String>();
		}
		StopwordSet st = new StopwordSet(lines, lang);
		log.debug("Loaded {} corrections, {} gendered nouns and {} stopwords for {}", ct.size(), gt.size(), st.size(), lang);
		return new LexicalResources(lang, ct, gt, st);
	}

	private static Map<String, String> toMap(List<String> lines, String file) {
		Map<String, String> ret = new LinkedHashMap<String, String>();
		for (String line : lines) {
			String[] parts = line.split("\t", 2);
			if (parts.length != 2 || parts[0].trim().isEmpty() || parts[1].trim().isEmpty()) {
				log.warn("Skipping malformed line in {}: {}", file, line);
				continue;
			}
			ret.put(parts[0].trim(), parts[1].trim());
		}
		return ret;
	}

	private static List<String> readLines(String file) {
		InputStream in = LexicalResources.class.getResourceAsStream(file);
		if (in == null) return null;
		List<String> ret = new ArrayList<String>();
		try {
			BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
			try {
				String line;
				while ((line = r.readLine()) != null) {
					if (line.trim().isEmpty() || line.startsWith("#")) continue;
					ret.add(line.trim());
				}
			} finally {
				r.close();
			}
		} catch (IOException e) {
			log.error("Couldn't read " + file, e);
			return null;
		}
		return ret;
	}

	public Locale getLocale() {
		return lang;
	}

	public CorrectionTable getCorrections() {
		return corrections;
	}

	public GenderedNounTable getGenderedNouns() {
		return genderedNouns;
	}

	public StopwordSet getStopwords() {
		return stopwords;
	}
}
