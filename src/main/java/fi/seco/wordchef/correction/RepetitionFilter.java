package fi.seco.wordchef.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import fi.seco.wordchef.TextUtil;

/**
 * Drops words that repeat the word right before them, ignoring case.
 */
public class RepetitionFilter {

	private final Locale lang;

	public RepetitionFilter(Locale lang) {
		this.lang = lang;
	}

	public String filter(String text) {
		return join(filter(TextUtil.words(text)));
	}

	public List<String> filter(List<String> words) {
		List<String> ret = new ArrayList<String>(words.size());
		String previous = null;
		for (String w : words) {
			String lower = w.toLowerCase(lang);
			if (!lower.equals(previous)) ret.add(w);
			previous = lower;
		}
		return ret;
	}

	static String join(List<String> words) {
		StringBuilder sb = new StringBuilder();
		for (String w : words) {
			if (sb.length() > 0) sb.append(' ');
			sb.append(w);
		}
		return sb.toString();
	}
}
