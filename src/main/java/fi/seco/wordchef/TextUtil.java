package fi.seco.wordchef;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class TextUtil {

	private final static Pattern ws = Pattern.compile("\\s+");
	private final static Pattern sp = Pattern.compile("[\\p{C}\\p{P}\\p{Z}\\p{S}]+");

	public static boolean isBlank(String str) {
		return str == null || str.trim().isEmpty();
	}

	/**
	 * Splits on runs of whitespace, dropping the empty leading fragment.
	 */
	public static List<String> words(String str) {
		List<String> ret = new ArrayList<String>();
		for (String w : ws.split(str.trim()))
			if (!w.isEmpty()) ret.add(w);
		return ret;
	}

	/**
	 * Splits on runs of punctuation, symbols, separators and control
	 * characters, leaving only letter/number runs.
	 */
	public static List<String> dataWords(String str) {
		List<String> ret = new ArrayList<String>();
		for (String w : sp.split(str))
			if (!w.isEmpty()) ret.add(w);
		return ret;
	}

	/**
	 * Splits on the period character, trimming fragments and discarding empty
	 * ones.
	 */
	public static List<String> periodFragments(String str) {
		List<String> ret = new ArrayList<String>();
		for (String f : str.split("\\.")) {
			f = f.trim();
			if (!f.isEmpty()) ret.add(f);
		}
		return ret;
	}
}
