package fi.seco.wordchef.patterns;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds dates (d/m/y or y/m/d, with slashes or dashes), money amounts in
 * euros or dollars, and e-mail addresses.
 */
public class PatternFinder {

	private final static Pattern dates = Pattern.compile("\\b(?:\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}|\\d{4}[/-]\\d{1,2}[/-]\\d{1,2})\\b", Pattern.UNICODE_CHARACTER_CLASS);
	private final static Pattern amounts = Pattern.compile("(?:(?:€\\s?)?\\b\\d{1,3}(?:[.,]\\d{3})*(?:[.,]\\d+)?\\s?(?:€|euros|USD|\\$)|\\$\\d+(?:\\.\\d+)?\\b)", Pattern.UNICODE_CHARACTER_CLASS);
	private final static Pattern emails = Pattern.compile("\\b[\\w.-]+@[\\w.-]+\\.\\w{2,4}\\b", Pattern.UNICODE_CHARACTER_CLASS);

	public PatternMatches find(String text) {
		return new PatternMatches(findDates(text), findAmounts(text), findEmails(text));
	}

	public List<String> findDates(String text) {
		return findAll(dates, text);
	}

	public List<String> findAmounts(String text) {
		return findAll(amounts, text);
	}

	public List<String> findEmails(String text) {
		return findAll(emails, text);
	}

	private static List<String> findAll(Pattern p, String text) {
		List<String> ret = new ArrayList<String>();
		Matcher m = p.matcher(text);
		while (m.find())
			ret.add(m.group());
		return ret;
	}
}
