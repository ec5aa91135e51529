package fi.seco.wordchef.patterns;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class PatternMatches {

	private final List<String> dates;
	private final List<String> amounts;
	private final List<String> emails;

	public PatternMatches(List<String> dates, List<String> amounts, List<String> emails) {
		this.dates = Collections.unmodifiableList(new ArrayList<String>(dates));
		this.amounts = Collections.unmodifiableList(new ArrayList<String>(amounts));
		this.emails = Collections.unmodifiableList(new ArrayList<String>(emails));
	}

	public List<String> getDates() {
		return dates;
	}

	public List<String> getAmounts() {
		return amounts;
	}

	public List<String> getEmails() {
		return emails;
	}

	@Override
	public String toString() {
		return "dates=" + dates + ", amounts=" + amounts + ", emails=" + emails;
	}
}
