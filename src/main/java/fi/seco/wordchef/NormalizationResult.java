package fi.seco.wordchef;

import fi.seco.wordchef.analysis.AnalysisMode;

public final class NormalizationResult {

	private final String original;
	private final String lemmatized;
	private final String withoutRepetitions;
	private final String corrected;
	private final AnalysisMode mode;

	public NormalizationResult(String original, String lemmatized, String withoutRepetitions, String corrected, AnalysisMode mode) {
		this.original = original;
		this.lemmatized = lemmatized;
		this.withoutRepetitions = withoutRepetitions;
		this.corrected = corrected;
		this.mode = mode;
	}

	public String getOriginal() {
		return original;
	}

	/**
	 * @return token lemmas, or Snowball stems in
	 *         {@link AnalysisMode#HEURISTIC_FALLBACK}
	 */
	public String getLemmatized() {
		return lemmatized;
	}

	public String getWithoutRepetitions() {
		return withoutRepetitions;
	}

	/**
	 * @return the corrected text; in {@link AnalysisMode#HEURISTIC_FALLBACK}
	 *         only repetitions have been removed
	 */
	public String getCorrected() {
		return corrected;
	}

	public AnalysisMode getMode() {
		return mode;
	}

	public boolean isFullyCorrected() {
		return mode == AnalysisMode.FULL_ANNOTATION;
	}

	@Override
	public String toString() {
		return corrected + " (" + mode + ")";
	}
}
