package fi.seco.wordchef.analysis;

/**
 * Which processing path produced a result.
 */
public enum AnalysisMode {
	/** Annotated tokens: all correction rules and noun-based scoring. */
	FULL_ANNOTATION,
	/**
	 * Whitespace and period splitting only: repetition removal, stemmed
	 * baseforms and length-based scoring.
	 */
	HEURISTIC_FALLBACK
}
