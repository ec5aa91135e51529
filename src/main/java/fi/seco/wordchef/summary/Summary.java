package fi.seco.wordchef.summary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import fi.seco.wordchef.analysis.AnalysisMode;

public final class Summary {

	private final String text;
	private final List<Integer> sentenceIndices;
	private final boolean complete;
	private final AnalysisMode mode;

	public Summary(String text, List<Integer> sentenceIndices, boolean complete, AnalysisMode mode) {
		this.text = text;
		this.sentenceIndices = Collections.unmodifiableList(new ArrayList<Integer>(sentenceIndices));
		this.complete = complete;
		this.mode = mode;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return indices of the sentences in the summary, ascending
	 */
	public List<Integer> getSentenceIndices() {
		return sentenceIndices;
	}

	/**
	 * @return true if the text had no more sentences than requested and was
	 *         returned unchanged
	 */
	public boolean isComplete() {
		return complete;
	}

	public AnalysisMode getMode() {
		return mode;
	}

	@Override
	public String toString() {
		return text;
	}
}
