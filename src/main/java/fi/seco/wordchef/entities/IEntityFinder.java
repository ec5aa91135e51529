package fi.seco.wordchef.entities;

import java.util.Collection;
import java.util.Locale;

import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.model.Document;

public interface IEntityFinder {

	/**
	 * @param doc an annotated document; entities are found over its tokens
	 * @throws AnnotatorUnavailableException if {@code lang} has no entity
	 *             models
	 */
	public Entities find(Document doc, Locale lang) throws AnnotatorUnavailableException;

	public Collection<Locale> getSupportedEntityLocales();

}
