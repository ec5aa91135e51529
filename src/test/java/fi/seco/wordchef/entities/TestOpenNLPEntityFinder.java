package fi.seco.wordchef.entities;

import static org.junit.Assert.*;

import java.util.Collections;
import java.util.Locale;

import org.junit.Test;

import fi.seco.wordchef.annotation.AnnotatorUnavailableException;
import fi.seco.wordchef.annotation.StaticAnnotator;
import fi.seco.wordchef.model.Document;
import fi.seco.wordchef.model.Sentence;

public class TestOpenNLPEntityFinder {

	final OpenNLPEntityFinder finder = new OpenNLPEntityFinder();

	@Test
	public void testLocalesWithoutModelsAreNotClaimed() {
		// the build ships no name finder models
		assertTrue(finder.getSupportedEntityLocales().isEmpty());
	}

	@Test(expected = AnnotatorUnavailableException.class)
	public void testFindingWithoutModelsIsUnavailable() throws AnnotatorUnavailableException {
		Document doc = new Document(Collections.singletonList(new Sentence(StaticAnnotator.plain("Ana", "vive", "en", "Madrid"), "Ana vive en Madrid", 0)));
		finder.find(doc, new Locale("es"));
	}
}
