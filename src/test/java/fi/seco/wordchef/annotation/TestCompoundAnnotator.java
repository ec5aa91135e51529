package fi.seco.wordchef.annotation;

import static org.junit.Assert.*;

import java.util.Locale;

import org.junit.Test;

import fi.seco.wordchef.model.Document;

public class TestCompoundAnnotator {

	@Test
	public void testFirstAnnotatorForALocaleWins() throws AnnotatorUnavailableException {
		StaticAnnotator first = new StaticAnnotator(new Locale("es"));
		StaticAnnotator second = new StaticAnnotator(new Locale("es"), new Locale("pt"));
		CompoundAnnotator c = new CompoundAnnotator(first, second);
		c.annotate("Hola.", new Locale("es"));
		c.annotate("Olá.", new Locale("pt"));
		assertEquals(1, first.getCalls());
		assertEquals(1, second.getCalls());
		assertTrue(c.getSupportedAnnotationLocales().contains(new Locale("pt")));
	}

	@Test
	public void testCountryFallsBackToLanguage() throws AnnotatorUnavailableException {
		CompoundAnnotator c = new CompoundAnnotator(new StaticAnnotator(new Locale("es")));
		Document doc = c.annotate("Hola mundo.", new Locale("es", "MX"));
		assertEquals(1, doc.size());
	}

	@Test(expected = AnnotatorUnavailableException.class)
	public void testUnsupportedLocaleIsUnavailable() throws AnnotatorUnavailableException {
		new CompoundAnnotator(new StaticAnnotator(new Locale("es"))).annotate("Hello.", new Locale("en"));
	}
}
