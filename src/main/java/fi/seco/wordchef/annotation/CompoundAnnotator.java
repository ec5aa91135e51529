package fi.seco.wordchef.annotation;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import fi.seco.wordchef.model.Document;

/**
 * Routes each locale to the first given annotator that supports it.
 */
public class CompoundAnnotator implements IAnnotator {

	private final Map<Locale, IAnnotator> as = new LinkedHashMap<Locale, IAnnotator>();

	public CompoundAnnotator(IAnnotator... annotators) {
		for (IAnnotator a : annotators)
			for (Locale l : a.getSupportedAnnotationLocales())
				if (!as.containsKey(l)) as.put(l, a);
	}

	@Override
	public Document annotate(String text, Locale lang) throws AnnotatorUnavailableException {
		IAnnotator a = getAnnotator(lang);
		if (a == null) throw AnnotatorUnavailableException.unsupported(lang);
		return a.annotate(text, as.containsKey(lang) ? lang : new Locale(lang.getLanguage()));
	}

	private IAnnotator getAnnotator(Locale lang) {
		if (lang == null) return null;
		if (as.containsKey(lang)) return as.get(lang);
		if (!"".equals(lang.getCountry())) return as.get(new Locale(lang.getLanguage()));
		return null;
	}

	@Override
	public Collection<Locale> getSupportedAnnotationLocales() {
		return as.keySet();
	}

}
