package fi.seco.wordchef.annotation;

import java.util.Collection;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.model.Document;

/**
 * Bounds the time spent waiting on another annotator. A request that runs
 * over the limit is cancelled and reported as unavailable.
 */
public class TimeLimitedAnnotator implements IAnnotator {

	private static final Logger log = LoggerFactory.getLogger(TimeLimitedAnnotator.class);

	private static final AtomicInteger threadCount = new AtomicInteger();

	private static final ExecutorService executor = Executors.newCachedThreadPool(new ThreadFactory() {
		@Override
		public Thread newThread(Runnable r) {
			Thread t = new Thread(r, "wordchef-annotator-" + threadCount.incrementAndGet());
			t.setDaemon(true);
			return t;
		}
	});

	private final IAnnotator delegate;
	private final long timeoutMillis;

	public TimeLimitedAnnotator(IAnnotator delegate, long timeoutMillis) {
		this.delegate = delegate;
		this.timeoutMillis = timeoutMillis;
	}

	@Override
	public Document annotate(final String text, final Locale lang) throws AnnotatorUnavailableException {
		if (timeoutMillis <= 0) return delegate.annotate(text, lang);
		Future<Document> f = executor.submit(new Callable<Document>() {
			@Override
			public Document call() throws AnnotatorUnavailableException {
				return delegate.annotate(text, lang);
			}
		});
		try {
			return f.get(timeoutMillis, TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			f.cancel(true);
			log.warn("Annotation for {} did not finish in {} ms", lang, timeoutMillis);
			throw new AnnotatorUnavailableException("Annotation timed out after " + timeoutMillis + " ms", e);
		} catch (InterruptedException e) {
			f.cancel(true);
			Thread.currentThread().interrupt();
			throw new AnnotatorUnavailableException("Interrupted while waiting for annotation", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof AnnotatorUnavailableException) throw (AnnotatorUnavailableException) cause;
			if (cause instanceof RuntimeException) throw (RuntimeException) cause;
			if (cause instanceof Error) throw (Error) cause;
			throw new AnnotatorUnavailableException("Annotation failed", cause);
		}
	}

	@Override
	public Collection<Locale> getSupportedAnnotationLocales() {
		return delegate.getSupportedAnnotationLocales();
	}

}
