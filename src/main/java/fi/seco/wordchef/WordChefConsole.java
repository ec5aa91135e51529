package fi.seco.wordchef;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import fi.seco.wordchef.entities.Entities;
import fi.seco.wordchef.entities.EntityType;
import fi.seco.wordchef.keywords.Keywords;
import fi.seco.wordchef.patterns.PatternMatches;
import fi.seco.wordchef.summary.Summary;

/**
 * Interactive menu over {@link WordChefService}. Every request and its result
 * go to the {@code fi.seco.wordchef.session} logger, which the shipped
 * logging configuration writes to {@code logs/wordchef-session.log}.
 */
public class WordChefConsole {

	private static final Logger log = LoggerFactory.getLogger(WordChefConsole.class);
	private static final Logger session = LoggerFactory.getLogger("fi.seco.wordchef.session");

	private final WordChefService service;
	private final BufferedReader in;
	private final PrintStream out;

	public WordChefConsole(WordChefService service, BufferedReader in, PrintStream out) {
		this.service = service;
		this.in = in;
		this.out = out;
	}

	private void menu() {
		out.println();
		out.println("=== wordChef ===");
		out.println("1) Normalize text");
		out.println("2) Find dates, amounts and e-mail addresses");
		out.println("3) Summarize");
		out.println("4) Keywords");
		out.println("5) Named entities");
		out.println("0) Exit");
		out.print("Choose an option: ");
		out.flush();
	}

	private String prompt(String message) throws IOException {
		out.println(message);
		out.print("> ");
		out.flush();
		String line = in.readLine();
		return line == null ? "" : line;
	}

	public void run() throws IOException {
		while (true) {
			menu();
			String option = in.readLine();
			if (option == null || "0".equals(option.trim())) {
				out.println("Bye.");
				return;
			}
			try {
				switch (option.trim()) {
				case "1":
					normalize(prompt("Text to normalize:"));
					break;
				case "2":
					patterns(prompt("Text to search:"));
					break;
				case "3":
					summarize(prompt("Text to summarize:"));
					break;
				case "4":
					keywords(prompt("Text to extract keywords from:"));
					break;
				case "5":
					entities(prompt("Text to extract named entities from:"));
					break;
				default:
					out.println("Unknown option, try again.");
				}
			} catch (EmptyInputException e) {
				session.info("empty input for option {}", option.trim());
				out.println("The text is empty.");
			}
		}
	}

	private void normalize(String text) {
		NormalizationResult r = service.normalize(text);
		session.info("normalize [{}] -> [{}] ({})", text, r.getCorrected(), r.getMode());
		out.println();
		out.println("--- Results (" + r.getMode() + ") ---");
		out.println("Original:            " + r.getOriginal());
		out.println("Lemmatized:          " + r.getLemmatized());
		out.println("Without repetitions: " + r.getWithoutRepetitions());
		out.println("Corrected:           " + r.getCorrected());
		if (!r.isFullyCorrected()) out.println("(no annotator available: only repeated words were removed)");
	}

	private void patterns(String text) {
		PatternMatches m = service.findPatterns(text);
		session.info("patterns [{}] -> {}", text, m);
		out.println("Dates:   " + (m.getDates().isEmpty() ? "none" : m.getDates()));
		out.println("Amounts: " + (m.getAmounts().isEmpty() ? "none" : m.getAmounts()));
		out.println("E-mails: " + (m.getEmails().isEmpty() ? "none" : m.getEmails()));
	}

	private void summarize(String text) {
		Summary s = service.summarize(text);
		session.info("summarize [{}] -> [{}] sentences {} ({})", text, s.getText(), s.getSentenceIndices(), s.getMode());
		out.println();
		out.println("--- Summary (" + s.getMode() + ") ---");
		out.println(s.getText());
	}

	private void keywords(String text) {
		Keywords k = service.extractKeywords(text);
		session.info("keywords [{}] -> {}", text, k);
		out.println("Top words: " + k.getTopWords());
		out.println("Nouns:     " + k.getNouns());
		out.println("Verbs:     " + k.getVerbs());
	}

	private void entities(String text) {
		Entities e = service.extractEntities(text);
		session.info("entities [{}] -> {}", text, e);
		if (!e.isAvailable()) {
			out.println("Named entities need annotation and entity models for this language.");
			return;
		}
		for (EntityType type : EntityType.values())
			out.println(type + ": " + (e.get(type).isEmpty() ? "none detected" : e.get(type)));
	}

	public static void main(String[] args) throws IOException {
		WordChefService service = new WordChefService();
		log.info("Starting wordChef console for {}", service.getConfiguration().getLocale());
		new WordChefConsole(service, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out).run();
	}
}
