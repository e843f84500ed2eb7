package org.javai.partlinker.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.partlinker.sxl.SymbolLibraryParser;
import org.javai.partlinker.template.SymbolTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a hand-drawn symbol from an existing library into the pieces of a static
 * template: symbol options, property templates and graphics.
 */
public class SymbolTemplateExtractor {

	private static final Logger logger = LoggerFactory.getLogger(SymbolTemplateExtractor.class);

	private static final List<String> OPTION_NAMES = List.of("pin_numbers", "pin_names", "exclude_from_sim");
	private static final Pattern GRAPHIC_START = Pattern.compile("\\(\\s*(pin|symbol)\\s+");
	private static final Pattern PROPERTY_START = Pattern.compile("\\(\\s*property\\s+\"(.*?)\"");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	/**
	 * @param libraryText content of a library file
	 * @param symbolName exact, case-sensitive symbol name
	 * @return the extracted pieces, or empty when the symbol is missing or cannot be closed
	 */
	public Optional<ExtractedTemplate> extract(String libraryText, String symbolName) {
		Matcher start = Pattern.compile("\\(\\s*symbol\\s+\"" + Pattern.quote(symbolName) + "\"")
				.matcher(libraryText);
		if (!start.find()) {
			logger.warn("Symbol '{}' not found", symbolName);
			return Optional.empty();
		}
		int end = SymbolLibraryParser.findClosingParen(libraryText, start.start());
		if (end < 0) {
			logger.warn("Could not find the end of symbol '{}'", symbolName);
			return Optional.empty();
		}
		String block = libraryText.substring(start.start(), end + 1);
		return Optional.of(new ExtractedTemplate(
				symbolName,
				options(block),
				propertyTemplates(block),
				graphics(block, symbolName)));
	}

	private String options(String block) {
		List<String> options = new ArrayList<>();
		for (String option : OPTION_NAMES) {
			Matcher matcher = Pattern.compile("\\(\\s*" + option + "\\s+").matcher(block);
			if (matcher.find()) {
				innerBlock(block, matcher.start()).map(this::collapse).ifPresent(options::add);
			}
		}
		return String.join(" ", options);
	}

	private Map<String, String> propertyTemplates(String block) {
		Map<String, String> templates = new LinkedHashMap<>();
		Matcher matcher = PROPERTY_START.matcher(block);
		while (matcher.find()) {
			Optional<String> property = innerBlock(block, matcher.start());
			if (property.isEmpty()) {
				continue;
			}
			String text = property.get();
			int nameEnd = matcher.end(1) - matcher.start() + 1;
			int valueStart = text.indexOf('"', nameEnd);
			int valueEnd = valueStart < 0 ? -1 : SymbolLibraryParser.findClosingQuote(text, valueStart);
			if (valueEnd < 0) {
				continue;
			}
			String template = text.substring(0, valueStart + 1) + SymbolTemplate.VALUE_PLACEHOLDER
					+ text.substring(valueEnd);
			templates.put(matcher.group(1), collapse(template));
		}
		return templates;
	}

	/**
	 * Pins and unit sub-symbols. Scanning skips past each kept block, so pins inside
	 * a unit are not listed a second time.
	 */
	private List<String> graphics(String block, String symbolName) {
		List<String> graphics = new ArrayList<>();
		String unitPrefix = "\"" + symbolName + "_";
		Matcher matcher = GRAPHIC_START.matcher(block);
		int from = 0;
		while (from < block.length() && matcher.find(from)) {
			from = matcher.end();
			Optional<String> inner = innerBlock(block, matcher.start());
			if (inner.isEmpty()) {
				continue;
			}
			String text = inner.get();
			String firstLine = text.lines().findFirst().orElse("");
			if ("pin".equals(matcher.group(1)) || firstLine.contains(unitPrefix)) {
				graphics.add(reindent(text, column(block, matcher.start())));
				from = matcher.start() + text.length();
			}
		}
		return graphics;
	}

	private Optional<String> innerBlock(String text, int start) {
		int end = SymbolLibraryParser.findClosingParen(text, start);
		return end < 0 ? Optional.empty() : Optional.of(text.substring(start, end + 1));
	}

	private static int column(String text, int index) {
		return index - (text.lastIndexOf('\n', index - 1) + 1);
	}

	/**
	 * Shifts the following lines left by the column the block opened at, so nesting
	 * is kept relative to the first line.
	 */
	private String reindent(String text, int column) {
		List<String> lines = text.lines().toList();
		StringBuilder result = new StringBuilder(lines.get(0));
		for (int i = 1; i < lines.size(); i++) {
			String line = lines.get(i);
			int cut = 0;
			while (cut < column && cut < line.length() && Character.isWhitespace(line.charAt(cut))) {
				cut++;
			}
			result.append('\n').append(line.substring(cut).stripTrailing());
		}
		return result.toString();
	}

	private String collapse(String text) {
		return WHITESPACE.matcher(text.strip()).replaceAll(" ");
	}
}
