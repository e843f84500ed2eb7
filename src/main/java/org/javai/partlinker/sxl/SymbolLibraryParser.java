package org.javai.partlinker.sxl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts {@code (symbol "NAME" ...)} blocks from library text.
 *
 * <p>This is a depth-counting scanner, not a parser for the whole format. From each
 * block-opening token it walks forward counting parentheses, ignoring those inside
 * double-quoted strings. A quote preceded by a backslash does not open or close a
 * string. The block ends where the depth returns to zero and is kept byte for byte.</p>
 *
 * <p>Scanning resumes after the end of each extracted block, so unit sub-symbols
 * nested inside a symbol are not reported on their own. Units of a symbol that could
 * not be closed are skipped as well.</p>
 */
public class SymbolLibraryParser {

	private static final Logger logger = LoggerFactory.getLogger(SymbolLibraryParser.class);

	private static final Pattern BLOCK_START = Pattern.compile("\\(\\s*symbol\\s+\"(.*?)\"");
	private static final Pattern UNIT_NAME = Pattern.compile("(.+)_\\d+_\\d+");

	/**
	 * Scans library text for symbol blocks.
	 *
	 * @param text library content; {@code null} is treated as empty
	 * @return the extracted blocks and the names of blocks that could not be closed
	 */
	public ParsedLibrary parse(String text) {
		if (text == null || text.isEmpty()) {
			return ParsedLibrary.empty();
		}
		Map<String, String> symbols = new LinkedHashMap<>();
		List<String> unparsable = new ArrayList<>();

		Matcher matcher = BLOCK_START.matcher(text);
		int from = 0;
		while (from < text.length() && matcher.find(from)) {
			String name = matcher.group(1);
			int start = matcher.start();
			if (isUnitOf(name, unparsable)) {
				logger.debug("Skipping unit '{}' of an unclosed symbol", name);
				from = matcher.end();
				continue;
			}
			int end = findClosingParen(text, start);
			if (end < 0) {
				logger.warn("Could not find the end of symbol '{}' starting at offset {}. Skipping.", name, start);
				unparsable.add(name);
				from = matcher.end();
				continue;
			}
			if (symbols.put(name, text.substring(start, end + 1)) != null) {
				logger.debug("Symbol '{}' appears more than once; keeping the later block", name);
			}
			from = end + 1;
		}
		return new ParsedLibrary(symbols, unparsable);
	}

	private static boolean isUnitOf(String name, List<String> unclosed) {
		if (unclosed.isEmpty()) {
			return false;
		}
		Matcher unit = UNIT_NAME.matcher(name);
		return unit.matches() && unclosed.contains(unit.group(1));
	}

	/**
	 * Returns the index of the parenthesis closing the one at {@code start}, or -1.
	 */
	public static int findClosingParen(String text, int start) {
		int depth = 0;
		boolean inString = false;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '"') {
				if (!isEscaped(text, i, start)) {
					inString = !inString;
				}
			} else if (!inString) {
				if (c == '(') {
					depth++;
				} else if (c == ')') {
					depth--;
					if (depth == 0) {
						return i;
					}
				}
			}
		}
		return -1;
	}

	/**
	 * Returns the index of the quote closing the string opened at {@code openQuote},
	 * skipping escaped quotes, or -1.
	 */
	public static int findClosingQuote(String text, int openQuote) {
		for (int i = openQuote + 1; i < text.length(); i++) {
			if (text.charAt(i) == '"' && !isEscaped(text, i, openQuote + 1)) {
				return i;
			}
		}
		return -1;
	}

	private static boolean isEscaped(String text, int index, int start) {
		return index > start && text.charAt(index - 1) == '\\';
	}
}
