package org.javai.partlinker.sxl;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Symbol blocks extracted from a library file.
 *
 * @param symbols symbol name to verbatim block text, in file order
 * @param unparsable names of symbols whose closing parenthesis could not be found
 */
public record ParsedLibrary(Map<String, String> symbols, List<String> unparsable) {

	private static final ParsedLibrary EMPTY = new ParsedLibrary(Map.of(), List.of());

	public ParsedLibrary {
		symbols = Collections.unmodifiableMap(new LinkedHashMap<>(symbols));
		unparsable = List.copyOf(unparsable);
	}

	public static ParsedLibrary empty() {
		return EMPTY;
	}

	public Optional<String> block(String symbolName) {
		return Optional.ofNullable(symbols.get(symbolName));
	}

	public boolean contains(String symbolName) {
		return symbols.containsKey(symbolName);
	}
}
