package org.javai.partlinker.sxl;

import java.util.regex.Pattern;

/**
 * Whitespace-insensitive comparison of symbol blocks.
 *
 * <p>Only used to classify changes. Files are always written with the renderer's
 * original formatting.</p>
 */
public final class SymbolText {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private SymbolText() {
	}

	public static String normalize(String text) {
		if (text == null) {
			return "";
		}
		return WHITESPACE.matcher(text).replaceAll(" ").trim();
	}

	public static boolean equivalent(String a, String b) {
		return normalize(a).equals(normalize(b));
	}
}
