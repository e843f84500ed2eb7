package org.javai.partlinker.render;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Lexical helpers for the symbol library format.
 */
public final class SymbolSyntax {

	private SymbolSyntax() {
	}

	/**
	 * Formats a coordinate with exactly two decimals. Rounds the exact binary value
	 * half-even, so the output does not depend on the default locale or on how the
	 * double would print in decimal.
	 */
	public static String coord(double value) {
		BigDecimal rounded = new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN);
		if (rounded.signum() == 0) {
			return "0.00";
		}
		return rounded.toPlainString();
	}

	/**
	 * Escapes backslashes and double quotes for use inside a quoted string.
	 */
	public static String escape(String value) {
		if (value == null) {
			return "";
		}
		return value.replace("\\", "\\\\").replace("\"", "\\\"");
	}

	public static String quote(String value) {
		return '"' + escape(value) + '"';
	}

	/**
	 * Collapses whitespace runs to single spaces, as configured property
	 * templates may span several lines.
	 */
	public static String collapse(String text) {
		return text.trim().replaceAll("\\s+", " ");
	}
}
