package org.javai.partlinker.template;

/**
 * Source of a mapped property value: a literal constant or a path into the part.
 */
public sealed interface FieldSource {

	/**
	 * Interprets a configured mapping value. Values wrapped in single quotes
	 * ({@code 'R?'}) are literals; everything else is a lookup path.
	 */
	static FieldSource parse(String raw) {
		String value = raw != null ? raw : "";
		if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
			return new Literal(value.substring(1, value.length() - 1));
		}
		return new Path(value);
	}

	record Literal(String value) implements FieldSource {
	}

	record Path(String path) implements FieldSource {
	}
}
