package org.javai.partlinker.template;

/**
 * How the graphics of a symbol are produced.
 */
public enum GeneratorKind {

	/** No graphics configured; the symbol carries a visible diagnostic text. */
	NONE,

	/** Graphics and pins copied from the template's {@code symbol_template}. */
	STATIC,

	/** Rectangular IC body with pins from the {@code Pin Description} parameter. */
	IC_BOX,

	/** Pin-header style connector driven by row and pin-count parameters. */
	CONNECTOR;

	/**
	 * Derives the kind from the {@code symbol_generator} value and whether a
	 * static {@code symbol_template} is present.
	 *
	 * @throws TemplateConfigException for an unknown generator name
	 */
	public static GeneratorKind fromConfig(String generator, boolean hasStaticTemplate) {
		if (generator != null && !generator.isBlank()) {
			return switch (generator.trim()) {
				case "IC_Box" -> IC_BOX;
				case "Connector" -> CONNECTOR;
				default -> throw new TemplateConfigException(
						"Unknown symbol_generator '" + generator + "'. Expected 'IC_Box' or 'Connector'.");
			};
		}
		return hasStaticTemplate ? STATIC : NONE;
	}
}
