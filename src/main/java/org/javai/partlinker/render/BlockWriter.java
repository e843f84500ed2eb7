package org.javai.partlinker.render;

/**
 * Accumulates the lines of a symbol block with two-space indentation.
 */
class BlockWriter {

	private static final String INDENT = "  ";

	private final StringBuilder output = new StringBuilder();

	BlockWriter line(int depth, String text) {
		if (!output.isEmpty()) {
			output.append('\n');
		}
		output.append(INDENT.repeat(depth)).append(text);
		return this;
	}

	/**
	 * Appends every non-blank line of {@code text}, each prefixed by the indentation
	 * for {@code depth} on top of its own leading whitespace.
	 */
	BlockWriter verbatim(int depth, String text) {
		for (String line : text.split("\\R")) {
			if (!line.isBlank()) {
				line(depth, line.stripTrailing());
			}
		}
		return this;
	}

	@Override
	public String toString() {
		return output.toString();
	}
}
