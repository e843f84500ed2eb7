package org.javai.partlinker.render;

import java.util.Objects;

/**
 * A fully rendered symbol.
 *
 * @param name symbol name, unique within a library file
 * @param text the complete {@code (symbol ...)} block, without trailing newline
 */
public record SymbolBlock(String name, String text) {

	public SymbolBlock {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}
}
