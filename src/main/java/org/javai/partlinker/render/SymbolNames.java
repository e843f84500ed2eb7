package org.javai.partlinker.render;

import org.javai.partlinker.part.PartRecord;

public final class SymbolNames {

	private SymbolNames() {
	}

	/**
	 * The library key of a part: its name with spaces replaced by underscores.
	 */
	public static String of(PartRecord part) {
		return part.name().replace(' ', '_');
	}
}
