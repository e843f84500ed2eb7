package org.javai.partlinker.geometry;

import java.util.List;

/**
 * Output of a layout engine: the units of a symbol, first unit first.
 */
public record SymbolLayout(List<UnitLayout> units) {

	public SymbolLayout {
		if (units == null || units.isEmpty()) {
			throw new IllegalArgumentException("A symbol layout needs at least one unit");
		}
		units = List.copyOf(units);
	}

	/**
	 * Geometry of unit 1, used to place the computed properties.
	 */
	public BoxGeometry primaryBox() {
		return units.get(0).box();
	}
}
