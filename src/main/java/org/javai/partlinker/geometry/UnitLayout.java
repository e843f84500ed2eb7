package org.javai.partlinker.geometry;

import java.util.List;

/**
 * One separately placeable sub-drawing of a symbol.
 *
 * @param unitNumber 1-based unit number
 * @param box body rectangle
 * @param elements pins and overlay graphics in emission order
 */
public record UnitLayout(int unitNumber, BoxGeometry box, List<UnitElement> elements) {

	public UnitLayout {
		elements = List.copyOf(elements);
	}

	public List<UnitElement.PlacedPin> pins() {
		return elements.stream()
				.filter(UnitElement.PlacedPin.class::isInstance)
				.map(UnitElement.PlacedPin.class::cast)
				.toList();
	}

	public List<UnitElement.PlacedPin> pinsAt(int orientation) {
		return pins().stream().filter(pin -> pin.orientation() == orientation).toList();
	}
}
