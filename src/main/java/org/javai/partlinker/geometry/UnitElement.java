package org.javai.partlinker.geometry;

/**
 * Drawable content of a unit, in emission order.
 */
public sealed interface UnitElement {

	/**
	 * A pin anchored at its outer end.
	 *
	 * @param orientation 0 for pins on the left pointing right, 180 for the right side
	 * @param nameHidden whether the pin name is hidden (connector pins are named by number)
	 */
	record PlacedPin(PinSpec pin, double x, double y, int orientation, boolean nameHidden)
			implements UnitElement {
	}

	record Polyline(double startX, double startY, double endX, double endY) implements UnitElement {
	}

	record Arc(double startX, double startY, double midX, double midY, double endX, double endY)
			implements UnitElement {
	}
}
