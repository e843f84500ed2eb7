package org.javai.partlinker.geometry;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a pin-header style connector as a single unit.
 *
 * <p>Single-row connectors put all pins on the left of a narrow body; multi-row
 * connectors use two columns of {@code pinsPerRow} pins. Pin names are the pin
 * numbers and are hidden. Each pin gets a gender overlay drawn inside the body,
 * mirrored between the two sides.</p>
 */
public class ConnectorLayout {

	public static final double SINGLE_ROW_WIDTH = 3.81;
	public static final double MULTI_ROW_WIDTH = 7.62;

	static final int MIN_GRIDS = 2;

	static final double CONTACT_LENGTH = 2.54;
	static final double SOCKET_DEPTH = 1.905;
	static final double SOCKET_RADIUS = 0.635;

	public SymbolLayout layout(ConnectorSpec spec) {
		int leftCount = spec.pinsPerRow();
		int rightCount = spec.isSingleRow() ? 0 : spec.pinsPerRow();

		double width = spec.isSingleRow() ? SINGLE_ROW_WIDTH : MULTI_ROW_WIDTH;
		BoxGeometry box = BoxGeometry.of(width, SchematicGrid.boxHeight(Math.max(leftCount, rightCount), MIN_GRIDS));

		List<UnitElement> elements = new ArrayList<>();
		if (spec.numbering() == NumberingStyle.LINE) {
			int number = 1;
			for (int i = 0; i < spec.pinsPerRow(); i++) {
				addPin(elements, box, spec.gender(), true, number++, rowY(leftCount, i));
				if (rightCount > 0) {
					addPin(elements, box, spec.gender(), false, number++, rowY(rightCount, i));
				}
			}
		} else {
			int number = 1;
			for (int i = 0; i < leftCount; i++) {
				addPin(elements, box, spec.gender(), true, number++, rowY(leftCount, i));
			}
			for (int i = 0; i < rightCount; i++) {
				addPin(elements, box, spec.gender(), false, number++, rowY(rightCount, i));
			}
		}
		return new SymbolLayout(List.of(new UnitLayout(1, box, elements)));
	}

	private static double rowY(int sideCount, int row) {
		return SchematicGrid.firstPinY(sideCount) - row * SchematicGrid.SPACING;
	}

	private static void addPin(List<UnitElement> elements, BoxGeometry box, ConnectorGender gender,
			boolean leftSide, int number, double y) {
		PinSpec pin = new PinSpec(number, Integer.toString(number), PinRole.PASSIVE);
		if (leftSide) {
			elements.add(new UnitElement.PlacedPin(pin, box.left() - SchematicGrid.PIN_LENGTH, y, 0, true));
		} else {
			elements.add(new UnitElement.PlacedPin(pin, box.right() + SchematicGrid.PIN_LENGTH, y, 180, true));
		}
		addGenderOverlay(elements, gender, leftSide ? box.left() : box.right(), leftSide ? 1 : -1, y);
	}

	/**
	 * Male: a straight contact from the body edge inwards. Female: a shorter
	 * contact ending in a socket arc that opens towards the body center.
	 *
	 * @param direction +1 on the left edge (drawing inwards to the right), -1 on the right edge
	 */
	static void addGenderOverlay(List<UnitElement> elements, ConnectorGender gender, double edge,
			int direction, double y) {
		switch (gender) {
			case MALE -> elements.add(new UnitElement.Polyline(edge, y, edge + direction * CONTACT_LENGTH, y));
			case FEMALE -> {
				double mid = edge + direction * SOCKET_DEPTH;
				double base = edge + direction * CONTACT_LENGTH;
				elements.add(new UnitElement.Polyline(edge, y, mid, y));
				elements.add(new UnitElement.Arc(
						base, y + direction * SOCKET_RADIUS,
						mid, y,
						base, y - direction * SOCKET_RADIUS));
			}
			case NONE -> {
				// no overlay
			}
		}
	}
}
