package org.javai.partlinker.geometry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lays out a rectangular IC body from a comma-separated pin list.
 *
 * <p>Pins whose names match the power-pin set (case-insensitive) go into a second
 * unit when the part also has other pins; otherwise everything stays in unit 1.
 * Each unit puts the first half of its pins (rounded up) on the left, top to bottom,
 * and the rest on the right.</p>
 */
public class IcBoxLayout {

	public static final double BOX_WIDTH = 15.24;

	static final int MAIN_UNIT_MIN_GRIDS = 3;
	static final int POWER_UNIT_MIN_GRIDS = 2;

	public SymbolLayout layout(String pinCsv, Collection<String> powerPinNames) {
		PinPartition partition = partition(parsePins(pinCsv, powerPinNames));

		List<UnitLayout> units = new ArrayList<>();
		if (partition.hasPowerUnit()) {
			units.add(buildUnit(1, partition.main(), MAIN_UNIT_MIN_GRIDS));
			units.add(buildUnit(2, partition.power(), POWER_UNIT_MIN_GRIDS));
		} else {
			List<PinSpec> all = new ArrayList<>(partition.main());
			all.addAll(partition.power());
			units.add(buildUnit(1, all, MAIN_UNIT_MIN_GRIDS));
		}
		return new SymbolLayout(units);
	}

	/**
	 * Parses {@code "IN+,IN-,VCC"} into numbered pins; blank entries are dropped
	 * and do not consume a number.
	 */
	public static List<PinSpec> parsePins(String pinCsv, Collection<String> powerPinNames) {
		Set<String> powerUpper = powerPinNames == null ? Set.of() : powerPinNames.stream()
				.map(name -> name.toUpperCase(Locale.ROOT))
				.collect(Collectors.toSet());
		List<PinSpec> pins = new ArrayList<>();
		if (pinCsv == null) {
			return pins;
		}
		int index = 1;
		for (String raw : pinCsv.split(",")) {
			String name = raw.trim();
			if (name.isEmpty()) {
				continue;
			}
			PinRole role = powerUpper.contains(name.toUpperCase(Locale.ROOT)) ? PinRole.POWER : PinRole.PASSIVE;
			pins.add(new PinSpec(index++, name, role));
		}
		return pins;
	}

	public static PinPartition partition(List<PinSpec> pins) {
		List<PinSpec> main = new ArrayList<>();
		List<PinSpec> power = new ArrayList<>();
		for (PinSpec pin : pins) {
			(pin.role() == PinRole.POWER ? power : main).add(pin);
		}
		return new PinPartition(main, power);
	}

	static UnitLayout buildUnit(int unitNumber, List<PinSpec> pins, int minGrids) {
		int leftCount = (pins.size() + 1) / 2;
		int rightCount = pins.size() / 2;

		double height = SchematicGrid.boxHeight(Math.max(leftCount, rightCount), minGrids);
		BoxGeometry box = BoxGeometry.of(BOX_WIDTH, height);

		double leftX = box.left() - SchematicGrid.PIN_LENGTH;
		double rightX = box.right() + SchematicGrid.PIN_LENGTH;

		List<UnitElement> elements = new ArrayList<>(pins.size());
		double y = SchematicGrid.firstPinY(leftCount);
		for (int i = 0; i < leftCount; i++) {
			elements.add(new UnitElement.PlacedPin(pins.get(i), leftX, y - i * SchematicGrid.SPACING, 0, false));
		}
		y = SchematicGrid.firstPinY(rightCount);
		for (int i = 0; i < rightCount; i++) {
			elements.add(new UnitElement.PlacedPin(
					pins.get(leftCount + i), rightX, y - i * SchematicGrid.SPACING, 180, false));
		}
		return new UnitLayout(unitNumber, box, elements);
	}
}
