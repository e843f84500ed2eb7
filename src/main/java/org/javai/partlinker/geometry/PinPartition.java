package org.javai.partlinker.geometry;

import java.util.List;

/**
 * Pins split into main and power groups, each in original relative order.
 */
public record PinPartition(List<PinSpec> main, List<PinSpec> power) {

	public PinPartition {
		main = List.copyOf(main);
		power = List.copyOf(power);
	}

	/**
	 * A separate power unit exists only when both groups are non-empty.
	 */
	public boolean hasPowerUnit() {
		return !main.isEmpty() && !power.isEmpty();
	}
}
