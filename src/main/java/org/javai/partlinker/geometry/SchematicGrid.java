package org.javai.partlinker.geometry;

/**
 * Schematic pitch constants and the box sizing rule shared by the generators.
 */
public final class SchematicGrid {

	/** 100 mil. */
	public static final double SPACING = 2.54;

	public static final double PIN_LENGTH = 2.54;

	private SchematicGrid() {
	}

	/**
	 * Height of a pin box: one grid per gap between the pins of the longer side,
	 * at least {@code minGrids}, plus one grid of padding.
	 */
	public static double boxHeight(int longestSide, int minGrids) {
		int grids = Math.max(minGrids, longestSide > 0 ? longestSide - 1 : 0);
		return grids * SPACING + SPACING;
	}

	/**
	 * Y of the first (topmost) pin of a side so the side is centered on the origin.
	 */
	public static double firstPinY(int sideCount) {
		return (sideCount - 1) * SPACING / 2.0;
	}
}
