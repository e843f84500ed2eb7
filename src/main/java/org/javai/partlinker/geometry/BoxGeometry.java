package org.javai.partlinker.geometry;

/**
 * Body rectangle of a unit, symmetric about the origin.
 *
 * @param top y of the top edge (positive)
 * @param left x of the left edge (negative)
 */
public record BoxGeometry(double top, double left) {

	public static BoxGeometry of(double width, double height) {
		return new BoxGeometry(height / 2.0, -width / 2.0);
	}

	public double bottom() {
		return -top;
	}

	public double right() {
		return -left;
	}

	public double height() {
		return 2 * top;
	}
}
