package org.javai.partlinker.geometry;

/**
 * Pin numbering of a multi-row connector.
 */
public enum NumberingStyle {

	/** Left column top to bottom, then right column: 1,2,3,4 | 5,6,7,8. */
	ROW,

	/** Left and right alternate per physical row: 1,3,5,7 | 2,4,6,8. */
	LINE
}
