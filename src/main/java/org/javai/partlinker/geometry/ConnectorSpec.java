package org.javai.partlinker.geometry;

import java.util.Locale;
import org.javai.partlinker.part.PartRecord;
import org.javai.partlinker.part.ValueResolver;

/**
 * Connector shape resolved from part parameters.
 *
 * @param rows number of rows, at least 1
 * @param pinsPerRow pins in each row, at least 1
 * @param numbering numbering style; {@link NumberingStyle#LINE} only for more than one row
 * @param gender overlay drawn next to each pin
 */
public record ConnectorSpec(int rows, int pinsPerRow, NumberingStyle numbering, ConnectorGender gender) {

	public static final String ROWS = "Number of Rows";
	public static final String PINS_PER_ROW = "Pins per Row";
	public static final String NUMBER_OF_PINS = "Number of Pins";
	public static final String PIN_COUNT = "Pin Count";
	public static final String GENDER = "Gender";
	public static final String PIN_ANNOTATION = "Pin Annotation";

	public ConnectorSpec {
		rows = Math.max(1, rows);
		pinsPerRow = Math.max(1, pinsPerRow);
		numbering = rows > 1 && numbering == NumberingStyle.LINE ? NumberingStyle.LINE : NumberingStyle.ROW;
		gender = gender != null ? gender : ConnectorGender.NONE;
	}

	/**
	 * Resolves the connector shape. Pins per row falls back to the total pin count
	 * ({@value #NUMBER_OF_PINS}, then {@value #PIN_COUNT}) divided over the rows.
	 */
	public static ConnectorSpec from(PartRecord part) {
		int rows = parseInt(ValueResolver.resolve(part, ROWS), 1);
		int pinsPerRow = parseInt(ValueResolver.resolve(part, PINS_PER_ROW), 0);

		if (pinsPerRow == 0) {
			String totalText = ValueResolver.resolve(part, NUMBER_OF_PINS);
			if (totalText.isEmpty()) {
				totalText = ValueResolver.resolve(part, PIN_COUNT);
			}
			int total = parseInt(totalText, 0);
			if (total > 0) {
				if (rows == 1) {
					pinsPerRow = total;
				} else if (rows > 1) {
					pinsPerRow = (total + rows - 1) / rows;
				}
			}
		}

		String annotation = ValueResolver.resolve(part, PIN_ANNOTATION).trim().toLowerCase(Locale.ROOT);
		NumberingStyle numbering = "line".equals(annotation) ? NumberingStyle.LINE : NumberingStyle.ROW;
		return new ConnectorSpec(rows, pinsPerRow, numbering, ConnectorGender.parse(ValueResolver.resolve(part, GENDER)));
	}

	public boolean isSingleRow() {
		return rows == 1;
	}

	private static int parseInt(String text, int fallback) {
		if (text == null || text.isBlank()) {
			return fallback;
		}
		try {
			return Integer.parseInt(text.trim());
		} catch (NumberFormatException e) {
			return fallback;
		}
	}
}
