package org.javai.partlinker.geometry;

import java.util.Locale;

public enum ConnectorGender {

	NONE,
	MALE,
	FEMALE;

	public static ConnectorGender parse(String value) {
		return switch (value == null ? "" : value.trim().toLowerCase(Locale.ROOT)) {
			case "male" -> MALE;
			case "female" -> FEMALE;
			default -> NONE;
		};
	}
}
