package org.javai.partlinker.geometry;

public enum PinRole {

	POWER("power_in"),
	PASSIVE("passive");

	private final String electricalType;

	PinRole(String electricalType) {
		this.electricalType = electricalType;
	}

	public String electricalType() {
		return electricalType;
	}
}
