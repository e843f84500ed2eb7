package org.javai.partlinker.geometry;

/**
 * A numbered pin.
 *
 * @param index 1-based pin number
 * @param name pin name as shown on the symbol
 * @param role power or passive
 */
public record PinSpec(int index, String name, PinRole role) {

	public String number() {
		return Integer.toString(index);
	}
}
