package org.javai.partlinker.library;

import java.util.ArrayList;
import java.util.List;
import org.javai.partlinker.part.PartRecord;

/**
 * Parts whose rendered symbol differs from the library on disk.
 *
 * @param newParts parts with no symbol of their name in the existing file
 * @param modifiedParts parts whose existing symbol differs beyond whitespace
 */
public record ChangeSet(List<PartRecord> newParts, List<PartRecord> modifiedParts) {

	public ChangeSet {
		newParts = List.copyOf(newParts);
		modifiedParts = List.copyOf(modifiedParts);
	}

	public boolean isEmpty() {
		return newParts.isEmpty() && modifiedParts.isEmpty();
	}

	public List<PartRecord> all() {
		List<PartRecord> all = new ArrayList<>(newParts);
		all.addAll(modifiedParts);
		return all;
	}

	public boolean contains(PartRecord part) {
		return newParts.contains(part) || modifiedParts.contains(part);
	}
}
