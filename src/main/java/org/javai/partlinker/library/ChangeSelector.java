package org.javai.partlinker.library;

import java.util.Collection;
import java.util.List;
import org.javai.partlinker.part.PartRecord;

/**
 * Chooses which changes to commit, typically after a human review.
 */
@FunctionalInterface
public interface ChangeSelector {

	Collection<PartRecord> select(ChangeSet changes);

	static ChangeSelector all() {
		return ChangeSet::all;
	}

	static ChangeSelector none() {
		return changes -> List.of();
	}
}
