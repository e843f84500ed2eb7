package org.javai.partlinker.library;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of classifying a batch of parts against the libraries on disk.
 *
 * @param libraries per-file state keyed by file name, in first-seen order
 * @param changes new and modified parts
 * @param diagnostics per-item problems, in the order they occurred
 */
public record ReconciliationPlan(
		Map<String, LibraryState> libraries,
		ChangeSet changes,
		List<Diagnostic> diagnostics) {

	public ReconciliationPlan {
		libraries = Collections.unmodifiableMap(new LinkedHashMap<>(libraries));
		diagnostics = List.copyOf(diagnostics);
	}

	public boolean isEmpty() {
		return changes.isEmpty();
	}

	public List<Diagnostic> diagnostics(DiagnosticKind kind) {
		return diagnostics.stream().filter(d -> d.kind() == kind).toList();
	}
}
