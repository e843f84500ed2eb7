package org.javai.partlinker.library;

/**
 * Steps of a reconciliation run, in order.
 */
public enum ReconcileStage {
	FETCH,
	GROUP,
	PARSE_EXISTING,
	GENERATE_DESIRED,
	CLASSIFY,
	SELECT,
	COMMIT
}
