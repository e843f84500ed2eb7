package org.javai.partlinker.library;

public enum DiagnosticKind {

	/** No template applies to the part's category; the part was skipped. */
	UNMATCHED_CATEGORY,

	/** Rendering the part failed; the part was skipped. */
	RENDER_FAILURE,

	/** An existing block could not be closed; it is treated as absent. */
	UNPARSABLE_SYMBOL,

	/** Two parts produce the same symbol name. */
	DUPLICATE_SYMBOL
}
