package org.javai.partlinker.library;

/**
 * A per-item problem recorded during a run.
 *
 * @param kind what went wrong
 * @param subject the part or symbol name concerned
 * @param libraryFile the library file the item belongs to
 * @param message human readable detail
 */
public record Diagnostic(DiagnosticKind kind, String subject, String libraryFile, String message) {
}
