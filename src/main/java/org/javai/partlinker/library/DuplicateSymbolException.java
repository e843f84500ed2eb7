package org.javai.partlinker.library;

import org.javai.partlinker.LinkerException;
import org.javai.partlinker.part.PartRecord;

/**
 * Two parts render to the same symbol name in one library file.
 */
public class DuplicateSymbolException extends LinkerException {

	private final String libraryFile;
	private final String symbolName;

	public DuplicateSymbolException(String libraryFile, String symbolName, PartRecord first, PartRecord second) {
		super("Symbol '" + symbolName + "' in " + libraryFile + " is produced by both part "
				+ first.id() + " ('" + first.name() + "') and part " + second.id() + " ('" + second.name() + "')");
		this.libraryFile = libraryFile;
		this.symbolName = symbolName;
	}

	public String libraryFile() {
		return libraryFile;
	}

	public String symbolName() {
		return symbolName;
	}
}
