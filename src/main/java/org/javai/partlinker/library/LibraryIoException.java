package org.javai.partlinker.library;

import java.nio.file.Path;
import org.javai.partlinker.LinkerException;

/**
 * A library file could not be read or written. Fatal for the run.
 */
public class LibraryIoException extends LinkerException {

	private final Path file;

	public LibraryIoException(Path file, String message, Throwable cause) {
		super(message + ": " + file, cause);
		this.file = file;
	}

	public Path file() {
		return file;
	}
}
