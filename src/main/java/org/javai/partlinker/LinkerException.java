package org.javai.partlinker;

/**
 * Base class for failures raised by the linker.
 */
public class LinkerException extends RuntimeException {

	public LinkerException(String message) {
		super(message);
	}

	public LinkerException(String message, Throwable cause) {
		super(message, cause);
	}
}
