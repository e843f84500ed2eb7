package org.javai.partlinker.partdb;

import org.javai.partlinker.LinkerException;

public class PartSourceException extends LinkerException {

	public PartSourceException(String message) {
		super(message);
	}

	public PartSourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
