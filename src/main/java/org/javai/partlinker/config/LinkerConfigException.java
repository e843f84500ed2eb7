package org.javai.partlinker.config;

import org.javai.partlinker.LinkerException;

public class LinkerConfigException extends LinkerException {

	public LinkerConfigException(String message) {
		super(message);
	}

	public LinkerConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
