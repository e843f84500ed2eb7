package org.javai.partlinker.template;

import org.javai.partlinker.LinkerException;

/**
 * Thrown when the template configuration is missing, empty or malformed.
 */
public class TemplateConfigException extends LinkerException {

	public TemplateConfigException(String message) {
		super(message);
	}

	public TemplateConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
