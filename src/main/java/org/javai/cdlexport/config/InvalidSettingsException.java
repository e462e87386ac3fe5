package org.javai.cdlexport.config;

/**
 * Exception thrown when export settings cannot be read or are inconsistent.
 */
public class InvalidSettingsException extends RuntimeException {

	public InvalidSettingsException(String message) {
		super(message);
	}

	public InvalidSettingsException(String message, Throwable cause) {
		super(message, cause);
	}
}
