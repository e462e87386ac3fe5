package org.javai.cdlexport.sxl;

/**
 * Exception thrown when parsing expression notation fails.
 */
public class SxlParseException extends RuntimeException {

	public SxlParseException(String message) {
		super(message);
	}

	public SxlParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
