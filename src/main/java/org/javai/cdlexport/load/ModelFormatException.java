package org.javai.cdlexport.load;

/**
 * Exception thrown when a model document is malformed.
 */
public class ModelFormatException extends RuntimeException {

	public ModelFormatException(String message) {
		super(message);
	}

	public ModelFormatException(String message, Throwable cause) {
		super(message, cause);
	}
}
