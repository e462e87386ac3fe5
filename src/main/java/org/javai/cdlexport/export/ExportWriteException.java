package org.javai.cdlexport.export;

/**
 * Thrown when an export model cannot be serialized.
 */
public class ExportWriteException extends RuntimeException {

	public ExportWriteException(String message, Throwable cause) {
		super(message, cause);
	}
}
