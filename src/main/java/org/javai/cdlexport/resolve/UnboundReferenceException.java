package org.javai.cdlexport.resolve;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;

/**
 * Thrown when a reference cannot be matched to any declaration.
 */
public class UnboundReferenceException extends CdlExportException {

	public UnboundReferenceException(String message) {
		super(ExportErrorKind.UNBOUND_REFERENCE, message, List.of());
	}
}
