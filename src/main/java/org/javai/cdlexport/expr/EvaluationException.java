package org.javai.cdlexport.expr;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;

/**
 * Thrown when a supported construct receives operands it cannot combine.
 */
public class EvaluationException extends CdlExportException {

	public EvaluationException(String message) {
		super(ExportErrorKind.EVALUATION_ERROR, message, List.of());
	}

	public EvaluationException(String message, Throwable cause) {
		super(ExportErrorKind.EVALUATION_ERROR, message, List.of(), cause);
	}
}
