package org.javai.cdlexport.expr;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;

/**
 * Thrown for expression nodes or function calls outside the supported subset.
 */
public class UnsupportedConstructException extends CdlExportException {

	public UnsupportedConstructException(String message) {
		super(ExportErrorKind.UNSUPPORTED_CONSTRUCT, message, List.of());
	}
}
