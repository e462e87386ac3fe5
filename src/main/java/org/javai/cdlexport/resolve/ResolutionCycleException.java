package org.javai.cdlexport.resolve;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;
import org.javai.cdlexport.model.BindingKey;

/**
 * Thrown when a chain of references returns to a binding that is still being resolved.
 * The {@link #chain()} starts and ends with the revisited binding.
 */
public class ResolutionCycleException extends CdlExportException {

	public ResolutionCycleException(List<BindingKey> cycle) {
		super(ExportErrorKind.RESOLUTION_CYCLE, "Resolution cycle", cycle);
	}
}
