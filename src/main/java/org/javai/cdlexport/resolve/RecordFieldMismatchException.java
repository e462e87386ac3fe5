package org.javai.cdlexport.resolve;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;
import org.javai.cdlexport.model.ModelPath;

/**
 * Thrown when a reference enters a data record that lacks the named field.
 */
public class RecordFieldMismatchException extends CdlExportException {

	private final ModelPath record;
	private final String field;

	public RecordFieldMismatchException(ModelPath record, String field) {
		super(ExportErrorKind.RECORD_FIELD_MISMATCH,
				"Record " + record + " has no field '" + field + "'", List.of());
		this.record = record;
		this.field = field;
	}

	public ModelPath record() {
		return record;
	}

	public String field() {
		return field;
	}
}
