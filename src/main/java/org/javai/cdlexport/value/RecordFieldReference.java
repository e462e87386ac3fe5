package org.javai.cdlexport.value;

import java.util.Objects;
import org.javai.cdlexport.model.ModelPath;

/**
 * Symbolic pointer to a field of a data-record instance. The field value is never read.
 *
 * @param record path of the record instance
 * @param field the field name inside the record
 */
public record RecordFieldReference(ModelPath record, String field) implements ParameterValue {

	public RecordFieldReference {
		Objects.requireNonNull(record, "record must not be null");
		Objects.requireNonNull(field, "field must not be null");
	}

	public static RecordFieldReference of(String record, String field) {
		return new RecordFieldReference(ModelPath.of(record), field);
	}

	@Override
	public String render() {
		return "@" + record + "." + field;
	}
}
