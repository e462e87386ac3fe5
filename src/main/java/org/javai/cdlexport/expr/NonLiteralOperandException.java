package org.javai.cdlexport.expr;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;
import org.javai.cdlexport.value.RecordFieldReference;

/**
 * Thrown when a symbolic record reference reaches an operator that needs a literal.
 */
public class NonLiteralOperandException extends CdlExportException {

	private final ExpressionNode.VariableRef reference;
	private final RecordFieldReference resolved;

	public NonLiteralOperandException(ExpressionNode.VariableRef reference, RecordFieldReference resolved) {
		super(ExportErrorKind.NON_LITERAL_QUALIFIED_PARAMETER,
				"Reference '" + reference.path() + "' resolves to record field " + resolved.render()
						+ " and cannot be folded to a literal", List.of());
		this.reference = reference;
		this.resolved = resolved;
	}

	public ExpressionNode.VariableRef reference() {
		return reference;
	}

	public RecordFieldReference resolved() {
		return resolved;
	}
}
