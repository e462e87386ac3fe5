package org.javai.cdlexport.export;

import java.util.List;
import org.javai.cdlexport.CdlExportException;
import org.javai.cdlexport.ExportErrorKind;

/**
 * Thrown instead of producing a partially resolved export. Carries every
 * failure found on qualified bindings, not only the first.
 */
public class ExportAbortedException extends CdlExportException {

	private final List<CdlExportException> failures;

	public ExportAbortedException(List<CdlExportException> failures) {
		super(ExportErrorKind.EXPORT_ABORTED, describe(failures), List.of(),
				failures.isEmpty() ? null : failures.get(0));
		this.failures = List.copyOf(failures);
		for (int i = 1; i < this.failures.size(); i++) {
			addSuppressed(this.failures.get(i));
		}
	}

	public List<CdlExportException> failures() {
		return failures;
	}

	private static String describe(List<CdlExportException> failures) {
		StringBuilder message = new StringBuilder("Export aborted: ")
				.append(failures.size()).append(" qualified binding(s) could not be resolved");
		for (CdlExportException failure : failures) {
			message.append(System.lineSeparator()).append("  ").append(failure.kind()).append(": ")
					.append(failure.getMessage());
		}
		return message.toString();
	}
}
