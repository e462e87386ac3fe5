package org.javai.cdlexport;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.javai.cdlexport.model.BindingKey;

/**
 * Base of every failure raised while resolving or assembling an export.
 * <p>
 * {@link #chain()} lists the bindings being resolved when the failure occurred,
 * outermost first, so a failure deep inside the equipment model can be traced
 * back to the control parameter that reached it.
 */
public class CdlExportException extends RuntimeException {

	private final ExportErrorKind kind;
	private volatile List<BindingKey> chain;

	public CdlExportException(ExportErrorKind kind, String message, List<BindingKey> chain) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.chain = chain != null ? List.copyOf(chain) : List.of();
	}

	public CdlExportException(ExportErrorKind kind, String message, List<BindingKey> chain, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.chain = chain != null ? List.copyOf(chain) : List.of();
	}

	public ExportErrorKind kind() {
		return kind;
	}

	public List<BindingKey> chain() {
		return chain;
	}

	/**
	 * Records the binding chain on a failure raised without one. A chain already
	 * present is kept, so the innermost resolution that saw the failure wins.
	 */
	public CdlExportException withChainIfAbsent(List<BindingKey> resolutionChain) {
		if (chain.isEmpty() && resolutionChain != null) {
			chain = List.copyOf(resolutionChain);
		}
		return this;
	}

	@Override
	public String getMessage() {
		if (chain.isEmpty()) {
			return super.getMessage();
		}
		return super.getMessage() + " [via " + chain.stream().map(BindingKey::toString)
				.collect(Collectors.joining(" -> ")) + "]";
	}
}
