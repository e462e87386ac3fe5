package org.javai.cdlexport.resolve;

import java.util.Objects;
import org.javai.cdlexport.model.Instance;
import org.javai.cdlexport.model.ModelPath;
import org.javai.cdlexport.model.ParameterBinding;

/**
 * What a reference denotes once its scope has been resolved.
 */
public sealed interface ScopeBinding {

	/**
	 * The reference names a parameter of an ordinary instance.
	 */
	record BoundParameter(ParameterBinding binding) implements ScopeBinding {
		public BoundParameter {
			Objects.requireNonNull(binding, "binding must not be null");
		}
	}

	/**
	 * The reference names a field of a data-record instance.
	 */
	record BoundRecordField(ModelPath record, String field) implements ScopeBinding {
		public BoundRecordField {
			Objects.requireNonNull(record, "record must not be null");
			Objects.requireNonNull(field, "field must not be null");
		}
	}

	/**
	 * The reference entered a data record that has no field of the requested name.
	 */
	record MissingRecordField(ModelPath record, String field) implements ScopeBinding {
		public MissingRecordField {
			Objects.requireNonNull(record, "record must not be null");
			Objects.requireNonNull(field, "field must not be null");
		}
	}

	/**
	 * The reference names a whole component rather than one of its parameters.
	 */
	record BoundInstance(Instance instance) implements ScopeBinding {
		public BoundInstance {
			Objects.requireNonNull(instance, "instance must not be null");
		}
	}

	/**
	 * No declaration was found.
	 */
	record Unbound(String reason) implements ScopeBinding {
		public Unbound {
			Objects.requireNonNull(reason, "reason must not be null");
		}
	}
}
