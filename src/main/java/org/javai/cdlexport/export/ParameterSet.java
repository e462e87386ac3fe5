package org.javai.cdlexport.export;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.javai.cdlexport.value.ParameterValue;

/**
 * The resolved values of one control sequence, keyed by parameter path relative
 * to the sequence root. The id is derived from the content, so sequences of the
 * same class with equal values share one set.
 */
public record ParameterSet(String id, String sequenceClass, Map<String, ParameterValue> values) {

	private static final String ID_PREFIX = "ps-";
	private static final int ID_HEX_LENGTH = 12;

	public ParameterSet {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(sequenceClass, "sequenceClass must not be null");
		values = Collections.unmodifiableMap(new TreeMap<>(values));
	}

	public static ParameterSet of(String sequenceClass, Map<String, ParameterValue> values) {
		Map<String, ParameterValue> sorted = new TreeMap<>(values);
		return new ParameterSet(contentId(sequenceClass, sorted), sequenceClass, sorted);
	}

	static String contentId(String sequenceClass, Map<String, ParameterValue> sorted) {
		StringBuilder canonical = new StringBuilder(sequenceClass).append('\n');
		sorted.forEach((name, value) -> canonical.append(name).append('=')
				.append(value.getClass().getSimpleName()).append(':').append(value.render()).append('\n'));
		try {
			byte[] digest = MessageDigest.getInstance("SHA-256")
					.digest(canonical.toString().getBytes(StandardCharsets.UTF_8));
			return ID_PREFIX + HexFormat.of().formatHex(digest).substring(0, ID_HEX_LENGTH);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 is not available", e);
		}
	}
}
