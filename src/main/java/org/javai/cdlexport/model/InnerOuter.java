package org.javai.cdlexport.model;

/**
 * Inward/outward redirection marker, on declarations and on references.
 */
public enum InnerOuter {
	NONE,
	INNER,
	OUTER,
	INNER_OUTER;

	public boolean declaresInner() {
		return this == INNER || this == INNER_OUTER;
	}

	public boolean redirectsOutward() {
		return this == OUTER;
	}

	/**
	 * Parses {@code inner}, {@code outer} or {@code inner outer}; blank means {@link #NONE}.
	 */
	public static InnerOuter parse(String text) {
		if (text == null || text.isBlank()) {
			return NONE;
		}
		return switch (text.trim().replaceAll("\\s+", " ")) {
			case "inner" -> INNER;
			case "outer" -> OUTER;
			case "inner outer" -> INNER_OUTER;
			default -> throw new IllegalArgumentException("Unknown inner/outer prefix: " + text);
		};
	}
}
