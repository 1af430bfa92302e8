package org.qronos.parse;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/** One entry in a {@link FormatSpec}: a token pattern, or a keyword that stands for a family of patterns or for POSIX timestamps */
public final class FormatCandidate {
	/** The kinds of candidates */
	public enum Kind {
		/** A literal directive or letter pattern */
		PATTERN,
		/** The ISO-8601 family, which expands to {@link FormatSpec#ISO_8601_PATTERNS} */
		ISO_8601,
		/** A POSIX timestamp in seconds, integer or fractional */
		TIMESTAMP
	}

	private final String theText;
	private final Kind theKind;

	private FormatCandidate(String text, Kind kind) {
		theText = text;
		theKind = kind;
	}

	/**
	 * @param text The pattern or keyword. {@value FormatSpec#ISO_8601} (in any case) is the ISO-8601 family; {@value FormatSpec#TIMESTAMP}
	 *        and <code>X</code> are POSIX timestamps; anything else is a pattern.
	 * @return The candidate
	 */
	public static FormatCandidate of(String text) {
		if (text == null || text.isEmpty())
			throw new IllegalArgumentException("A format candidate must not be empty");
		if (text.equalsIgnoreCase(FormatSpec.ISO_8601))
			return new FormatCandidate(text, Kind.ISO_8601);
		else if (text.equals(FormatSpec.TIMESTAMP) || text.equals("X"))
			return new FormatCandidate(text, Kind.TIMESTAMP);
		else
			return new FormatCandidate(text, Kind.PATTERN);
	}

	/** @return The candidate as the caller supplied it */
	public String getText() {
		return theText;
	}

	/** @return What kind of candidate this is */
	public Kind getKind() {
		return theKind;
	}

	/** @return The concrete patterns to try for this candidate, most specific first. Empty for {@link Kind#TIMESTAMP timestamps}. */
	public List<String> getPatterns() {
		switch (theKind) {
		case ISO_8601:
			return FormatSpec.ISO_8601_PATTERNS;
		case TIMESTAMP:
			return ImmutableList.of();
		default:
			return ImmutableList.of(theText);
		}
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof FormatCandidate && theText.equals(((FormatCandidate) obj).theText);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(theText);
	}

	@Override
	public String toString() {
		return theText;
	}
}
