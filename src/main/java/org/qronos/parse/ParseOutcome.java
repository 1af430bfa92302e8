package org.qronos.parse;

import java.util.List;

import org.qronos.ParseAttempt;
import org.qronos.TimeParseException;
import org.qronos.UtcInstant;

import com.google.common.collect.ImmutableList;

/** The result of {@link MultiFormatParser#tryParse(ParseInput, FormatSpec, org.qronos.ZoneRef) trying} to parse an instant */
public final class ParseOutcome {
	private final String theValue;
	private final UtcInstant theInstant;
	private final FormatCandidate theCandidate;
	private final String thePattern;
	private final List<ParseAttempt> theAttempts;

	private ParseOutcome(String value, UtcInstant instant, FormatCandidate candidate, String pattern, List<ParseAttempt> attempts) {
		theValue = value;
		theInstant = instant;
		theCandidate = candidate;
		thePattern = pattern;
		theAttempts = ImmutableList.copyOf(attempts);
	}

	static ParseOutcome success(String value, UtcInstant instant, FormatCandidate candidate, String pattern,
		List<ParseAttempt> failedAttempts) {
		return new ParseOutcome(value, instant, candidate, pattern, failedAttempts);
	}

	static ParseOutcome failure(String value, List<ParseAttempt> attempts) {
		return new ParseOutcome(value, null, null, null, attempts);
	}

	/** @return Whether a candidate matched the value */
	public boolean isSuccess() {
		return theInstant != null;
	}

	/** @return The text of the value that was parsed */
	public String getValue() {
		return theValue;
	}

	/**
	 * @return The parsed instant
	 * @throws IllegalStateException If parsing failed
	 */
	public UtcInstant getInstant() throws IllegalStateException {
		if (theInstant == null)
			throw new IllegalStateException("Parsing failed: " + theAttempts);
		return theInstant;
	}

	/** @return The candidate that matched, or null if parsing failed */
	public FormatCandidate getCandidate() {
		return theCandidate;
	}

	/** @return The concrete pattern that matched (or the timestamp keyword), or null if parsing failed */
	public String getPattern() {
		return thePattern;
	}

	/** @return The failed attempts, in order. For a success, these are the attempts made before the match. */
	public List<ParseAttempt> getAttempts() {
		return theAttempts;
	}

	/**
	 * @return The instant, if parsing succeeded
	 * @throws TimeParseException If parsing failed
	 */
	public UtcInstant getOrThrow() throws TimeParseException {
		if (theInstant == null)
			throw new TimeParseException(theValue, theAttempts);
		return theInstant;
	}

	@Override
	public String toString() {
		if (theInstant != null)
			return theValue + " -> " + theInstant + " (" + thePattern + ")";
		return theValue + " -> " + theAttempts;
	}
}
