package org.qronos;

import java.util.Objects;

/** One failed candidate in a {@link TimeParseException} */
public final class ParseAttempt {
	private final String theCandidate;
	private final String thePattern;
	private final String theReason;

	/**
	 * @param candidate The format or keyword as the caller supplied it
	 * @param pattern The concrete pattern or grammar that was tried for the candidate
	 * @param reason Why the value did not match
	 */
	public ParseAttempt(String candidate, String pattern, String reason) {
		theCandidate = Objects.requireNonNull(candidate);
		thePattern = pattern == null ? candidate : pattern;
		theReason = reason;
	}

	/** @return The format or keyword as the caller supplied it */
	public String getCandidate() {
		return theCandidate;
	}

	/** @return The concrete pattern or grammar that was tried */
	public String getPattern() {
		return thePattern;
	}

	/** @return Why the value did not match */
	public String getReason() {
		return theReason;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof ParseAttempt))
			return false;
		ParseAttempt other = (ParseAttempt) obj;
		return theCandidate.equals(other.theCandidate) && thePattern.equals(other.thePattern)
			&& Objects.equals(theReason, other.theReason);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theCandidate, thePattern, theReason);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('"').append(theCandidate);
		if (!thePattern.equals(theCandidate))
			str.append(" -> ").append(thePattern);
		return str.append("\" (").append(theReason).append(')').toString();
	}
}
