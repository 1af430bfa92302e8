package org.qronos.span;

import java.util.Objects;

import org.qronos.ElapsedTime;
import org.qronos.UtcInstant;

/** The first and last microsecond of one or more calendar units */
public final class SpanBoundary {
	private final UtcInstant theStart;
	private final UtcInstant theEnd;

	/**
	 * @param start The first instant in the span
	 * @param end The last instant in the span
	 * @throws IllegalArgumentException If the end is before the start
	 */
	public SpanBoundary(UtcInstant start, UtcInstant end) throws IllegalArgumentException {
		if (end.isBefore(start))
			throw new IllegalArgumentException("Span end " + end + " is before its start " + start);
		theStart = start;
		theEnd = end;
	}

	/** @return The first instant in the span */
	public UtcInstant getStart() {
		return theStart;
	}

	/** @return The last instant in the span */
	public UtcInstant getEnd() {
		return theEnd;
	}

	/**
	 * @param instant The instant to test
	 * @return Whether the instant is in this span
	 */
	public boolean contains(UtcInstant instant) {
		return instant.isBetween(theStart, theEnd);
	}

	/** @return The time from the start to the end of this span, plus the final microsecond */
	public ElapsedTime getLength() {
		return theEnd.minus(theStart).plus(ElapsedTime.RESOLUTION);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		else if (!(obj instanceof SpanBoundary))
			return false;
		return theStart.equals(((SpanBoundary) obj).theStart) && theEnd.equals(((SpanBoundary) obj).theEnd);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theStart, theEnd);
	}

	@Override
	public String toString() {
		return "(" + theStart + ", " + theEnd + ")";
	}
}
