package org.qronos.format;

import java.util.Objects;

/** A piece of a compiled pattern: either literal text or a token that stands for a date field */
public final class PatternSegment {
	private final String theSource;
	private final String theLiteral;
	private final TokenKind theKind;
	private final int theWidth;
	private final boolean isFormatOnly;

	private PatternSegment(String source, String literal, TokenKind kind, int width, boolean formatOnly) {
		theSource = source;
		theLiteral = literal;
		theKind = kind;
		theWidth = width;
		isFormatOnly = formatOnly;
	}

	/**
	 * @param text The literal text
	 * @return A segment that matches or renders exactly the given text
	 */
	public static PatternSegment literal(String text) {
		return new PatternSegment(text, text, null, 0, false);
	}

	/**
	 * @param source The token as written in the pattern, e.g. "dd" or "%d"
	 * @param kind The kind of the token
	 * @param width The width of the token. For numeric kinds this is the number of digits to pad to when formatting; for
	 *        {@link TokenKind#FRACTION} it is the number of digits to print.
	 * @param formatOnly Whether the token may only be used to format, not to parse
	 * @return The token segment
	 */
	public static PatternSegment token(String source, TokenKind kind, int width, boolean formatOnly) {
		return new PatternSegment(source, null, Objects.requireNonNull(kind), width, formatOnly);
	}

	/** @return The segment as written in the pattern */
	public String getSource() {
		return theSource;
	}

	/** @return Whether this segment is literal text */
	public boolean isLiteral() {
		return theKind == null;
	}

	/** @return The literal text of this segment, or null if this is a token */
	public String getLiteral() {
		return theLiteral;
	}

	/** @return The kind of this token, or null if this is literal text */
	public TokenKind getKind() {
		return theKind;
	}

	/** @return The width of this token */
	public int getWidth() {
		return theWidth;
	}

	/** @return Whether this token may only be used for formatting */
	public boolean isFormatOnly() {
		return isFormatOnly;
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof PatternSegment))
			return false;
		PatternSegment other = (PatternSegment) obj;
		return theKind == other.theKind && theWidth == other.theWidth && Objects.equals(theLiteral, other.theLiteral)
			&& isFormatOnly == other.isFormatOnly;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theKind, theWidth, theLiteral);
	}

	@Override
	public String toString() {
		if (isLiteral())
			return "'" + theLiteral + "'";
		return theSource + "=" + theKind + "(" + theWidth + ")";
	}
}
