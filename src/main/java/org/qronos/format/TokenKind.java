package org.qronos.format;

/** The field and presentation that a pattern token or directive maps to */
public enum TokenKind {
	/** The full year, 4 digits */
	YEAR(true),
	/** The last two digits of the year */
	YEAR_OF_CENTURY(true),
	/** The full name of the month */
	MONTH_NAME(false),
	/** The abbreviated name of the month */
	MONTH_ABBREVIATION(false),
	/** The month as a number, 1-12 */
	MONTH_NUMBER(true),
	/** The day of the month, 1-31 */
	DAY_OF_MONTH(true),
	/** The day of the year, 1-366 */
	DAY_OF_YEAR(true),
	/** The full name of the day of the week */
	WEEKDAY_NAME(false),
	/** The abbreviated name of the day of the week */
	WEEKDAY_ABBREVIATION(false),
	/** The ISO day of the week, 1=Monday through 7=Sunday */
	WEEKDAY_ISO(true),
	/** The POSIX day of the week, 0=Sunday through 6=Saturday */
	WEEKDAY_SUNDAY_ZERO(true),
	/** The hour of the day, 0-23 */
	HOUR_OF_DAY(true),
	/** The hour on a 12-hour clock, 1-12 */
	HOUR_OF_AM_PM(true),
	/** The ante-meridiem/post-meridiem marker */
	AM_PM(false),
	/** The minute of the hour */
	MINUTE(true),
	/** The second of the minute */
	SECOND(true),
	/** The fraction of the second, as up to 6 digits */
	FRACTION(true),
	/** The UTC offset, like +0530 */
	OFFSET(false),
	/** The UTC offset with a colon, like +05:30 */
	OFFSET_COLON(false),
	/** Seconds since 1970-01-01T00:00:00Z */
	TIMESTAMP(true);

	private final boolean isNumeric;

	private TokenKind(boolean numeric) {
		isNumeric = numeric;
	}

	/** @return Whether tokens of this kind are always written with digits only */
	public boolean isNumeric() {
		return isNumeric;
	}

	/** @return Whether this kind is one of the two UTC offset kinds */
	public boolean isOffset() {
		return this == OFFSET || this == OFFSET_COLON;
	}

	/**
	 * @return The kind whose value this kind determines. Parsing two tokens of the same field would be ambiguous, so a pattern may not
	 *         contain two tokens with the same field.
	 */
	public TokenKind getField() {
		switch (this) {
		case YEAR_OF_CENTURY:
			return YEAR;
		case MONTH_NAME:
		case MONTH_ABBREVIATION:
			return MONTH_NUMBER;
		case WEEKDAY_NAME:
		case WEEKDAY_ABBREVIATION:
		case WEEKDAY_SUNDAY_ZERO:
			return WEEKDAY_ISO;
		case HOUR_OF_AM_PM:
			return HOUR_OF_DAY;
		case OFFSET_COLON:
			return OFFSET;
		default:
			return this;
		}
	}
}
