package org.qronos;

import java.util.Locale;

/** Calendrical units that instants may be truncated to, spanned by, and stepped through */
public enum SpanUnit {
	/** Seconds */
	SECOND(TimeUtils.MICROS_PER_SECOND, 1),
	/** Minutes */
	MINUTE(TimeUtils.MICROS_PER_MINUTE, 60),
	/** Hours */
	HOUR(TimeUtils.MICROS_PER_HOUR, 60 * 60),
	/** Days */
	DAY(TimeUtils.MICROS_PER_DAY, TimeUtils.SECONDS_PER_DAY),
	/** ISO weeks, starting on Monday */
	WEEK(TimeUtils.MICROS_PER_WEEK, 7 * TimeUtils.SECONDS_PER_DAY),
	/** Calendar months, 28 to 31 days long */
	MONTH(-1, 30 * TimeUtils.SECONDS_PER_DAY),
	/** Calendar years, 365 or 366 days long */
	YEAR(-1, 365 * TimeUtils.SECONDS_PER_DAY),
	/** Ten calendar years, starting on a year divisible by 10 */
	DECADE(-1, 10 * 365 * TimeUtils.SECONDS_PER_DAY),
	/** One hundred calendar years, starting on a year divisible by 100 */
	CENTURY(-1, 100 * 365L * TimeUtils.SECONDS_PER_DAY);

	private final long theFixedMicros;
	private final long theNominalSeconds;

	private SpanUnit(long fixedMicros, long nominalSeconds) {
		theFixedMicros = fixedMicros;
		theNominalSeconds = nominalSeconds;
	}

	/** @return Whether this unit's length depends on where it falls in the calendar */
	public boolean isCalendarBased() {
		return theFixedMicros < 0;
	}

	/**
	 * @return The exact length of this unit in microseconds
	 * @throws UnsupportedOperationException If this unit is {@link #isCalendarBased() calendar-based}
	 */
	public long getMicros() throws UnsupportedOperationException {
		if (theFixedMicros < 0)
			throw new UnsupportedOperationException(this + " has no fixed length");
		return theFixedMicros;
	}

	/**
	 * @return The number of seconds this unit is considered to be when measuring durations in it, with months of 30 days and years of
	 *         365 days
	 */
	public long getNominalSeconds() {
		return theNominalSeconds;
	}

	/** @return The lower-case singular name of this unit */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return getName();
	}

	/**
	 * @param name The name of the unit, singular or plural, in any case
	 * @return The unit with the given name
	 * @throws InvalidUnitException If the name does not name a unit
	 */
	public static SpanUnit parse(String name) throws InvalidUnitException {
		if (name == null)
			throw new InvalidUnitException(null, "No unit given");
		String lower = name.trim().toLowerCase(Locale.ROOT);
		if (lower.equals("centuries"))
			return CENTURY;
		for (SpanUnit unit : values()) {
			String unitName = unit.getName();
			if (lower.equals(unitName) || lower.equals(unitName + "s"))
				return unit;
		}
		throw new InvalidUnitException(name, "Time frame must be one of " + describeUnits() + ", not '" + name + "'");
	}

	static String describeUnits() {
		StringBuilder str = new StringBuilder();
		SpanUnit[] units = values();
		for (int i = units.length - 1; i >= 0; i--) {
			if (str.length() > 0)
				str.append('|');
			str.append(units[i].getName());
		}
		return str.toString();
	}
}
