package org.qronos.format;

import org.qronos.RangeOverflowException;
import org.qronos.TimeUtils;
import org.qronos.UtcInstant;
import org.qronos.ZoneRef;
import org.qronos.locale.TimezoneOffsetProvider;

/**
 * The date and time fields extracted from text by a {@link ParsePlan}. The fields are local to the offset found in the text if there
 * was one, or to whatever zone the caller decides otherwise.
 */
public final class ParsedFields {
	private final int theYear;
	private final int theMonth;
	private final int theDay;
	private final int theHour;
	private final int theMinute;
	private final int theSecond;
	private final int theMicrosecond;
	private final Integer theOffsetSeconds;
	private final Long theTimestampMicros;

	ParsedFields(int year, int month, int day, int hour, int minute, int second, int microsecond, Integer offsetSeconds,
		Long timestampMicros) {
		theYear = year;
		theMonth = month;
		theDay = day;
		theHour = hour;
		theMinute = minute;
		theSecond = second;
		theMicrosecond = microsecond;
		theOffsetSeconds = offsetSeconds;
		theTimestampMicros = timestampMicros;
	}

	/** @return The year */
	public int getYear() {
		return theYear;
	}

	/** @return The month, 1-12 */
	public int getMonth() {
		return theMonth;
	}

	/** @return The day of the month */
	public int getDay() {
		return theDay;
	}

	/** @return The hour of the day, 0-23 */
	public int getHour() {
		return theHour;
	}

	/** @return The minute of the hour */
	public int getMinute() {
		return theMinute;
	}

	/** @return The second of the minute */
	public int getSecond() {
		return theSecond;
	}

	/** @return The microsecond of the second */
	public int getMicrosecond() {
		return theMicrosecond;
	}

	/** @return Whether the text specified a UTC offset */
	public boolean hasOffset() {
		return theOffsetSeconds != null;
	}

	/** @return The UTC offset specified in the text, in seconds, or null if there was none */
	public Integer getOffsetSeconds() {
		return theOffsetSeconds;
	}

	/** @return Whether the text was a POSIX timestamp, which identifies an instant regardless of any zone */
	public boolean isTimestamp() {
		return theTimestampMicros != null;
	}

	/** @return The local fields as microseconds since 1970-01-01T00:00:00 in their own zone */
	public long getLocalEpochMicros() {
		return TimeUtils.toEpochDay(theYear, theMonth, theDay) * TimeUtils.MICROS_PER_DAY + theHour * TimeUtils.MICROS_PER_HOUR
			+ theMinute * TimeUtils.MICROS_PER_MINUTE + theSecond * TimeUtils.MICROS_PER_SECOND + theMicrosecond;
	}

	/**
	 * @param defaultZone The zone to interpret the fields in if the text had no offset
	 * @param zones The offset provider to get the default zone's offset from
	 * @return The UTC instant the fields represent
	 * @throws IllegalArgumentException If the zone is not recognized by the provider
	 * @throws RangeOverflowException If the instant is outside the supported calendar
	 */
	public UtcInstant toInstant(ZoneRef defaultZone, TimezoneOffsetProvider zones)
		throws IllegalArgumentException, RangeOverflowException {
		if (theTimestampMicros != null)
			return UtcInstant.ofEpochMicros(theTimestampMicros);
		long local = getLocalEpochMicros();
		int offset;
		if (theOffsetSeconds != null)
			offset = theOffsetSeconds;
		else if (defaultZone == null || defaultZone.isUtc())
			offset = 0;
		else
			offset = zones.getLocalOffsetSeconds(defaultZone, local);
		return UtcInstant.ofEpochMicros(local - offset * TimeUtils.MICROS_PER_SECOND);
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		if (theTimestampMicros != null)
			return str.append("@").append(theTimestampMicros).append("us").toString();
		TimeUtils.printInt(theYear, 4, str).append('-');
		TimeUtils.printInt(theMonth, 2, str).append('-');
		TimeUtils.printInt(theDay, 2, str).append('T');
		TimeUtils.printInt(theHour, 2, str).append(':');
		TimeUtils.printInt(theMinute, 2, str).append(':');
		TimeUtils.printInt(theSecond, 2, str).append('.');
		TimeUtils.printInt(theMicrosecond, 6, str);
		if (theOffsetSeconds != null)
			TimeUtils.printOffset(theOffsetSeconds, true, str);
		return str.toString();
	}
}
