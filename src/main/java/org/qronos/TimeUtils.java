package org.qronos;

import java.math.BigDecimal;
import java.math.RoundingMode;

import com.google.common.math.LongMath;

/**
 * Proleptic-Gregorian calendar arithmetic on plain numbers. {@link UtcInstant}, the span engine and the pattern plans all do their
 * calendar math here so that no intermediate {@link java.util.Calendar} or {@link java.time} object is needed.
 */
public class TimeUtils {
	/** Microseconds in a second */
	public static final long MICROS_PER_SECOND = 1_000_000L;
	/** Microseconds in a minute */
	public static final long MICROS_PER_MINUTE = 60 * MICROS_PER_SECOND;
	/** Microseconds in an hour */
	public static final long MICROS_PER_HOUR = 60 * MICROS_PER_MINUTE;
	/** Microseconds in a day */
	public static final long MICROS_PER_DAY = 24 * MICROS_PER_HOUR;
	/** Microseconds in a week */
	public static final long MICROS_PER_WEEK = 7 * MICROS_PER_DAY;
	/** Seconds in a day */
	public static final int SECONDS_PER_DAY = 24 * 60 * 60;

	/** The smallest year an instant may have */
	public static final int MIN_YEAR = 1;
	/** The largest year an instant may have */
	public static final int MAX_YEAR = 9999;

	private static final int[] DAYS_IN_MONTH = new int[] { 31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31 };
	private static final int[] DAYS_BEFORE_MONTH = new int[] { 0, 31, 59, 90, 120, 151, 181, 212, 243, 273, 304, 334 };

	private TimeUtils() {
	}

	/**
	 * @param year The year to test
	 * @return Whether the year has a February 29th
	 */
	public static boolean isLeapYear(int year) {
		return (year % 4 == 0) && (year % 100 != 0 || year % 400 == 0);
	}

	/**
	 * @param year The year
	 * @return 366 for leap years, 365 otherwise
	 */
	public static int getDaysInYear(int year) {
		return isLeapYear(year) ? 366 : 365;
	}

	/**
	 * @param year The year of the month
	 * @param month The month, 1-12
	 * @return The number of days in the month
	 */
	public static int getDaysInMonth(int year, int month) {
		if (month == 2 && isLeapYear(year))
			return 29;
		return DAYS_IN_MONTH[month - 1];
	}

	/**
	 * @param year The year
	 * @param month The month, 1-12
	 * @param day The day of the month
	 * @return The day of the year, starting at 1
	 */
	public static int getDayOfYear(int year, int month, int day) {
		int doy = DAYS_BEFORE_MONTH[month - 1] + day;
		if (month > 2 && isLeapYear(year))
			doy++;
		return doy;
	}

	/**
	 * Converts a civil date to a count of days since 1970-01-01. Works for any year, including those outside the range an instant may
	 * hold, so that boundary arithmetic may overshoot and be checked afterward.
	 *
	 * @param year The year
	 * @param month The month, 1-12
	 * @param day The day of the month, 1-31
	 * @return The number of days between 1970-01-01 and the given date
	 */
	public static long toEpochDay(long year, int month, int day) {
		long y = month <= 2 ? year - 1 : year;
		long era = Math.floorDiv(y, 400);
		long yoe = y - era * 400; // [0, 399]
		long mp = (month + 9) % 12; // March=0
		long doy = (153 * mp + 2) / 5 + day - 1; // [0, 365]
		long doe = yoe * 365 + yoe / 4 - yoe / 100 + doy; // [0, 146096]
		return era * 146097 + doe - 719468;
	}

	/**
	 * The inverse of {@link #toEpochDay(long, int, int)}
	 *
	 * @param epochDay The number of days since 1970-01-01
	 * @return {year, month, day}
	 */
	public static long[] fromEpochDay(long epochDay) {
		long z = epochDay + 719468;
		long era = Math.floorDiv(z, 146097);
		long doe = z - era * 146097;
		long yoe = (doe - doe / 1460 + doe / 36524 - doe / 146096) / 365;
		long doy = doe - (365 * yoe + yoe / 4 - yoe / 100);
		long mp = (5 * doy + 2) / 153;
		long day = doy - (153 * mp + 2) / 5 + 1;
		long month = mp < 10 ? mp + 3 : mp - 9;
		long year = yoe + era * 400 + (month <= 2 ? 1 : 0);
		return new long[] { year, month, day };
	}

	/**
	 * @param epochDay The number of days since 1970-01-01
	 * @return The ISO day of the week, 1=Monday through 7=Sunday
	 */
	public static int getDayOfWeek(long epochDay) {
		// 1970-01-01 was a Thursday
		return (int) Math.floorMod(epochDay + 3, 7) + 1;
	}

	/**
	 * @param year The year to floor
	 * @param multiple The multiple to floor to, e.g. 10 for a decade
	 * @return The greatest multiple of <code>multiple</code> that is &lt;= <code>year</code>
	 */
	public static int floorYear(int year, int multiple) {
		return year - Math.floorMod(year, multiple);
	}

	/**
	 * Adds a number of units to an instant. Calendar units are added to the month and year fields, with the day clamped to the end of the
	 * resulting month. The result saturates rather than overflowing, and is not checked against the supported years, so that e.g. the
	 * start of the year after {@value #MAX_YEAR} may be computed.
	 *
	 * @param epochMicros The instant, in microseconds since 1970-01-01T00:00:00Z
	 * @param amount The number of units to add
	 * @param unit The unit to add
	 * @return The shifted instant, in microseconds since 1970-01-01T00:00:00Z. {@link Long#MAX_VALUE} or {@link Long#MIN_VALUE} if
	 *         the result's year is more than one year outside {@value #MIN_YEAR}..{@value #MAX_YEAR}.
	 */
	public static long addUnits(long epochMicros, long amount, SpanUnit unit) {
		switch (unit) {
		case MONTH:
			return addMonths(epochMicros, amount);
		case YEAR:
			return addMonths(epochMicros, LongMath.saturatedMultiply(amount, 12));
		case DECADE:
			return addMonths(epochMicros, LongMath.saturatedMultiply(amount, 120));
		case CENTURY:
			return addMonths(epochMicros, LongMath.saturatedMultiply(amount, 1200));
		default:
			return LongMath.saturatedAdd(epochMicros, LongMath.saturatedMultiply(amount, unit.getMicros()));
		}
	}

	private static long addMonths(long epochMicros, long months) {
		long epochDay = Math.floorDiv(epochMicros, MICROS_PER_DAY);
		long timeOfDay = Math.floorMod(epochMicros, MICROS_PER_DAY);
		long[] date = fromEpochDay(epochDay);
		long total = LongMath.saturatedAdd(date[0] * 12 + date[1] - 1, months);
		long year = Math.floorDiv(total, 12);
		if (year > MAX_YEAR + 1)
			return Long.MAX_VALUE;
		else if (year < MIN_YEAR - 1)
			return Long.MIN_VALUE;
		int month = (int) Math.floorMod(total, 12) + 1;
		int day = Math.min((int) date[2], getDaysInMonth((int) year, month));
		return toEpochDay(year, month, day) * MICROS_PER_DAY + timeOfDay;
	}

	/**
	 * Converts fractional seconds to microseconds, rounding half-even at the microsecond
	 *
	 * @param seconds The number of seconds
	 * @return The number of microseconds
	 * @throws ArithmeticException If the value is not finite or does not fit in a long
	 */
	public static long secondsToMicros(double seconds) throws ArithmeticException {
		if (Double.isNaN(seconds) || Double.isInfinite(seconds))
			throw new ArithmeticException("Not a finite number of seconds: " + seconds);
		return new BigDecimal(Double.toString(seconds)).movePointRight(6).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
	}

	/**
	 * Prints an integer into a StringBuilder, padding zeros as necessary to a specified number of places
	 *
	 * @param value The value to append
	 * @param places The number of digits (not including the '-', if any) for the integer
	 * @param into The StringBuilder to append to (or null to create a new one)
	 * @return The StringBuilder
	 */
	public static StringBuilder printInt(long value, int places, StringBuilder into) {
		if (into == null)
			into = new StringBuilder();
		int start = into.length();
		into.append(value);
		if (into.charAt(start) == '-')
			start++;
		while (into.length() - start < places)
			into.insert(start, '0');
		return into;
	}

	/**
	 * Prints a UTC offset
	 *
	 * @param offsetSeconds The offset to print, in seconds east of UTC
	 * @param colon Whether to separate hours and minutes with a colon
	 * @param into The StringBuilder to append to
	 * @return The StringBuilder
	 */
	public static StringBuilder printOffset(int offsetSeconds, boolean colon, StringBuilder into) {
		into.append(offsetSeconds < 0 ? '-' : '+');
		int abs = Math.abs(offsetSeconds);
		printInt(abs / 3600, 2, into);
		if (colon)
			into.append(':');
		printInt((abs / 60) % 60, 2, into);
		if (abs % 60 != 0) {
			if (colon)
				into.append(':');
			printInt(abs % 60, 2, into);
		}
		return into;
	}
}
