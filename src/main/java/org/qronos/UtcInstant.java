package org.qronos;

import java.io.Serializable;
import java.time.Instant;
import java.util.Locale;

import org.qronos.format.RenderPlan;
import org.qronos.format.TokenTranslator;
import org.qronos.humanize.HumanizeConfig;
import org.qronos.humanize.Humanizer;
import org.qronos.locale.LocaleDataProvider;
import org.qronos.locale.TimezoneOffsetProvider;
import org.qronos.parse.FormatSpec;
import org.qronos.parse.MultiFormatParser;
import org.qronos.parse.ParseInput;

import com.google.common.math.LongMath;

/**
 * An immutable instant on the UTC time line with microsecond resolution, in the proleptic Gregorian calendar between
 * {@link #MIN 0001-01-01T00:00:00} and {@link #MAX 9999-12-31T23:59:59.999999}.
 * <p>
 * An instant has no zone of its own. Zones are only applied when an instant is {@link #of(int, int, int, int, int, int, int, ZoneRef)
 * created from} or {@link #format(String, ZoneRef, Locale) formatted to} local wall-clock fields.
 * </p>
 */
public final class UtcInstant implements Comparable<UtcInstant>, Serializable {
	private static final long serialVersionUID = 1L;

	private static final long MIN_MICROS = TimeUtils.toEpochDay(TimeUtils.MIN_YEAR, 1, 1) * TimeUtils.MICROS_PER_DAY;
	private static final long MAX_MICROS = (TimeUtils.toEpochDay(TimeUtils.MAX_YEAR, 12, 31) + 1) * TimeUtils.MICROS_PER_DAY - 1;

	/** The earliest representable instant, 0001-01-01T00:00:00 */
	public static final UtcInstant MIN = new UtcInstant(MIN_MICROS);
	/** The latest representable instant, 9999-12-31T23:59:59.999999 */
	public static final UtcInstant MAX = new UtcInstant(MAX_MICROS);
	/** 1970-01-01T00:00:00 */
	public static final UtcInstant EPOCH = new UtcInstant(0);

	private final long theEpochMicros;
	private final int theYear;
	private final int theMonth;
	private final int theDay;
	private final int theHour;
	private final int theMinute;
	private final int theSecond;
	private final int theMicrosecond;

	private UtcInstant(long epochMicros) {
		theEpochMicros = epochMicros;
		long epochDay = Math.floorDiv(epochMicros, TimeUtils.MICROS_PER_DAY);
		long timeOfDay = Math.floorMod(epochMicros, TimeUtils.MICROS_PER_DAY);
		long[] date = TimeUtils.fromEpochDay(epochDay);
		theYear = (int) date[0];
		theMonth = (int) date[1];
		theDay = (int) date[2];
		theHour = (int) (timeOfDay / TimeUtils.MICROS_PER_HOUR);
		theMinute = (int) ((timeOfDay / TimeUtils.MICROS_PER_MINUTE) % 60);
		theSecond = (int) ((timeOfDay / TimeUtils.MICROS_PER_SECOND) % 60);
		theMicrosecond = (int) (timeOfDay % TimeUtils.MICROS_PER_SECOND);
	}

	/**
	 * @param epochMicros The number of microseconds since 1970-01-01T00:00:00Z
	 * @return The instant
	 * @throws RangeOverflowException If the instant is outside the supported years
	 */
	public static UtcInstant ofEpochMicros(long epochMicros) throws RangeOverflowException {
		if (epochMicros < MIN_MICROS || epochMicros > MAX_MICROS)
			throw new RangeOverflowException("Instant " + epochMicros + "us from the epoch is outside years " + TimeUtils.MIN_YEAR + ".."
				+ TimeUtils.MAX_YEAR);
		if (epochMicros == 0)
			return EPOCH;
		return new UtcInstant(epochMicros);
	}

	/**
	 * @param epochSeconds The POSIX timestamp, possibly fractional
	 * @return The instant, rounded half-even to the microsecond
	 * @throws RangeOverflowException If the instant is outside the supported years
	 */
	public static UtcInstant ofEpochSecond(double epochSeconds) throws RangeOverflowException {
		long micros;
		try {
			micros = TimeUtils.secondsToMicros(epochSeconds);
		} catch (ArithmeticException e) {
			throw new RangeOverflowException("Timestamp " + epochSeconds + " is out of range: " + e.getMessage());
		}
		return ofEpochMicros(micros);
	}

	/** @return The current instant */
	public static UtcInstant now() {
		Instant now = Instant.now();
		return ofEpochMicros(now.getEpochSecond() * TimeUtils.MICROS_PER_SECOND + now.getNano() / 1000);
	}

	/**
	 * @param year The year, 1-9999
	 * @param month The month, 1-12
	 * @param day The day of the month
	 * @return The instant at midnight UTC on the given date
	 * @throws IllegalArgumentException If any field is out of range
	 */
	public static UtcInstant of(int year, int month, int day) throws IllegalArgumentException {
		return of(year, month, day, 0, 0, 0, 0);
	}

	/**
	 * @param year The year, 1-9999
	 * @param month The month, 1-12
	 * @param day The day of the month
	 * @param hour The hour of the day, 0-23
	 * @param minute The minute of the hour, 0-59
	 * @param second The second of the minute, 0-59
	 * @return The instant
	 * @throws IllegalArgumentException If any field is out of range
	 */
	public static UtcInstant of(int year, int month, int day, int hour, int minute, int second) throws IllegalArgumentException {
		return of(year, month, day, hour, minute, second, 0);
	}

	/**
	 * @param year The year, 1-9999
	 * @param month The month, 1-12
	 * @param day The day of the month
	 * @param hour The hour of the day, 0-23
	 * @param minute The minute of the hour, 0-59
	 * @param second The second of the minute, 0-59
	 * @param microsecond The microsecond of the second, 0-999999
	 * @return The instant
	 * @throws IllegalArgumentException If any field is out of range
	 */
	public static UtcInstant of(int year, int month, int day, int hour, int minute, int second, int microsecond)
		throws IllegalArgumentException {
		return ofEpochMicros(toLocalMicros(year, month, day, hour, minute, second, microsecond));
	}

	/**
	 * @param year The year, 1-9999
	 * @param month The month, 1-12
	 * @param day The day of the month
	 * @param hour The hour of the day, 0-23
	 * @param minute The minute of the hour, 0-59
	 * @param second The second of the minute, 0-59
	 * @param microsecond The microsecond of the second, 0-999999
	 * @param zone The zone that the fields are wall-clock fields in
	 * @return The instant
	 * @throws IllegalArgumentException If any field is out of range or the zone is not recognized
	 * @throws RangeOverflowException If the fields are in range, but the zone's offset moves the instant outside the supported years
	 */
	public static UtcInstant of(int year, int month, int day, int hour, int minute, int second, int microsecond, ZoneRef zone)
		throws IllegalArgumentException, RangeOverflowException {
		long local = toLocalMicros(year, month, day, hour, minute, second, microsecond);
		if (zone == null || zone.isUtc())
			return ofEpochMicros(local);
		int offset = TimezoneOffsetProvider.getDefault().getLocalOffsetSeconds(zone, local);
		return ofEpochMicros(local - offset * TimeUtils.MICROS_PER_SECOND);
	}

	private static long toLocalMicros(int year, int month, int day, int hour, int minute, int second, int microsecond) {
		checkField("year", year, TimeUtils.MIN_YEAR, TimeUtils.MAX_YEAR);
		checkField("month", month, 1, 12);
		checkField("day", day, 1, TimeUtils.getDaysInMonth(year, month));
		checkField("hour", hour, 0, 23);
		checkField("minute", minute, 0, 59);
		checkField("second", second, 0, 59);
		checkField("microsecond", microsecond, 0, 999_999);
		return TimeUtils.toEpochDay(year, month, day) * TimeUtils.MICROS_PER_DAY + hour * TimeUtils.MICROS_PER_HOUR
			+ minute * TimeUtils.MICROS_PER_MINUTE + second * TimeUtils.MICROS_PER_SECOND + microsecond;
	}

	private static void checkField(String name, int value, int min, int max) {
		if (value < min || value > max)
			throw new IllegalArgumentException(name + " must be in " + min + ".." + max + ", not " + value);
	}

	/**
	 * Parses an instant from ISO-8601 text or a POSIX timestamp
	 *
	 * @param text The text to parse
	 * @return The parsed instant
	 * @throws TimeParseException If the text is not an ISO-8601 date/time or a timestamp
	 */
	public static UtcInstant parse(String text) throws TimeParseException {
		return MultiFormatParser.getDefault().parse(ParseInput.text(text), FormatSpec.DEFAULT, ZoneRef.UTC);
	}

	/**
	 * @param text The text to parse
	 * @param formats The patterns or keywords to try, in order
	 * @return The instant parsed by the first format that matched the text
	 * @throws TimeParseException If no format matched the text
	 */
	public static UtcInstant parse(String text, String... formats) throws TimeParseException {
		return MultiFormatParser.getDefault().parse(ParseInput.text(text), FormatSpec.of(formats), ZoneRef.UTC);
	}

	/** @return The number of microseconds since 1970-01-01T00:00:00Z */
	public long getEpochMicros() {
		return theEpochMicros;
	}

	/** @return The POSIX timestamp of this instant, with the microseconds as the fraction */
	public double toEpochSecond() {
		return theEpochMicros / (double) TimeUtils.MICROS_PER_SECOND;
	}

	/** @return The year, 1-9999 */
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

	/** @return The minute of the hour, 0-59 */
	public int getMinute() {
		return theMinute;
	}

	/** @return The second of the minute, 0-59 */
	public int getSecond() {
		return theSecond;
	}

	/** @return The microsecond of the second, 0-999999 */
	public int getMicrosecond() {
		return theMicrosecond;
	}

	/** @return The number of days since 1970-01-01 */
	public long getEpochDay() {
		return Math.floorDiv(theEpochMicros, TimeUtils.MICROS_PER_DAY);
	}

	/** @return The number of microseconds since midnight */
	public long getMicroOfDay() {
		return Math.floorMod(theEpochMicros, TimeUtils.MICROS_PER_DAY);
	}

	/** @return The day of the year, starting at 1 */
	public int getDayOfYear() {
		return TimeUtils.getDayOfYear(theYear, theMonth, theDay);
	}

	/** @return The ISO day of the week, 1=Monday through 7=Sunday */
	public int getDayOfWeek() {
		return TimeUtils.getDayOfWeek(getEpochDay());
	}

	/** @return Whether this instant's year is a leap year */
	public boolean isLeapYear() {
		return TimeUtils.isLeapYear(theYear);
	}

	/** @return The number of days in this instant's month */
	public int getDaysInMonth() {
		return TimeUtils.getDaysInMonth(theYear, theMonth);
	}

	/**
	 * @param duration The elapsed time to add
	 * @return The instant the given time after this one
	 * @throws RangeOverflowException If the result is outside the supported years
	 */
	public UtcInstant plus(ElapsedTime duration) throws RangeOverflowException {
		return ofEpochMicros(LongMath.saturatedAdd(theEpochMicros, duration.getTotalMicros()));
	}

	/**
	 * @param duration The elapsed time to subtract
	 * @return The instant the given time before this one
	 * @throws RangeOverflowException If the result is outside the supported years
	 */
	public UtcInstant minus(ElapsedTime duration) throws RangeOverflowException {
		return ofEpochMicros(LongMath.saturatedSubtract(theEpochMicros, duration.getTotalMicros()));
	}

	/**
	 * @param other The instant to subtract
	 * @return The elapsed time from the other instant to this one
	 */
	public ElapsedTime minus(UtcInstant other) {
		return ElapsedTime.ofMicros(theEpochMicros - other.theEpochMicros);
	}

	/**
	 * Adds a number of units to this instant. Calendar units are added to the month and year fields, with the day clamped to the end of
	 * the resulting month, so that 2016-01-31 plus one month is 2016-02-29.
	 *
	 * @param amount The number of units to add
	 * @param unit The unit to add
	 * @return The shifted instant
	 * @throws RangeOverflowException If the result is outside the supported years
	 */
	public UtcInstant plus(long amount, SpanUnit unit) throws RangeOverflowException {
		return ofEpochMicros(TimeUtils.addUnits(theEpochMicros, amount, unit));
	}

	/**
	 * @param amount The number of units to subtract
	 * @param unit The unit to subtract
	 * @return The shifted instant
	 * @throws RangeOverflowException If the result is outside the supported years
	 * @see #plus(long, SpanUnit)
	 */
	public UtcInstant minus(long amount, SpanUnit unit) throws RangeOverflowException {
		return plus(LongMath.saturatedMultiply(amount, -1), unit);
	}

	/**
	 * Shifts this instant by a combination of calendar and fixed amounts. The years and months are applied first, clamping the day to
	 * the end of the resulting month, then the rest are added as elapsed time.
	 *
	 * @param years The number of years to add
	 * @param months The number of months to add
	 * @param weeks The number of weeks to add
	 * @param days The number of days to add
	 * @param hours The number of hours to add
	 * @param minutes The number of minutes to add
	 * @param seconds The number of seconds to add
	 * @param micros The number of microseconds to add
	 * @return The shifted instant
	 * @throws RangeOverflowException If the result is outside the supported years
	 */
	public UtcInstant shift(long years, long months, long weeks, long days, long hours, long minutes, long seconds, long micros)
		throws RangeOverflowException {
		ElapsedTime fixed;
		try {
			fixed = ElapsedTime.of(weeks, days, hours, minutes, seconds, micros);
		} catch (ArithmeticException e) {
			throw new RangeOverflowException("Shift is too large: " + e.getMessage());
		}
		long shifted = TimeUtils.addUnits(theEpochMicros, LongMath.saturatedAdd(LongMath.saturatedMultiply(years, 12), months),
			SpanUnit.MONTH);
		if (shifted < MIN_MICROS || shifted > MAX_MICROS)
			throw new RangeOverflowException("Shifting " + this + " by " + years + " years and " + months + " months leaves years "
				+ TimeUtils.MIN_YEAR + ".." + TimeUtils.MAX_YEAR);
		return ofEpochMicros(LongMath.saturatedAdd(shifted, fixed.getTotalMicros()));
	}

	/**
	 * @param year The year for the new instant
	 * @return An instant like this one, but in the given year
	 * @throws IllegalArgumentException If the year is out of range, or this is February 29th and the year is not a leap year
	 */
	public UtcInstant withYear(int year) throws IllegalArgumentException {
		return of(year, theMonth, theDay, theHour, theMinute, theSecond, theMicrosecond);
	}

	/**
	 * @param month The month for the new instant
	 * @return An instant like this one, but in the given month
	 * @throws IllegalArgumentException If the month is out of range, or this instant's day is not in the month
	 */
	public UtcInstant withMonth(int month) throws IllegalArgumentException {
		return of(theYear, month, theDay, theHour, theMinute, theSecond, theMicrosecond);
	}

	/**
	 * @param day The day of the month for the new instant
	 * @return An instant like this one, but on the given day of the month
	 * @throws IllegalArgumentException If the day is not in this instant's month
	 */
	public UtcInstant withDay(int day) throws IllegalArgumentException {
		return of(theYear, theMonth, day, theHour, theMinute, theSecond, theMicrosecond);
	}

	/**
	 * @param hour The hour of the day for the new instant
	 * @return An instant like this one, but in the given hour
	 * @throws IllegalArgumentException If the hour is out of range
	 */
	public UtcInstant withHour(int hour) throws IllegalArgumentException {
		return of(theYear, theMonth, theDay, hour, theMinute, theSecond, theMicrosecond);
	}

	/**
	 * @param minute The minute of the hour for the new instant
	 * @return An instant like this one, but in the given minute
	 * @throws IllegalArgumentException If the minute is out of range
	 */
	public UtcInstant withMinute(int minute) throws IllegalArgumentException {
		return of(theYear, theMonth, theDay, theHour, minute, theSecond, theMicrosecond);
	}

	/**
	 * @param second The second of the minute for the new instant
	 * @return An instant like this one, but in the given second
	 * @throws IllegalArgumentException If the second is out of range
	 */
	public UtcInstant withSecond(int second) throws IllegalArgumentException {
		return of(theYear, theMonth, theDay, theHour, theMinute, second, theMicrosecond);
	}

	/**
	 * @param microsecond The microsecond of the second for the new instant
	 * @return An instant like this one, but in the given microsecond
	 * @throws IllegalArgumentException If the microsecond is out of range
	 */
	public UtcInstant withMicrosecond(int microsecond) throws IllegalArgumentException {
		return of(theYear, theMonth, theDay, theHour, theMinute, theSecond, microsecond);
	}

	/**
	 * @param other The instant to compare with
	 * @return Whether this instant is strictly before the other
	 */
	public boolean isBefore(UtcInstant other) {
		return theEpochMicros < other.theEpochMicros;
	}

	/**
	 * @param other The instant to compare with
	 * @return Whether this instant is before or equal to the other
	 */
	public boolean isOnOrBefore(UtcInstant other) {
		return theEpochMicros <= other.theEpochMicros;
	}

	/**
	 * @param other The instant to compare with
	 * @return Whether this instant is strictly after the other
	 */
	public boolean isAfter(UtcInstant other) {
		return theEpochMicros > other.theEpochMicros;
	}

	/**
	 * @param other The instant to compare with
	 * @return Whether this instant is after or equal to the other
	 */
	public boolean isOnOrAfter(UtcInstant other) {
		return theEpochMicros >= other.theEpochMicros;
	}

	/**
	 * @param start The start of the interval, inclusive
	 * @param end The end of the interval, inclusive
	 * @return Whether this instant is between the two
	 */
	public boolean isBetween(UtcInstant start, UtcInstant end) {
		return isOnOrAfter(start) && isOnOrBefore(end);
	}

	/**
	 * @param pattern The directive or letter pattern to format with
	 * @return This instant's UTC fields, formatted with the pattern in the default locale
	 * @throws UnsupportedTokenException If the pattern contains an unrecognized token
	 */
	public String format(String pattern) throws UnsupportedTokenException {
		return format(pattern, ZoneRef.UTC, Locale.getDefault(Locale.Category.FORMAT));
	}

	/**
	 * @param pattern The directive or letter pattern to format with
	 * @param zone The zone to format this instant's wall-clock fields in
	 * @param locale The locale for month and weekday names and AM/PM markers
	 * @return The formatted text
	 * @throws UnsupportedTokenException If the pattern contains an unrecognized token
	 * @throws IllegalArgumentException If the zone is not recognized
	 */
	public String format(String pattern, ZoneRef zone, Locale locale) throws UnsupportedTokenException, IllegalArgumentException {
		RenderPlan plan = TokenTranslator.compileRenderer(pattern);
		int offset = zone == null || zone.isUtc() ? 0 : TimezoneOffsetProvider.getDefault().getOffsetSeconds(zone, theEpochMicros);
		return plan.render(this, offset, LocaleDataProvider.getDefault().resolve(locale));
	}

	/**
	 * Describes this instant relative to another, like "in 3 hours" or "2 days ago"
	 *
	 * @param other The reference instant
	 * @return The humanized time from the other instant to this one
	 */
	public String timeFrom(UtcInstant other) {
		return timeFrom(other, HumanizeConfig.DEFAULT);
	}

	/**
	 * @param other The reference instant
	 * @param config The humanization configuration. The direction is always added.
	 * @return The humanized time from the other instant to this one
	 */
	public String timeFrom(UtcInstant other, HumanizeConfig config) {
		return Humanizer.humanize(minus(other), config.withDirection(true));
	}

	/**
	 * Describes another instant relative to this one, like "in 3 hours" or "2 days ago"
	 *
	 * @param other The instant to describe
	 * @return The humanized time from this instant to the other
	 */
	public String timeTo(UtcInstant other) {
		return timeTo(other, HumanizeConfig.DEFAULT);
	}

	/**
	 * @param other The instant to describe
	 * @param config The humanization configuration. The direction is always added.
	 * @return The humanized time from this instant to the other
	 */
	public String timeTo(UtcInstant other, HumanizeConfig config) {
		return other.timeFrom(this, config);
	}

	/** @return The humanized time from the current moment to this instant, like "in 3 hours" for an instant 3 hours from now */
	public String timeFromNow() {
		return timeFrom(now());
	}

	/**
	 * @param config The humanization configuration. The direction is always added.
	 * @return The humanized time from the current moment to this instant
	 */
	public String timeFromNow(HumanizeConfig config) {
		return timeFrom(now(), config);
	}

	/** @return The humanized time from this instant to the current moment, like "in 3 hours" for an instant 3 hours ago */
	public String timeToNow() {
		return timeTo(now());
	}

	/**
	 * @param config The humanization configuration. The direction is always added.
	 * @return The humanized time from this instant to the current moment
	 */
	public String timeToNow(HumanizeConfig config) {
		return timeTo(now(), config);
	}

	@Override
	public int compareTo(UtcInstant o) {
		return Long.compare(theEpochMicros, o.theEpochMicros);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof UtcInstant && ((UtcInstant) obj).theEpochMicros == theEpochMicros;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(theEpochMicros);
	}

	/**
	 * Appends this instant in ISO-8601 form with a zero UTC offset, with the fraction only if it is non-zero
	 *
	 * @param str The StringBuilder to append to
	 * @return The StringBuilder
	 */
	public StringBuilder appendIso(StringBuilder str) {
		TimeUtils.printInt(theYear, 4, str).append('-');
		TimeUtils.printInt(theMonth, 2, str).append('-');
		TimeUtils.printInt(theDay, 2, str).append('T');
		TimeUtils.printInt(theHour, 2, str).append(':');
		TimeUtils.printInt(theMinute, 2, str).append(':');
		TimeUtils.printInt(theSecond, 2, str);
		if (theMicrosecond != 0)
			TimeUtils.printInt(theMicrosecond, 6, str.append('.'));
		return str.append("+00:00");
	}

	/** @return This instant in ISO-8601 form, e.g. "2016-07-25T19:33:18+00:00" */
	@Override
	public String toString() {
		return appendIso(new StringBuilder()).toString();
	}
}
