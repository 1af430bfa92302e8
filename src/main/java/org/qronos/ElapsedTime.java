package org.qronos;

import java.io.Serializable;

import org.qronos.humanize.HumanizeConfig;
import org.qronos.humanize.Humanizer;
import org.qronos.parse.DurationGrammar;

/**
 * An immutable, signed amount of elapsed time with microsecond resolution.
 * <p>
 * The canonical value is the {@link #getTotalMicros() total number of microseconds}, which is what all arithmetic operates on. The
 * component accessors follow the usual normalization for durations: {@link #getDays() days} carries the sign while
 * {@link #getSeconds() seconds} and {@link #getMicroseconds() microseconds} are always non-negative, so -1 second is -1 day plus 86399
 * seconds.
 * </p>
 */
public final class ElapsedTime implements Comparable<ElapsedTime>, Serializable {
	private static final long serialVersionUID = 1L;

	/** No time */
	public static final ElapsedTime ZERO = new ElapsedTime(0);
	/** The smallest positive amount of time */
	public static final ElapsedTime RESOLUTION = new ElapsedTime(1);

	private final long theMicros;

	private ElapsedTime(long micros) {
		theMicros = micros;
	}

	/**
	 * @param micros The number of microseconds
	 * @return The elapsed time
	 * @throws ArithmeticException If the microseconds are {@link Long#MIN_VALUE}, which cannot be negated
	 */
	public static ElapsedTime ofMicros(long micros) throws ArithmeticException {
		if (micros == Long.MIN_VALUE)
			throw new ArithmeticException("Elapsed time out of range: " + micros + " microseconds");
		return micros == 0 ? ZERO : new ElapsedTime(micros);
	}

	/**
	 * @param seconds The number of seconds, possibly fractional
	 * @return The elapsed time, rounded half-even to the microsecond
	 * @throws ArithmeticException If the seconds are not finite or too large
	 */
	public static ElapsedTime ofSeconds(double seconds) throws ArithmeticException {
		return ofMicros(TimeUtils.secondsToMicros(seconds));
	}

	/**
	 * @param weeks The number of weeks
	 * @param days The number of days
	 * @param hours The number of hours
	 * @param minutes The number of minutes
	 * @param seconds The number of seconds
	 * @param micros The number of microseconds
	 * @return The sum of all the given amounts
	 * @throws ArithmeticException If the total does not fit
	 */
	public static ElapsedTime of(long weeks, long days, long hours, long minutes, long seconds, long micros) throws ArithmeticException {
		long total = Math.multiplyExact(weeks, TimeUtils.MICROS_PER_WEEK);
		total = Math.addExact(total, Math.multiplyExact(days, TimeUtils.MICROS_PER_DAY));
		total = Math.addExact(total, Math.multiplyExact(hours, TimeUtils.MICROS_PER_HOUR));
		total = Math.addExact(total, Math.multiplyExact(minutes, TimeUtils.MICROS_PER_MINUTE));
		total = Math.addExact(total, Math.multiplyExact(seconds, TimeUtils.MICROS_PER_SECOND));
		total = Math.addExact(total, micros);
		return ofMicros(total);
	}

	/**
	 * @param amount The number of units
	 * @param unit The fixed-length unit
	 * @return The elapsed time
	 * @throws InvalidUnitException If the unit is calendar-based and so has no fixed length
	 */
	public static ElapsedTime of(long amount, SpanUnit unit) throws InvalidUnitException {
		if (unit.isCalendarBased())
			throw new InvalidUnitException(unit.getName(), "A " + unit + " has no fixed length");
		return ofMicros(Math.multiplyExact(amount, unit.getMicros()));
	}

	/**
	 * Parses a duration from text like "1w 3d 2h 32m", "2 days, 5:34:56" or "2:04:13:02.266"
	 *
	 * @param text The text to parse
	 * @return The parsed elapsed time
	 * @throws TimeParseException If the text is not a recognized duration
	 * @see DurationGrammar
	 */
	public static ElapsedTime parse(String text) throws TimeParseException {
		return DurationGrammar.parse(text);
	}

	/** @return The total number of microseconds in this elapsed time */
	public long getTotalMicros() {
		return theMicros;
	}

	/** @return The total number of seconds in this elapsed time, with the microseconds as the fraction */
	public double getTotalSeconds() {
		return theMicros / (double) TimeUtils.MICROS_PER_SECOND;
	}

	/** @return The signed number of whole days, rounded toward negative infinity */
	public long getDays() {
		return Math.floorDiv(theMicros, TimeUtils.MICROS_PER_DAY);
	}

	/** @return The seconds after the {@link #getDays() days}, 0-86399 */
	public int getSeconds() {
		return (int) (Math.floorMod(theMicros, TimeUtils.MICROS_PER_DAY) / TimeUtils.MICROS_PER_SECOND);
	}

	/** @return The microseconds after the {@link #getSeconds() seconds}, 0-999999 */
	public int getMicroseconds() {
		return (int) Math.floorMod(theMicros, TimeUtils.MICROS_PER_SECOND);
	}

	/** @return Whether this elapsed time is less than zero */
	public boolean isNegative() {
		return theMicros < 0;
	}

	/** @return Whether this elapsed time is zero */
	public boolean isZero() {
		return theMicros == 0;
	}

	/**
	 * @param other The elapsed time to add
	 * @return The sum of this and the other elapsed time
	 */
	public ElapsedTime plus(ElapsedTime other) {
		return ofMicros(Math.addExact(theMicros, other.theMicros));
	}

	/**
	 * @param other The elapsed time to subtract
	 * @return The difference between this and the other elapsed time
	 */
	public ElapsedTime minus(ElapsedTime other) {
		return ofMicros(Math.subtractExact(theMicros, other.theMicros));
	}

	/** @return This elapsed time with the opposite sign */
	public ElapsedTime negated() {
		return ofMicros(Math.negateExact(theMicros));
	}

	/** @return This elapsed time, made positive */
	public ElapsedTime abs() {
		return theMicros < 0 ? negated() : this;
	}

	/**
	 * @param multiplier The factor to multiply by
	 * @return This elapsed time times the multiplier, rounded half-even to the microsecond
	 */
	public ElapsedTime multipliedBy(double multiplier) {
		return ofMicros((long) Math.rint(theMicros * multiplier));
	}

	/**
	 * @param divisor The number to divide by
	 * @return This elapsed time divided by the divisor, rounded toward negative infinity
	 */
	public ElapsedTime dividedBy(long divisor) {
		return ofMicros(Math.floorDiv(theMicros, divisor));
	}

	/**
	 * @param other The elapsed time to divide by
	 * @return The ratio between this and the other elapsed time
	 */
	public double dividedBy(ElapsedTime other) {
		return theMicros / (double) other.theMicros;
	}

	/**
	 * @param config The humanization configuration
	 * @return A human-readable phrase for this elapsed time, like "3 hours" or "in 2 days"
	 * @see Humanizer#humanize(ElapsedTime, HumanizeConfig)
	 */
	public String format(HumanizeConfig config) {
		return Humanizer.humanize(this, config);
	}

	@Override
	public int compareTo(ElapsedTime o) {
		return Long.compare(theMicros, o.theMicros);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof ElapsedTime && ((ElapsedTime) obj).theMicros == theMicros;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(theMicros);
	}

	/**
	 * Prints this elapsed time in clock form, e.g. "10 days, 2:32:00", "0:00:01.500000" or "-1 day, 0:00:00". Negative values are printed
	 * as a minus sign followed by the clock form of the magnitude, so the result can always be {@link #parse(String) parsed} back.
	 */
	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		long magnitude = theMicros;
		if (magnitude < 0) {
			str.append('-');
			magnitude = -magnitude;
		}
		long days = magnitude / TimeUtils.MICROS_PER_DAY;
		long rem = magnitude % TimeUtils.MICROS_PER_DAY;
		if (days != 0)
			str.append(days).append(days == 1 ? " day, " : " days, ");
		str.append(rem / TimeUtils.MICROS_PER_HOUR).append(':');
		TimeUtils.printInt((rem / TimeUtils.MICROS_PER_MINUTE) % 60, 2, str).append(':');
		TimeUtils.printInt((rem / TimeUtils.MICROS_PER_SECOND) % 60, 2, str);
		long micros = rem % TimeUtils.MICROS_PER_SECOND;
		if (micros != 0)
			TimeUtils.printInt(micros, 6, str.append('.'));
		return str.toString();
	}
}
