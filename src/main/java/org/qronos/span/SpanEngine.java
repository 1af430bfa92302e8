package org.qronos.span;

import org.qronos.InvalidUnitException;
import org.qronos.RangeOverflowException;
import org.qronos.SpanUnit;
import org.qronos.TimeUtils;
import org.qronos.UtcInstant;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;

/**
 * Calendrical boundaries of instants and sequences over them.
 * <p>
 * Weeks start on Monday. Decades start on years divisible by 10 and centuries on years divisible by 100, so the century containing 2015
 * is 2000-2099. The end of a span is the last microsecond before the start of the next one.
 * </p>
 * <p>
 * The sequences returned by {@link #range(SpanUnit, UtcInstant, UtcInstant, int) range} and
 * {@link #spanRange(SpanUnit, UtcInstant, UtcInstant, int) spanRange} are lazy and may be iterated any number of times. They are
 * half-open: nothing at or after the end is produced. A sequence whose next value would fall outside the supported years simply ends.
 * </p>
 */
public class SpanEngine {
	private static final long MIN_MICROS = UtcInstant.MIN.getEpochMicros();
	private static final long MAX_MICROS = UtcInstant.MAX.getEpochMicros();

	private SpanEngine() {
	}

	/**
	 * @param unit The unit to truncate to
	 * @param instant The instant to truncate
	 * @return The first microsecond of the unit containing the instant
	 * @throws RangeOverflowException If the unit's start is before year {@value TimeUtils#MIN_YEAR}, e.g. the decade of year 5
	 */
	public static UtcInstant startOf(SpanUnit unit, UtcInstant instant) throws RangeOverflowException {
		return UtcInstant.ofEpochMicros(startMicros(unit, instant));
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param instant The instant to truncate
	 * @return The first microsecond of the unit containing the instant
	 * @throws InvalidUnitException If the unit name is not recognized
	 * @throws RangeOverflowException If the unit's start is before year {@value TimeUtils#MIN_YEAR}
	 */
	public static UtcInstant startOf(String unit, UtcInstant instant) throws InvalidUnitException, RangeOverflowException {
		return startOf(SpanUnit.parse(unit), instant);
	}

	/**
	 * @param unit The unit to get the end of
	 * @param instant The instant in the first unit
	 * @return The last microsecond of the unit containing the instant
	 * @throws RangeOverflowException If the end is outside the supported years
	 */
	public static UtcInstant endOf(SpanUnit unit, UtcInstant instant) throws RangeOverflowException {
		return endOf(unit, instant, 1);
	}

	/**
	 * @param unit The unit to get the end of
	 * @param instant The instant in the first unit
	 * @param count The number of units, counting the one containing the instant
	 * @return The last microsecond of the <code>count</code>th unit, starting with the one containing the instant
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @throws RangeOverflowException If the end is outside the supported years
	 */
	public static UtcInstant endOf(SpanUnit unit, UtcInstant instant, int count) throws IllegalArgumentException, RangeOverflowException {
		checkCount(count);
		return UtcInstant.ofEpochMicros(endMicros(unit, startMicros(unit, instant), count));
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param instant The instant in the first unit
	 * @param count The number of units, counting the one containing the instant
	 * @return The last microsecond of the <code>count</code>th unit, starting with the one containing the instant
	 * @throws InvalidUnitException If the unit name is not recognized
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @throws RangeOverflowException If the end is outside the supported years
	 */
	public static UtcInstant endOf(String unit, UtcInstant instant, int count)
		throws InvalidUnitException, IllegalArgumentException, RangeOverflowException {
		return endOf(SpanUnit.parse(unit), instant, count);
	}

	/**
	 * @param unit The unit to span
	 * @param instant The instant to span
	 * @return The start and end of the unit containing the instant
	 * @throws RangeOverflowException If the span is not entirely within the supported years
	 */
	public static SpanBoundary span(SpanUnit unit, UtcInstant instant) throws RangeOverflowException {
		return span(unit, instant, 1);
	}

	/**
	 * @param unit The unit to span
	 * @param instant The instant to span
	 * @param count The number of units in the span, counting the one containing the instant
	 * @return The start of the unit containing the instant and the end of the <code>count</code>th unit from there
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @throws RangeOverflowException If the span is not entirely within the supported years
	 */
	public static SpanBoundary span(SpanUnit unit, UtcInstant instant, int count) throws IllegalArgumentException, RangeOverflowException {
		checkCount(count);
		long start = startMicros(unit, instant);
		return new SpanBoundary(UtcInstant.ofEpochMicros(start), UtcInstant.ofEpochMicros(endMicros(unit, start, count)));
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param instant The instant to span
	 * @param count The number of units in the span, counting the one containing the instant
	 * @return The start of the unit containing the instant and the end of the <code>count</code>th unit from there
	 * @throws InvalidUnitException If the unit name is not recognized
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @throws RangeOverflowException If the span is not entirely within the supported years
	 */
	public static SpanBoundary span(String unit, UtcInstant instant, int count)
		throws InvalidUnitException, IllegalArgumentException, RangeOverflowException {
		return span(SpanUnit.parse(unit), instant, count);
	}

	/**
	 * @param unit The unit of each span
	 * @param start The instant in the first span
	 * @param end The instant to stop before. No span starting at or after this is produced.
	 * @param count The number of units in each span
	 * @return Consecutive spans of <code>count</code> units, the first starting at the start of the unit containing <code>start</code>
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @throws RangeOverflowException If the start of the unit containing <code>start</code> is before year {@value TimeUtils#MIN_YEAR}
	 */
	public static Iterable<SpanBoundary> spanRange(SpanUnit unit, UtcInstant start, UtcInstant end, int count)
		throws IllegalArgumentException, RangeOverflowException {
		checkCount(count);
		long first = startMicros(unit, start);
		long stop = end.getEpochMicros();
		return () -> new AbstractIterator<SpanBoundary>() {
			private long theNext = first;

			@Override
			protected SpanBoundary computeNext() {
				if (theNext >= stop || theNext < MIN_MICROS || theNext > MAX_MICROS)
					return endOfData();
				long spanEnd = endMicros(unit, theNext, count);
				if (spanEnd > MAX_MICROS)
					return endOfData();
				SpanBoundary span = new SpanBoundary(UtcInstant.ofEpochMicros(theNext), UtcInstant.ofEpochMicros(spanEnd));
				theNext = spanEnd + 1;
				return span;
			}
		};
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param start The instant in the first span
	 * @param end The instant to stop before
	 * @param count The number of units in each span
	 * @return Consecutive spans of <code>count</code> units
	 * @throws InvalidUnitException If the unit name is not recognized
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @see #spanRange(SpanUnit, UtcInstant, UtcInstant, int)
	 */
	public static Iterable<SpanBoundary> spanRange(String unit, UtcInstant start, UtcInstant end, int count)
		throws InvalidUnitException, IllegalArgumentException {
		return spanRange(SpanUnit.parse(unit), start, end, count);
	}

	/**
	 * Steps from one instant toward another. Calendar units are stepped from the start each time (the <code>n</code>th value is
	 * <code>start.plus(n*count, unit)</code>), so month-end days are clamped without drifting: stepping monthly from January 31st gives
	 * February 28th or 29th, then March 31st.
	 *
	 * @param unit The unit to step by
	 * @param start The first instant in the sequence
	 * @param end The instant to stop before. No value at or after this is produced.
	 * @param count The number of units in each step
	 * @return The instants from <code>start</code> toward <code>end</code>
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 */
	public static Iterable<UtcInstant> range(SpanUnit unit, UtcInstant start, UtcInstant end, int count) throws IllegalArgumentException {
		checkCount(count);
		long startMicros = start.getEpochMicros();
		long stop = end.getEpochMicros();
		return () -> new AbstractIterator<UtcInstant>() {
			private long theStep;

			@Override
			protected UtcInstant computeNext() {
				long next = TimeUtils.addUnits(startMicros, theStep * count, unit);
				if (next >= stop || next < MIN_MICROS || next > MAX_MICROS)
					return endOfData();
				theStep++;
				return UtcInstant.ofEpochMicros(next);
			}
		};
	}

	/**
	 * @param unit The unit name, singular or plural
	 * @param start The first instant in the sequence
	 * @param end The instant to stop before
	 * @param count The number of units in each step
	 * @return The instants from <code>start</code> toward <code>end</code>
	 * @throws InvalidUnitException If the unit name is not recognized
	 * @throws IllegalArgumentException If <code>count&lt;1</code>
	 * @see #range(SpanUnit, UtcInstant, UtcInstant, int)
	 */
	public static Iterable<UtcInstant> range(String unit, UtcInstant start, UtcInstant end, int count)
		throws InvalidUnitException, IllegalArgumentException {
		return range(SpanUnit.parse(unit), start, end, count);
	}

	private static void checkCount(int count) {
		Preconditions.checkArgument(count >= 1, "Count must be at least 1, not %s", count);
	}

	private static long startMicros(SpanUnit unit, UtcInstant instant) {
		long micros = instant.getEpochMicros();
		long epochDay = instant.getEpochDay();
		switch (unit) {
		case SECOND:
		case MINUTE:
		case HOUR:
		case DAY:
			return micros - Math.floorMod(micros, unit.getMicros());
		case WEEK:
			return (epochDay - (instant.getDayOfWeek() - 1)) * TimeUtils.MICROS_PER_DAY;
		case MONTH:
			return TimeUtils.toEpochDay(instant.getYear(), instant.getMonth(), 1) * TimeUtils.MICROS_PER_DAY;
		case YEAR:
			return TimeUtils.toEpochDay(instant.getYear(), 1, 1) * TimeUtils.MICROS_PER_DAY;
		case DECADE:
			return checkStart(unit, instant, TimeUtils.floorYear(instant.getYear(), 10));
		case CENTURY:
			return checkStart(unit, instant, TimeUtils.floorYear(instant.getYear(), 100));
		default:
			throw new IllegalStateException("Unrecognized unit: " + unit);
		}
	}

	private static long checkStart(SpanUnit unit, UtcInstant instant, int year) throws RangeOverflowException {
		if (year < TimeUtils.MIN_YEAR)
			throw new RangeOverflowException("The " + unit + " containing " + instant + " starts in year " + year + ", before year "
				+ TimeUtils.MIN_YEAR);
		return TimeUtils.toEpochDay(year, 1, 1) * TimeUtils.MICROS_PER_DAY;
	}

	/** The last microsecond of <code>count</code> units from a unit boundary. May be out of range. */
	private static long endMicros(SpanUnit unit, long start, int count) {
		long next = TimeUtils.addUnits(start, count, unit);
		return next == Long.MAX_VALUE ? next : next - 1;
	}
}
