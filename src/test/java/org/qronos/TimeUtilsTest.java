package org.qronos;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link TimeUtils} */
public class TimeUtilsTest {
	/** Tests the conversions between civil dates and epoch days */
	@Test
	public void testEpochDays() {
		Assert.assertEquals(0, TimeUtils.toEpochDay(1970, 1, 1));
		Assert.assertEquals(11017, TimeUtils.toEpochDay(2000, 3, 1));
		Assert.assertEquals(-1, TimeUtils.toEpochDay(1969, 12, 31));
		Assert.assertArrayEquals(new long[] { 1969, 12, 31 }, TimeUtils.fromEpochDay(-1));
		Assert.assertArrayEquals(new long[] { 2000, 2, 29 }, TimeUtils.fromEpochDay(11016));
		Assert.assertArrayEquals(new long[] { 1, 1, 1 }, TimeUtils.fromEpochDay(TimeUtils.toEpochDay(1, 1, 1)));
		Assert.assertArrayEquals(new long[] { 9999, 12, 31 }, TimeUtils.fromEpochDay(TimeUtils.toEpochDay(9999, 12, 31)));
		for (long day = TimeUtils.toEpochDay(1899, 12, 1); day < TimeUtils.toEpochDay(1901, 3, 1); day++) {
			long[] date = TimeUtils.fromEpochDay(day);
			Assert.assertEquals(day, TimeUtils.toEpochDay(date[0], (int) date[1], (int) date[2]));
		}
	}

	/** Tests leap years, month lengths, days of the year and days of the week */
	@Test
	public void testCalendarFields() {
		Assert.assertTrue(TimeUtils.isLeapYear(2000));
		Assert.assertTrue(TimeUtils.isLeapYear(2016));
		Assert.assertFalse(TimeUtils.isLeapYear(1900));
		Assert.assertFalse(TimeUtils.isLeapYear(2015));
		Assert.assertEquals(29, TimeUtils.getDaysInMonth(2016, 2));
		Assert.assertEquals(28, TimeUtils.getDaysInMonth(1900, 2));
		Assert.assertEquals(31, TimeUtils.getDaysInMonth(2016, 12));
		Assert.assertEquals(366, TimeUtils.getDayOfYear(2016, 12, 31));
		Assert.assertEquals(60, TimeUtils.getDayOfYear(2015, 3, 1));
		Assert.assertEquals(4, TimeUtils.getDayOfWeek(0)); // Thursday
		Assert.assertEquals(1, TimeUtils.getDayOfWeek(TimeUtils.toEpochDay(1, 1, 1))); // Monday
		Assert.assertEquals(7, TimeUtils.getDayOfWeek(TimeUtils.toEpochDay(2016, 7, 24))); // Sunday
	}

	/** Tests {@link TimeUtils#floorYear(int, int)} */
	@Test
	public void testFloorYear() {
		Assert.assertEquals(2010, TimeUtils.floorYear(2015, 10));
		Assert.assertEquals(2000, TimeUtils.floorYear(2015, 100));
		Assert.assertEquals(2000, TimeUtils.floorYear(2000, 100));
		Assert.assertEquals(0, TimeUtils.floorYear(5, 10));
	}

	/** Tests calendar-correct unit addition */
	@Test
	public void testAddUnits() {
		long jan31 = TimeUtils.toEpochDay(2016, 1, 31) * TimeUtils.MICROS_PER_DAY;
		Assert.assertEquals(TimeUtils.toEpochDay(2016, 2, 29) * TimeUtils.MICROS_PER_DAY, TimeUtils.addUnits(jan31, 1, SpanUnit.MONTH));
		Assert.assertEquals(TimeUtils.toEpochDay(2015, 12, 31) * TimeUtils.MICROS_PER_DAY, TimeUtils.addUnits(jan31, -1, SpanUnit.MONTH));
		Assert.assertEquals(TimeUtils.toEpochDay(2026, 1, 31) * TimeUtils.MICROS_PER_DAY, TimeUtils.addUnits(jan31, 1, SpanUnit.DECADE));
		Assert.assertEquals(jan31 + 3 * TimeUtils.MICROS_PER_WEEK, TimeUtils.addUnits(jan31, 3, SpanUnit.WEEK));
		// One year past the supported range is still computed, more is saturated
		Assert.assertEquals(TimeUtils.toEpochDay(10000, 1, 31) * TimeUtils.MICROS_PER_DAY,
			TimeUtils.addUnits(jan31, 10000 - 2016, SpanUnit.YEAR));
		Assert.assertEquals(Long.MAX_VALUE, TimeUtils.addUnits(jan31, 81, SpanUnit.CENTURY));
	}

	/** Tests {@link TimeUtils#secondsToMicros(double)} */
	@Test
	public void testSecondsToMicros() {
		Assert.assertEquals(1_500_000, TimeUtils.secondsToMicros(1.5));
		Assert.assertEquals(-250_000, TimeUtils.secondsToMicros(-0.25));
		Assert.assertEquals(1_469_475_198_000_000L, TimeUtils.secondsToMicros(1469475198.0));
	}

	/** Tests {@link TimeUtils#printInt(long, int, StringBuilder)} and {@link TimeUtils#printOffset(int, boolean, StringBuilder)} */
	@Test
	public void testPrinting() {
		Assert.assertEquals("0042", TimeUtils.printInt(42, 4, null).toString());
		Assert.assertEquals("-07", TimeUtils.printInt(-7, 2, null).toString());
		Assert.assertEquals("12345", TimeUtils.printInt(12345, 2, null).toString());
		Assert.assertEquals("+0100", TimeUtils.printOffset(3600, false, new StringBuilder()).toString());
		Assert.assertEquals("-05:30", TimeUtils.printOffset(-19800, true, new StringBuilder()).toString());
		Assert.assertEquals("+00:00", TimeUtils.printOffset(0, true, new StringBuilder()).toString());
		Assert.assertEquals("+01:02:03", TimeUtils.printOffset(3723, true, new StringBuilder()).toString());
	}
}
