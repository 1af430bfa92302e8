package org.qronos;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link ElapsedTime} */
public class ElapsedTimeTest {
	/** Tests the normalized components of positive and negative durations */
	@Test
	public void testComponents() {
		ElapsedTime time = ElapsedTime.of(1, 3, 2, 32, 0, 0);
		Assert.assertEquals(873_120L * TimeUtils.MICROS_PER_SECOND, time.getTotalMicros());
		Assert.assertEquals(10, time.getDays());
		Assert.assertEquals(2 * 3600 + 32 * 60, time.getSeconds());
		Assert.assertEquals(0, time.getMicroseconds());

		ElapsedTime negative = ElapsedTime.ofSeconds(-1.25);
		Assert.assertTrue(negative.isNegative());
		Assert.assertEquals(-1, negative.getDays());
		Assert.assertEquals(86398, negative.getSeconds());
		Assert.assertEquals(750_000, negative.getMicroseconds());
		Assert.assertEquals(-1.25, negative.getTotalSeconds(), 0.0);
	}

	/** Tests the arithmetic operations */
	@Test
	public void testArithmetic() {
		ElapsedTime hour = ElapsedTime.of(1, SpanUnit.HOUR);
		ElapsedTime minute = ElapsedTime.of(1, SpanUnit.MINUTE);
		Assert.assertEquals(ElapsedTime.of(0, 0, 1, 1, 0, 0), hour.plus(minute));
		Assert.assertEquals(ElapsedTime.of(0, 0, 0, 59, 0, 0), hour.minus(minute));
		Assert.assertEquals(ElapsedTime.ofSeconds(-3600), hour.negated());
		Assert.assertEquals(hour, hour.negated().abs());
		Assert.assertEquals(ElapsedTime.of(0, 0, 0, 90, 0, 0), hour.multipliedBy(1.5));
		Assert.assertEquals(ElapsedTime.of(0, 0, 0, 20, 0, 0), hour.dividedBy(3));
		Assert.assertEquals(60.0, hour.dividedBy(minute), 0.0);
		Assert.assertTrue(minute.compareTo(hour) < 0);
		Assert.assertTrue(ElapsedTime.ZERO.isZero());
		try {
			ElapsedTime.of(1, SpanUnit.MONTH);
			Assert.fail("Months have no fixed length");
		} catch (InvalidUnitException e) {
			Assert.assertEquals("month", e.getUnit());
		}
	}

	/** Tests the clock form printed by {@link ElapsedTime#toString()} and that it parses back */
	@Test
	public void testClockForm() throws TimeParseException {
		Assert.assertEquals("10 days, 2:32:00", ElapsedTime.of(1, 3, 2, 32, 0, 0).toString());
		Assert.assertEquals("1 day, 0:00:00", ElapsedTime.of(0, 1, 0, 0, 0, 0).toString());
		Assert.assertEquals("0:00:00", ElapsedTime.ZERO.toString());
		Assert.assertEquals("-0:00:01", ElapsedTime.ofSeconds(-1).toString());
		Assert.assertEquals("2 days, 4:13:02.266000", ElapsedTime.of(0, 2, 4, 13, 2, 266_000).toString());

		for (ElapsedTime time : new ElapsedTime[] { ElapsedTime.ZERO, ElapsedTime.RESOLUTION, ElapsedTime.ofSeconds(-1),
			ElapsedTime.of(0, -1, 0, 0, 0, 0), ElapsedTime.of(1, 3, 2, 32, 0, 0), ElapsedTime.ofMicros(-123_456_789_012L) })
			Assert.assertEquals(time, ElapsedTime.parse(time.toString()));
	}

	/** Tests the extremes of the range */
	@Test
	public void testExtremes() throws TimeParseException {
		ElapsedTime max = ElapsedTime.ofMicros(Long.MAX_VALUE);
		ElapsedTime min = ElapsedTime.ofMicros(-Long.MAX_VALUE);
		Assert.assertEquals(min, max.negated());
		Assert.assertEquals("-106751991 days, 4:00:54.775807", min.toString());
		Assert.assertEquals(min, ElapsedTime.parse(min.toString()));
		try {
			ElapsedTime.ofMicros(Long.MIN_VALUE);
			Assert.fail("Cannot be negated");
		} catch (ArithmeticException e) {
			// Expected
		}
		try {
			min.minus(ElapsedTime.RESOLUTION);
			Assert.fail("Out of range");
		} catch (ArithmeticException e) {
			// Expected
		}
	}
}
