package org.qronos.span;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qronos.ElapsedTime;
import org.qronos.InvalidUnitException;
import org.qronos.RangeOverflowException;
import org.qronos.SpanUnit;
import org.qronos.UtcInstant;

/** Tests for {@link SpanEngine} and {@link SpanBoundary} */
public class SpanEngineTest {
	private static final UtcInstant SAMPLE = UtcInstant.of(2015, 4, 4, 12, 30, 37, 651_839);

	private static <T> List<T> list(Iterable<T> iterable) {
		List<T> list = new ArrayList<>();
		for (T value : iterable)
			list.add(value);
		return list;
	}

	/** Tests the start and end of each unit */
	@Test
	public void testSpans() {
		Assert.assertEquals(new SpanBoundary(UtcInstant.of(2010, 1, 1), UtcInstant.of(2019, 12, 31, 23, 59, 59, 999_999)),
			SpanEngine.span(SpanUnit.DECADE, SAMPLE));
		Assert.assertEquals(new SpanBoundary(UtcInstant.of(2000, 1, 1), UtcInstant.of(2099, 12, 31, 23, 59, 59, 999_999)),
			SpanEngine.span(SpanUnit.CENTURY, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 1, 1), SpanEngine.startOf(SpanUnit.YEAR, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 1), SpanEngine.startOf(SpanUnit.MONTH, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 4), SpanEngine.startOf(SpanUnit.DAY, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 4, 12, 0, 0), SpanEngine.startOf(SpanUnit.HOUR, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 4, 12, 30, 0), SpanEngine.startOf(SpanUnit.MINUTE, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 4, 12, 30, 37), SpanEngine.startOf(SpanUnit.SECOND, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 30, 23, 59, 59, 999_999), SpanEngine.endOf(SpanUnit.MONTH, SAMPLE));
		Assert.assertEquals(UtcInstant.of(2015, 4, 4, 12, 30, 37, 999_999), SpanEngine.endOf(SpanUnit.SECOND, SAMPLE));

		// Weeks start on Monday
		Assert.assertEquals(UtcInstant.of(2016, 7, 25), SpanEngine.startOf(SpanUnit.WEEK, UtcInstant.of(2016, 7, 25)));
		Assert.assertEquals(UtcInstant.of(2016, 7, 25), SpanEngine.startOf(SpanUnit.WEEK, UtcInstant.of(2016, 7, 27, 8, 0, 0)));
		Assert.assertEquals(UtcInstant.of(2016, 7, 25), SpanEngine.startOf(SpanUnit.WEEK, UtcInstant.of(2016, 7, 31, 23, 0, 0)));
		Assert.assertEquals(UtcInstant.of(2016, 7, 31, 23, 59, 59, 999_999), SpanEngine.endOf(SpanUnit.WEEK, UtcInstant.of(2016, 7, 27)));

		// Multiple units
		Assert.assertEquals(UtcInstant.of(2016, 2, 29, 23, 59, 59, 999_999), SpanEngine.endOf(SpanUnit.MONTH, UtcInstant.of(2016, 1, 15), 2));
		Assert.assertEquals(new SpanBoundary(UtcInstant.of(2015, 1, 1), UtcInstant.of(2017, 12, 31, 23, 59, 59, 999_999)),
			SpanEngine.span("years", SAMPLE, 3));
	}

	/** Tests that an instant is always within its own span */
	@Test
	public void testContainment() {
		UtcInstant[] instants = { SAMPLE, UtcInstant.of(2016, 2, 29, 23, 59, 59, 999_999), UtcInstant.of(1969, 12, 31, 12, 0, 0),
			UtcInstant.of(2000, 1, 1), UtcInstant.of(100, 6, 15) };
		for (UtcInstant instant : instants) {
			for (SpanUnit unit : SpanUnit.values()) {
				SpanBoundary span = SpanEngine.span(unit, instant);
				Assert.assertTrue(unit + " " + instant, span.contains(instant));
				Assert.assertFalse(span.getStart().isAfter(instant));
				Assert.assertFalse(span.getEnd().isBefore(instant));
				Assert.assertEquals(span.getStart(), SpanEngine.startOf(unit, span.getEnd()));
			}
		}
	}

	/** Tests spans at the edges of the supported years */
	@Test
	public void testLimits() {
		Assert.assertEquals(UtcInstant.MAX, SpanEngine.endOf(SpanUnit.YEAR, UtcInstant.MAX));
		Assert.assertEquals(UtcInstant.MAX, SpanEngine.endOf(SpanUnit.DECADE, UtcInstant.of(9995, 1, 1)));
		Assert.assertEquals(UtcInstant.MAX, SpanEngine.endOf(SpanUnit.CENTURY, UtcInstant.of(9950, 1, 1)));
		Assert.assertEquals(UtcInstant.MIN, SpanEngine.startOf(SpanUnit.WEEK, UtcInstant.of(1, 1, 3)));
		Assert.assertEquals(UtcInstant.MIN, SpanEngine.startOf(SpanUnit.YEAR, UtcInstant.MIN));
		try {
			SpanEngine.endOf(SpanUnit.YEAR, UtcInstant.MAX, 2);
			Assert.fail("Past year 9999");
		} catch (RangeOverflowException e) {
			// Expected
		}
		try {
			SpanEngine.startOf(SpanUnit.DECADE, UtcInstant.of(5, 1, 1));
			Assert.fail("The first decade starts in year 0");
		} catch (RangeOverflowException e) {
			// Expected
		}
		try {
			SpanEngine.span(SpanUnit.DAY, SAMPLE, 0);
			Assert.fail("Count must be positive");
		} catch (IllegalArgumentException e) {
			// Expected
		}
		try {
			SpanEngine.startOf("fortnight", SAMPLE);
			Assert.fail("Not a unit");
		} catch (InvalidUnitException e) {
			Assert.assertEquals("fortnight", e.getUnit());
		}
	}

	/** Tests stepping from one instant to another */
	@Test
	public void testRange() {
		Iterable<UtcInstant> hours = SpanEngine.range(SpanUnit.HOUR, SAMPLE, SAMPLE.plus(3, SpanUnit.HOUR), 1);
		List<UtcInstant> values = list(hours);
		Assert.assertEquals(Arrays.asList(SAMPLE, SAMPLE.plus(1, SpanUnit.HOUR), SAMPLE.plus(2, SpanUnit.HOUR)), values);
		// Ranges may be iterated again
		Assert.assertEquals(values, list(hours));

		Assert.assertEquals(Arrays.asList(UtcInstant.of(2016, 1, 31), UtcInstant.of(2016, 2, 29), UtcInstant.of(2016, 3, 31),
			UtcInstant.of(2016, 4, 30)), list(SpanEngine.range(SpanUnit.MONTH, UtcInstant.of(2016, 1, 31), UtcInstant.of(2016, 5, 1), 1)));
		Assert.assertEquals(Arrays.asList(UtcInstant.of(2016, 2, 29), UtcInstant.of(2018, 2, 28), UtcInstant.of(2020, 2, 29)),
			list(SpanEngine.range("years", UtcInstant.of(2016, 2, 29), UtcInstant.of(2021, 1, 1), 2)));
		Assert.assertEquals(3, list(SpanEngine.range(SpanUnit.MONTH, UtcInstant.of(9999, 10, 1), UtcInstant.MAX, 1)).size());

		Assert.assertTrue(list(SpanEngine.range(SpanUnit.DAY, SAMPLE, SAMPLE, 1)).isEmpty());
		Assert.assertTrue(list(SpanEngine.range(SpanUnit.DAY, SAMPLE, UtcInstant.EPOCH, 1)).isEmpty());
		try {
			SpanEngine.range(SpanUnit.DAY, SAMPLE, UtcInstant.MAX, 0);
			Assert.fail("Count must be positive");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}

	/** Tests stepping through spans */
	@Test
	public void testSpanRange() {
		List<SpanBoundary> weeks = list(SpanEngine.spanRange(SpanUnit.WEEK, UtcInstant.of(2016, 7, 27), UtcInstant.of(2016, 8, 9), 1));
		Assert.assertEquals(3, weeks.size());
		Assert.assertEquals(UtcInstant.of(2016, 7, 25), weeks.get(0).getStart());
		Assert.assertEquals(UtcInstant.of(2016, 8, 1), weeks.get(1).getStart());
		Assert.assertEquals(UtcInstant.of(2016, 8, 14, 23, 59, 59, 999_999), weeks.get(2).getEnd());

		List<SpanBoundary> quarters = list(SpanEngine.spanRange("months", SAMPLE, UtcInstant.of(2016, 1, 1), 3));
		Assert.assertEquals(3, quarters.size());
		Assert.assertEquals(new SpanBoundary(UtcInstant.of(2015, 10, 1), UtcInstant.of(2015, 12, 31, 23, 59, 59, 999_999)),
			quarters.get(2));

		// The last span would extend past year 9999
		Assert.assertEquals(1, list(SpanEngine.spanRange(SpanUnit.YEAR, UtcInstant.of(9997, 1, 1), UtcInstant.MAX, 2)).size());
		Assert.assertTrue(list(SpanEngine.spanRange(SpanUnit.DAY, SAMPLE, UtcInstant.EPOCH, 1)).isEmpty());
	}

	/** Tests {@link SpanBoundary} itself */
	@Test
	public void testBoundary() {
		SpanBoundary day = SpanEngine.span(SpanUnit.DAY, SAMPLE);
		Assert.assertEquals(ElapsedTime.ofSeconds(86400), day.getLength());
		Assert.assertEquals("(2015-04-04T00:00:00+00:00, 2015-04-04T23:59:59.999999+00:00)", day.toString());
		Assert.assertFalse(day.contains(UtcInstant.of(2015, 4, 5)));
		try {
			new SpanBoundary(UtcInstant.of(2015, 4, 5), UtcInstant.of(2015, 4, 4));
			Assert.fail("End before start");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}
}
