package org.qronos;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link SpanUnit} */
public class SpanUnitTest {
	/** Tests unit name resolution */
	@Test
	public void testParse() {
		Assert.assertEquals(SpanUnit.DAY, SpanUnit.parse("day"));
		Assert.assertEquals(SpanUnit.DAY, SpanUnit.parse("Days"));
		Assert.assertEquals(SpanUnit.CENTURY, SpanUnit.parse("centuries"));
		Assert.assertEquals(SpanUnit.CENTURY, SpanUnit.parse("CENTURY"));
		Assert.assertEquals(SpanUnit.DECADE, SpanUnit.parse(" decades "));
		try {
			SpanUnit.parse("fortnight");
			Assert.fail("Unrecognized unit");
		} catch (InvalidUnitException e) {
			Assert.assertEquals("fortnight", e.getUnit());
			Assert.assertTrue(e.getMessage(), e.getMessage().contains("century|decade|year|month|week|day|hour|minute|second"));
		}
	}

	/** Tests fixed and nominal unit lengths */
	@Test
	public void testLengths() {
		Assert.assertFalse(SpanUnit.WEEK.isCalendarBased());
		Assert.assertTrue(SpanUnit.MONTH.isCalendarBased());
		Assert.assertEquals(TimeUtils.MICROS_PER_WEEK, SpanUnit.WEEK.getMicros());
		Assert.assertEquals(30L * 86400, SpanUnit.MONTH.getNominalSeconds());
		Assert.assertEquals(365L * 86400, SpanUnit.YEAR.getNominalSeconds());
		Assert.assertEquals(36500L * 86400, SpanUnit.CENTURY.getNominalSeconds());
	}
}
