package org.qronos;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.qronos.span.SpanBoundary;

/** Tests for the {@link Qronos} shortcuts */
public class QronosTest {
	/** Tests parsing through the shortcuts */
	@Test
	public void testParse() throws TimeParseException {
		UtcInstant expected = UtcInstant.of(2016, 7, 25, 19, 33, 18);
		Assert.assertEquals(expected, Qronos.parse("2016-07-25T19:33:18Z"));
		Assert.assertEquals(expected, Qronos.parse(1469475198.0));
		Assert.assertEquals(expected, Qronos.parse("07/25/2016 13:33:18", "America/Denver", "MM/dd/yyyy HH:mm:ss"));
		Assert.assertEquals(expected, Qronos.parse("2016-07-25 19:33:18", null));
		Assert.assertEquals(ElapsedTime.of(1, 3, 2, 32, 0, 0), Qronos.parseDuration("1w 3d 2h 32m"));
		Assert.assertFalse(Qronos.now().isBefore(expected));
	}

	/** Tests the sequence shortcuts */
	@Test
	public void testRanges() {
		List<UtcInstant> days = new ArrayList<>();
		for (UtcInstant day : Qronos.range("days", UtcInstant.of(2016, 2, 27), UtcInstant.of(2016, 3, 2)))
			days.add(day);
		Assert.assertEquals(4, days.size());
		Assert.assertEquals(UtcInstant.of(2016, 2, 29), days.get(2));

		List<SpanBoundary> years = new ArrayList<>();
		for (SpanBoundary year : Qronos.spanRange("year", UtcInstant.of(2014, 6, 1), UtcInstant.of(2016, 1, 1)))
			years.add(year);
		Assert.assertEquals(2, years.size());
		Assert.assertEquals(UtcInstant.of(2015, 1, 1), years.get(1).getStart());
		Assert.assertEquals(UtcInstant.of(2015, 12, 31, 23, 59, 59, 999999), years.get(1).getEnd());
	}
}
