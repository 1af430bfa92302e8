package org.qronos.parse;

import org.junit.Assert;
import org.junit.Test;
import org.qronos.ElapsedTime;
import org.qronos.TimeParseException;
import org.qronos.TimeUtils;

/** Tests for {@link DurationGrammar} */
public class DurationGrammarTest {
	private static void assertSeconds(double expected, String text) throws TimeParseException {
		Assert.assertEquals(text, ElapsedTime.ofSeconds(expected), DurationGrammar.parse(text));
	}

	private static TimeParseException assertFails(String text) {
		try {
			ElapsedTime time = DurationGrammar.parse(text);
			Assert.fail("Expected \"" + text + "\" to fail, but got " + time);
			return null;
		} catch (TimeParseException e) {
			Assert.assertEquals(text, e.getValue());
			return e;
		}
	}

	/** Tests the unit grammar */
	@Test
	public void testUnits() throws TimeParseException {
		assertSeconds(873_120, "1w 3d 2h 32m");
		assertSeconds(2 * 86400 + 5 * 3600 + 34 * 60, "2 days, 5 hours and 34 minutes");
		assertSeconds(2 * 86400 + 5 * 3600 + 34 * 60 + 56, "2 days, 5 hours, 34 minutes, 56 seconds");
		assertSeconds(5400, "1 hour and 30 minutes");
		assertSeconds(5400, "1.5h");
		assertSeconds(5400, "1.5hrs");
		assertSeconds(5400, "1 HR 30 Min");
		assertSeconds(150, "2,5 min");
		assertSeconds(604_800, "1 wk.");
		assertSeconds(43_200, "0.5 days");
		assertSeconds(30, "30sec");
		assertSeconds(1800, "1h -30m");
		assertSeconds(32, "32");
		assertSeconds(1.5, "1.5");
		assertSeconds(-5400, "-1h 30m");
		assertSeconds(-5400, "- 1h 30m");
		assertSeconds(5400, "+1h 30m");
	}

	/** Tests the clock grammar */
	@Test
	public void testClock() throws TimeParseException {
		Assert.assertEquals(ElapsedTime.of(0, 2, 4, 13, 2, 266_000), DurationGrammar.parse("2:04:13:02.266"));
		assertSeconds(4 * 3600 + 13 * 60 + 2, "4:13:02");
		assertSeconds(253, "4:13");
		assertSeconds(253.5, "4:13.5");
		assertSeconds(873_120, "10 days, 2:32:00");
		assertSeconds(86_400, "1 day, 0:00:00");
		assertSeconds(-1, "-0:00:01");
		// Hours are not limited in the short forms
		assertSeconds(30 * 3600, "30:00:00");
	}

	/** Tests text that is not a duration */
	@Test
	public void testFailures() {
		TimeParseException e = assertFails("abc");
		Assert.assertEquals(1, e.getAttempts().size());
		Assert.assertEquals(DurationGrammar.UNIT_GRAMMAR, e.getAttempts().get(0).getCandidate());

		e = assertFails("5:99:00");
		Assert.assertEquals(DurationGrammar.CLOCK_GRAMMAR, e.getAttempts().get(0).getCandidate());
		Assert.assertTrue(e.getMessage(), e.getMessage().contains("minutes"));

		Assert.assertTrue(assertFails("1 fortnight").getMessage().contains("fortnight"));
		assertFails("1h 32");
		assertFails("1:2:3:4:5");
		assertFails("4:61");
		assertFails("h");
		assertFails("");
		assertFails("-");
		assertFails("   ");
		try {
			DurationGrammar.parse((String) null);
			Assert.fail("Null is not a duration");
		} catch (TimeParseException ex) {
			// Expected
		}
	}

	/** Tests durations from numbers of seconds */
	@Test
	public void testNumeric() {
		Assert.assertEquals(1_500_000, DurationGrammar.parse(1.5).getTotalMicros());
		Assert.assertEquals(-TimeUtils.MICROS_PER_SECOND, DurationGrammar.parse(-1).getTotalMicros());
		try {
			DurationGrammar.parse(Double.NaN);
			Assert.fail("NaN is not a duration");
		} catch (ArithmeticException e) {
			// Expected
		}
	}
}
