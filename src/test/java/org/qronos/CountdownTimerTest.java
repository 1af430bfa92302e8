package org.qronos;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link CountdownTimer} */
public class CountdownTimerTest {
	private static class ManualClock implements CountdownTimer.TimerClock {
		long now;

		@Override
		public long nowMicros() {
			return now;
		}
	}

	/** Tests a countdown that is paused and resumed */
	@Test
	public void testCountdown() {
		ManualClock clock = new ManualClock();
		CountdownTimer timer = new CountdownTimer(ElapsedTime.ofSeconds(10), clock);
		Assert.assertFalse(timer.isRunning());
		Assert.assertEquals(ElapsedTime.ZERO, timer.getElapsed());

		timer.start();
		clock.now += 4 * TimeUtils.MICROS_PER_SECOND;
		Assert.assertEquals(ElapsedTime.ofSeconds(4), timer.getElapsed());
		Assert.assertEquals(ElapsedTime.ofSeconds(6), timer.getRemaining());
		Assert.assertFalse(timer.isDone());

		timer.stop();
		clock.now += 100 * TimeUtils.MICROS_PER_SECOND;
		Assert.assertEquals(ElapsedTime.ofSeconds(4), timer.getElapsed());

		timer.start();
		clock.now += 7 * TimeUtils.MICROS_PER_SECOND;
		Assert.assertTrue(timer.isDone());
		Assert.assertEquals(ElapsedTime.ZERO, timer.getRemaining());
		Assert.assertEquals(ElapsedTime.ofSeconds(11), timer.getElapsed());

		timer.reset();
		Assert.assertFalse(timer.isRunning());
		Assert.assertEquals(ElapsedTime.ZERO, timer.getElapsed());
	}

	/** Tests a timer with no target */
	@Test
	public void testStopwatch() {
		ManualClock clock = new ManualClock();
		CountdownTimer timer = new CountdownTimer(null, clock).start();
		clock.now += 1500;
		Assert.assertEquals(ElapsedTime.ofMicros(1500), timer.getElapsed());
		Assert.assertFalse(timer.isDone());
		try {
			timer.getRemaining();
			Assert.fail("A stopwatch has no remaining time");
		} catch (IllegalStateException e) {
			// Expected
		}
	}
}
