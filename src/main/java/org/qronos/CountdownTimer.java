package org.qronos;

/**
 * A stopwatch that may also count down toward a target duration. Elapsed time accumulates only while the timer is running, so it may be
 * stopped and restarted.
 * <p>
 * This class is not thread-safe.
 * </p>
 */
public class CountdownTimer {
	/** Supplies the current time to a timer */
	public interface TimerClock {
		/** @return The current time in microseconds, from an arbitrary but fixed origin */
		long nowMicros();
	}

	/** A monotonic clock based on {@link System#nanoTime()} */
	public static class SystemClock implements TimerClock {
		@Override
		public long nowMicros() {
			return System.nanoTime() / 1000;
		}
	}

	private final TimerClock theClock;
	private final ElapsedTime theTarget;
	private long theAccumulated;
	private long theStartedAt;
	private boolean isRunning;

	/** Creates a stopwatch with no target */
	public CountdownTimer() {
		this(null);
	}

	/** @param target The duration to count down, or null for a plain stopwatch */
	public CountdownTimer(ElapsedTime target) {
		this(target, new SystemClock());
	}

	/**
	 * @param target The duration to count down, or null for a plain stopwatch
	 * @param clock The clock to measure time with
	 */
	public CountdownTimer(ElapsedTime target, TimerClock clock) {
		if (target != null && target.isNegative())
			throw new IllegalArgumentException("Countdown target must not be negative: " + target);
		theTarget = target;
		theClock = clock;
	}

	/** @return The duration this timer counts down, or null if it is a plain stopwatch */
	public ElapsedTime getTarget() {
		return theTarget;
	}

	/** @return Whether this timer is currently running */
	public boolean isRunning() {
		return isRunning;
	}

	/**
	 * Starts or resumes the timer. Has no effect if it is already running.
	 *
	 * @return This timer
	 */
	public CountdownTimer start() {
		if (!isRunning) {
			theStartedAt = theClock.nowMicros();
			isRunning = true;
		}
		return this;
	}

	/**
	 * Pauses the timer, keeping the time elapsed so far. Has no effect if it is not running.
	 *
	 * @return This timer
	 */
	public CountdownTimer stop() {
		if (isRunning) {
			theAccumulated += theClock.nowMicros() - theStartedAt;
			isRunning = false;
		}
		return this;
	}

	/**
	 * Stops the timer and clears the elapsed time
	 *
	 * @return This timer
	 */
	public CountdownTimer reset() {
		isRunning = false;
		theAccumulated = 0;
		return this;
	}

	/** @return The total time this timer has been running since it was created or {@link #reset() reset} */
	public ElapsedTime getElapsed() {
		long elapsed = theAccumulated;
		if (isRunning)
			elapsed += theClock.nowMicros() - theStartedAt;
		return ElapsedTime.ofMicros(elapsed);
	}

	/**
	 * @return The time left before the target is reached, never negative
	 * @throws IllegalStateException If this timer has no target
	 */
	public ElapsedTime getRemaining() throws IllegalStateException {
		if (theTarget == null)
			throw new IllegalStateException("This timer has no target");
		ElapsedTime remaining = theTarget.minus(getElapsed());
		return remaining.isNegative() ? ElapsedTime.ZERO : remaining;
	}

	/** @return Whether this timer has a target and has run at least that long */
	public boolean isDone() {
		return theTarget != null && getElapsed().compareTo(theTarget) >= 0;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append(getElapsed());
		if (theTarget != null)
			str.append('/').append(theTarget);
		return str.append(isRunning ? " (running)" : " (stopped)").toString();
	}
}
