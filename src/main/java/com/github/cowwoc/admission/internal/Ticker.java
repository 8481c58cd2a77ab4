package com.github.cowwoc.admission.internal;

import com.google.common.math.LongMath;

import java.time.Duration;
import java.util.function.LongSupplier;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Computes the deadlines of a periodic tick, relative to the time the ticker was started.
 * <p>
 * Ticks that were missed because the consumer fell behind are dropped, not replayed. The next deadline is
 * always the first multiple of the interval that lies in the future.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
public final class Ticker
{
	private final long intervalNanos;
	private final LongSupplier nanoTime;
	private final long startedAt;
	/**
	 * The number of intervals that have been consumed.
	 */
	private long ticks;
	private boolean stopped;

	/**
	 * Creates a ticker driven by {@link System#nanoTime()}.
	 *
	 * @param interval the time between ticks
	 * @throws NullPointerException     if {@code interval} is null
	 * @throws IllegalArgumentException if {@code interval} is zero or negative
	 */
	public Ticker(Duration interval)
	{
		this(interval, System::nanoTime);
	}

	/**
	 * Creates a ticker.
	 *
	 * @param interval the time between ticks
	 * @param nanoTime returns the current value of a monotonic clock, in nanoseconds
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws IllegalArgumentException if {@code interval} is zero or negative
	 */
	public Ticker(Duration interval, LongSupplier nanoTime)
	{
		requireThat(interval, "interval").isNotNull();
		requireThat(interval, "interval").isGreaterThan(Duration.ZERO);
		requireThat(nanoTime, "nanoTime").isNotNull();
		this.intervalNanos = toNanos(interval);
		this.nanoTime = nanoTime;
		this.startedAt = nanoTime.getAsLong();
	}

	/**
	 * Converts a duration to nanoseconds, saturating at {@code Long.MAX_VALUE}.
	 *
	 * @param duration a positive duration
	 * @return the number of nanoseconds
	 */
	private static long toNanos(Duration duration)
	{
		try
		{
			return duration.toNanos();
		}
		catch (ArithmeticException e)
		{
			// Roughly 292 years. The ticker will never fire.
			return Long.MAX_VALUE;
		}
	}

	/**
	 * Returns the time left until the next tick.
	 *
	 * @return the number of nanoseconds until the next tick; zero or negative if the tick is due.
	 *         {@code Long.MAX_VALUE} if the ticker is stopped.
	 */
	public long nanosUntilNextTick()
	{
		if (stopped)
			return Long.MAX_VALUE;
		long nextTickAt = LongMath.saturatedMultiply(ticks + 1, intervalNanos);
		return nextTickAt - elapsedNanos();
	}

	/**
	 * Consumes the tick that is due, along with any ticks that were missed before it.
	 *
	 * @return the number of ticks that were dropped because they were missed
	 * @throws IllegalStateException if no tick is due or the ticker is stopped
	 */
	public long advance()
	{
		if (stopped)
			throw new IllegalStateException("Ticker is stopped");
		long ticksDue = elapsedNanos() / intervalNanos;
		if (ticksDue <= ticks)
			throw new IllegalStateException("No tick is due. ticks: " + ticks + ", ticksDue: " + ticksDue);
		long dropped = ticksDue - ticks - 1;
		ticks = ticksDue;
		assertThat(r -> r.requireThat(dropped, "dropped").isNotNegative());
		return dropped;
	}

	/**
	 * Stops the ticker. Subsequent ticks will never become due.
	 */
	public void stop()
	{
		stopped = true;
	}

	/**
	 * Returns true if the ticker is stopped.
	 *
	 * @return true if the ticker is stopped
	 */
	public boolean isStopped()
	{
		return stopped;
	}

	/**
	 * @return the number of nanoseconds since the ticker was started
	 */
	private long elapsedNanos()
	{
		return nanoTime.getAsLong() - startedAt;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(Ticker.class).
			add("interval", Duration.ofNanos(intervalNanos)).
			add("ticks", ticks).
			add("stopped", stopped).
			toString();
	}
}
