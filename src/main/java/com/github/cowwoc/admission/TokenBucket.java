package com.github.cowwoc.admission;

import com.github.cowwoc.admission.annotation.CheckReturnValue;
import com.github.cowwoc.admission.internal.CloseableLock;
import com.github.cowwoc.admission.internal.LockAsResource;
import com.github.cowwoc.admission.internal.Ticker;
import com.github.cowwoc.admission.internal.ToStringBuilder;
import com.google.common.math.LongMath;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Admits or rejects units of work, one token per unit.
 * <p>
 * The bucket starts full. A dedicated thread adds {@code rate} tokens every {@code interval}, never
 * exceeding {@code capacity}. The thread runs until {@link #stop()} or {@link #close()} is invoked.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class TokenBucket implements AutoCloseable
{
	private static final ThreadFactory DEFAULT_THREAD_FACTORY = new ThreadFactoryBuilder().
		setNameFormat("token-bucket-refill-%d").
		setDaemon(true).
		build();
	private final long capacity;
	private final long rate;
	private final Duration interval;
	private final List<BucketListener> listeners;
	private final Thread refillThread;
	/**
	 * Guards {@code tokens} and {@code state}. See the {@link com.github.cowwoc.admission.internal locking
	 * policy} for more details.
	 */
	private final LockAsResource lock = new LockAsResource();
	/**
	 * Signalled when {@code state} changes.
	 */
	private final Condition stateChanged = lock.newCondition();
	private long tokens;
	private BucketState state = BucketState.RUNNING;
	private final Logger log = LoggerFactory.getLogger(TokenBucket.class);

	/**
	 * Builds a new bucket.
	 *
	 * @return a TokenBucket builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a running bucket.
	 *
	 * @param rate     the number of tokens to add every {@code interval}
	 * @param capacity the maximum number of tokens that the bucket may hold
	 * @param interval the time between refills
	 * @return a new bucket
	 * @throws NullPointerException     if {@code interval} is null
	 * @throws IllegalArgumentException if {@code rate}, {@code capacity} or {@code interval} are zero or
	 *                                  negative
	 */
	public static TokenBucket of(long rate, long capacity, Duration interval)
	{
		return builder().
			rate(rate).
			capacity(capacity).
			interval(interval).
			build();
	}

	/**
	 * Creates a new bucket. The replenishment thread is created but not started.
	 *
	 * @param capacity      the maximum number of tokens that the bucket may hold
	 * @param rate          the number of tokens to add every {@code interval}
	 * @param interval      the time between refills
	 * @param listeners     the event listeners associated with this bucket
	 * @param threadFactory creates the replenishment thread
	 */
	private TokenBucket(long capacity, long rate, Duration interval, List<BucketListener> listeners,
	                    ThreadFactory threadFactory)
	{
		// Assume that all preconditions are enforced by Builder
		this.capacity = capacity;
		this.rate = rate;
		this.interval = interval;
		this.listeners = List.copyOf(listeners);
		this.tokens = capacity;
		this.refillThread = threadFactory.newThread(this::refillLoop);
		if (refillThread == null)
			throw new IllegalArgumentException("threadFactory rejected the replenishment task");
	}

	/**
	 * Returns the maximum number of tokens that the bucket may hold.
	 *
	 * @return the maximum number of tokens that the bucket may hold
	 */
	public long getCapacity()
	{
		return capacity;
	}

	/**
	 * Returns the number of tokens added every {@link #getInterval() interval}.
	 *
	 * @return the number of tokens added every interval
	 */
	public long getRate()
	{
		return rate;
	}

	/**
	 * Returns the time between refills.
	 *
	 * @return the time between refills
	 */
	public Duration getInterval()
	{
		return interval;
	}

	/**
	 * Returns the event listeners associated with this bucket.
	 *
	 * @return an unmodifiable list
	 */
	public List<BucketListener> getListeners()
	{
		return listeners;
	}

	/**
	 * Returns the number of tokens that are available. The value may be stale by the time it is returned.
	 *
	 * @return the number of tokens that are available
	 */
	public long getAvailableTokens()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return tokens;
		}
	}

	/**
	 * Returns the lifecycle state of the bucket.
	 *
	 * @return the lifecycle state of the bucket
	 */
	public BucketState getState()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return state;
		}
	}

	/**
	 * Consumes a single token, only if one is available at the time of invocation. Consumption order is not
	 * guaranteed to be fair.
	 * <p>
	 * This method never waits for tokens. It may be invoked in any lifecycle state; once the bucket is
	 * stopped it only ever drains.
	 *
	 * @return true if the unit of work is admitted; false if it must be rejected
	 */
	@CheckReturnValue
	public boolean tryAcquire()
	{
		boolean admitted;
		long tokensLeft;
		try (CloseableLock ignored = lock.lock())
		{
			admitted = tokens > 0;
			if (admitted)
				--tokens;
			tokensLeft = tokens;
		}
		log.trace("admitted: {}, tokensLeft: {}", admitted, tokensLeft);
		return admitted;
	}

	/**
	 * Adds {@code rate} tokens to the bucket, discarding any tokens beyond {@code capacity}.
	 * <p>
	 * Invoked by the replenishment thread once per tick.
	 *
	 * @return false if the bucket is no longer running and no tokens were added
	 * @implNote This method acquires its own locks
	 */
	boolean refill()
	{
		long tokensAdded;
		long availableTokens;
		try (CloseableLock ignored = lock.lock())
		{
			if (state != BucketState.RUNNING)
				return false;
			long tokensBefore = tokens;
			tokens = Math.min(LongMath.saturatedAdd(tokens, rate), capacity);
			tokensAdded = tokens - tokensBefore;
			availableTokens = tokens;
		}
		assertThat(r ->
		{
			r.requireThat(tokensAdded, "tokensAdded").isNotNegative();
			r.requireThat(availableTokens, "availableTokens").isNotNegative().
				isLessThanOrEqualTo(capacity, "capacity");
		});
		log.debug("Refilled tokens. Current count: {}", availableTokens);
		for (BucketListener listener : listeners)
		{
			try
			{
				listener.refilled(this, tokensAdded, availableTokens);
			}
			catch (RuntimeException e)
			{
				log.warn("Listener {} failed after a refill", listener, e);
			}
		}
		return true;
	}

	/**
	 * Starts the replenishment thread.
	 */
	private void start()
	{
		refillThread.start();
		log.debug("Started {}", refillThread.getName());
	}

	/**
	 * The body of the replenishment thread. Refills the bucket on every tick until shutdown is requested.
	 */
	private void refillLoop()
	{
		Ticker ticker = new Ticker(interval);
		try
		{
			while (awaitNextTick(ticker))
				refill();
		}
		catch (InterruptedException e)
		{
			log.debug("{} was interrupted. Stopping.", refillThread.getName());
			Thread.currentThread().interrupt();
		}
		finally
		{
			ticker.stop();
			try (CloseableLock ignored = lock.lock())
			{
				state = BucketState.STOPPED;
				stateChanged.signalAll();
			}
			log.debug("Stopped {}", refillThread.getName());
			for (BucketListener listener : listeners)
			{
				try
				{
					listener.stopped(this);
				}
				catch (RuntimeException e)
				{
					log.warn("Listener {} failed after the bucket stopped", listener, e);
				}
			}
		}
	}

	/**
	 * Blocks until the next tick is due or shutdown is requested, whichever comes first.
	 *
	 * @param ticker the replenishment timer
	 * @return true if a tick is due; false if shutdown was requested
	 * @throws InterruptedException if the thread is interrupted while waiting
	 * @implNote This method acquires its own locks
	 */
	private boolean awaitNextTick(Ticker ticker) throws InterruptedException
	{
		try (CloseableLock ignored = lock.lock())
		{
			while (state == BucketState.RUNNING)
			{
				long nanosLeft = ticker.nanosUntilNextTick();
				if (nanosLeft <= 0)
				{
					long dropped = ticker.advance();
					if (dropped > 0)
						log.debug("Dropped {} missed ticks", dropped);
					return true;
				}
				stateChanged.awaitNanos(nanosLeft);
			}
			return false;
		}
	}

	/**
	 * Requests that the replenishment thread stop. No tokens are added once this method returns.
	 * <p>
	 * This method does not wait for the thread to exit (see {@link #awaitTermination(long, TimeUnit)}) and may
	 * be invoked any number of times.
	 *
	 * @return true if this invocation initiated the shutdown; false if shutdown had already been requested
	 */
	public boolean stop()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (state != BucketState.RUNNING)
				return false;
			state = BucketState.STOPPING;
			stateChanged.signalAll();
		}
		log.debug("Stopping {}", refillThread.getName());
		return true;
	}

	/**
	 * Blocks until the replenishment thread exits or the timeout elapses, whichever comes first.
	 *
	 * @param timeout the maximum amount of time to wait
	 * @param unit    the unit of {@code timeout}
	 * @return true if the bucket is {@link BucketState#STOPPED stopped}; false if the timeout elapsed first
	 * @throws NullPointerException     if {@code unit} is null
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 */
	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException
	{
		requireThat(timeout, "timeout").isNotNegative();
		requireThat(unit, "unit").isNotNull();
		long nanosLeft = unit.toNanos(timeout);
		try (CloseableLock ignored = lock.lock())
		{
			while (state != BucketState.STOPPED)
			{
				if (nanosLeft <= 0)
					return false;
				nanosLeft = stateChanged.awaitNanos(nanosLeft);
			}
			return true;
		}
	}

	/**
	 * Stops the bucket and waits for the replenishment thread to exit.
	 * <p>
	 * If the current thread is interrupted while waiting, the method returns early with the thread's
	 * interrupted status set. Invoking this method from a {@link BucketListener} only requests shutdown.
	 */
	@Override
	public void close()
	{
		stop();
		if (Thread.currentThread() == refillThread)
			return;
		try
		{
			while (!awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS))
				log.trace("Waiting for {} to exit", refillThread.getName());
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(TokenBucket.class).
				add("tokens", tokens).
				add("capacity", capacity).
				add("rate", rate).
				add("interval", interval).
				add("state", state).
				toString();
		}
	}

	/**
	 * Builds a bucket.
	 * <p>
	 * The defaults admit a burst of 10 units of work, then one unit every 2 seconds.
	 * <p>
	 * <b>Thread safety</b>: This class is not thread-safe.
	 */
	public static final class Builder
	{
		private long capacity = 10;
		private long rate = 1;
		private Duration interval = Duration.ofSeconds(2);
		private final List<BucketListener> listeners = new ArrayList<>();
		private ThreadFactory threadFactory = DEFAULT_THREAD_FACTORY;

		/**
		 * Builds a bucket.
		 */
		Builder()
		{
		}

		/**
		 * Returns the maximum number of tokens that the bucket may hold.
		 *
		 * @return the maximum number of tokens that the bucket may hold (default: 10)
		 */
		@CheckReturnValue
		public long capacity()
		{
			return capacity;
		}

		/**
		 * Sets the maximum number of tokens that the bucket may hold. The bucket starts out full.
		 *
		 * @param capacity the maximum number of tokens that the bucket may hold
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is zero or negative
		 */
		public Builder capacity(long capacity)
		{
			requireThat(capacity, "capacity").isPositive();
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the number of tokens to add every {@code interval}.
		 *
		 * @return the number of tokens to add every {@code interval} (default: 1)
		 */
		@CheckReturnValue
		public long rate()
		{
			return rate;
		}

		/**
		 * Sets the number of tokens to add every {@code interval}.
		 *
		 * @param rate the number of tokens to add every {@code interval}
		 * @return this
		 * @throws IllegalArgumentException if {@code rate} is zero or negative
		 */
		public Builder rate(long rate)
		{
			requireThat(rate, "rate").isPositive();
			this.rate = rate;
			return this;
		}

		/**
		 * Returns the time between refills.
		 *
		 * @return the time between refills (default: 2 seconds)
		 */
		@CheckReturnValue
		public Duration interval()
		{
			return interval;
		}

		/**
		 * Sets the time between refills.
		 *
		 * @param interval the time between refills
		 * @return this
		 * @throws NullPointerException     if {@code interval} is null
		 * @throws IllegalArgumentException if {@code interval} is zero or negative
		 */
		public Builder interval(Duration interval)
		{
			requireThat(interval, "interval").isNotNull();
			requireThat(interval, "interval").isGreaterThan(Duration.ZERO);
			this.interval = interval;
			return this;
		}

		/**
		 * Adds an event listener to the bucket.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		public Builder addListener(BucketListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Sets the factory of the replenishment thread. By default, the thread is a daemon named
		 * {@code token-bucket-refill-<n>}.
		 *
		 * @param threadFactory creates the replenishment thread
		 * @return this
		 * @throws NullPointerException if {@code threadFactory} is null
		 */
		public Builder threadFactory(ThreadFactory threadFactory)
		{
			requireThat(threadFactory, "threadFactory").isNotNull();
			this.threadFactory = threadFactory;
			return this;
		}

		/**
		 * Builds a new bucket and starts refilling it.
		 *
		 * @return a new TokenBucket
		 * @throws IllegalArgumentException if {@code threadFactory} returns {@code null}
		 */
		public TokenBucket build()
		{
			TokenBucket bucket = new TokenBucket(capacity, rate, interval, listeners, threadFactory);
			bucket.start();
			return bucket;
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("capacity", capacity).
				add("rate", rate).
				add("interval", interval).
				add("listeners", listeners).
				toString();
		}
	}
}
