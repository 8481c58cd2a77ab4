package com.github.cowwoc.admission;

import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class TokenBucketTest
{
	/**
	 * Long enough that the replenishment thread never ticks during a test.
	 */
	private static final Duration NEVER = Duration.ofHours(1);

	@Test
	public void startsFull()
	{
		try (TokenBucket bucket = TokenBucket.of(1, 7, NEVER))
		{
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isEqualTo(7L);
			requireThat(bucket.getState(), "bucket.getState()").isEqualTo(BucketState.RUNNING);
		}
	}

	@Test
	public void burstUpToCapacity()
	{
		try (TokenBucket bucket = TokenBucket.of(1, 10, NEVER))
		{
			for (int i = 0; i < 10; ++i)
				requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isZero();
		}
	}

	@Test
	public void rejectionDoesNotChangeState()
	{
		try (TokenBucket bucket = TokenBucket.of(1, 1, NEVER))
		{
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			for (int i = 0; i < 5; ++i)
				requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isZero();
		}
	}

	@Test
	public void refillAddsRate()
	{
		try (TokenBucket bucket = TokenBucket.of(3, 10, NEVER))
		{
			while (bucket.tryAcquire())
			{
				// drain
			}
			requireThat(bucket.refill(), "bucket.refill()").isTrue();
			for (int i = 0; i < 3; ++i)
				requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();
		}
	}

	@Test
	public void refillLargerThanCapacity()
	{
		try (TokenBucket bucket = TokenBucket.of(20, 5, NEVER))
		{
			while (bucket.tryAcquire())
			{
				// drain
			}
			requireThat(bucket.refill(), "bucket.refill()").isTrue();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isEqualTo(5L);
			for (int i = 0; i < 5; ++i)
				requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();
		}
	}

	@Test
	public void idleBucketIsCappedAtCapacity()
	{
		try (TokenBucket bucket = TokenBucket.of(3, 10, NEVER))
		{
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			for (int i = 0; i < 20; ++i)
				requireThat(bucket.refill(), "bucket.refill()").isTrue();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isEqualTo(10L);
		}
	}

	@Test
	public void refillDoesNotOverflow()
	{
		try (TokenBucket bucket = TokenBucket.of(Long.MAX_VALUE, Long.MAX_VALUE, NEVER))
		{
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.refill(), "bucket.refill()").isTrue();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").
				isEqualTo(Long.MAX_VALUE);
		}
	}

	@Test
	public void listenerSeesTokensAdded()
	{
		long[] observed = new long[2];
		BucketListener listener = new BucketListener()
		{
			@Override
			public void refilled(TokenBucket bucket, long tokensAdded, long availableTokens)
			{
				observed[0] = tokensAdded;
				observed[1] = availableTokens;
			}
		};
		try (TokenBucket bucket = TokenBucket.builder().
			capacity(4).
			rate(3).
			interval(NEVER).
			addListener(listener).
			build())
		{
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.refill(), "bucket.refill()").isTrue();
			requireThat(observed[0], "tokensAdded").isEqualTo(1L);
			requireThat(observed[1], "availableTokens").isEqualTo(4L);
		}
	}

	@Test
	public void failingListenerDoesNotPreventRefill()
	{
		BucketListener listener = new BucketListener()
		{
			@Override
			public void refilled(TokenBucket bucket, long tokensAdded, long availableTokens)
			{
				throw new IllegalStateException("listener failure");
			}
		};
		try (TokenBucket bucket = TokenBucket.builder().
			capacity(2).
			rate(1).
			interval(NEVER).
			addListener(listener).
			build())
		{
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.refill(), "bucket.refill()").isTrue();
			requireThat(bucket.getAvailableTokens(), "bucket.getAvailableTokens()").isEqualTo(2L);
		}
	}

	/**
	 * capacity=10, rate=1, interval=2s: ten immediate admissions, a rejection, then one admission per tick.
	 */
	@Test
	public void tenRequestBurstThenOnePerTwoSeconds() throws InterruptedException
	{
		CountDownLatch refilled = new CountDownLatch(1);
		BucketListener listener = new BucketListener()
		{
			@Override
			public void refilled(TokenBucket bucket, long tokensAdded, long availableTokens)
			{
				refilled.countDown();
			}
		};
		try (TokenBucket bucket = TokenBucket.builder().
			capacity(10).
			rate(1).
			interval(Duration.ofSeconds(2)).
			addListener(listener).
			build())
		{
			for (int i = 0; i < 10; ++i)
				requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();

			requireThat(refilled.await(10, TimeUnit.SECONDS), "refilled").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isTrue();
			requireThat(bucket.tryAcquire(), "bucket.tryAcquire()").isFalse();
		}
	}

	@Test
	public void builderDefaults()
	{
		TokenBucket.Builder builder = TokenBucket.builder();
		requireThat(builder.capacity(), "builder.capacity()").isEqualTo(10L);
		requireThat(builder.rate(), "builder.rate()").isEqualTo(1L);
		requireThat(builder.interval(), "builder.interval()").isEqualTo(Duration.ofSeconds(2));
	}

	@Test
	public void gettersReflectConfiguration()
	{
		try (TokenBucket bucket = TokenBucket.of(2, 5, NEVER))
		{
			requireThat(bucket.getRate(), "bucket.getRate()").isEqualTo(2L);
			requireThat(bucket.getCapacity(), "bucket.getCapacity()").isEqualTo(5L);
			requireThat(bucket.getInterval(), "bucket.getInterval()").isEqualTo(NEVER);
			requireThat(bucket.getListeners(), "bucket.getListeners()").isEmpty();
			requireThat(bucket.toString(), "bucket.toString()").contains("capacity=5");
		}
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rateMustBePositive()
	{
		TokenBucket.of(0, 10, NEVER);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void capacityMustBePositive()
	{
		TokenBucket.of(1, -1, NEVER);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void intervalMustBePositive()
	{
		TokenBucket.of(1, 10, Duration.ZERO);
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void intervalMayNotBeNull()
	{
		TokenBucket.of(1, 10, null);
	}
}
