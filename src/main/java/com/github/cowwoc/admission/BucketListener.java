package com.github.cowwoc.admission;

/**
 * Listens for bucket events.
 * <p>
 * Listeners are invoked by the replenishment thread without holding the bucket's lock. They must return
 * promptly because the next tick is not serviced until they do.
 */
public interface BucketListener
{
	/**
	 * Invoked after tokens were added to the bucket.
	 *
	 * @param bucket          the bucket
	 * @param tokensAdded     the number of tokens that were added (zero if the bucket was already full)
	 * @param availableTokens the number of tokens available immediately after the refill
	 */
	default void refilled(TokenBucket bucket, long tokensAdded, long availableTokens)
	{
	}

	/**
	 * Invoked once, after the replenishment thread has released its timer and before it exits.
	 *
	 * @param bucket the bucket
	 */
	default void stopped(TokenBucket bucket)
	{
	}
}
