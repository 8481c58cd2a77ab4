package com.github.cowwoc.admission;

/**
 * The lifecycle of a {@link TokenBucket}.
 * <p>
 * States only ever move forward: {@code RUNNING -> STOPPING -> STOPPED}.
 */
public enum BucketState
{
	/**
	 * Tokens are replenished every interval.
	 */
	RUNNING,
	/**
	 * Shutdown was requested but the replenishment thread has not exited yet. No further tokens will be
	 * added.
	 */
	STOPPING,
	/**
	 * The replenishment thread has exited and released its timer. Tokens may still be consumed but are never
	 * added.
	 */
	STOPPED
}
