package com.github.cowwoc.admission.internal;

/**
 * A held lock that is released by {@code try-with-resources}.
 */
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock. Unlike {@link AutoCloseable#close()}, never throws a checked exception.
	 */
	@Override
	void close();
}
