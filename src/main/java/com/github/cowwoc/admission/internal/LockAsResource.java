package com.github.cowwoc.admission.internal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enables the use of try-with-resources with a mutual-exclusion Lock.
 */
public final class LockAsResource
{
	private final Lock lock;

	/**
	 * Creates a new non-fair lock.
	 */
	public LockAsResource()
	{
		this.lock = new ReentrantLock();
	}

	/**
	 * Acquires the lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock lock()
	{
		lock.lock();
		return lock::unlock;
	}

	/**
	 * Returns a new condition bound to this lock.
	 *
	 * @return a new condition
	 */
	public Condition newCondition()
	{
		return lock.newCondition();
	}
}
