/**
 * <h1>Locking policy</h1>
 * <p>
 * Unless otherwise stated, public methods are responsible for acquiring locks on behalf of non-public
 * methods that they invoke.
 * <p>
 * A bucket's token count and lifecycle state are guarded by a single {@link java.util.concurrent.locks.ReentrantLock}.
 * Critical sections hold it for a single increment or decrement. The replenishment thread waits on a
 * {@link java.util.concurrent.locks.Condition} of the same lock, so a shutdown request wakes it without
 * waiting for the next tick.
 * <p>
 * Listeners are never invoked while the lock is held.
 */
package com.github.cowwoc.admission.internal;
