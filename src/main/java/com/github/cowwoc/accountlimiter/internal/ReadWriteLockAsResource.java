package com.github.cowwoc.accountlimiter.internal;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A read-write lock that is acquired and released using try-with-resources.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class ReadWriteLockAsResource
{
	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	 * Acquires a read lock, blocking until it becomes available.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock readLock()
	{
		Lock readLock = lock.readLock();
		readLock.lock();
		return readLock::unlock;
	}

	/**
	 * Acquires the write lock, blocking until it becomes available.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock writeLock()
	{
		Lock writeLock = lock.writeLock();
		writeLock.lock();
		return writeLock::unlock;
	}

	/**
	 * Returns true if the current thread holds the write lock.
	 *
	 * @return true if the current thread holds the write lock
	 */
	public boolean isWriteLockedByCurrentThread()
	{
		return lock.isWriteLockedByCurrentThread();
	}
}
