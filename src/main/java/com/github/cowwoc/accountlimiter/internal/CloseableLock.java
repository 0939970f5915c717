package com.github.cowwoc.accountlimiter.internal;

/**
 * A lock that is held until {@link #close()} is invoked.
 * <p>
 * Releasing the lock does not throw any exceptions, so try-with-resources blocks need no {@code catch}.
 */
public interface CloseableLock extends AutoCloseable
{
	/**
	 * Releases the lock.
	 */
	@Override
	void close();
}
