package com.github.cowwoc.accountlimiter.internal;

import java.io.Serial;
import java.util.concurrent.ExecutionException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A runtime exception dedicated to wrapping checked exceptions.
 */
public final class WrappingException extends RuntimeException
{
	@Serial
	private static final long serialVersionUID = 0L;

	/**
	 * Wraps an exception.
	 *
	 * @param cause the exception to wrap
	 * @throws NullPointerException if {@code cause} is null
	 */
	private WrappingException(Throwable cause)
	{
		super(cause);
	}

	/**
	 * Rethrows unchecked exceptions and errors. Wraps checked exceptions.
	 * <p>
	 * {@code ExecutionException}s are unwrapped so that the failure of a task is reported using the
	 * exception that the task threw.
	 *
	 * @param t the exception to process
	 * @return the wrapped exception
	 * @throws NullPointerException if {@code t} is null
	 * @throws RuntimeException     if {@code t} is a {@code RuntimeException}
	 * @throws Error                if {@code t} is an {@code Error}
	 */
	public static WrappingException wrap(Throwable t)
	{
		checkNotNull(t, "t");
		if (t instanceof ExecutionException && t.getCause() != null)
			return wrap(t.getCause());
		if (t instanceof RuntimeException re)
			throw re;
		if (t instanceof Error e)
			throw e;
		return new WrappingException(t);
	}
}
