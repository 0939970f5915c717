package com.github.cowwoc.accountlimiter;

import com.github.cowwoc.accountlimiter.internal.ToStringBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A snapshot of a bucket's state.
 * <p>
 * The token count is the one computed by the most recent admission. Tokens that accrued since then are not
 * reflected until the next admission recomputes them.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 */
public final class BucketSummary
{
	private final long capacity;
	private final Duration refillInterval;
	private final long currentTokens;
	private final Instant lastAdmittedAt;

	/**
	 * Creates a new summary.
	 *
	 * @param capacity       the maximum number of tokens that the bucket may hold
	 * @param refillInterval the amount of time it takes to regenerate a single token
	 * @param currentTokens  the number of tokens in the bucket
	 * @param lastAdmittedAt the last time that a request was admitted ({@code null} if none were)
	 */
	BucketSummary(long capacity, Duration refillInterval, long currentTokens, Instant lastAdmittedAt)
	{
		assert (capacity > 0) : "capacity: " + capacity;
		assert (refillInterval != null);
		assert (currentTokens >= 0 && currentTokens <= capacity) : "currentTokens: " + currentTokens +
			", capacity: " + capacity;
		this.capacity = capacity;
		this.refillInterval = refillInterval;
		this.currentTokens = currentTokens;
		this.lastAdmittedAt = lastAdmittedAt;
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
	 * Returns the amount of time it takes to regenerate a single token.
	 *
	 * @return the amount of time it takes to regenerate a single token
	 */
	public Duration getRefillInterval()
	{
		return refillInterval;
	}

	/**
	 * Returns the number of tokens in the bucket.
	 *
	 * @return the number of tokens in the bucket
	 */
	public long getCurrentTokens()
	{
		return currentTokens;
	}

	/**
	 * Returns the last time that a request was admitted.
	 *
	 * @return {@code null} if the bucket never admitted a request
	 */
	public Instant getLastAdmittedAt()
	{
		return lastAdmittedAt;
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof BucketSummary other))
			return false;
		return capacity == other.capacity && currentTokens == other.currentTokens &&
			refillInterval.equals(other.refillInterval) && Objects.equals(lastAdmittedAt, other.lastAdmittedAt);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(capacity, refillInterval, currentTokens, lastAdmittedAt);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(BucketSummary.class).
			add("capacity", capacity).
			add("refillInterval", refillInterval).
			add("currentTokens", currentTokens).
			add("lastAdmittedAt", lastAdmittedAt).
			toString();
	}
}
