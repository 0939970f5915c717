package com.github.cowwoc.accountlimiter;

import com.github.cowwoc.accountlimiter.annotation.CheckReturnValue;
import com.github.cowwoc.accountlimiter.internal.CloseableLock;
import com.github.cowwoc.accountlimiter.internal.ReadWriteLockAsResource;
import com.github.cowwoc.accountlimiter.internal.ToStringBuilder;
import com.google.common.math.LongMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A bucket that holds up to {@code capacity} tokens and regenerates one token every
 * {@code refillInterval}. Each admitted request consumes one token.
 * <p>
 * Tokens are only added at whole-interval boundaries, measured from the last time that a request was
 * admitted. The refill is computed lazily, at the beginning of each admission.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class TokenBucket
{
	/**
	 * The capacity of buckets that do not specify one.
	 */
	public static final long DEFAULT_CAPACITY = 10;
	/**
	 * The refill interval of buckets that do not specify one.
	 */
	public static final Duration DEFAULT_REFILL_INTERVAL = Duration.ofSeconds(5);
	/**
	 * The requester of requests that do not identify their caller.
	 */
	static final String ANONYMOUS = "anonymous";

	private final long capacity;
	private final Duration refillInterval;
	long currentTokens;
	Instant lastAdmittedAt;
	/**
	 * A lock over this object's state. See the {@link com.github.cowwoc.accountlimiter.internal locking policy}
	 * for more details.
	 */
	private final ReadWriteLockAsResource lock = new ReadWriteLockAsResource();
	private final Logger log = LoggerFactory.getLogger(TokenBucket.class);

	/**
	 * Builds a new bucket.
	 *
	 * @return a TokenBucket builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new bucket that is full of tokens.
	 *
	 * @param capacity              the maximum number of tokens that the bucket may hold
	 * @param refillIntervalSeconds the number of seconds it takes to regenerate a single token
	 * @throws IllegalArgumentException if any of the arguments are negative or zero
	 */
	public TokenBucket(long capacity, long refillIntervalSeconds)
	{
		this(capacity, toRefillInterval(refillIntervalSeconds));
	}

	/**
	 * @param refillIntervalSeconds the number of seconds it takes to regenerate a single token
	 * @return the refill interval
	 * @throws IllegalArgumentException if {@code refillIntervalSeconds} is negative or zero
	 */
	private static Duration toRefillInterval(long refillIntervalSeconds)
	{
		checkArgument(refillIntervalSeconds > 0, "refillIntervalSeconds must be positive: %s",
			refillIntervalSeconds);
		return Duration.ofSeconds(refillIntervalSeconds);
	}

	/**
	 * Creates a new bucket that is full of tokens.
	 *
	 * @param capacity       the maximum number of tokens that the bucket may hold
	 * @param refillInterval the amount of time it takes to regenerate a single token
	 * @throws NullPointerException     if {@code refillInterval} is null
	 * @throws IllegalArgumentException if {@code capacity} is negative or zero. If {@code refillInterval} is
	 *                                  shorter than one second or is not a whole number of seconds.
	 */
	private TokenBucket(long capacity, Duration refillInterval)
	{
		checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
		checkRefillInterval(refillInterval);
		this.capacity = capacity;
		this.refillInterval = refillInterval;
		this.currentTokens = capacity;
	}

	/**
	 * @param refillInterval the amount of time it takes to regenerate a single token
	 * @throws NullPointerException     if {@code refillInterval} is null
	 * @throws IllegalArgumentException if {@code refillInterval} is shorter than one second or is not a whole
	 *                                  number of seconds
	 */
	private static void checkRefillInterval(Duration refillInterval)
	{
		checkNotNull(refillInterval, "refillInterval");
		checkArgument(refillInterval.toSeconds() > 0, "refillInterval must be at least one second: %s",
			refillInterval);
		checkArgument(refillInterval.getNano() == 0, "refillInterval must be a whole number of seconds: %s",
			refillInterval);
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
	 * Admits a request if a token is available at the time of invocation.
	 *
	 * @param requestedAt the time at which the request arrived
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException if {@code requestedAt} is null
	 */
	@CheckReturnValue
	public boolean tryAdmit(Instant requestedAt)
	{
		return tryAdmit(ANONYMOUS, requestedAt);
	}

	/**
	 * Admits a request if a token is available at the time of invocation.
	 * <p>
	 * The refill and the consumption take place under a single lock acquisition, so concurrent callers never
	 * consume the same token.
	 *
	 * @param requester   identifies the caller in log messages
	 * @param requestedAt the time at which the request arrived
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException if any of the arguments are null
	 */
	@CheckReturnValue
	public boolean tryAdmit(String requester, Instant requestedAt)
	{
		return decide(requester, requestedAt).admitted;
	}

	/**
	 * Admits a request if a token is available at the time of invocation.
	 *
	 * @param requester   identifies the caller in log messages
	 * @param requestedAt the time at which the request arrived
	 * @return the decision, along with the state of the bucket immediately after it was made
	 * @throws NullPointerException if any of the arguments are null
	 */
	Decision decide(String requester, Instant requestedAt)
	{
		checkNotNull(requester, "requester");
		checkNotNull(requestedAt, "requestedAt");
		boolean admitted;
		long intervalsElapsed;
		BucketSummary summary;
		try (CloseableLock ignored = lock.writeLock())
		{
			intervalsElapsed = refill(requestedAt);
			admitted = currentTokens > 0;
			if (admitted)
			{
				lastAdmittedAt = requestedAt;
				--currentTokens;
			}
			summary = new BucketSummary(capacity, refillInterval, currentTokens, lastAdmittedAt);
		}
		if (intervalsElapsed < 0)
		{
			log.debug("{} requested a token at {}, before the last admission. The clock moved backwards.",
				requester, requestedAt);
		}
		if (admitted)
			log.debug("Admitted request from {}. Tokens left: {}", requester, summary.getCurrentTokens());
		else
		{
			log.debug("Rejected request from {}. Not enough tokens, try again in {}.", requester,
				refillInterval);
		}
		return new Decision(admitted, summary);
	}

	/**
	 * Adds the tokens that accrued since the last admission.
	 *
	 * @param requestedAt the time at which the request arrived
	 * @return the number of whole refill intervals that elapsed since the last admission (negative if
	 * {@code requestedAt} precedes it, in which case no tokens are added)
	 */
	private long refill(Instant requestedAt)
	{
		assert (lock.isWriteLockedByCurrentThread());
		if (lastAdmittedAt == null)
			return 0;
		Duration elapsed = Duration.between(lastAdmittedAt, requestedAt);
		if (elapsed.isNegative())
			return -1;
		long tokensToAdd = elapsed.dividedBy(refillInterval);
		currentTokens = Math.min(capacity, LongMath.saturatedAdd(currentTokens, tokensToAdd));
		return tokensToAdd;
	}

	/**
	 * Returns a snapshot of the bucket's state. This method does not refill the bucket.
	 *
	 * @return a snapshot of the bucket's state
	 */
	public BucketSummary summary()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return new BucketSummary(capacity, refillInterval, currentTokens, lastAdmittedAt);
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.readLock())
		{
			return new ToStringBuilder(TokenBucket.class).
				add("capacity", capacity).
				add("refillInterval", refillInterval).
				add("currentTokens", currentTokens).
				add("lastAdmittedAt", lastAdmittedAt).
				toString();
		}
	}

	/**
	 * The outcome of an admission.
	 */
	static final class Decision
	{
		/**
		 * true if the request was admitted, false if it was rejected.
		 */
		final boolean admitted;
		/**
		 * The state of the bucket immediately after the decision.
		 */
		final BucketSummary summary;

		/**
		 * @param admitted true if the request was admitted, false if it was rejected
		 * @param summary  the state of the bucket immediately after the decision
		 */
		Decision(boolean admitted, BucketSummary summary)
		{
			assert (summary != null);
			this.admitted = admitted;
			this.summary = summary;
		}
	}

	/**
	 * Builds a bucket.
	 * <p>
	 * <b>Thread safety</b>: This class is not thread-safe.
	 */
	public static final class Builder
	{
		private long capacity = DEFAULT_CAPACITY;
		private Duration refillInterval = DEFAULT_REFILL_INTERVAL;

		/**
		 * Use {@link TokenBucket#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Returns the maximum number of tokens that the bucket may hold.
		 *
		 * @return the maximum number of tokens that the bucket may hold
		 */
		public long capacity()
		{
			return capacity;
		}

		/**
		 * Sets the maximum number of tokens that the bucket may hold. The bucket starts out full.
		 *
		 * @param capacity the maximum number of tokens that the bucket may hold
		 * @return this
		 * @throws IllegalArgumentException if {@code capacity} is negative or zero
		 */
		@CheckReturnValue
		public Builder capacity(long capacity)
		{
			checkArgument(capacity > 0, "capacity must be positive: %s", capacity);
			this.capacity = capacity;
			return this;
		}

		/**
		 * Returns the amount of time it takes to regenerate a single token.
		 *
		 * @return the amount of time it takes to regenerate a single token
		 */
		public Duration refillInterval()
		{
			return refillInterval;
		}

		/**
		 * Sets the amount of time it takes to regenerate a single token.
		 *
		 * @param refillInterval the amount of time it takes to regenerate a single token
		 * @return this
		 * @throws NullPointerException     if {@code refillInterval} is null
		 * @throws IllegalArgumentException if {@code refillInterval} is shorter than one second or is not a
		 *                                  whole number of seconds
		 */
		@CheckReturnValue
		public Builder refillInterval(Duration refillInterval)
		{
			checkRefillInterval(refillInterval);
			this.refillInterval = refillInterval;
			return this;
		}

		/**
		 * Builds a new bucket that is full of tokens.
		 *
		 * @return a new TokenBucket
		 */
		public TokenBucket build()
		{
			return new TokenBucket(capacity, refillInterval);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("capacity", capacity).
				add("refillInterval", refillInterval).
				toString();
		}
	}
}
