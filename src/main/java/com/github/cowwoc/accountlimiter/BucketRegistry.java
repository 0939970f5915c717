package com.github.cowwoc.accountlimiter;

import com.github.cowwoc.accountlimiter.annotation.CheckReturnValue;
import com.github.cowwoc.accountlimiter.internal.ToStringBuilder;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Maps accounts to their token buckets.
 * <p>
 * The registry never creates a bucket on demand. Each account must be {@link #register(Object, TokenBucket)
 * registered} before requests are admitted against it.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe. Admissions against different accounts do not contend
 * with each other.
 *
 * @param <K> the type of the account identifier
 */
public final class BucketRegistry<K>
{
	private final ConcurrentMap<K, TokenBucket> accountToBucket = new ConcurrentHashMap<>();
	private final Clock clock;
	private final List<AdmissionListener<K>> listeners;
	private final Logger log = LoggerFactory.getLogger(BucketRegistry.class);

	/**
	 * Builds a new registry.
	 *
	 * @param <K> the type of the account identifier
	 * @return a BucketRegistry builder
	 */
	public static <K> Builder<K> builder()
	{
		return new Builder<>();
	}

	/**
	 * Creates a new registry that reads the time from the system clock.
	 */
	public BucketRegistry()
	{
		this(Clock.systemUTC(), List.of());
	}

	/**
	 * Creates a new registry.
	 *
	 * @param clock     the clock used by {@link #admit(Object)}
	 * @param listeners the listeners to notify of admission decisions
	 * @throws NullPointerException if any of the arguments are null
	 */
	private BucketRegistry(Clock clock, List<AdmissionListener<K>> listeners)
	{
		checkNotNull(clock, "clock");
		checkNotNull(listeners, "listeners");
		this.clock = clock;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Registers a bucket for an account. If the account already has a bucket, it is replaced and its state
	 * is discarded.
	 *
	 * @param accountId the identifier of the account
	 * @param bucket    the account's bucket
	 * @return the bucket that was replaced ({@code null} if none was)
	 * @throws NullPointerException if any of the arguments are null
	 */
	public TokenBucket register(K accountId, TokenBucket bucket)
	{
		checkNotNull(accountId, "accountId");
		checkNotNull(bucket, "bucket");
		TokenBucket previous = accountToBucket.put(accountId, bucket);
		if (previous == null)
			log.debug("Registered {}: {}", accountId, bucket);
		else
			log.debug("Replaced the bucket of {}. Before: {}, after: {}", accountId, previous, bucket);
		return previous;
	}

	/**
	 * Registers a new bucket for an account. If the account already has a bucket, it is replaced and its
	 * state is discarded.
	 *
	 * @param accountId             the identifier of the account
	 * @param capacity              the maximum number of tokens that the bucket may hold
	 * @param refillIntervalSeconds the number of seconds it takes to regenerate a single token
	 * @return the new bucket
	 * @throws NullPointerException     if {@code accountId} is null
	 * @throws IllegalArgumentException if {@code capacity} or {@code refillIntervalSeconds} are negative or
	 *                                  zero
	 */
	public TokenBucket register(K accountId, long capacity, long refillIntervalSeconds)
	{
		checkNotNull(accountId, "accountId");
		TokenBucket bucket = new TokenBucket(capacity, refillIntervalSeconds);
		register(accountId, bucket);
		return bucket;
	}

	/**
	 * Registers a new bucket for an account. If the account already has a bucket, it is replaced and its
	 * state is discarded.
	 *
	 * @param accountId     the identifier of the account
	 * @param bucketBuilder configures the bucket
	 * @return the new bucket
	 * @throws NullPointerException if any of the arguments are null
	 */
	public TokenBucket register(K accountId, Consumer<TokenBucket.Builder> bucketBuilder)
	{
		checkNotNull(accountId, "accountId");
		checkNotNull(bucketBuilder, "bucketBuilder");
		TokenBucket.Builder builder = TokenBucket.builder();
		bucketBuilder.accept(builder);
		TokenBucket bucket = builder.build();
		register(accountId, bucket);
		return bucket;
	}

	/**
	 * Removes an account's bucket.
	 *
	 * @param accountId the identifier of the account
	 * @return the bucket that was removed
	 * @throws NullPointerException     if {@code accountId} is null
	 * @throws AccountNotFoundException if the account is not registered
	 */
	public TokenBucket deregister(K accountId)
	{
		checkNotNull(accountId, "accountId");
		TokenBucket bucket = accountToBucket.remove(accountId);
		if (bucket == null)
			throw new AccountNotFoundException(accountId);
		log.debug("Deregistered {}", accountId);
		return bucket;
	}

	/**
	 * Returns an account's bucket.
	 *
	 * @param accountId the identifier of the account
	 * @return {@code null} if the account is not registered
	 * @throws NullPointerException if {@code accountId} is null
	 */
	public TokenBucket getBucket(K accountId)
	{
		checkNotNull(accountId, "accountId");
		return accountToBucket.get(accountId);
	}

	/**
	 * Returns the registered accounts.
	 *
	 * @return a snapshot of the registered accounts
	 */
	public ImmutableSet<K> getAccounts()
	{
		return ImmutableSet.copyOf(accountToBucket.keySet());
	}

	/**
	 * Returns the number of registered accounts.
	 *
	 * @return the number of registered accounts
	 */
	public int size()
	{
		return accountToBucket.size();
	}

	/**
	 * Returns a snapshot of every account's bucket. The buckets are not refilled.
	 *
	 * @return a map from each account to the state of its bucket
	 */
	public ImmutableMap<K, BucketSummary> summaries()
	{
		ImmutableMap.Builder<K, BucketSummary> result = ImmutableMap.builder();
		for (Entry<K, TokenBucket> entry : accountToBucket.entrySet())
			result.put(entry.getKey(), entry.getValue().summary());
		return result.build();
	}

	/**
	 * Admits a request against an account, using the registry's clock.
	 *
	 * @param accountId the identifier of the account
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException     if {@code accountId} is null
	 * @throws AccountNotFoundException if the account is not registered
	 */
	@CheckReturnValue
	public boolean admit(K accountId)
	{
		return admit(accountId, TokenBucket.ANONYMOUS, now());
	}

	/**
	 * Admits a request against an account, using the registry's clock.
	 *
	 * @param accountId the identifier of the account
	 * @param requester identifies the caller in log messages and listener notifications
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws AccountNotFoundException if the account is not registered
	 */
	@CheckReturnValue
	public boolean admit(K accountId, String requester)
	{
		return admit(accountId, requester, now());
	}

	/**
	 * Admits a request against an account.
	 *
	 * @param accountId   the identifier of the account
	 * @param requestedAt the time at which the request arrived
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws AccountNotFoundException if the account is not registered
	 */
	@CheckReturnValue
	public boolean admit(K accountId, Instant requestedAt)
	{
		return admit(accountId, TokenBucket.ANONYMOUS, requestedAt);
	}

	/**
	 * Admits a request against an account.
	 *
	 * @param accountId   the identifier of the account
	 * @param requester   identifies the caller in log messages and listener notifications
	 * @param requestedAt the time at which the request arrived
	 * @return true if the request was admitted, false if it was rejected
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws AccountNotFoundException if the account is not registered
	 * @throws RuntimeException         if a listener throws an exception. The decision has already been
	 *                                  applied to the bucket by then.
	 */
	@CheckReturnValue
	public boolean admit(K accountId, String requester, Instant requestedAt)
	{
		checkNotNull(accountId, "accountId");
		checkNotNull(requester, "requester");
		checkNotNull(requestedAt, "requestedAt");
		TokenBucket bucket = accountToBucket.get(accountId);
		if (bucket == null)
			throw new AccountNotFoundException(accountId);
		TokenBucket.Decision decision = bucket.decide(requester, requestedAt);
		for (AdmissionListener<K> listener : listeners)
		{
			if (decision.admitted)
				listener.admitted(accountId, requester, requestedAt, decision.summary);
			else
				listener.rejected(accountId, requester, requestedAt, decision.summary);
		}
		return decision.admitted;
	}

	/**
	 * @return the current time, truncated to whole seconds
	 */
	private Instant now()
	{
		return clock.instant().truncatedTo(ChronoUnit.SECONDS);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(BucketRegistry.class).
			add("accountToBucket", summaries()).
			add("clock", clock).
			toString();
	}

	/**
	 * Builds a registry.
	 * <p>
	 * <b>Thread safety</b>: This class is not thread-safe.
	 *
	 * @param <K> the type of the account identifier
	 */
	public static final class Builder<K>
	{
		private Clock clock = Clock.systemUTC();
		private final List<AdmissionListener<K>> listeners = new ArrayList<>();

		/**
		 * Use {@link BucketRegistry#builder()}.
		 */
		Builder()
		{
		}

		/**
		 * Returns the clock that the registry reads the time from.
		 *
		 * @return the clock that the registry reads the time from
		 */
		public Clock clock()
		{
			return clock;
		}

		/**
		 * Sets the clock that the registry reads the time from, when the caller does not provide it.
		 *
		 * @param clock a clock
		 * @return this
		 * @throws NullPointerException if {@code clock} is null
		 */
		@CheckReturnValue
		public Builder<K> clock(Clock clock)
		{
			checkNotNull(clock, "clock");
			this.clock = clock;
			return this;
		}

		/**
		 * Returns the listeners to notify of admission decisions.
		 *
		 * @return the listeners to notify of admission decisions
		 */
		public List<AdmissionListener<K>> listeners()
		{
			return listeners;
		}

		/**
		 * Adds a listener to notify of admission decisions.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		@CheckReturnValue
		public Builder<K> addListener(AdmissionListener<K> listener)
		{
			checkNotNull(listener, "listener");
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new registry.
		 *
		 * @return a new BucketRegistry
		 */
		public BucketRegistry<K> build()
		{
			return new BucketRegistry<>(clock, listeners);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("clock", clock).
				add("listeners", listeners).
				toString();
		}
	}
}
