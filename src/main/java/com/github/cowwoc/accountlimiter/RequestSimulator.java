package com.github.cowwoc.accountlimiter;

import com.github.cowwoc.accountlimiter.annotation.CheckReturnValue;
import com.github.cowwoc.accountlimiter.internal.ToStringBuilder;
import com.github.cowwoc.accountlimiter.internal.WrappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Issues synthetic requests against a registry from multiple threads.
 * <p>
 * Every round, each worker submits one request per account and then pauses. Requests use the registry's
 * clock and identify themselves using the worker's name.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe. Each invocation of {@link #run()} starts its own
 * workers.
 *
 * @param <K> the type of the account identifier
 */
public final class RequestSimulator<K>
{
	private final BucketRegistry<K> registry;
	private final List<K> accounts;
	private final int workers;
	private final int rounds;
	private final Duration pause;
	private final Logger log = LoggerFactory.getLogger(RequestSimulator.class);

	/**
	 * Builds a new simulator.
	 *
	 * @param registry the registry to issue requests against
	 * @param <K>      the type of the account identifier
	 * @return a RequestSimulator builder
	 * @throws NullPointerException if {@code registry} is null
	 */
	public static <K> Builder<K> builder(BucketRegistry<K> registry)
	{
		return new Builder<>(registry);
	}

	/**
	 * @param registry the registry to issue requests against
	 * @param accounts the accounts to issue requests against
	 * @param workers  the number of threads issuing requests
	 * @param rounds   the number of rounds that each worker runs
	 * @param pause    the amount of time that each worker sleeps after a round
	 */
	private RequestSimulator(BucketRegistry<K> registry, List<K> accounts, int workers, int rounds,
	                         Duration pause)
	{
		this.registry = registry;
		this.accounts = List.copyOf(accounts);
		this.workers = workers;
		this.rounds = rounds;
		this.pause = pause;
	}

	/**
	 * Runs the simulation, blocking until every worker is done.
	 *
	 * @return the number of requests that were admitted and rejected, per account
	 * @throws AccountNotFoundException if one of the accounts is not registered. The remaining workers are
	 *                                  interrupted as soon as the first one fails.
	 * @throws InterruptedException     if the thread is interrupted while waiting for the workers
	 */
	public SimulationReport<K> run() throws InterruptedException
	{
		Map<K, LongAdder> admitted = new ConcurrentHashMap<>();
		Map<K, LongAdder> rejected = new ConcurrentHashMap<>();
		for (K account : accounts)
		{
			admitted.put(account, new LongAdder());
			rejected.put(account, new LongAdder());
		}
		log.info("Simulating {} rounds of requests against {} using {} workers", rounds, accounts, workers);

		AtomicInteger nextWorkerId = new AtomicInteger(1);
		ExecutorService executor = Executors.newFixedThreadPool(workers, task ->
			new Thread(task, "worker-" + nextWorkerId.getAndIncrement()));
		try
		{
			Callable<Void> worker = () ->
			{
				runWorker(admitted, rejected);
				return null;
			};
			// Wait for workers in the order that they finish, so the first failure cancels the rest
			CompletionService<Void> completionService = new ExecutorCompletionService<>(executor);
			for (int i = 0; i < workers; ++i)
				completionService.submit(worker);
			for (int i = 0; i < workers; ++i)
				completionService.take().get();
		}
		catch (ExecutionException e)
		{
			throw WrappingException.wrap(e);
		}
		finally
		{
			executor.shutdownNow();
		}

		Map<K, Long> admittedTotals = new HashMap<>();
		Map<K, Long> rejectedTotals = new HashMap<>();
		Map<K, BucketSummary> summaries = new HashMap<>();
		for (K account : accounts)
		{
			admittedTotals.put(account, admitted.get(account).sum());
			rejectedTotals.put(account, rejected.get(account).sum());
			TokenBucket bucket = registry.getBucket(account);
			if (bucket != null)
				summaries.put(account, bucket.summary());
		}
		SimulationReport<K> report = new SimulationReport<>(admittedTotals, rejectedTotals, summaries);
		log.info("Simulation complete: {}", report);
		return report;
	}

	/**
	 * Issues requests on behalf of the current worker.
	 *
	 * @param admitted the number of requests admitted per account
	 * @param rejected the number of requests rejected per account
	 * @throws AccountNotFoundException if one of the accounts is not registered
	 * @throws InterruptedException     if the worker is interrupted while pausing
	 */
	private void runWorker(Map<K, LongAdder> admitted, Map<K, LongAdder> rejected) throws InterruptedException
	{
		String requester = Thread.currentThread().getName();
		for (int round = 1; round <= rounds; ++round)
		{
			for (K account : accounts)
			{
				if (registry.admit(account, requester))
					admitted.get(account).increment();
				else
					rejected.get(account).increment();
			}
			if (round < rounds && !pause.isZero())
				Thread.sleep(pause.toMillis());
		}
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(RequestSimulator.class).
			add("accounts", accounts).
			add("workers", workers).
			add("rounds", rounds).
			add("pause", pause).
			toString();
	}

	/**
	 * Builds a simulator.
	 * <p>
	 * <b>Thread safety</b>: This class is not thread-safe.
	 *
	 * @param <K> the type of the account identifier
	 */
	public static final class Builder<K>
	{
		private final BucketRegistry<K> registry;
		private final List<K> accounts = new ArrayList<>();
		private int workers = 2;
		private int rounds = 20;
		private Duration pause = Duration.ofSeconds(3);

		/**
		 * Use {@link RequestSimulator#builder(BucketRegistry)}.
		 *
		 * @param registry the registry to issue requests against
		 * @throws NullPointerException if {@code registry} is null
		 */
		Builder(BucketRegistry<K> registry)
		{
			checkNotNull(registry, "registry");
			this.registry = registry;
		}

		/**
		 * Adds an account to issue requests against.
		 *
		 * @param accountId the identifier of the account
		 * @return this
		 * @throws NullPointerException if {@code accountId} is null
		 */
		@CheckReturnValue
		public Builder<K> addAccount(K accountId)
		{
			checkNotNull(accountId, "accountId");
			accounts.add(accountId);
			return this;
		}

		/**
		 * Sets the number of threads that issue requests.
		 *
		 * @param workers the number of threads that issue requests
		 * @return this
		 * @throws IllegalArgumentException if {@code workers} is negative or zero
		 */
		@CheckReturnValue
		public Builder<K> workers(int workers)
		{
			checkArgument(workers > 0, "workers must be positive: %s", workers);
			this.workers = workers;
			return this;
		}

		/**
		 * Sets the number of rounds that each worker runs.
		 *
		 * @param rounds the number of rounds that each worker runs
		 * @return this
		 * @throws IllegalArgumentException if {@code rounds} is negative or zero
		 */
		@CheckReturnValue
		public Builder<K> rounds(int rounds)
		{
			checkArgument(rounds > 0, "rounds must be positive: %s", rounds);
			this.rounds = rounds;
			return this;
		}

		/**
		 * Sets the amount of time that each worker sleeps between rounds.
		 *
		 * @param pause the amount of time that each worker sleeps between rounds
		 * @return this
		 * @throws NullPointerException     if {@code pause} is null
		 * @throws IllegalArgumentException if {@code pause} is negative
		 */
		@CheckReturnValue
		public Builder<K> pause(Duration pause)
		{
			checkNotNull(pause, "pause");
			checkArgument(!pause.isNegative(), "pause may not be negative: %s", pause);
			this.pause = pause;
			return this;
		}

		/**
		 * Builds a new simulator.
		 *
		 * @return a new RequestSimulator
		 * @throws IllegalArgumentException if no accounts were added
		 */
		public RequestSimulator<K> build()
		{
			checkArgument(!accounts.isEmpty(), "accounts may not be empty");
			return new RequestSimulator<>(registry, accounts, workers, rounds, pause);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("accounts", accounts).
				add("workers", workers).
				add("rounds", rounds).
				add("pause", pause).
				toString();
		}
	}
}
