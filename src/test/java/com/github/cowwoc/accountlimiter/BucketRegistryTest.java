package com.github.cowwoc.accountlimiter;

import org.testng.annotations.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public final class BucketRegistryTest
{
	private static final Instant START = Instant.ofEpochSecond(1_700_000_000L);

	@Test
	public void admitUnknownAccount()
	{
		BucketRegistry<Integer> registry = new BucketRegistry<>();
		try
		{
			//noinspection ResultOfMethodCallIgnored
			registry.admit(1, START);
			throw new AssertionError("Expected AccountNotFoundException");
		}
		catch (AccountNotFoundException e)
		{
			assertEquals(e.getAccountId(), 1);
		}
		assertEquals(registry.size(), 0);
		assertNull(registry.getBucket(1));
	}

	@Test(expectedExceptions = AccountNotFoundException.class)
	public void deregisterUnknownAccount()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		registry.deregister("alice");
	}

	@Test(expectedExceptions = AccountNotFoundException.class)
	public void admitAfterDeregister()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		registry.register("alice", 5, 10);
		TokenBucket removed = registry.deregister("alice");
		assertEquals(removed.getCapacity(), 5L);
		//noinspection ResultOfMethodCallIgnored
		registry.admit("alice", START);
	}

	@Test
	public void invalidConfigurationIsNotRegistered()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		try
		{
			registry.register("alice", 0, 10);
			throw new AssertionError("Expected IllegalArgumentException");
		}
		catch (IllegalArgumentException e)
		{
			assertTrue(registry.getAccounts().isEmpty());
		}
	}

	@Test
	public void accountsAreIndependent()
	{
		BucketRegistry<Integer> registry = new BucketRegistry<>();
		registry.register(1, 1, 60);
		registry.register(2, 1, 60);
		assertTrue(registry.admit(1, START));
		assertFalse(registry.admit(1, START));
		assertTrue(registry.admit(2, START));
	}

	@Test
	public void replacingBucketDiscardsState()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		TokenBucket first = registry.register("alice", 1, 60);
		assertTrue(registry.admit("alice", START));
		assertFalse(registry.admit("alice", START));

		TokenBucket replaced = registry.register("alice", new TokenBucket(2, 60));
		assertSame(replaced, first);
		assertEquals(registry.size(), 1);
		assertTrue(registry.admit("alice", START));
		assertTrue(registry.admit("alice", START));
		assertFalse(registry.admit("alice", START));
	}

	@Test
	public void registerUsingBuilder()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		TokenBucket bucket = registry.register("alice", builder -> builder.capacity(3).
			refillInterval(Duration.ofMinutes(1)));
		assertSame(registry.getBucket("alice"), bucket);
		assertEquals(bucket.getCapacity(), 3L);
		assertEquals(bucket.getRefillInterval(), Duration.ofSeconds(60));
	}

	@Test
	public void admitUsesRegistryClock()
	{
		Clock clock = Clock.fixed(START.plusMillis(900), ZoneOffset.UTC);
		BucketRegistry<String> registry = BucketRegistry.<String>builder().
			clock(clock).
			build();
		TokenBucket bucket = registry.register("alice", 2, 10);
		assertTrue(registry.admit("alice"));
		assertTrue(registry.admit("alice", "worker-1"));
		assertFalse(registry.admit("alice"));
		// Whole seconds only
		assertEquals(bucket.summary().getLastAdmittedAt(), START);
	}

	@Test
	public void summariesDoNotRefill()
	{
		BucketRegistry<String> registry = new BucketRegistry<>();
		registry.register("alice", 2, 1);
		registry.register("bob", 4, 1);
		assertTrue(registry.admit("alice", START));

		assertEquals(registry.summaries(), registry.summaries());
		BucketSummary alice = registry.summaries().get("alice");
		assertEquals(alice.getCurrentTokens(), 1L);
		BucketSummary bob = registry.summaries().get("bob");
		assertEquals(bob.getCurrentTokens(), 4L);
		assertNull(bob.getLastAdmittedAt());
	}

	@Test
	public void listenersAreNotified()
	{
		List<String> events = Collections.synchronizedList(new ArrayList<>());
		BucketRegistry<String> registry = BucketRegistry.<String>builder().
			addListener(new AdmissionListener<>()
			{
				@Override
				public void admitted(String accountId, String requester, Instant requestedAt, BucketSummary summary)
				{
					events.add("admitted " + accountId + " " + requester + " " + summary.getCurrentTokens());
				}

				@Override
				public void rejected(String accountId, String requester, Instant requestedAt, BucketSummary summary)
				{
					events.add("rejected " + accountId + " " + requester + " " + summary.getCurrentTokens());
				}
			}).
			build();
		registry.register("alice", 2, 60);
		assertTrue(registry.admit("alice", "first", START));
		assertTrue(registry.admit("alice", "second", START));
		assertFalse(registry.admit("alice", "third", START));
		assertEquals(events, List.of("admitted alice first 1", "admitted alice second 0",
			"rejected alice third 0"));
	}

	@Test
	public void listenerSummaryIsTakenWithDecision()
	{
		List<BucketSummary> summaries = Collections.synchronizedList(new ArrayList<>());
		BucketRegistry<String> registry = BucketRegistry.<String>builder().
			addListener(new AdmissionListener<>()
			{
				@Override
				public void admitted(String accountId, String requester, Instant requestedAt, BucketSummary summary)
				{
					summaries.add(summary);
				}
			}).
			build();
		TokenBucket bucket = registry.register("alice", 3, 60);
		assertTrue(registry.admit("alice", START));
		assertTrue(registry.admit("alice", START.plusSeconds(1)));
		assertEquals(summaries.get(0).getCurrentTokens(), 2L);
		assertEquals(summaries.get(0).getLastAdmittedAt(), START);
		assertEquals(summaries.get(1), bucket.summary());
	}

	@Test
	public void listenerExceptionPropagatesAfterDecision()
	{
		BucketRegistry<String> registry = BucketRegistry.<String>builder().
			addListener(new AdmissionListener<>()
			{
				@Override
				public void admitted(String accountId, String requester, Instant requestedAt, BucketSummary summary)
				{
					throw new IllegalStateException("listener failed");
				}
			}).
			build();
		TokenBucket bucket = registry.register("alice", 3, 60);
		try
		{
			//noinspection ResultOfMethodCallIgnored
			registry.admit("alice", START);
			throw new AssertionError("Expected IllegalStateException");
		}
		catch (IllegalStateException e)
		{
			assertEquals(e.getMessage(), "listener failed");
		}
		// The token is consumed even though the listener failed
		assertEquals(bucket.summary().getCurrentTokens(), 2L);
		assertEquals(bucket.summary().getLastAdmittedAt(), START);
	}

	@Test
	public void deregisterDuringAdmissions() throws Exception
	{
		int threads = 8;
		BucketRegistry<String> registry = new BucketRegistry<>();
		registry.register("alice", Long.MAX_VALUE, 3600);

		ExecutorService executor = Executors.newFixedThreadPool(threads + 1);
		try
		{
			AtomicBoolean deregistered = new AtomicBoolean();
			AtomicInteger admittedAfterDeregister = new AtomicInteger();
			CountDownLatch ready = new CountDownLatch(threads + 1);
			CountDownLatch go = new CountDownLatch(1);
			List<Future<Long>> admitters = new ArrayList<>();
			for (int i = 0; i < threads; ++i)
			{
				Callable<Long> task = () ->
				{
					ready.countDown();
					go.await();
					long admitted = 0;
					while (true)
					{
						// Read the flag before admitting so that a true value means the removal preceded the lookup
						boolean removed = deregistered.get();
						try
						{
							if (registry.admit("alice", START))
							{
								++admitted;
								if (removed)
									admittedAfterDeregister.incrementAndGet();
							}
						}
						catch (AccountNotFoundException e)
						{
							assertEquals(e.getAccountId(), "alice");
							return admitted;
						}
					}
				};
				admitters.add(executor.submit(task));
			}
			Callable<TokenBucket> remover = () ->
			{
				ready.countDown();
				go.await();
				Thread.sleep(50);
				TokenBucket removed = registry.deregister("alice");
				deregistered.set(true);
				return removed;
			};
			Future<TokenBucket> removal = executor.submit(remover);
			ready.await();
			go.countDown();

			TokenBucket removedBucket = removal.get(10, TimeUnit.SECONDS);
			long totalAdmitted = 0;
			for (Future<Long> admitter : admitters)
				totalAdmitted += admitter.get(10, TimeUnit.SECONDS);
			assertEquals(admittedAfterDeregister.get(), 0);
			assertNull(registry.getBucket("alice"));
			assertEquals(registry.size(), 0);
			// Every admission before the removal consumed a token from the removed bucket
			assertEquals(Long.MAX_VALUE - removedBucket.summary().getCurrentTokens(), totalAdmitted);
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void concurrentAdmissionsAgainstOneAccount() throws Exception
	{
		int threads = 16;
		int capacity = 5;
		BucketRegistry<String> registry = new BucketRegistry<>();
		registry.register("alice", capacity, 3600);

		List<Boolean> results = admitConcurrently(registry, threads, i -> "alice");
		long admitted = results.stream().filter(Boolean::booleanValue).count();
		assertEquals(admitted, (long) capacity);
	}

	@Test
	public void concurrentAdmissionsAgainstManyAccounts() throws Exception
	{
		int accounts = 8;
		int requestsPerAccount = 4;
		BucketRegistry<Integer> registry = new BucketRegistry<>();
		for (int i = 0; i < accounts; ++i)
			registry.register(i, requestsPerAccount, 3600);

		List<Boolean> results = admitConcurrently(registry, accounts * requestsPerAccount, i -> i % accounts);
		assertFalse(results.contains(false));
		for (BucketSummary summary : registry.summaries().values())
			assertEquals(summary.getCurrentTokens(), 0L);
	}

	/**
	 * Admits requests from multiple threads at the same time.
	 *
	 * @param registry a registry
	 * @param threads  the number of threads
	 * @param account  returns the account that a thread should issue a request against
	 * @param <K>      the type of the account identifier
	 * @return the admission decisions
	 * @throws Exception if a thread fails
	 */
	private static <K> List<Boolean> admitConcurrently(BucketRegistry<K> registry, int threads,
	                                                   IntFunction<K> account)
		throws Exception
	{
		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try
		{
			CountDownLatch ready = new CountDownLatch(threads);
			CountDownLatch go = new CountDownLatch(1);
			List<Future<Boolean>> futures = new ArrayList<>();
			for (int i = 0; i < threads; ++i)
			{
				K accountId = account.apply(i);
				String requester = "thread-" + i;
				Callable<Boolean> task = () ->
				{
					ready.countDown();
					go.await();
					return registry.admit(accountId, requester, START);
				};
				futures.add(executor.submit(task));
			}
			ready.await();
			go.countDown();
			List<Boolean> results = new ArrayList<>();
			for (Future<Boolean> future : futures)
				results.add(future.get());
			return results;
		}
		finally
		{
			executor.shutdownNow();
		}
	}
}
