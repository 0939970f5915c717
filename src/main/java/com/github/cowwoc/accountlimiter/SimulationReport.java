package com.github.cowwoc.accountlimiter;

import com.github.cowwoc.accountlimiter.internal.ToStringBuilder;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * The outcome of a {@link RequestSimulator} run.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 *
 * @param <K> the type of the account identifier
 */
public final class SimulationReport<K>
{
	private final ImmutableMap<K, Long> admitted;
	private final ImmutableMap<K, Long> rejected;
	private final ImmutableMap<K, BucketSummary> summaries;

	/**
	 * @param admitted  the number of requests that were admitted, per account
	 * @param rejected  the number of requests that were rejected, per account
	 * @param summaries the state of each account's bucket at the end of the run
	 */
	SimulationReport(Map<K, Long> admitted, Map<K, Long> rejected, Map<K, BucketSummary> summaries)
	{
		assert (admitted != null);
		assert (rejected != null);
		assert (summaries != null);
		this.admitted = ImmutableMap.copyOf(admitted);
		this.rejected = ImmutableMap.copyOf(rejected);
		this.summaries = ImmutableMap.copyOf(summaries);
	}

	/**
	 * Returns the number of requests that an account admitted.
	 *
	 * @param accountId the identifier of the account
	 * @return zero if the account was not part of the simulation
	 */
	public long getAdmitted(K accountId)
	{
		return admitted.getOrDefault(accountId, 0L);
	}

	/**
	 * Returns the number of requests that an account rejected.
	 *
	 * @param accountId the identifier of the account
	 * @return zero if the account was not part of the simulation
	 */
	public long getRejected(K accountId)
	{
		return rejected.getOrDefault(accountId, 0L);
	}

	/**
	 * Returns the total number of requests that were admitted.
	 *
	 * @return the total number of requests that were admitted
	 */
	public long getTotalAdmitted()
	{
		return admitted.values().stream().mapToLong(Long::longValue).sum();
	}

	/**
	 * Returns the total number of requests that were rejected.
	 *
	 * @return the total number of requests that were rejected
	 */
	public long getTotalRejected()
	{
		return rejected.values().stream().mapToLong(Long::longValue).sum();
	}

	/**
	 * Returns the state of each account's bucket at the end of the run.
	 *
	 * @return the state of each account's bucket at the end of the run
	 */
	public ImmutableMap<K, BucketSummary> getSummaries()
	{
		return summaries;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(SimulationReport.class).
			add("admitted", admitted).
			add("rejected", rejected).
			add("summaries", summaries).
			toString();
	}
}
