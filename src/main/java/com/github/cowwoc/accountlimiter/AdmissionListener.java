package com.github.cowwoc.accountlimiter;

import java.time.Instant;

/**
 * Listens for admission decisions.
 * <p>
 * Listeners are invoked after the bucket's lock has been released. The summary they receive is captured
 * under the lock, together with the decision, so it is not affected by concurrent admissions.
 * <p>
 * Exceptions thrown by a listener propagate to the caller of {@link BucketRegistry#admit(Object)}. The
 * decision is not rolled back.
 *
 * @param <K> the type of the account identifier
 */
public interface AdmissionListener<K>
{
	/**
	 * Invoked after a request is admitted.
	 *
	 * @param accountId   the account that the request was made against
	 * @param requester   identifies the caller
	 * @param requestedAt the time at which the request arrived
	 * @param summary     the state of the account's bucket immediately after the token was consumed
	 */
	default void admitted(K accountId, String requester, Instant requestedAt, BucketSummary summary)
	{
	}

	/**
	 * Invoked after a request is rejected because the account ran out of tokens.
	 *
	 * @param accountId   the account that the request was made against
	 * @param requester   identifies the caller
	 * @param requestedAt the time at which the request arrived
	 * @param summary     the state of the account's bucket when the request was rejected
	 */
	default void rejected(K accountId, String requester, Instant requestedAt, BucketSummary summary)
	{
	}
}
