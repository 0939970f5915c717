/**
 * <h1>Locking policy</h1>
 * <p>
 * Every {@link com.github.cowwoc.accountlimiter.TokenBucket} owns its own lock. Admission acquires the
 * write lock once and holds it across the refill and the consume decision. Snapshots acquire the read lock.
 * <p>
 * The registry holds no lock. Its map is a {@link java.util.concurrent.ConcurrentHashMap}.
 * <p>
 * No I/O, logging or listener callbacks take place while a bucket lock is held.
 */
package com.github.cowwoc.accountlimiter.internal;
