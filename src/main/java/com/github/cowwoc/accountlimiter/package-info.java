/**
 * Per-account admission control using the <a href="https://en.wikipedia.org/wiki/Token_bucket">Token
 * bucket algorithm</a>.
 * <p>
 * Register a {@link com.github.cowwoc.accountlimiter.TokenBucket} for each account with a
 * {@link com.github.cowwoc.accountlimiter.BucketRegistry}, then ask the registry to admit requests.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.accountlimiter.BucketRegistry}).
 */
package com.github.cowwoc.accountlimiter;
