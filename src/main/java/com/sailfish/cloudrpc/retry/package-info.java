/**
 * Contains the retry and backoff policies consulted between attempts, such as
 * {@link com.sailfish.cloudrpc.retry.LimitedRetryPolicy} and
 * {@link com.sailfish.cloudrpc.retry.ExponentialBackoffPolicy}, and the settings that build them.
 */
package com.sailfish.cloudrpc.retry;
