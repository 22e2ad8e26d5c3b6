/**
 * Bounded retry with exponential backoff.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.retry.RetryConfig} - Immutable policy configuration</li>
 *   <li>{@link com.ryuqq.hustle.core.retry.BackoffCalculator} - initialDelay * multiplier^k + jitter</li>
 *   <li>{@link com.ryuqq.hustle.core.retry.RetryPolicy} - Executes a {@code Callable} within the bound</li>
 *   <li>{@link com.ryuqq.hustle.core.retry.Sleeper} - Injectable backoff wait</li>
 * </ul>
 *
 * <h2>Result Type</h2>
 * <p>{@link com.ryuqq.hustle.core.retry.RetryResult} is a sealed interface with two cases,
 * {@link com.ryuqq.hustle.core.retry.Succeeded} and {@link com.ryuqq.hustle.core.retry.Exhausted},
 * both carrying the number of attempts made. {@code getOrThrow()} rethrows the original error
 * object unchanged.</p>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.retry;
