/**
 * Runner Layer - queue-driven scheduler.
 *
 * <p>This package walks a work-unit graph from one entry unit with a FIFO queue of
 * (unit, envelope) pairs, forking the envelope once per followed route.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.runner.Hustle} - Breadth-first scheduler</li>
 *   <li>{@link com.ryuqq.hustle.runner.HustleConfig} - Failure mode and step budget</li>
 *   <li>{@link com.ryuqq.hustle.runner.RunSummary} - Steps, terminated branches, contained failures</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * hustle-runner (Hustle)
 *   ↓ depends on
 * hustle-core (WorkUnit, StateEnvelope, Move, RetryPolicy, HustleObserver)
 * </pre>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
package com.ryuqq.hustle.runner;
