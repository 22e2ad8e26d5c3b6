/**
 * Testkit - fixtures for testing work-unit graphs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.testkit.RecordingObserver} - Captures engine events</li>
 *   <li>{@link com.ryuqq.hustle.testkit.RecordingSleeper} - Captures backoff delays without blocking</li>
 *   <li>{@link com.ryuqq.hustle.testkit.TestUnits} - Lambda-backed work units</li>
 *   <li>{@link com.ryuqq.hustle.testkit.contract.AbstractHustleContractTest} - Base class for contract tests</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
package com.ryuqq.hustle.testkit;
