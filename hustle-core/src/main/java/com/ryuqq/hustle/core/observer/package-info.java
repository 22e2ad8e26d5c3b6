/**
 * Structured event stream emitted by the scheduler and the retry policy.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.observer.HustleObserver} - Injectable event sink</li>
 *   <li>{@link com.ryuqq.hustle.core.observer.HustleEvent} - Event name plus ordered key/value fields</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.observer.Slf4jHustleObserver} - Default, renders events through SLF4J</li>
 *   <li>{@code HustleObserver.noop()} - Discards events</li>
 *   <li>{@code HustleObserver.composite(...)} - Fans out to several observers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.observer;
