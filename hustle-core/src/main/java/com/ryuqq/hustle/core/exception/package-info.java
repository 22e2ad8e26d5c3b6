/**
 * Error taxonomy raised by the engine itself.
 *
 * <p>Failures thrown by a work unit's own execute step are not wrapped into this hierarchy;
 * they are retried per the unit's retry policy and then rethrown unchanged.</p>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.exception;
