/**
 * Work units and the moves they emit.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.task.WorkUnit} - validate / execute / deliver / finalize step and link table</li>
 *   <li>{@link com.ryuqq.hustle.core.task.Move} - Routing intent: route name plus optional change patch</li>
 *   <li>{@link com.ryuqq.hustle.core.task.MoveEmitter} - Declares moves during delivery</li>
 * </ul>
 *
 * <h2>Input Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.task.InputContract} - Validates and coerces a map-shaped change</li>
 *   <li>{@link com.ryuqq.hustle.core.task.MapSchemaContract} - Named, typed required/optional fields</li>
 * </ul>
 *
 * <h2>Validation Bypass</h2>
 * <p>Contracts only apply when the change is a {@code java.util.Map}. A structured change
 * (record, POJO, {@code Forkable}) is handed to {@code execute} as is, even when a contract
 * is configured: it is treated as already validated upstream.</p>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.task;
