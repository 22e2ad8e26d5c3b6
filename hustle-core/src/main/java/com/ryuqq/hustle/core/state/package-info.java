/**
 * Run state carried between work units.
 *
 * <h2>Partitions</h2>
 * <ul>
 *   <li><strong>capital</strong> - Shared by reference across the whole run and all its branches</li>
 *   <li><strong>change</strong> - Branch-local, deep-copied on every fork</li>
 * </ul>
 *
 * <h2>Copying</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.state.ChangeCopier} - Copy/merge strategy SPI</li>
 *   <li>{@link com.ryuqq.hustle.core.state.DefaultChangeCopier} - Maps, collections, arrays, immutable JDK values</li>
 *   <li>{@link com.ryuqq.hustle.core.state.Forkable} / {@link com.ryuqq.hustle.core.state.Patchable} -
 *       Explicit copy and merge for structured values</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.state;
