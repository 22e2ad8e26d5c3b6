/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Capabilities the engine's work units call into but does not implement itself.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.core.spi.ChatCompletion} - Messages + model identifier → response text (async)</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., hustle-adapter-openai) provide concrete implementations.
 * Provider failures surface as {@link com.ryuqq.hustle.core.spi.ChatCompletionException},
 * which work units let escape from {@code execute} so their retry policy can handle them.</p>
 *
 * @since 1.0.0
 * @author Hustle Team
 */
package com.ryuqq.hustle.core.spi;
