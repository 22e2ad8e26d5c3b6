/**
 * OpenAI Adapter - chat-completions client for OpenAI-compatible endpoints.
 *
 * <p>Implements the {@link com.ryuqq.hustle.core.spi.ChatCompletion} SPI over
 * {@code java.net.http.HttpClient} with Jackson request and response handling.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.adapter.openai.LlmProvider} - Known providers and their defaults</li>
 *   <li>{@link com.ryuqq.hustle.adapter.openai.ChatEndpointConfig} - Base URL, API key, headers, timeout</li>
 *   <li>{@link com.ryuqq.hustle.adapter.openai.OpenAiCompatibleChatCompletion} - The client</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
package com.ryuqq.hustle.adapter.openai;
