/**
 * Jackson Adapter - typed input contracts and tree-based change copying.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.hustle.adapter.jackson.JacksonInputContract} - Coerces a loose map into a record or POJO</li>
 *   <li>{@link com.ryuqq.hustle.adapter.jackson.JacksonChangeCopier} - Deep copy and patch merge through JsonNode</li>
 * </ul>
 *
 * @author Hustle Team
 * @since 1.0.0
 */
package com.ryuqq.hustle.adapter.jackson;
