/**
 * Admission control SPI.
 *
 * <ul>
 *   <li>{@link com.ryuqq.orchestration.core.protection.RateLimiter} - Token consumption per key</li>
 *   <li>{@link com.ryuqq.orchestration.core.protection.noop.NoOpRateLimiter} - Always admits</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestration Team
 */
package com.ryuqq.orchestration.core.protection;
