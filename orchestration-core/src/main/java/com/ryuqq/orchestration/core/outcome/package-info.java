/**
 * Provider call outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for a single routed provider call.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orchestration.core.outcome.Ok} - Provider responded</li>
 *   <li>{@link com.ryuqq.orchestration.core.outcome.Retry} - Transient failure (retryable on the same provider)</li>
 *   <li>{@link com.ryuqq.orchestration.core.outcome.Fail} - Permanent failure (requires failover)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestration Team
 */
package com.ryuqq.orchestration.core.outcome;
