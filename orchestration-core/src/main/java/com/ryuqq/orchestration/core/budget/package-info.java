/**
 * Budget model package.
 *
 * <p>Immutable budget state per request chain, guardrail thresholds and model pricing.
 * Decision logic lives in the runner adapter.</p>
 *
 * @since 1.0.0
 * @author Orchestration Team
 */
package com.ryuqq.orchestration.core.budget;
