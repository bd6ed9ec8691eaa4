/**
 * Orchestration domain model package.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.orchestration.core.model.Action} - Immutable unit of work with declared dependencies</li>
 *   <li>{@link com.ryuqq.orchestration.core.model.ExecutionPlan} - Ordered levels computed from an action set</li>
 *   <li>{@link com.ryuqq.orchestration.core.model.ActionResult} - Outcome of one attempt</li>
 *   <li>{@link com.ryuqq.orchestration.core.model.RetryPolicy} - Per-action retry and backoff settings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestration Team
 */
package com.ryuqq.orchestration.core.model;
