/**
 * Execution Coordinator contract.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.orchestration.application.coordinator.Coordinator} - plan/run 계약</li>
 *   <li>{@link com.ryuqq.orchestration.application.coordinator.ExecutionSummary} - 배치 결과 집계</li>
 *   <li>{@link com.ryuqq.orchestration.application.coordinator.RunOptions} - 실행 옵션</li>
 * </ul>
 *
 * <p><strong>구현체:</strong></p>
 * <p>구현체는 adapter-runner 모듈의 {@code ExecutionCoordinator}에서 제공됩니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.orchestration.application.coordinator;
