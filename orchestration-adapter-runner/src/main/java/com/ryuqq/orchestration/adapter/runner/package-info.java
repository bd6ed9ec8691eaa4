/**
 * Orchestration 실행 어댑터.
 *
 * <p>{@link com.ryuqq.orchestration.adapter.runner.ExecutionCoordinator}가 레벨 단위로 Action을 실행하고,
 * 하위 패키지가 Provider 선택, Rate Limit, 건강 상태, 예산을 담당합니다.</p>
 *
 * <ul>
 *   <li>{@code routing}: Multi-Provider Router와 실패 분류</li>
 *   <li>{@code ratelimit}: Token Bucket, 조정 Rate Limiter, 요청 대기열</li>
 *   <li>{@code health}: Provider Health Monitor와 주기적 점검</li>
 *   <li>{@code budget}: 비용 계산, Guardrail, 요청 체인 예산 장부</li>
 *   <li>{@code config}: JSON 설정 로더</li>
 * </ul>
 */
package com.ryuqq.orchestration.adapter.runner;
