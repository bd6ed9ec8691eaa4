package com.ryuqq.orchestration.adapter.runner.ratelimit;

/**
 * 대기열 통계.
 *
 * @param queueSize 현재 대기 중인 요청 수
 * @param processed 성공적으로 처리된 요청 수
 * @param failed 실패한 처리 시도 수 (재등록 포함)
 * @param deadLettered 재시도 소진으로 폐기된 요청 수
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
public record QueueStats(int queueSize, long processed, long failed, long deadLettered) {
}
