/**
 * In-memory Provider adapter implementation package.
 *
 * <p>실제 전송 계층 없이 {@link com.ryuqq.orchestration.core.spi.ProviderClient}를
 * 재현하는 테스트/로컬 실행용 구현을 제공합니다.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.orchestration.adapter.inmemory.provider.InMemoryProviderClient}:
 *       Provider별 시나리오를 따르는 thread-safe ProviderClient</li>
 *   <li>{@link com.ryuqq.orchestration.adapter.inmemory.provider.ProviderScript}:
 *       응답/실패/지연 단계의 순차 시나리오</li>
 * </ul>
 *
 * @author Orchestration Team
 * @since 1.0.0
 */
package com.ryuqq.orchestration.adapter.inmemory.provider;
