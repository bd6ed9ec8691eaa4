package com.ryuqq.orchestration.adapter.runner.health;

import com.ryuqq.orchestration.core.exception.ProviderException;
import com.ryuqq.orchestration.core.model.ProviderId;
import com.ryuqq.orchestration.core.provider.HealthStatus;
import com.ryuqq.orchestration.core.provider.ProviderConfig;
import com.ryuqq.orchestration.core.spi.ProviderClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * HealthCheckScheduler 유닛 테스트.
 */
@ExtendWith(MockitoExtension.class)
class HealthCheckSchedulerTest {

    private static final ProviderId P1 = ProviderId.of("provider-1");
    private static final ProviderId P2 = ProviderId.of("provider-2");

    @Mock
    private ProviderClient client;

    private ProviderHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new ProviderHealthMonitor(List.of(
            ProviderConfig.of("provider-1", 0),
            ProviderConfig.of("provider-2", 1)
        ));
    }

    @Test
    void 트래픽이_없어도_probe_실패가_누적되면_UNHEALTHY() {
        // given
        doThrow(ProviderException.connectionReset("refused")).when(client).ping(P1);
        HealthCheckScheduler scheduler = new HealthCheckScheduler(monitor, client, new HealthCheckConfig());

        // when
        for (int i = 0; i < 3; i++) {
            scheduler.runChecks();
        }

        // then
        assertThat(monitor.status(P1)).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(monitor.status(P2)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(monitor.metrics(P2).totalRequests()).isEqualTo(3);
    }

    @Test
    void probe가_비활성화되면_합성_요청을_보내지_않음() {
        // given
        HealthCheckScheduler scheduler = new HealthCheckScheduler(monitor, client,
            new HealthCheckConfig().withProbeEnabled(false));

        // when
        scheduler.runChecks();

        // then
        verify(client, never()).ping(P1);
        assertThat(monitor.metrics(P1).lastCheck()).isNotNull();
    }

    @Test
    void checkProvider는_기록_후_상태를_반환() {
        // given
        HealthCheckScheduler scheduler = new HealthCheckScheduler(monitor, client, new HealthCheckConfig());

        // when
        HealthStatus status = scheduler.checkProvider(P2);

        // then
        assertThat(status).isEqualTo(HealthStatus.HEALTHY);
        verify(client).ping(P2);
        assertThat(monitor.metrics(P2).totalRequests()).isEqualTo(1);
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void 응답없는_ping은_타임아웃_후_실패로_기록되고_다음_Provider를_막지_않음() throws Exception {
        // given
        CountDownLatch neverReleased = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        doAnswer(invocation -> {
            try {
                neverReleased.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        }).when(client).ping(P1);
        HealthCheckScheduler scheduler = new HealthCheckScheduler(monitor, client,
            new HealthCheckConfig().withProbeTimeoutMs(200));

        // when
        scheduler.runChecks();

        // then
        assertThat(monitor.metrics(P1).totalErrors()).isEqualTo(1);
        assertThat(monitor.metrics(P1).consecutiveFailures()).isEqualTo(1);
        assertThat(monitor.metrics(P2).totalRequests()).isEqualTo(1);
        assertThat(monitor.metrics(P2).totalErrors()).isZero();
        verify(client).ping(P2);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        scheduler.shutdown();
    }

    @Test
    void probeTimeoutMs는_양수여야_함() {
        assertThatThrownBy(() -> new HealthCheckConfig().withProbeTimeoutMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("probeTimeoutMs");
    }
}
