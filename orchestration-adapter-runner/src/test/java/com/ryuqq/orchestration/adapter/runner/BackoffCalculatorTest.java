package com.ryuqq.orchestration.adapter.runner;

import com.ryuqq.orchestration.core.model.BackoffShape;
import com.ryuqq.orchestration.core.model.RetryPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 */
class BackoffCalculatorTest {

    private final BackoffCalculator deterministic = new BackoffCalculator(0.0);

    @Test
    void EXPONENTIAL은_시도마다_두_배() {
        assertThat(deterministic.calculate(BackoffShape.EXPONENTIAL, 100, 10_000, 1)).isEqualTo(100);
        assertThat(deterministic.calculate(BackoffShape.EXPONENTIAL, 100, 10_000, 2)).isEqualTo(200);
        assertThat(deterministic.calculate(BackoffShape.EXPONENTIAL, 100, 10_000, 4)).isEqualTo(800);
    }

    @Test
    void LINEAR는_시도_수에_비례() {
        assertThat(deterministic.calculate(BackoffShape.LINEAR, 100, 10_000, 1)).isEqualTo(100);
        assertThat(deterministic.calculate(BackoffShape.LINEAR, 100, 10_000, 3)).isEqualTo(300);
    }

    @Test
    void 최대_지연으로_제한() {
        assertThat(deterministic.calculate(BackoffShape.EXPONENTIAL, 1_000, 5_000, 10)).isEqualTo(5_000);
        assertThat(deterministic.calculate(BackoffShape.EXPONENTIAL, 1_000, 5_000, 200)).isEqualTo(5_000);
    }

    @Test
    void Jitter는_지연의_비율_범위_안에서_추가() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(0.5);

        // when & then
        for (int i = 0; i < 100; i++) {
            assertThat(calculator.calculate(BackoffShape.EXPONENTIAL, 1_000, 60_000, 2))
                .isBetween(2_000L, 3_000L);
        }
    }

    @Test
    void 기본_지연이_0이면_즉시_재시도() {
        assertThat(new BackoffCalculator().calculate(new RetryPolicy(3, BackoffShape.LINEAR, 0, 0), 2))
            .isZero();
    }

    @Test
    void 재시도_정책으로_계산() {
        // given
        RetryPolicy policy = new RetryPolicy(5, BackoffShape.EXPONENTIAL, 250, 1_000);

        // when & then
        assertThat(deterministic.calculate(policy, 2)).isEqualTo(500);
        assertThat(deterministic.calculate(policy, 3)).isEqualTo(1_000);
    }

    @Test
    void 잘못된_인자는_거부() {
        assertThatThrownBy(() -> deterministic.calculate(BackoffShape.LINEAR, 100, 1_000, 0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> deterministic.calculate(null, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(1.5))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
