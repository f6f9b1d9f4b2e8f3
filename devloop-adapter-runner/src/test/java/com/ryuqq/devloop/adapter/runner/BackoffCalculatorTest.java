package com.ryuqq.devloop.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_jitter없이_지수적으로_증가함() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.5, () -> 0.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(400);
    }

    @Test
    void calculate_jitter는_지수값의_비율_이내() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.5, () -> 0.99);

        assertThat(calculator.calculate(2)).isEqualTo(299);
    }

    @Test
    void calculate_maxDelay로_제한됨() {
        BackoffCalculator calculator = new BackoffCalculator(100, 1_000, 0.1, () -> 0.5);

        assertThat(calculator.calculate(40)).isEqualTo(1_000);
    }

    @Test
    void calculate_attempt가_0이면_예외() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }

    @Test
    void constructor_maxDelay가_baseDelay보다_작으면_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(1_000, 10, 0.1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
    }
}
