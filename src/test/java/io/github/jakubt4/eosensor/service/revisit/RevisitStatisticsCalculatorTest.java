package io.github.jakubt4.eosensor.service.revisit;

import io.github.jakubt4.eosensor.dto.RevisitGrid;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RevisitStatisticsCalculatorTest {

    private final RevisitStatisticsCalculator calculator = new RevisitStatisticsCalculator();

    @Test
    void summarizesCoveredCells() {
        final var grid = new RevisitGrid(new int[][] {{0, 1}, {3, 5}});

        final var stats = calculator.summarize(grid, 24);

        assertThat(stats.totalCells()).isEqualTo(4);
        assertThat(stats.coveredCells()).isEqualTo(3);
        assertThat(stats.coverage()).isCloseTo(75.0, within(1e-9));
        assertThat(stats.minRevisits()).isEqualTo(1);
        assertThat(stats.maxRevisits()).isEqualTo(5);
        assertThat(stats.averageRevisits()).isCloseTo(3.0, within(1e-9));
        assertThat(stats.averageRevisitTime()).isCloseTo(8.0, within(1e-9));
        assertThat(stats.minRevisitTime()).isCloseTo(6.0, within(1e-9));
        assertThat(stats.maxGap()).isCloseTo(12.0, within(1e-9));
    }

    @Test
    void emptyGridFallsBackToSpan() {
        final var stats = calculator.summarize(new RevisitGrid(new int[3][6]), 48);

        assertThat(stats.coveredCells()).isZero();
        assertThat(stats.coverage()).isZero();
        assertThat(stats.minRevisits()).isZero();
        assertThat(stats.averageRevisits()).isZero();
        assertThat(stats.averageRevisitTime()).isEqualTo(48.0);
        assertThat(stats.minRevisitTime()).isEqualTo(48.0);
        assertThat(stats.maxGap()).isEqualTo(48.0);
    }

    @Test
    void singleVisitsHaveNoRevisitInterval() {
        final var stats = calculator.summarize(new RevisitGrid(new int[][] {{1, 1}, {0, 1}}), 12);

        assertThat(stats.minRevisitTime()).isEqualTo(12.0);
        assertThat(stats.maxGap()).isEqualTo(12.0);
        assertThat(stats.averageRevisitTime()).isEqualTo(12.0);
    }
}
