package uk.gegc.studyscheduler.features.repetition.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ReviewQueueStatsCalculator Tests")
class ReviewQueueStatsCalculatorTest {

    private static final Instant NOW = Instant.parse("2025-05-01T10:00:00Z");

    private final ReviewQueueStatsCalculator calculator = new ReviewQueueStatsCalculator(new RetentionEstimator());

    @Test
    @DisplayName("Counts due cards per maturity and averages their retention")
    void computesStats() {
        List<CardState> states = List.of(
                CardState.initial("new", NOW.minusSeconds(60)),
                new CardState("young", 2.5, 6, 3, NOW.minusSeconds(60), NOW.minus(6, ChronoUnit.DAYS)),
                new CardState("notDue", 2.5, 30, 6, NOW.plus(5, ChronoUnit.DAYS), NOW.minus(25, ChronoUnit.DAYS)));

        ReviewQueueStats stats = calculator.compute(states, NOW);

        assertThat(stats.totalCards()).isEqualTo(3);
        assertThat(stats.totalDue()).isEqualTo(2);
        assertThat(stats.dueByMaturity())
                .containsEntry(CardMaturity.NEW, 1)
                .containsEntry(CardMaturity.YOUNG, 1)
                .containsEntry(CardMaturity.MATURE, 0);
        // new card contributes 0, young card exp(-0.5) after a full interval
        assertThat(stats.averageDueRetention()).isCloseTo(Math.exp(-0.5) / 2, within(0.001));
    }

    @Test
    @DisplayName("Retention decays with time since review and is 0 for unseen cards")
    void retention() {
        RetentionEstimator estimator = new RetentionEstimator();

        assertThat(estimator.estimate(0, 10)).isEqualTo(1.0);
        assertThat(estimator.estimate(10, 10)).isCloseTo(Math.exp(-0.5), within(1e-9));
        assertThat(estimator.estimate(CardState.initial("c", NOW), NOW)).isZero();
    }

    @Test
    @DisplayName("Formats intervals for display")
    void formatsIntervals() {
        assertThat(IntervalFormatter.format(0)).isEqualTo("Today");
        assertThat(IntervalFormatter.format(1)).isEqualTo("1 day");
        assertThat(IntervalFormatter.format(16)).isEqualTo("16 days");
        assertThat(IntervalFormatter.format(45)).isEqualTo("2 months");
        assertThat(IntervalFormatter.format(31)).isEqualTo("1 month");
        assertThat(IntervalFormatter.format(800)).isEqualTo("2 years");
    }
}
