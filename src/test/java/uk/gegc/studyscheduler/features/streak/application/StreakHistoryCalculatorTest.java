package uk.gegc.studyscheduler.features.streak.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StreakHistoryCalculator Tests")
class StreakHistoryCalculatorTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 20);

    private final StreakHistoryCalculator calculator = new StreakHistoryCalculator();

    @Test
    @DisplayName("Counts the run ending yesterday as current and the best run as longest")
    void currentAndLongest() {
        List<Instant> activity = List.of(
                utc("2025-06-01T10:00:00Z"), utc("2025-06-02T10:00:00Z"), utc("2025-06-03T10:00:00Z"),
                utc("2025-06-04T10:00:00Z"),
                utc("2025-06-18T08:00:00Z"), utc("2025-06-18T21:00:00Z"), utc("2025-06-19T07:00:00Z"));

        StreakRecord record = calculator.fromActivity(activity, ZoneOffset.UTC, TODAY);

        assertThat(record).isEqualTo(new StreakRecord(LocalDate.of(2025, 6, 19), 2, 4));
    }

    @Test
    @DisplayName("A run that ended before yesterday is not current")
    void brokenStreak() {
        StreakRecord record = calculator.fromActivity(
                List.of(utc("2025-06-10T10:00:00Z"), utc("2025-06-11T10:00:00Z")), ZoneOffset.UTC, TODAY);

        assertThat(record.currentStreak()).isZero();
        assertThat(record.longestStreak()).isEqualTo(2);
    }

    @Test
    @DisplayName("Local dates follow the learner's zone")
    void usesLearnerZone() {
        // 23:30 UTC on the 19th is already the 20th in Tokyo
        ZoneId tokyo = ZoneId.of("Asia/Tokyo");
        StreakRecord record = calculator.fromActivity(
                List.of(utc("2025-06-18T23:30:00Z"), utc("2025-06-19T23:30:00Z")), tokyo, TODAY);

        assertThat(record).isEqualTo(new StreakRecord(TODAY, 2, 2));
    }

    @Test
    @DisplayName("No activity gives an empty record")
    void noActivity() {
        assertThat(calculator.fromActivity(List.of(), ZoneOffset.UTC, TODAY)).isEqualTo(StreakRecord.empty());
    }

    private static Instant utc(String text) {
        return Instant.parse(text);
    }
}
