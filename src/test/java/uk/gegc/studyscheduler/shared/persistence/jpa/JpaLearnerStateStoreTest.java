package uk.gegc.studyscheduler.shared.persistence.jpa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.session.domain.model.ReviewSession;
import uk.gegc.studyscheduler.features.session.domain.model.SessionType;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@Import(JpaLearnerStateStore.class)
class JpaLearnerStateStoreTest {

    private static final Instant NOW = Instant.parse("2025-05-05T10:00:00Z");

    @Autowired
    private JpaLearnerStateStore store;

    @Test
    @DisplayName("Card states are upserted per learner and card")
    void upsertsCardStates() {
        store.saveCardState("a", CardState.initial("card-1", NOW));
        store.saveCardState("a", new CardState("card-1", 2.6, 6, 2, NOW.plus(6, ChronoUnit.DAYS), NOW));
        store.saveCardState("b", CardState.initial("card-1", NOW));

        assertThat(store.loadCardStates("a"))
                .containsExactly(new CardState("card-1", 2.6, 6, 2, NOW.plus(6, ChronoUnit.DAYS), NOW));
        assertThat(store.loadCardStates("b")).hasSize(1);
        assertThat(store.loadCardStates("nobody")).isEmpty();
    }

    @Test
    @DisplayName("Missing streak loads as empty and saved streak round-trips")
    void streakRecord() {
        assertThat(store.loadStreak("a")).isEqualTo(StreakRecord.empty());

        StreakRecord record = new StreakRecord(LocalDate.of(2025, 5, 4), 3, 7);
        store.saveStreak("a", record);

        assertThat(store.loadStreak("a")).isEqualTo(record);
    }

    @Test
    @DisplayName("Only completed sessions count as activity, oldest first")
    void sessionsAndActivity() {
        store.appendSession(session("s-2", true, NOW));
        store.appendSession(session("s-1", true, NOW.minus(1, ChronoUnit.DAYS)));
        store.appendSession(session("s-3", false, NOW.minus(2, ChronoUnit.DAYS)));

        assertThat(store.loadActivityInstants("a"))
                .containsExactly(NOW.minus(1, ChronoUnit.DAYS), NOW);
    }

    private static ReviewSession session(String id, boolean completed, Instant start) {
        ReviewSession session = new ReviewSession();
        session.setSessionId(id);
        session.setLearnerId("a");
        session.setSessionType(SessionType.REVIEW);
        session.setStartTime(start);
        session.setEndTime(start.plus(20, ChronoUnit.MINUTES));
        session.setDurationMinutes(20);
        session.setCompleted(completed);
        return session;
    }
}
