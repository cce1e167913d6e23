package uk.gegc.studyscheduler.features.streak.application;

import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.time.Instant;
import java.time.ZoneId;

public interface StreakService {

    /**
     * Records learner activity at {@code activityAt}, counted on the learner-local date in {@code zone}.
     * Retries on concurrent updates; out-of-order activity is ignored.
     */
    StreakRecord recordActivity(String learnerId, Instant activityAt, ZoneId zone);

    StreakRecord recordActivityTx(String learnerId, Instant activityAt, ZoneId zone);

    boolean isStreakAtRisk(String learnerId, ZoneId zone);

    /**
     * Recomputes the stored record from the learner's completed sessions and saves it.
     */
    StreakRecord rebuildFromHistory(String learnerId, ZoneId zone);

    StreakRecord rebuildFromHistoryTx(String learnerId, ZoneId zone);
}
