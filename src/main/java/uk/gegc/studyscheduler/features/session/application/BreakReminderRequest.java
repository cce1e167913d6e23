package uk.gegc.studyscheduler.features.session.application;

import java.time.Duration;
import java.time.Instant;

/**
 * @param crossingIndex    1 for the first threshold crossed in the current active stretch, 2 for the second
 * @param stretch          active stretch the crossing belongs to, incremented on every resume
 * @param continuousActive threshold multiple that was crossed
 * @param requestedAt      tick instant that detected the crossing
 */
public record BreakReminderRequest(
        String sessionId,
        String learnerId,
        int crossingIndex,
        int stretch,
        Duration continuousActive,
        Instant requestedAt
) {
}
