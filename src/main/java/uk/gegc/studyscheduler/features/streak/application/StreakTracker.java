package uk.gegc.studyscheduler.features.streak.application;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.streak.domain.exception.OutOfOrderActivityException;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Day-granular streak rules. All dates are in the learner's own zone; callers convert instants
 * before calling in.
 */
@Component
public class StreakTracker {

    public StreakRecord recordActivity(StreakRecord record, LocalDate activityDate) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(activityDate, "activityDate");

        LocalDate last = record.lastActivityDate();
        if (last == null) {
            return new StreakRecord(activityDate, 1, Math.max(record.longestStreak(), 1));
        }
        if (activityDate.isBefore(last)) {
            throw new OutOfOrderActivityException(last, activityDate);
        }
        if (activityDate.isEqual(last)) {
            return record;
        }

        int current = activityDate.isEqual(last.plusDays(1))
                ? record.currentStreak() + 1
                : 1;
        return new StreakRecord(activityDate, current, Math.max(record.longestStreak(), current));
    }

    /**
     * True once the learner-local clock passes {@code threshold} on a day that has no activity yet
     * while yesterday's streak is still alive.
     */
    public boolean isStreakAtRisk(StreakRecord record, ZonedDateTime localNow, LocalTime threshold) {
        if (record.currentStreak() <= 0 || record.lastActivityDate() == null) {
            return false;
        }
        LocalDate today = localNow.toLocalDate();
        if (!record.lastActivityDate().isEqual(today.minusDays(1))) {
            return false;
        }
        return !localNow.toLocalTime().isBefore(threshold);
    }

    /**
     * Streak as the learner sees it today: a stored streak whose last day is older than yesterday is broken.
     */
    public int effectiveCurrentStreak(StreakRecord record, LocalDate today) {
        LocalDate last = record.lastActivityDate();
        if (last == null) return 0;
        if (last.isEqual(today) || last.isEqual(today.minusDays(1))) {
            return record.currentStreak();
        }
        return 0;
    }
}
