package uk.gegc.studyscheduler.features.streak.domain.model;

import java.time.LocalDate;

/**
 * @param lastActivityDate learner-local date of the last recorded activity, null before any
 * @param currentStreak    consecutive active days ending at {@code lastActivityDate}
 * @param longestStreak    best streak ever reached
 */
public record StreakRecord(LocalDate lastActivityDate, int currentStreak, int longestStreak) {

    public StreakRecord {
        if (currentStreak < 0) {
            throw new IllegalArgumentException("currentStreak must be >= 0, got " + currentStreak);
        }
        if (longestStreak < currentStreak) {
            throw new IllegalArgumentException("longestStreak " + longestStreak
                    + " is below currentStreak " + currentStreak);
        }
    }

    public static StreakRecord empty() {
        return new StreakRecord(null, 0, 0);
    }

    public boolean hasActivity() {
        return lastActivityDate != null;
    }
}
