package uk.gegc.studyscheduler.features.notification.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Learner notification preferences, passed explicitly into every computation.
 *
 * @param quietHoursStart start of the nightly quiet window, null for none; the window may span midnight
 */
@Builder(toBuilder = true)
public record NotificationPrefs(
        boolean enabled,
        boolean dueCards,
        boolean streakReminders,
        boolean breakReminders,
        boolean sessionComplete,
        ZoneId zone,
        LocalTime quietHoursStart,
        LocalTime quietHoursEnd
) {

    public NotificationPrefs {
        Objects.requireNonNull(zone, "zone");
    }

    public static NotificationPrefs defaults(ZoneId zone) {
        return new NotificationPrefs(true, true, true, true, true, zone, null, null);
    }

    public boolean allows(NotificationKind kind) {
        if (!enabled) return false;
        return switch (kind) {
            case DUE_CARDS_READY -> dueCards;
            case STREAK_AT_RISK -> streakReminders;
            case BREAK_REMINDER -> breakReminders;
            case SESSION_COMPLETE -> sessionComplete;
        };
    }

    public boolean isQuietAt(Instant instant) {
        if (quietHoursStart == null || quietHoursEnd == null || quietHoursStart.equals(quietHoursEnd)) {
            return false;
        }
        LocalTime local = instant.atZone(zone).toLocalTime();
        if (quietHoursStart.isBefore(quietHoursEnd)) {
            return !local.isBefore(quietHoursStart) && local.isBefore(quietHoursEnd);
        }
        return !local.isBefore(quietHoursStart) || local.isBefore(quietHoursEnd);
    }
}
