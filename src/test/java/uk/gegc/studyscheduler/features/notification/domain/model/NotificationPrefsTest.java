package uk.gegc.studyscheduler.features.notification.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationPrefs Tests")
class NotificationPrefsTest {

    @Test
    @DisplayName("Quiet hours spanning midnight cover late evening and early morning")
    void quietHoursAcrossMidnight() {
        NotificationPrefs prefs = NotificationPrefs.defaults(ZoneOffset.UTC).toBuilder()
                .quietHoursStart(LocalTime.of(22, 0))
                .quietHoursEnd(LocalTime.of(7, 0))
                .build();

        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T23:15:00Z"))).isTrue();
        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T06:59:00Z"))).isTrue();
        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T07:00:00Z"))).isFalse();
        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T12:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Quiet hours within one day")
    void quietHoursSameDay() {
        NotificationPrefs prefs = NotificationPrefs.defaults(ZoneOffset.UTC).toBuilder()
                .quietHoursStart(LocalTime.of(13, 0))
                .quietHoursEnd(LocalTime.of(14, 0))
                .build();

        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T13:30:00Z"))).isTrue();
        assertThat(prefs.isQuietAt(Instant.parse("2025-01-01T14:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Master switch disables every kind")
    void masterSwitch() {
        NotificationPrefs prefs = NotificationPrefs.defaults(ZoneOffset.UTC).toBuilder().enabled(false).build();

        for (NotificationKind kind : NotificationKind.values()) {
            assertThat(prefs.allows(kind)).isFalse();
        }
        assertThat(NotificationPrefs.defaults(ZoneOffset.UTC).toBuilder().breakReminders(false).build()
                .allows(NotificationKind.BREAK_REMINDER)).isFalse();
    }
}
