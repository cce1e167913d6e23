package uk.gegc.studyscheduler.features.streak.application;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.streak.domain.model.StreakRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;

/**
 * Rebuilds a streak record from raw activity instants, for learners whose record is missing or
 * needs repair.
 */
@Component
public class StreakHistoryCalculator {

    public StreakRecord fromActivity(Collection<Instant> activityInstants, ZoneId zone, LocalDate today) {
        List<LocalDate> days = activityInstants.stream()
                .map(instant -> instant.atZone(zone).toLocalDate())
                .filter(day -> !day.isAfter(today))
                .distinct()
                .sorted()
                .toList();
        if (days.isEmpty()) {
            return StreakRecord.empty();
        }

        int longest = 1;
        int run = 1;
        for (int i = 1; i < days.size(); i++) {
            run = days.get(i).isEqual(days.get(i - 1).plusDays(1)) ? run + 1 : 1;
            longest = Math.max(longest, run);
        }

        // run now holds the streak ending at the last active day
        LocalDate last = days.get(days.size() - 1);
        boolean alive = last.isEqual(today) || last.isEqual(today.minusDays(1));
        return new StreakRecord(last, alive ? run : 0, longest);
    }
}
