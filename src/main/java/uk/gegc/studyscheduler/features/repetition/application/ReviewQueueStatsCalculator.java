package uk.gegc.studyscheduler.features.repetition.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardMaturity;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ReviewQueueStatsCalculator {

    private final RetentionEstimator retentionEstimator;

    public ReviewQueueStats compute(Collection<CardState> states, Instant now) {
        List<CardState> due = states.stream()
                .filter(state -> state.isDue(now))
                .toList();

        Map<CardMaturity, Integer> byMaturity = new EnumMap<>(CardMaturity.class);
        for (CardMaturity maturity : CardMaturity.values()) {
            byMaturity.put(maturity, 0);
        }
        due.forEach(state -> byMaturity.merge(state.maturity(), 1, Integer::sum));

        double averageRetention = due.stream()
                .mapToDouble(state -> retentionEstimator.estimate(state, now))
                .average()
                .orElse(0.0);

        return new ReviewQueueStats(states.size(), due.size(), byMaturity, averageRetention);
    }
}
