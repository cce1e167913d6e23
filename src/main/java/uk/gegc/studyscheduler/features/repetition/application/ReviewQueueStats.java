package uk.gegc.studyscheduler.features.repetition.application;

import uk.gegc.studyscheduler.features.repetition.domain.model.CardMaturity;

import java.util.Map;

public record ReviewQueueStats(
        int totalCards,
        int totalDue,
        Map<CardMaturity, Integer> dueByMaturity,
        double averageDueRetention
) {
    public ReviewQueueStats {
        dueByMaturity = Map.copyOf(dueByMaturity);
    }
}
