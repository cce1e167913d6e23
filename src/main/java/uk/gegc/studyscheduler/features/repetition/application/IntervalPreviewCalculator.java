package uk.gegc.studyscheduler.features.repetition.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.repetition.domain.model.RepetitionRating;
import uk.gegc.studyscheduler.features.repetition.domain.model.ReviewGrade;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class IntervalPreviewCalculator {

    private final SrsAlgorithm srsAlgorithm;

    public IntervalPreview preview(CardState state, Instant now) {
        return new IntervalPreview(
                intervalFor(state, RepetitionRating.AGAIN, now),
                intervalFor(state, RepetitionRating.HARD, now),
                intervalFor(state, RepetitionRating.GOOD, now),
                intervalFor(state, RepetitionRating.EASY, now)
        );
    }

    private int intervalFor(CardState state, RepetitionRating rating, Instant now) {
        return srsAlgorithm.schedule(state, ReviewGrade.of(rating), now).intervalDays();
    }
}
