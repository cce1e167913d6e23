package uk.gegc.studyscheduler.features.repetition.application;

import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.repetition.domain.model.ReviewGrade;

import java.time.Instant;

public interface SrsAlgorithm {

    /**
     * Applies one graded review to a card and returns its next state. Pure: same inputs, same output.
     */
    CardState schedule(CardState state, ReviewGrade grade, Instant now);

    CardState initialState(String cardId, Instant now);
}
