package uk.gegc.studyscheduler.features.repetition.application;

import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.repetition.domain.model.ReviewGrade;

import java.util.List;

public interface CardReviewService {

    ReviewWorkingSet openWorkingSet(String learnerId);

    /**
     * Grades one card, keeps the new state in the working set and writes it through to the store.
     *
     * @throws uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException when the write
     *         fails; the new state stays in the working set for {@link #flushPendingWrites}
     */
    CardState reviewCard(ReviewWorkingSet workingSet, String cardId, ReviewGrade grade);

    /**
     * Retries writes the store rejected earlier.
     *
     * @return number of states written
     */
    int flushPendingWrites(ReviewWorkingSet workingSet);

    List<String> dueQueue(ReviewWorkingSet workingSet, Integer limit);
}
