package uk.gegc.studyscheduler.features.repetition.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.studyscheduler.features.repetition.application.CardReviewService;
import uk.gegc.studyscheduler.features.repetition.application.ReviewQueueBuilder;
import uk.gegc.studyscheduler.features.repetition.application.ReviewWorkingSet;
import uk.gegc.studyscheduler.features.repetition.application.SrsAlgorithm;
import uk.gegc.studyscheduler.features.repetition.config.RepetitionProperties;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;
import uk.gegc.studyscheduler.features.repetition.domain.model.ReviewGrade;
import uk.gegc.studyscheduler.shared.exception.PersistenceUnavailableException;
import uk.gegc.studyscheduler.shared.persistence.LearnerStateStore;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CardReviewServiceImpl implements CardReviewService {

    private final Clock clock;
    private final LearnerStateStore learnerStateStore;
    private final SrsAlgorithm srsAlgorithm;
    private final ReviewQueueBuilder reviewQueueBuilder;
    private final RepetitionProperties repetitionProperties;
    private final MeterRegistry meterRegistry;

    @Override
    public ReviewWorkingSet openWorkingSet(String learnerId) {
        List<CardState> states = learnerStateStore.loadCardStates(learnerId);
        log.debug("Opened working set learnerId={} cards={}", learnerId, states.size());
        return new ReviewWorkingSet(learnerId, states);
    }

    @Override
    public CardState reviewCard(ReviewWorkingSet workingSet, String cardId, ReviewGrade grade) {
        Instant reviewedAt = Instant.now(clock);
        CardState current = workingSet.find(cardId)
                .orElseGet(() -> srsAlgorithm.initialState(cardId, reviewedAt));

        CardState next = srsAlgorithm.schedule(current, grade, reviewedAt);
        workingSet.putUnsaved(next);
        meterRegistry.counter("study.reviews.graded", "outcome", grade.isFailure() ? "fail" : "pass").increment();

        write(workingSet, next);
        log.info("Card reviewed learnerId={} cardId={} quality={} intervalDays={} dueAt={}",
                workingSet.getLearnerId(), cardId, grade.quality(), next.intervalDays(), next.dueAt());
        return next;
    }

    @Override
    public int flushPendingWrites(ReviewWorkingSet workingSet) {
        int written = 0;
        for (CardState state : workingSet.unsavedStates()) {
            write(workingSet, state);
            written++;
        }
        if (written > 0) {
            log.info("Flushed pending card writes learnerId={} count={}", workingSet.getLearnerId(), written);
        }
        return written;
    }

    @Override
    public List<String> dueQueue(ReviewWorkingSet workingSet, Integer limit) {
        int effectiveLimit = limit != null ? limit : repetitionProperties.getDefaultQueueLimit();
        return reviewQueueBuilder.buildQueue(workingSet.states(), Instant.now(clock), effectiveLimit);
    }

    private void write(ReviewWorkingSet workingSet, CardState state) {
        try {
            learnerStateStore.saveCardState(workingSet.getLearnerId(), state);
            workingSet.markSaved(state.cardId());
        } catch (PersistenceUnavailableException e) {
            log.warn("Card state kept in memory for retry learnerId={} cardId={}: {}",
                    workingSet.getLearnerId(), state.cardId(), e.getMessage());
            throw e;
        }
    }
}
