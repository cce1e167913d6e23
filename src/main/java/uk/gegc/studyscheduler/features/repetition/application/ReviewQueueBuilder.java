package uk.gegc.studyscheduler.features.repetition.application;

import org.springframework.stereotype.Component;
import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Derives the review queue from card states. Nothing is cached: every call re-reads the states it
 * is given, so a card rescheduled a moment ago is never served from a stale order.
 */
@Component
public class ReviewQueueBuilder {

    public static final Comparator<CardState> QUEUE_ORDER = Comparator
            .comparing(CardState::dueAt)
            .thenComparingInt(CardState::repetitions)
            .thenComparing(CardState::cardId);

    public List<String> buildQueue(Collection<CardState> states, Instant now) {
        return buildQueue(states, now, null);
    }

    /**
     * @param limit maximum queue length, null for no cap
     * @return due card ids, most overdue first
     */
    public List<String> buildQueue(Collection<CardState> states, Instant now, Integer limit) {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(now, "now");
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("Queue limit must be positive, got " + limit);
        }

        return states.stream()
                .filter(state -> state.isDue(now))
                .sorted(QUEUE_ORDER)
                .limit(limit == null ? Long.MAX_VALUE : limit)
                .map(CardState::cardId)
                .toList();
    }

    public ReviewQueueSnapshot snapshot(Collection<CardState> states, Instant now) {
        List<String> due = buildQueue(states, now);
        Instant nextDueAt = states.stream()
                .map(CardState::dueAt)
                .filter(dueAt -> dueAt.isAfter(now))
                .min(Comparator.naturalOrder())
                .orElse(null);
        return new ReviewQueueSnapshot(due, nextDueAt, now);
    }
}
