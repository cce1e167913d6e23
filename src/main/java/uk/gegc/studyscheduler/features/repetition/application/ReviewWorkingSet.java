package uk.gegc.studyscheduler.features.repetition.application;

import uk.gegc.studyscheduler.features.repetition.domain.model.CardState;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory card states of the learner's active review session. States the store has not
 * accepted yet stay flagged as unsaved until a later write succeeds.
 * <p>
 * Not thread-safe; one working set belongs to one session.
 */
public class ReviewWorkingSet {

    private final String learnerId;
    private final Map<String, CardState> states = new LinkedHashMap<>();
    private final Set<String> unsavedCardIds = new LinkedHashSet<>();

    public ReviewWorkingSet(String learnerId, Collection<CardState> loaded) {
        this.learnerId = learnerId;
        loaded.forEach(state -> states.put(state.cardId(), state));
    }

    public String getLearnerId() {
        return learnerId;
    }

    public Optional<CardState> find(String cardId) {
        return Optional.ofNullable(states.get(cardId));
    }

    public Collection<CardState> states() {
        return Collections.unmodifiableCollection(states.values());
    }

    public void putUnsaved(CardState state) {
        states.put(state.cardId(), state);
        unsavedCardIds.add(state.cardId());
    }

    public void markSaved(String cardId) {
        unsavedCardIds.remove(cardId);
    }

    public List<CardState> unsavedStates() {
        return unsavedCardIds.stream().map(states::get).toList();
    }

    public boolean hasUnsavedStates() {
        return !unsavedCardIds.isEmpty();
    }
}
