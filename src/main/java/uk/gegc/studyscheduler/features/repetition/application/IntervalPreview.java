package uk.gegc.studyscheduler.features.repetition.application;

/**
 * Interval in days each rating button would schedule the card for.
 */
public record IntervalPreview(int again, int hard, int good, int easy) {
}
