package uk.gegc.studyscheduler.features.repetition.domain.model;

import uk.gegc.studyscheduler.features.repetition.domain.exception.InvalidGradeException;

import java.util.Locale;

/**
 * SM-2 quality score in the range 0..5. Grades below 3 count as a failed recall.
 */
public record ReviewGrade(int quality) {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;
    public static final int PASSING_QUALITY = 3;

    public ReviewGrade {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new InvalidGradeException("Grade must be between 0 and 5, got " + quality);
        }
    }

    public static ReviewGrade of(int quality) {
        return new ReviewGrade(quality);
    }

    public static ReviewGrade of(RepetitionRating rating) {
        if (rating == null) {
            throw new InvalidGradeException("Rating is required");
        }
        return new ReviewGrade(rating.getSm2Value());
    }

    /**
     * Parses a rating label ("again", "hard", "good", "easy"), case-insensitive.
     */
    public static ReviewGrade fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidGradeException("Rating label is required");
        }
        try {
            return of(RepetitionRating.valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new InvalidGradeException("Unknown rating label: " + label);
        }
    }

    public boolean isFailure() {
        return quality < PASSING_QUALITY;
    }
}
