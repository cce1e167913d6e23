package uk.gegc.studyscheduler.features.repetition.domain.model;

public enum CardMaturity {
    NEW,
    LEARNING,
    YOUNG,
    MATURE;

    static final int LEARNING_REPETITIONS = 3;
    static final int MATURE_INTERVAL_DAYS = 21;

    public static CardMaturity of(int repetitions, int intervalDays) {
        if (repetitions == 0) return NEW;
        if (repetitions < LEARNING_REPETITIONS) return LEARNING;
        if (intervalDays < MATURE_INTERVAL_DAYS) return YOUNG;
        return MATURE;
    }
}
