package uk.gegc.studyscheduler.features.repetition.domain.exception;

public class InvalidGradeException extends RuntimeException {

    public InvalidGradeException(String message) {
        super(message);
    }
}
