package uk.gegc.studyscheduler.shared.exception;

/**
 * Raised when the learner state store cannot be reached or rejects a read/write.
 * In-memory state held by the caller stays valid and the operation may be retried.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message) {
        super(message);
    }

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
