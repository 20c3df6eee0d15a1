package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;

/**
 * Writing a finished session to the store failed. The in-memory result stays authoritative.
 */
public class PersistenceFailureException extends GameRuleException {

    public PersistenceFailureException(String message) {
        super(ErrorCode.PERSISTENCE_FAILURE, message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        this(message);
        initCause(cause);
    }
}
