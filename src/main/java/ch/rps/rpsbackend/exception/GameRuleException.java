package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;
import lombok.Getter;

/**
 * Base class for rejected requests against the session engine.
 *
 * <p>A rule violation is local to the request that caused it: it is reported back to the
 * originating connection and leaves session state untouched.
 */
@Getter
public abstract class GameRuleException extends RuntimeException {

    private final ErrorCode code;

    protected GameRuleException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
