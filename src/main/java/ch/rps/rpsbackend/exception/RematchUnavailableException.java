package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;
import ch.rps.rpsbackend.domain.enums.SessionStatus;

public class RematchUnavailableException extends GameRuleException {

    public RematchUnavailableException(String sessionId, SessionStatus status) {
        super(ErrorCode.REMATCH_UNAVAILABLE,
                "Rematch requires a completed session, " + sessionId + " is " + status);
    }
}
