package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;
import ch.rps.rpsbackend.domain.enums.SessionStatus;

public class NotActiveException extends GameRuleException {

    public NotActiveException(String sessionId, SessionStatus status) {
        super(ErrorCode.NOT_ACTIVE, "Session " + sessionId + " is not active (status " + status + ")");
    }
}
