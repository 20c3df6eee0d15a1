package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;

public class AlreadyActiveException extends GameRuleException {

    public AlreadyActiveException(String sessionId) {
        super(ErrorCode.ALREADY_ACTIVE, "Session " + sessionId + " is no longer waiting for an opponent");
    }
}
