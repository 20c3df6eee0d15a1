package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;

public class UnknownParticipantException extends GameRuleException {

    public UnknownParticipantException(String message) {
        super(ErrorCode.UNKNOWN_PARTICIPANT, message);
    }

    public static UnknownParticipantException notBound(String sessionId, Long accountId) {
        return new UnknownParticipantException("Account " + accountId + " does not belong to session " + sessionId);
    }
}
