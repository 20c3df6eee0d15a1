package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;
import ch.rps.rpsbackend.domain.enums.Slot;

public class AlreadyChosenException extends GameRuleException {

    public AlreadyChosenException(String sessionId, Slot slot) {
        super(ErrorCode.ALREADY_CHOSEN, "Slot " + slot + " of session " + sessionId + " has already chosen");
    }
}
