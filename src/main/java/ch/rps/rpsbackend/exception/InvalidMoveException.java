package ch.rps.rpsbackend.exception;

import ch.rps.rpsbackend.domain.enums.ErrorCode;

public class InvalidMoveException extends GameRuleException {

    public InvalidMoveException(String move) {
        super(ErrorCode.INVALID_MOVE, "Invalid move: " + move);
    }
}
