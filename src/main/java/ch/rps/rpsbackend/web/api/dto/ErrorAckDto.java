package ch.rps.rpsbackend.web.api.dto;

import ch.rps.rpsbackend.domain.enums.ErrorCode;
import ch.rps.rpsbackend.exception.GameRuleException;

/**
 * Rejection sent back to the connection that issued a request ({@code /user/queue/errors}).
 *
 * @param code    machine readable reason
 * @param message human readable detail
 */
public record ErrorAckDto(
        ErrorCode code,
        String message
) {
    public static ErrorAckDto from(GameRuleException e) {
        return new ErrorAckDto(e.getCode(), e.getMessage());
    }
}
