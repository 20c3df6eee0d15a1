package ch.rps.rpsbackend.web.api.dto;

import ch.rps.rpsbackend.domain.enums.SessionStatus;

public record QuickMatchResponseDto(
        String sessionId,
        SessionStatus status,
        boolean matched,
        String message
) {
    public static QuickMatchResponseDto matched(String sessionId, SessionStatus status) {
        return new QuickMatchResponseDto(sessionId, status, true, "Matched with a player!");
    }

    public static QuickMatchResponseDto waiting(String sessionId, SessionStatus status) {
        return new QuickMatchResponseDto(sessionId, status, false, "Waiting for an opponent...");
    }
}
