package ch.rps.rpsbackend.web.api.dto;

/**
 * Inbound STOMP payload for a move submission.
 *
 * @param move "rock", "paper" or "scissors"
 */
public record MoveRequest(
        String move
) {}
