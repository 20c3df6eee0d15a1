package ch.rps.rpsbackend.web.api.dto;

import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.domain.SessionSnapshot;
import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.SessionStatus;

import java.time.Instant;

/**
 * Public view of a session.
 *
 * <p>Moves are only revealed once the session is terminal; while it is active the view only tells
 * whether each slot has chosen.
 */
public record SessionViewDto(
        String sessionId,
        SessionStatus status,
        Long accountAId,
        String nameA,
        Long accountBId,
        String nameB,
        boolean choiceMadeA,
        boolean choiceMadeB,
        String moveA,
        String moveB,
        Long winnerAccountId,
        int deltaA,
        int deltaB,
        Instant deadlineA,
        Instant deadlineB,
        String rematchOf,
        String rematchSessionId
) {
    public static SessionViewDto from(SessionSnapshot s) {
        boolean reveal = s.status().isTerminal();
        Participant a = s.slotA();
        Participant b = s.slotB();
        return new SessionViewDto(
                s.sessionId(),
                s.status(),
                a.accountId(),
                a.displayName(),
                b != null ? b.accountId() : null,
                b != null ? b.displayName() : null,
                s.moveA() != null,
                s.moveB() != null,
                reveal ? wire(s.moveA()) : null,
                reveal ? wire(s.moveB()) : null,
                s.winnerAccountId(),
                s.ratingDeltaA(),
                s.ratingDeltaB(),
                s.deadlineA(),
                s.deadlineB(),
                s.rematchOf(),
                s.rematchSessionId()
        );
    }

    private static String wire(Move move) {
        return move != null ? move.wireName() : null;
    }
}
