package ch.rps.rpsbackend.domain;

import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.Outcome;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.domain.enums.Slot;

import java.time.Instant;

/**
 * Consistent, immutable copy of a {@link GameSession} taken under the session lock.
 *
 * <p>Snapshots are what leaves the critical section: they feed outbound events, the
 * persistence write and the REST view.
 */
public record SessionSnapshot(
        String sessionId,
        SessionStatus status,
        Participant slotA,
        Participant slotB,
        Move moveA,
        Move moveB,
        Outcome outcome,
        int ratingDeltaA,
        int ratingDeltaB,
        boolean quickPlay,
        String rematchOf,
        String rematchSessionId,
        Instant createdAt,
        Instant completedAt,
        Instant deadlineA,
        Instant deadlineB
) {

    public Participant participant(Slot slot) {
        return slot == Slot.A ? slotA : slotB;
    }

    public Move move(Slot slot) {
        return slot == Slot.A ? moveA : moveB;
    }

    public Instant deadline(Slot slot) {
        return slot == Slot.A ? deadlineA : deadlineB;
    }

    public Long accountId(Slot slot) {
        Participant participant = participant(slot);
        return participant != null ? participant.accountId() : null;
    }

    public boolean hasTimeout() {
        return moveA == Move.TIMEOUT || moveB == Move.TIMEOUT;
    }

    public Long winnerAccountId() {
        if (outcome == null || outcome == Outcome.TIE) {
            return null;
        }
        return accountId(outcome == Outcome.A ? Slot.A : Slot.B);
    }

    public Long loserAccountId() {
        if (outcome == null || outcome == Outcome.TIE) {
            return null;
        }
        return accountId(outcome == Outcome.A ? Slot.B : Slot.A);
    }
}
