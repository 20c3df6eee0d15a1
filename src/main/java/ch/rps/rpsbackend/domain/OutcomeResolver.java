package ch.rps.rpsbackend.domain;

import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.Outcome;

/**
 * Decides a round from the two playable moves. Stateless.
 */
public final class OutcomeResolver {

    private OutcomeResolver() {
        // utility class
    }

    /**
     * Resolves the moves of slot A and slot B.
     *
     * <p>Timeouts never reach this method: a timed-out slot loses without comparing moves.
     *
     * @param moveA move of slot A
     * @param moveB move of slot B
     * @return {@link Outcome#A}, {@link Outcome#B} or {@link Outcome#TIE} (iff both moves are equal)
     * @throws IllegalArgumentException if a move is missing or {@link Move#TIMEOUT}
     */
    public static Outcome resolve(Move moveA, Move moveB) {
        if (moveA == null || moveB == null || !moveA.isPlayable() || !moveB.isPlayable()) {
            throw new IllegalArgumentException("Only playable moves can be resolved: " + moveA + " vs " + moveB);
        }
        if (moveA == moveB) {
            return Outcome.TIE;
        }
        return moveA.beats(moveB) ? Outcome.A : Outcome.B;
    }
}
