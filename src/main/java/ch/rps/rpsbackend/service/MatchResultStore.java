package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.SessionSnapshot;

/**
 * Persistence boundary for terminal sessions. Called exactly once per terminal transition,
 * never while a session lock is held.
 */
public interface MatchResultStore {

    /**
     * Stores the result of a completed session and applies rating deltas and win/loss/tie counters
     * to both accounts in one transaction.
     *
     * @param snapshot snapshot of a {@code COMPLETED} session
     */
    void commitCompleted(SessionSnapshot snapshot);

    /**
     * Stores a cancellation marker for a cancelled session. Accounts are not touched.
     *
     * @param snapshot snapshot of a {@code CANCELLED} session
     */
    void commitCancelled(SessionSnapshot snapshot);
}
