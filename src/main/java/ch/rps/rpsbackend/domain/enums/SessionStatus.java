package ch.rps.rpsbackend.domain.enums;

public enum SessionStatus {
    /**
     * Slot A bound, waiting for a second account.
     */
    WAITING,
    /**
     * Both slots bound, turn deadlines armed, moves are accepted.
     */
    ACTIVE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
