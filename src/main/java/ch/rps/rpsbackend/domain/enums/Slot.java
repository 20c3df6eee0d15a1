package ch.rps.rpsbackend.domain.enums;

/**
 * One of the two participant positions of a session.
 */
public enum Slot {
    A,
    B;

    public Slot other() {
        return this == A ? B : A;
    }
}
