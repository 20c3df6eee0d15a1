package ch.rps.rpsbackend.domain.enums;

/**
 * Result of a session from the point of view of its slots.
 */
public enum Outcome {
    A,
    B,
    TIE;

    public static Outcome winnerOf(Slot slot) {
        return slot == Slot.A ? A : B;
    }

    public Outcome mirrored() {
        return switch (this) {
            case A -> B;
            case B -> A;
            case TIE -> TIE;
        };
    }
}
