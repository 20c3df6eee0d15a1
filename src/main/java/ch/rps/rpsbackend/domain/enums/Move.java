package ch.rps.rpsbackend.domain.enums;

import ch.rps.rpsbackend.exception.InvalidMoveException;

import java.util.Locale;

/**
 * Value recorded in a session slot.
 *
 * <p>{@link #ROCK}, {@link #PAPER} and {@link #SCISSORS} are the playable moves. {@link #TIMEOUT}
 * is never submitted by a client; it is recorded when a slot's turn deadline expires.
 */
public enum Move {
    ROCK,
    PAPER,
    SCISSORS,
    TIMEOUT;

    public boolean isPlayable() {
        return this != TIMEOUT;
    }

    /**
     * Beats-relation over the playable moves: rock > scissors > paper > rock.
     *
     * @param other opposing move
     * @return {@code true} if this move wins against {@code other}
     */
    public boolean beats(Move other) {
        return switch (this) {
            case ROCK -> other == SCISSORS;
            case PAPER -> other == ROCK;
            case SCISSORS -> other == PAPER;
            case TIMEOUT -> false;
        };
    }

    /**
     * Lower-case name used on the wire ("rock", "paper", "scissors", "timeout").
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a move submitted by a client. Only playable moves are accepted.
     *
     * @param value raw move, case-insensitive
     * @return parsed move
     * @throws InvalidMoveException if the value is missing or not a playable move
     */
    public static Move fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidMoveException(value);
        }
        try {
            Move move = Move.valueOf(value.trim().toUpperCase(Locale.ROOT));
            if (!move.isPlayable()) {
                throw new InvalidMoveException(value);
            }
            return move;
        } catch (IllegalArgumentException e) {
            throw new InvalidMoveException(value);
        }
    }
}
