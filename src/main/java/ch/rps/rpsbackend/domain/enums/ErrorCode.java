package ch.rps.rpsbackend.domain.enums;

/**
 * Codes reported back to a client when one of its requests is rejected.
 */
public enum ErrorCode {
    ALREADY_ACTIVE,
    NOT_ACTIVE,
    UNKNOWN_PARTICIPANT,
    ALREADY_CHOSEN,
    SESSION_NOT_FOUND,
    INVALID_MOVE,
    REMATCH_UNAVAILABLE,
    PERSISTENCE_FAILURE
}
