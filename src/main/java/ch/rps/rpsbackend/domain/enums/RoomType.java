package ch.rps.rpsbackend.domain.enums;

public enum RoomType {
    NONE,
    LOBBY,
    SESSION
}
