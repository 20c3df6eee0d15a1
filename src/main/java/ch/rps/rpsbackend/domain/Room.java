package ch.rps.rpsbackend.domain;

import ch.rps.rpsbackend.domain.enums.RoomType;

import java.util.Objects;

/**
 * Fan-out group a connection currently belongs to: nothing, the lobby, or one session.
 *
 * @param type      kind of room
 * @param sessionId session identity for {@link RoomType#SESSION}, {@code null} otherwise
 */
public record Room(RoomType type, String sessionId) {

    public static final Room NONE = new Room(RoomType.NONE, null);
    public static final Room LOBBY = new Room(RoomType.LOBBY, null);

    public Room {
        Objects.requireNonNull(type, "type");
        if (type == RoomType.SESSION && sessionId == null) {
            throw new IllegalArgumentException("Session room requires a session id");
        }
        if (type != RoomType.SESSION && sessionId != null) {
            throw new IllegalArgumentException("Only session rooms carry a session id");
        }
    }

    public static Room session(String sessionId) {
        return new Room(RoomType.SESSION, sessionId);
    }

    public boolean isLobby() {
        return type == RoomType.LOBBY;
    }

    public boolean isSession() {
        return type == RoomType.SESSION;
    }

    @Override
    public String toString() {
        return isSession() ? "Session:" + sessionId : type.name();
    }
}
