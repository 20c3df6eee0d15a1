package ch.rps.rpsbackend.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RealtimeEventType
{
    USER_JOINED_LOBBY,
    USER_LEFT_LOBBY,
    PLAYER_JOINED,
    WAITING_FOR_OPPONENT,
    CHOICE_MADE,
    GAME_RESULT,
    GAME_TIMEOUT,
    OPPONENT_DISCONNECTED,
    NEW_GAME_CREATED,
    PERSISTENCE_WARNING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
