package ch.rps.rpsbackend.web.api.dto;

import ch.rps.rpsbackend.domain.SessionSnapshot;
import ch.rps.rpsbackend.domain.enums.RealtimeEventType;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Outbound event delivered to a single connection on {@code /user/queue/events}.
 *
 * @param type      event name on the wire (e.g. {@code game_result})
 * @param sessionId session the event belongs to, {@code null} for lobby events
 * @param timeStamp creation time of the event
 * @param payload   event specific fields
 */
public record RealtimeEventDto(
        RealtimeEventType type,
        String sessionId,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static RealtimeEventDto userJoinedLobby(Long accountId, String name) {
        return new RealtimeEventDto(
                RealtimeEventType.USER_JOINED_LOBBY,
                null,
                Instant.now(),
                Map.of(
                        "accountId", accountId,
                        "name", name
                )
        );
    }

    public static RealtimeEventDto userLeftLobby(Long accountId, String name) {
        return new RealtimeEventDto(
                RealtimeEventType.USER_LEFT_LOBBY,
                null,
                Instant.now(),
                Map.of(
                        "accountId", accountId,
                        "name", name
                )
        );
    }

    public static RealtimeEventDto playerJoined(String sessionId, Long accountId, String name,
                                                String opponentName, boolean active, long deadlineSeconds) {
        // names may be null for accounts without a display name, Map.of would reject them
        Map<String, Object> payload = new HashMap<>();
        payload.put("accountId", accountId);
        payload.put("name", name);
        payload.put("opponentName", opponentName);
        payload.put("active", active);
        payload.put("deadlineSeconds", deadlineSeconds);

        return new RealtimeEventDto(
                RealtimeEventType.PLAYER_JOINED,
                sessionId,
                Instant.now(),
                payload
        );
    }

    public static RealtimeEventDto waitingForOpponent(String sessionId) {
        return new RealtimeEventDto(
                RealtimeEventType.WAITING_FOR_OPPONENT,
                sessionId,
                Instant.now(),
                Map.of(
                        "message", "Waiting for another player to join..."
                )
        );
    }

    public static RealtimeEventDto choiceMade(String sessionId, Long accountId) {
        return new RealtimeEventDto(
                RealtimeEventType.CHOICE_MADE,
                sessionId,
                Instant.now(),
                Map.of(
                        "accountId", accountId
                )
        );
    }

    public static RealtimeEventDto gameResult(SessionSnapshot snapshot) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("moveA", snapshot.moveA().wireName());
        payload.put("moveB", snapshot.moveB().wireName());
        payload.put("winnerAccountId", snapshot.winnerAccountId());
        payload.put("deltaA", snapshot.ratingDeltaA());
        payload.put("deltaB", snapshot.ratingDeltaB());

        return new RealtimeEventDto(
                RealtimeEventType.GAME_RESULT,
                snapshot.sessionId(),
                Instant.now(),
                payload
        );
    }

    public static RealtimeEventDto gameTimeout(SessionSnapshot snapshot) {
        // both ids are null when both slots timed out
        Map<String, Object> payload = new HashMap<>();
        payload.put("winnerAccountId", snapshot.winnerAccountId());
        payload.put("loserAccountId", snapshot.loserAccountId());
        payload.put("deltaA", snapshot.ratingDeltaA());
        payload.put("deltaB", snapshot.ratingDeltaB());

        return new RealtimeEventDto(
                RealtimeEventType.GAME_TIMEOUT,
                snapshot.sessionId(),
                Instant.now(),
                payload
        );
    }

    public static RealtimeEventDto opponentDisconnected(String sessionId) {
        return new RealtimeEventDto(
                RealtimeEventType.OPPONENT_DISCONNECTED,
                sessionId,
                Instant.now(),
                Map.of(
                        "message", "Your opponent disconnected. The game was cancelled."
                )
        );
    }

    public static RealtimeEventDto newGameCreated(String previousSessionId, String newSessionId) {
        return new RealtimeEventDto(
                RealtimeEventType.NEW_GAME_CREATED,
                previousSessionId,
                Instant.now(),
                Map.of(
                        "sessionId", newSessionId
                )
        );
    }

    public static RealtimeEventDto persistenceWarning(String sessionId) {
        return new RealtimeEventDto(
                RealtimeEventType.PERSISTENCE_WARNING,
                sessionId,
                Instant.now(),
                Map.of(
                        "message", "The result is final but could not be saved yet. Ratings may update later."
                )
        );
    }
}
