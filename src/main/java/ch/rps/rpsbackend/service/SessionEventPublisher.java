package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.PresenceEntry;
import ch.rps.rpsbackend.domain.Room;
import ch.rps.rpsbackend.web.api.dto.RealtimeEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Delivers outbound events to individual connections.
 *
 * <p>Every event is addressed to one STOMP session on {@code /user/queue/events}. Delivery is
 * fire-and-forget per connection: the broker hands the message to its outbound channel, and a
 * failure for one connection is logged without affecting the others.
 */
@Component
@Slf4j
public class SessionEventPublisher {

    public static final String EVENTS_DESTINATION = "/queue/events";

    private final SimpMessagingTemplate messagingTemplate;
    private final PresenceRegistry presenceRegistry;

    public SessionEventPublisher(SimpMessagingTemplate messagingTemplate, PresenceRegistry presenceRegistry) {
        this.messagingTemplate = messagingTemplate;
        this.presenceRegistry = presenceRegistry;
    }

    public void publishToConnection(String connectionId, RealtimeEventDto event) {
        try {
            messagingTemplate.convertAndSendToUser(connectionId, EVENTS_DESTINATION, event, headersFor(connectionId));
            log.debug("Sent {} to connection {}", event.type(), connectionId);
        } catch (MessagingException e) {
            log.warn("Could not deliver {} to connection {}: {}", event.type(), connectionId, e.getMessage());
        }
    }

    /**
     * Sends the event to every connection currently in the session's room.
     */
    public void publishToSessionRoom(String sessionId, RealtimeEventDto event) {
        publishToRoom(Room.session(sessionId), event);
    }

    /**
     * Sends the event to the connections of one participant that are in the session's room.
     */
    public void publishToParticipant(String sessionId, Long accountId, RealtimeEventDto event) {
        for (PresenceEntry entry : presenceRegistry.connectionsIn(Room.session(sessionId))) {
            if (entry.accountId().equals(accountId)) {
                publishToConnection(entry.connectionId(), event);
            }
        }
    }

    /**
     * Sends the event to every live connection of an account, whatever room it is in.
     */
    public void publishToAccount(Long accountId, RealtimeEventDto event) {
        for (PresenceEntry entry : presenceRegistry.connectionsOf(accountId)) {
            publishToConnection(entry.connectionId(), event);
        }
    }

    public void publishToLobby(RealtimeEventDto event) {
        publishToRoom(Room.LOBBY, event);
    }

    private void publishToRoom(Room room, RealtimeEventDto event) {
        for (PresenceEntry entry : presenceRegistry.connectionsIn(room)) {
            publishToConnection(entry.connectionId(), event);
        }
    }

    private MessageHeaders headersFor(String connectionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(connectionId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
