package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.exception.GameRuleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.List;

/**
 * Bridges STOMP session lifecycle events to the {@link RealtimeGateway}.
 *
 * <p>The STOMP session id is the connection id. Clients identify their account with the native
 * header {@code accountId} on the CONNECT frame; connections without a valid account are not
 * registered, and every later action from them is rejected as an unknown participant.
 *
 * <p>A disconnect cancels the session of the room the connection was in (see
 * {@link RealtimeGateway#disconnect(String)}). There is no grace period for reconnects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketEventListener {

    public static final String ACCOUNT_ID_HEADER = "accountId";

    private final RealtimeGateway realtimeGateway;

    @EventListener
    public void handleConnect(SessionConnectEvent event) {
        StompHeaderAccessor accessor = StompHeaderAccessor.wrap(event.getMessage());
        String connectionId = accessor.getSessionId();
        if (connectionId == null) {
            return;
        }

        List<String> accountIdHeaders = accessor.getNativeHeader(ACCOUNT_ID_HEADER);
        if (accountIdHeaders == null || accountIdHeaders.isEmpty()) {
            log.warn("Connection {} without {} header", connectionId, ACCOUNT_ID_HEADER);
            return;
        }

        try {
            Long accountId = Long.valueOf(accountIdHeaders.get(0));
            realtimeGateway.connect(connectionId, accountId);
        } catch (NumberFormatException e) {
            log.warn("Invalid accountId in connect header: {}", accountIdHeaders.get(0));
        } catch (GameRuleException e) {
            log.warn("Connection {} rejected: {}", connectionId, e.getMessage());
        }
    }

    @EventListener
    public void handleDisconnect(SessionDisconnectEvent event) {
        String connectionId = event.getSessionId();
        if (connectionId == null) {
            return;
        }
        realtimeGateway.disconnect(connectionId);
    }
}
