package ch.rps.rpsbackend.application.service;

import ch.rps.rpsbackend.exception.UnknownParticipantException;
import ch.rps.rpsbackend.service.RealtimeGateway;
import ch.rps.rpsbackend.service.WebSocketEventListener;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionConnectEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WebSocketEventListener}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Account identification from the CONNECT frame</li>
 *   <li>Rejection of missing or malformed account headers</li>
 *   <li>Disconnect forwarding</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class WebSocketEventListenerTest {

    @Mock
    private RealtimeGateway realtimeGateway;

    @InjectMocks
    private WebSocketEventListener listener;

    @Test
    void handleConnect_registersAccountFromHeader() {
        listener.handleConnect(connectEvent("c1", "42"));

        verify(realtimeGateway).connect("c1", 42L);
    }

    @Test
    void handleConnect_withoutHeader_isIgnored() {
        listener.handleConnect(connectEvent("c1", null));

        verifyNoInteractions(realtimeGateway);
    }

    @Test
    void handleConnect_malformedHeader_isIgnored() {
        listener.handleConnect(connectEvent("c1", "not-a-number"));

        verify(realtimeGateway, never()).connect(any(), anyLong());
    }

    @Test
    void handleConnect_unknownAccount_doesNotPropagate() {
        when(realtimeGateway.connect("c1", 99L)).thenThrow(new UnknownParticipantException("Account not found: 99"));

        listener.handleConnect(connectEvent("c1", "99"));

        verify(realtimeGateway).connect("c1", 99L);
    }

    @Test
    void handleDisconnect_forwardsConnectionId() {
        listener.handleDisconnect(disconnectEvent("c1"));

        verify(realtimeGateway).disconnect("c1");
    }

    // ------------------------------------------------------------------------------------
    // Helper Methods
    // ------------------------------------------------------------------------------------

    private SessionConnectEvent connectEvent(String connectionId, String accountId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.CONNECT);
        accessor.setSessionId(connectionId);
        if (accountId != null) {
            accessor.setNativeHeader(WebSocketEventListener.ACCOUNT_ID_HEADER, accountId);
        }
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionConnectEvent(this, message);
    }

    private SessionDisconnectEvent disconnectEvent(String connectionId) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.DISCONNECT);
        accessor.setSessionId(connectionId);
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
        return new SessionDisconnectEvent(this, message, connectionId, CloseStatus.NORMAL);
    }
}
