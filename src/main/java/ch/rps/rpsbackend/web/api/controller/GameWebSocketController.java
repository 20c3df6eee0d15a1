package ch.rps.rpsbackend.web.api.controller;

import ch.rps.rpsbackend.exception.GameRuleException;
import ch.rps.rpsbackend.service.RealtimeGateway;
import ch.rps.rpsbackend.web.api.dto.ErrorAckDto;
import ch.rps.rpsbackend.web.api.dto.MoveRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

/**
 * Inbound STOMP messages. The STOMP session id identifies the connection; all replies are sent
 * per connection by the gateway.
 */
@Controller
@Slf4j
public class GameWebSocketController {

    private final RealtimeGateway realtimeGateway;

    public GameWebSocketController(RealtimeGateway realtimeGateway) {
        this.realtimeGateway = realtimeGateway;
    }

    @MessageMapping("/lobby/join")
    public void joinLobby(SimpMessageHeaderAccessor headerAccessor) {
        realtimeGateway.joinLobby(headerAccessor.getSessionId());
    }

    @MessageMapping("/lobby/leave")
    public void leaveLobby(SimpMessageHeaderAccessor headerAccessor) {
        realtimeGateway.leaveLobby(headerAccessor.getSessionId());
    }

    @MessageMapping("/sessions/{sessionId}/join")
    public void joinSession(@DestinationVariable String sessionId,
                            SimpMessageHeaderAccessor headerAccessor) {
        realtimeGateway.joinSession(headerAccessor.getSessionId(), sessionId);
    }

    @MessageMapping("/sessions/{sessionId}/move")
    public void submitMove(@DestinationVariable String sessionId,
                           @Payload MoveRequest request,
                           SimpMessageHeaderAccessor headerAccessor) {
        realtimeGateway.submitMove(headerAccessor.getSessionId(), sessionId, request.move());
    }

    @MessageMapping("/sessions/{sessionId}/rematch")
    public void requestRematch(@DestinationVariable String sessionId,
                               SimpMessageHeaderAccessor headerAccessor) {
        realtimeGateway.requestRematch(headerAccessor.getSessionId(), sessionId);
    }

    /**
     * Acknowledges a rejected request to the connection that sent it, and only to that one.
     */
    @MessageExceptionHandler(GameRuleException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public ErrorAckDto handleGameRuleException(GameRuleException e) {
        log.warn("Rejected realtime request: {} ({})", e.getMessage(), e.getCode());
        return ErrorAckDto.from(e);
    }
}
