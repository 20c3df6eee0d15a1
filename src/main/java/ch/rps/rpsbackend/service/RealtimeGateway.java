package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.domain.PresenceEntry;
import ch.rps.rpsbackend.domain.Room;
import ch.rps.rpsbackend.domain.SessionSnapshot;
import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.domain.enums.Slot;
import ch.rps.rpsbackend.exception.GameRuleException;
import ch.rps.rpsbackend.exception.UnknownParticipantException;
import ch.rps.rpsbackend.web.api.dto.OnlineAccountDto;
import ch.rps.rpsbackend.web.api.dto.RealtimeEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for everything a realtime connection does.
 *
 * <p>Translates inbound connection events into presence changes and session transitions and
 * decides which connections hear about them. Guard failures surface as {@link GameRuleException}
 * and are acknowledged to the originating connection only.
 */
@Service
@Slf4j
public class RealtimeGateway {

    private final PresenceRegistry presenceRegistry;
    private final SessionDirectory sessionDirectory;
    private final GameSessionService gameSessionService;
    private final Matchmaker matchmaker;
    private final AccountService accountService;
    private final SessionEventPublisher eventPublisher;

    public RealtimeGateway(PresenceRegistry presenceRegistry,
                           SessionDirectory sessionDirectory,
                           GameSessionService gameSessionService,
                           Matchmaker matchmaker,
                           AccountService accountService,
                           SessionEventPublisher eventPublisher) {
        this.presenceRegistry = presenceRegistry;
        this.sessionDirectory = sessionDirectory;
        this.gameSessionService = gameSessionService;
        this.matchmaker = matchmaker;
        this.accountService = accountService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Registers a new connection for an existing account.
     *
     * @throws UnknownParticipantException if the account does not exist
     */
    public PresenceEntry connect(String connectionId, Long accountId) {
        Participant participant = accountService.participantFor(accountId);
        PresenceEntry entry = presenceRegistry.connect(connectionId, participant.accountId(), participant.displayName());
        log.info("Connection {} opened for account {}", connectionId, accountId);
        return entry;
    }

    public void joinLobby(String connectionId) {
        PresenceEntry entry = requireConnection(connectionId);
        if (entry.room().isLobby()) {
            return;
        }
        presenceRegistry.setRoom(connectionId, Room.LOBBY);
        eventPublisher.publishToLobby(RealtimeEventDto.userJoinedLobby(entry.accountId(), entry.displayName()));
        log.debug("Account {} joined the lobby", entry.accountId());
    }

    public void leaveLobby(String connectionId) {
        PresenceEntry entry = requireConnection(connectionId);
        if (!entry.room().isLobby()) {
            return;
        }
        presenceRegistry.setRoom(connectionId, Room.NONE);
        eventPublisher.publishToLobby(RealtimeEventDto.userLeftLobby(entry.accountId(), entry.displayName()));
        log.debug("Account {} left the lobby", entry.accountId());
    }

    /**
     * Moves the connection into a session room. A non-participant joins the session if it is still
     * waiting; a participant gets the current state of the session.
     *
     * @throws ch.rps.rpsbackend.exception.SessionNotFoundException if the session is unknown
     * @throws UnknownParticipantException if the account is not bound and the session is not waiting
     */
    public void joinSession(String connectionId, String sessionId) {
        PresenceEntry entry = requireConnection(connectionId);
        GameSession session = sessionDirectory.require(sessionId);
        Long accountId = entry.accountId();

        boolean bound = session.isParticipant(accountId);
        if (!bound && session.getStatus() != SessionStatus.WAITING) {
            throw UnknownParticipantException.notBound(sessionId, accountId);
        }

        Room previousRoom = entry.room();
        presenceRegistry.setRoom(connectionId, Room.session(sessionId));

        if (!bound) {
            try {
                // activation announces the joiner to the whole room, this connection included
                matchmaker.joinSpecific(sessionId, accountId);
            } catch (GameRuleException e) {
                presenceRegistry.setRoom(connectionId, previousRoom);
                throw e;
            }
        }
        if (previousRoom.isLobby()) {
            eventPublisher.publishToLobby(RealtimeEventDto.userLeftLobby(accountId, entry.displayName()));
        }
        if (bound) {
            session.runLocked(() -> announceToJoiner(session, connectionId, accountId));
        }
        log.debug("Connection {} entered room {}", connectionId, Room.session(sessionId));
    }

    public SessionSnapshot submitMove(String connectionId, String sessionId, String move) {
        PresenceEntry entry = requireConnection(connectionId);
        Move parsed = Move.fromWire(move);
        return gameSessionService.submitMove(sessionId, entry.accountId(), parsed);
    }

    public GameSession requestRematch(String connectionId, String sessionId) {
        PresenceEntry entry = requireConnection(connectionId);
        return matchmaker.createRematch(sessionId, entry.accountId());
    }

    /**
     * Removes a connection. Leaving a session room cancels that session unless the account still has
     * another connection in the same room. Once the account's last connection is gone, every
     * waiting or active session it holds a slot in is cancelled as well.
     */
    public void disconnect(String connectionId) {
        Optional<PresenceEntry> removed = presenceRegistry.disconnect(connectionId);
        if (removed.isEmpty()) {
            log.debug("Disconnect for unknown connection {}", connectionId);
            return;
        }
        PresenceEntry entry = removed.get();
        Long accountId = entry.accountId();
        Room room = entry.room();
        log.info("Connection {} of account {} closed (room {})", connectionId, accountId, room);

        if (room.isLobby()) {
            eventPublisher.publishToLobby(RealtimeEventDto.userLeftLobby(accountId, entry.displayName()));
        }

        Set<String> toCancel = new LinkedHashSet<>();
        if (room.isSession()) {
            if (presenceRegistry.listRoom(room).contains(accountId)) {
                log.debug("Account {} still connected to session {}", accountId, room.sessionId());
            } else {
                sessionDirectory.find(room.sessionId())
                        .filter(session -> session.isParticipant(accountId))
                        .ifPresent(session -> toCancel.add(session.getSessionId()));
            }
        }
        if (presenceRegistry.connectionsOf(accountId).isEmpty()) {
            sessionDirectory.findOpenOf(accountId)
                    .forEach(session -> toCancel.add(session.getSessionId()));
        }

        for (String sessionId : toCancel) {
            gameSessionService.cancel(sessionId, accountId);
        }
    }

    /**
     * Accounts with at least one connection in the lobby.
     */
    public List<OnlineAccountDto> onlineInLobby() {
        Map<Long, OnlineAccountDto> online = new LinkedHashMap<>();
        for (PresenceEntry entry : presenceRegistry.connectionsIn(Room.LOBBY)) {
            online.putIfAbsent(entry.accountId(), new OnlineAccountDto(entry.accountId(), entry.displayName()));
        }
        return List.copyOf(online.values());
    }

    private void announceToJoiner(GameSession session, String connectionId, Long accountId) {
        SessionSnapshot snapshot = session.snapshot();
        String sessionId = snapshot.sessionId();

        switch (snapshot.status()) {
            case WAITING -> eventPublisher.publishToConnection(connectionId,
                    RealtimeEventDto.waitingForOpponent(sessionId));
            case ACTIVE -> {
                Slot slot = session.slotOf(accountId).orElseThrow();
                Participant self = snapshot.participant(slot);
                Participant opponent = snapshot.participant(slot.other());
                long remaining = Math.max(0, Duration.between(Instant.now(), snapshot.deadline(slot)).toSeconds());
                eventPublisher.publishToSessionRoom(sessionId, RealtimeEventDto.playerJoined(
                        sessionId, accountId, self.displayName(), opponent.displayName(), true, remaining));
            }
            case COMPLETED -> eventPublisher.publishToConnection(connectionId, snapshot.hasTimeout()
                    ? RealtimeEventDto.gameTimeout(snapshot)
                    : RealtimeEventDto.gameResult(snapshot));
            case CANCELLED -> eventPublisher.publishToConnection(connectionId,
                    RealtimeEventDto.opponentDisconnected(sessionId));
        }
    }

    private PresenceEntry requireConnection(String connectionId) {
        return presenceRegistry.find(connectionId)
                .orElseThrow(() -> new UnknownParticipantException("Connection not registered: " + connectionId));
    }
}
