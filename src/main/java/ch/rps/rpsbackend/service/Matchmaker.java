package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.exception.AlreadyActiveException;
import ch.rps.rpsbackend.exception.RematchUnavailableException;
import ch.rps.rpsbackend.exception.UnknownParticipantException;
import ch.rps.rpsbackend.web.api.dto.RealtimeEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pairs accounts into sessions.
 *
 * <p>Scan-and-bind runs under one matchmaking lock: two concurrent quick matches never bind the
 * same slot B and never both open a session when one of them could have joined the other's.
 * Lock order is always matchmaking lock first, then a session lock.
 */
@Service
@Slf4j
public class Matchmaker {

    private final SessionDirectory sessionDirectory;
    private final GameSessionService gameSessionService;
    private final AccountService accountService;
    private final SessionEventPublisher eventPublisher;

    private final ReentrantLock matchmakingLock = new ReentrantLock();

    public Matchmaker(SessionDirectory sessionDirectory,
                      GameSessionService gameSessionService,
                      AccountService accountService,
                      SessionEventPublisher eventPublisher) {
        this.sessionDirectory = sessionDirectory;
        this.gameSessionService = gameSessionService;
        this.accountService = accountService;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Joins the oldest waiting quick-play session of another account, or opens a new one.
     * An account that already waits in its own quick-play session gets that session back.
     */
    public MatchmakingResult requestQuickMatch(Long accountId) {
        Participant requester = accountService.participantFor(accountId);

        matchmakingLock.lock();
        try {
            for (GameSession candidate : sessionDirectory.findJoinableQuickPlay(accountId)) {
                try {
                    gameSessionService.activate(candidate, requester);
                    log.info("Quick match: account {} joined session {}", accountId, candidate.getSessionId());
                    return new MatchmakingResult(candidate, true);
                } catch (AlreadyActiveException e) {
                    // cancelled or joined since the scan
                    log.debug("Quick match: session {} no longer joinable", candidate.getSessionId());
                }
            }

            Optional<GameSession> ownWaiting = sessionDirectory.findWaitingQuickPlayOf(accountId);
            if (ownWaiting.isPresent()) {
                log.debug("Quick match: account {} already waits in session {}",
                        accountId, ownWaiting.get().getSessionId());
                return new MatchmakingResult(ownWaiting.get(), false);
            }

            GameSession created = gameSessionService.openSession(requester, true, null);
            return new MatchmakingResult(created, false);
        } finally {
            matchmakingLock.unlock();
        }
    }

    /**
     * Joins a specific waiting session, e.g. from a shared link.
     *
     * @throws ch.rps.rpsbackend.exception.SessionNotFoundException if the session is unknown
     * @throws AlreadyActiveException if the session is no longer waiting
     */
    public GameSession joinSpecific(String sessionId, Long accountId) {
        Participant joiner = accountService.participantFor(accountId);

        matchmakingLock.lock();
        try {
            GameSession session = sessionDirectory.require(sessionId);
            if (session.getSlotA().is(accountId)) {
                return session;
            }
            gameSessionService.activate(session, joiner);
            log.info("Account {} joined session {} directly", accountId, sessionId);
            return session;
        } finally {
            matchmakingLock.unlock();
        }
    }

    /**
     * Opens an active session for the two participants of a completed one. Only one rematch is
     * created per session; later requests get the existing one.
     *
     * @throws RematchUnavailableException  if the previous session is not completed
     * @throws UnknownParticipantException if the requester did not play the previous session
     */
    public GameSession createRematch(String previousSessionId, Long requesterAccountId) {
        GameSession previous = sessionDirectory.require(previousSessionId);
        if (!previous.isParticipant(requesterAccountId)) {
            throw UnknownParticipantException.notBound(previousSessionId, requesterAccountId);
        }

        matchmakingLock.lock();
        try {
            return previous.withLock(() -> {
                if (previous.getStatus() != SessionStatus.COMPLETED) {
                    throw new RematchUnavailableException(previousSessionId, previous.getStatus());
                }
                if (previous.getRematchSessionId() != null) {
                    return sessionDirectory.require(previous.getRematchSessionId());
                }

                GameSession rematch = gameSessionService.openSession(previous.getSlotA(), false, previousSessionId);
                gameSessionService.activate(rematch, previous.getSlotB());
                previous.linkRematch(rematch.getSessionId());
                log.info("Rematch {} created for session {}", rematch.getSessionId(), previousSessionId);

                RealtimeEventDto announcement = RealtimeEventDto.newGameCreated(previousSessionId, rematch.getSessionId());
                eventPublisher.publishToAccount(previous.getSlotA().accountId(), announcement);
                eventPublisher.publishToAccount(previous.getSlotB().accountId(), announcement);
                return rematch;
            });
        } finally {
            matchmakingLock.unlock();
        }
    }

    /**
     * Session returned by quick match and whether it was paired right away.
     */
    public record MatchmakingResult(GameSession session, boolean matched) {}
}
