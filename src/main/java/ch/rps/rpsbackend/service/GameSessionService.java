package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.domain.RatingUpdate;
import ch.rps.rpsbackend.domain.SessionSnapshot;
import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.Outcome;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.domain.enums.Slot;
import ch.rps.rpsbackend.exception.PersistenceFailureException;
import ch.rps.rpsbackend.web.api.dto.RealtimeEventDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Drives the lifecycle of live sessions.
 *
 * <p>Every transition runs under the session lock and publishes its events before the lock is
 * released, so both participants see events in transition order. Account ratings are read before
 * the lock is taken and results are persisted after it is released.
 */
@Service
@Slf4j
public class GameSessionService {

    private final SessionDirectory sessionDirectory;
    private final TurnTimerService turnTimerService;
    private final RatingEngine ratingEngine;
    private final AccountService accountService;
    private final MatchResultStore matchResultStore;
    private final SessionEventPublisher eventPublisher;
    private final Duration turnTimeout;

    public GameSessionService(SessionDirectory sessionDirectory,
                              TurnTimerService turnTimerService,
                              RatingEngine ratingEngine,
                              AccountService accountService,
                              MatchResultStore matchResultStore,
                              SessionEventPublisher eventPublisher,
                              @Value("${rps.session.turn-timeout-seconds:30}") long turnTimeoutSeconds) {
        this.sessionDirectory = sessionDirectory;
        this.turnTimerService = turnTimerService;
        this.ratingEngine = ratingEngine;
        this.accountService = accountService;
        this.matchResultStore = matchResultStore;
        this.eventPublisher = eventPublisher;
        this.turnTimeout = Duration.ofSeconds(turnTimeoutSeconds);
    }

    /**
     * Creates a waiting session with the creator bound to slot A and registers it.
     */
    public GameSession openSession(Participant creator, boolean quickPlay, String rematchOf) {
        GameSession session = GameSession.open(creator, quickPlay, rematchOf);
        sessionDirectory.register(session);
        log.info("Session {} created by account {} (quickPlay={}, rematchOf={})",
                session.getSessionId(), creator.accountId(), quickPlay, rematchOf);
        return session;
    }

    /**
     * Binds slot B, activates the session and arms both turn deadlines.
     *
     * @throws ch.rps.rpsbackend.exception.AlreadyActiveException if the session is no longer waiting
     */
    public void activate(GameSession session, Participant joiner) {
        session.runLocked(() -> {
            Instant deadline = Instant.now().plus(turnTimeout);
            session.join(joiner, deadline);

            String sessionId = session.getSessionId();
            for (Slot slot : Slot.values()) {
                turnTimerService.arm(sessionId, slot, deadline, () -> expireTimer(sessionId, slot));
            }
            log.info("Session {} active: account {} vs account {}",
                    sessionId, session.getSlotA().accountId(), joiner.accountId());

            Participant creator = session.getSlotA();
            eventPublisher.publishToSessionRoom(sessionId, RealtimeEventDto.playerJoined(
                    sessionId, joiner.accountId(), joiner.displayName(), creator.displayName(),
                    true, turnTimeout.toSeconds()));
        });
    }

    /**
     * Records a move. Completes the session when both slots are decided.
     */
    public SessionSnapshot submitMove(String sessionId, Long accountId, Move move) {
        GameSession session = sessionDirectory.require(sessionId);

        // ratings must not be read under the session lock
        int ratingA = accountService.currentRating(session.getSlotA().accountId());
        int ratingB = Optional.ofNullable(session.getSlotB())
                .map(p -> accountService.currentRating(p.accountId()))
                .orElse(0);

        Optional<SessionSnapshot> completed = session.withLock(() -> {
            Slot slot = session.recordMove(accountId, move);
            turnTimerService.cancel(sessionId, slot);
            log.debug("Session {}: slot {} chose", sessionId, slot);

            Participant opponent = session.participant(slot.other());
            eventPublisher.publishToParticipant(sessionId, opponent.accountId(),
                    RealtimeEventDto.choiceMade(sessionId, accountId));

            if (!session.isDecided()) {
                return Optional.<SessionSnapshot>empty();
            }
            return completeLocked(session, ratingA, ratingB);
        });

        completed.ifPresent(this::persistCompleted);
        return completed.orElseGet(session::snapshot);
    }

    /**
     * Turn deadline callback. Records a timeout for a still pending slot; a no-op for unknown or
     * non-active sessions and for slots that already hold a move.
     */
    public void expireTimer(String sessionId, Slot slot) {
        Optional<GameSession> found = sessionDirectory.find(sessionId);
        if (found.isEmpty()) {
            log.debug("Timer for unknown session {} slot {} ignored", sessionId, slot);
            return;
        }
        GameSession session = found.get();
        if (session.getStatus() != SessionStatus.ACTIVE) {
            log.debug("Timer for session {} slot {} ignored, session is {}", sessionId, slot, session.getStatus());
            return;
        }

        int ratingA = accountService.currentRating(session.getSlotA().accountId());
        int ratingB = accountService.currentRating(session.getSlotB().accountId());

        Optional<SessionSnapshot> completed = session.withLock(() -> {
            if (!session.recordTimeout(slot)) {
                log.debug("Timer for session {} slot {} lost the race, nothing to do", sessionId, slot);
                return Optional.<SessionSnapshot>empty();
            }
            log.info("Session {}: slot {} timed out", sessionId, slot);
            if (!session.isDecided()) {
                return Optional.<SessionSnapshot>empty();
            }
            return completeLocked(session, ratingA, ratingB);
        });

        completed.ifPresent(this::persistCompleted);
    }

    /**
     * Cancels a waiting or active session because a participant left. The remaining participant is
     * notified. Terminal sessions are left untouched.
     *
     * @param departingAccountId account that left, or {@code null} when the system cancels
     * @return {@code true} if the session was cancelled by this call
     */
    public boolean cancel(String sessionId, Long departingAccountId) {
        Optional<GameSession> found = sessionDirectory.find(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        GameSession session = found.get();

        Optional<SessionSnapshot> cancelled = session.withLock(() -> {
            if (!session.cancel(Instant.now())) {
                return Optional.<SessionSnapshot>empty();
            }
            turnTimerService.cancelAll(sessionId);
            log.info("Session {} cancelled (departing account {})", sessionId, departingAccountId);

            RealtimeEventDto event = RealtimeEventDto.opponentDisconnected(sessionId);
            for (Slot slot : Slot.values()) {
                Participant participant = session.participant(slot);
                if (participant != null && !participant.is(departingAccountId)) {
                    eventPublisher.publishToParticipant(sessionId, participant.accountId(), event);
                }
            }
            return Optional.of(session.snapshot());
        });

        cancelled.ifPresent(this::persistCancelled);
        return cancelled.isPresent();
    }

    public SessionSnapshot snapshot(String sessionId) {
        return sessionDirectory.require(sessionId).snapshot();
    }

    public Duration getTurnTimeout() {
        return turnTimeout;
    }

    private Optional<SessionSnapshot> completeLocked(GameSession session, int ratingA, int ratingB) {
        Outcome outcome = session.decide();
        RatingUpdate update = session.bothTimedOut()
                ? RatingUpdate.unchanged(ratingA, ratingB)
                : ratingEngine.update(ratingA, ratingB, outcome);

        if (!session.complete(outcome, update, Instant.now())) {
            return Optional.empty();
        }
        String sessionId = session.getSessionId();
        turnTimerService.cancelAll(sessionId);

        SessionSnapshot snapshot = session.snapshot();
        log.info("Session {} completed: outcome {} (deltaA={}, deltaB={})",
                sessionId, outcome, update.deltaA(), update.deltaB());

        RealtimeEventDto event = snapshot.hasTimeout()
                ? RealtimeEventDto.gameTimeout(snapshot)
                : RealtimeEventDto.gameResult(snapshot);
        eventPublisher.publishToSessionRoom(sessionId, event);
        return Optional.of(snapshot);
    }

    private void persistCompleted(SessionSnapshot snapshot) {
        try {
            matchResultStore.commitCompleted(snapshot);
        } catch (PersistenceFailureException | DataAccessException | TransactionException e) {
            log.error("Could not persist result of session {}", snapshot.sessionId(), e);
            eventPublisher.publishToSessionRoom(snapshot.sessionId(),
                    RealtimeEventDto.persistenceWarning(snapshot.sessionId()));
        }
    }

    private void persistCancelled(SessionSnapshot snapshot) {
        try {
            matchResultStore.commitCancelled(snapshot);
        } catch (PersistenceFailureException | DataAccessException | TransactionException e) {
            log.error("Could not persist cancellation of session {}", snapshot.sessionId(), e);
        }
    }
}
