package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Single source of truth for live sessions, keyed by session id.
 *
 * <p>Only the map itself is guarded here; each {@link GameSession} guards its own state.
 * Terminal sessions stay registered for the retention window so rematches and late
 * reads can still resolve them.
 */
@Component
@Slf4j
public class SessionDirectory {

    private final ConcurrentMap<String, GameSession> sessions = new ConcurrentHashMap<>();

    public void register(GameSession session) {
        GameSession previous = sessions.putIfAbsent(session.getSessionId(), session);
        if (previous != null) {
            throw new IllegalStateException("Session id already registered: " + session.getSessionId());
        }
    }

    public Optional<GameSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public GameSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Waiting quick-play sessions another account could join, oldest first.
     * The result is a hint only; the join itself re-checks the status under the session lock.
     *
     * @param excludedAccountId requester, whose own sessions are skipped
     */
    public List<GameSession> findJoinableQuickPlay(Long excludedAccountId) {
        return sessions.values().stream()
                .filter(GameSession::isQuickPlay)
                .filter(s -> s.getStatus() == SessionStatus.WAITING)
                .filter(s -> s.getSlotB() == null)
                .filter(s -> !s.getSlotA().is(excludedAccountId))
                .sorted(Comparator.comparing(GameSession::getCreatedAt))
                .toList();
    }

    /**
     * Waiting quick-play session opened by the given account, if any.
     */
    public Optional<GameSession> findWaitingQuickPlayOf(Long accountId) {
        return sessions.values().stream()
                .filter(GameSession::isQuickPlay)
                .filter(s -> s.getStatus() == SessionStatus.WAITING)
                .filter(s -> s.getSlotA().is(accountId))
                .min(Comparator.comparing(GameSession::getCreatedAt));
    }

    /**
     * Waiting or active sessions the account holds a slot in. Status is read without the session
     * lock; callers re-check it when they act on a session.
     */
    public List<GameSession> findOpenOf(Long accountId) {
        return sessions.values().stream()
                .filter(s -> !s.getStatus().isTerminal())
                .filter(s -> s.isParticipant(accountId))
                .toList();
    }

    public List<GameSession> findWaitingCreatedBefore(Instant threshold) {
        return sessions.values().stream()
                .filter(s -> s.getStatus() == SessionStatus.WAITING)
                .filter(s -> s.getCreatedAt().isBefore(threshold))
                .toList();
    }

    /**
     * Removes terminal sessions that ended before the threshold.
     *
     * @return number of evicted sessions
     */
    public int evictTerminatedBefore(Instant threshold) {
        int before = sessions.size();
        sessions.values().removeIf(s -> s.withLock(() ->
                s.getStatus().isTerminal()
                        && s.getCompletedAt() != null
                        && s.getCompletedAt().isBefore(threshold)));
        int evicted = before - sessions.size();
        if (evicted > 0) {
            log.debug("Evicted {} terminated session(s)", evicted);
        }
        return evicted;
    }

    public Collection<GameSession> all() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
