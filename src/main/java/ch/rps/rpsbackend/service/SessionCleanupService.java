package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.GameSession;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Periodic housekeeping of the session directory.
 *
 * <p>Each run
 * <ul>
 *   <li>cancels sessions that waited for an opponent longer than {@code rps.session.waiting-timeout-minutes}</li>
 *   <li>evicts terminal sessions that ended more than {@code rps.session.retention-minutes} ago</li>
 * </ul>
 * Terminal sessions are kept for a while so late reads and rematch requests still resolve.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Getter
public class SessionCleanupService {

    private final SessionDirectory sessionDirectory;
    private final GameSessionService gameSessionService;

    @Value("${rps.session.cleanup-interval-ms:60000}")
    private long cleanupIntervalMs;

    @Value("${rps.session.retention-minutes:30}")
    private int retentionMinutes;

    @Value("${rps.session.waiting-timeout-minutes:10}")
    private int waitingTimeoutMinutes;

    @Scheduled(fixedRateString = "${rps.session.cleanup-interval-ms:60000}")
    public void cleanupSessions() {
        Instant now = Instant.now();

        List<GameSession> stale = sessionDirectory.findWaitingCreatedBefore(now.minusSeconds(waitingTimeoutMinutes * 60L));
        int cancelled = 0;
        for (GameSession session : stale) {
            if (gameSessionService.cancel(session.getSessionId(), null)) {
                cancelled++;
            }
        }

        int evicted = sessionDirectory.evictTerminatedBefore(now.minusSeconds(retentionMinutes * 60L));

        if (cancelled > 0 || evicted > 0) {
            log.info("Session cleanup: cancelled {} stale waiting session(s), evicted {} terminated session(s)",
                    cancelled, evicted);
        } else {
            log.debug("Session cleanup: nothing to do ({} live session(s))", sessionDirectory.size());
        }
    }

    /**
     * Runs the cleanup outside the schedule, e.g. from tests.
     */
    public void triggerCleanup() {
        cleanupSessions();
    }
}
