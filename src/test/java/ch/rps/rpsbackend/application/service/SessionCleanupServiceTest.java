package ch.rps.rpsbackend.application.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.service.GameSessionService;
import ch.rps.rpsbackend.service.SessionCleanupService;
import ch.rps.rpsbackend.service.SessionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SessionCleanupService}.
 *
 * <p>Notes:
 * <ul>
 *   <li>The session directory is real, session cancellation is mocked</li>
 *   <li>Scheduled execution is not tested (Spring scheduling framework responsibility)</li>
 *   <li>Uses ReflectionTestUtils to set @Value properties and session creation times</li>
 * </ul>
 */
@ExtendWith(MockitoExtension.class)
class SessionCleanupServiceTest {

    private static final Participant ALICE = new Participant(1L, "alice");
    private static final Participant BOB = new Participant(2L, "bob");

    @Mock
    private GameSessionService gameSessionService;

    private SessionDirectory directory;
    private SessionCleanupService cleanupService;

    @BeforeEach
    void setUp() {
        directory = new SessionDirectory();
        cleanupService = new SessionCleanupService(directory, gameSessionService);
        ReflectionTestUtils.setField(cleanupService, "retentionMinutes", 30);
        ReflectionTestUtils.setField(cleanupService, "waitingTimeoutMinutes", 10);
        ReflectionTestUtils.setField(cleanupService, "cleanupIntervalMs", 60000L);
    }

    @Test
    void cleanup_cancelsStaleWaitingSessionsOnly() {
        GameSession stale = new GameSession("S-stale", ALICE, true, null);
        ReflectionTestUtils.setField(stale, "createdAt", Instant.now().minus(Duration.ofMinutes(15)));
        GameSession fresh = new GameSession("S-fresh", BOB, true, null);
        directory.register(stale);
        directory.register(fresh);
        when(gameSessionService.cancel("S-stale", null)).thenReturn(true);

        cleanupService.cleanupSessions();

        verify(gameSessionService).cancel("S-stale", null);
        verify(gameSessionService, never()).cancel(eq("S-fresh"), any());
    }

    @Test
    void cleanup_evictsTerminalSessionsAfterRetention() {
        GameSession old = new GameSession("S-old", ALICE, true, null);
        old.runLocked(() -> old.cancel(Instant.now().minus(Duration.ofHours(2))));
        GameSession recent = new GameSession("S-recent", BOB, true, null);
        recent.runLocked(() -> recent.cancel(Instant.now().minus(Duration.ofMinutes(5))));
        directory.register(old);
        directory.register(recent);

        cleanupService.triggerCleanup();

        assertThat(directory.find("S-old")).isEmpty();
        assertThat(directory.find("S-recent")).isPresent();
        verifyNoInteractions(gameSessionService);
    }

    @Test
    void cleanup_withNothingToDo_leavesDirectoryUntouched() {
        directory.register(new GameSession("S-1", ALICE, true, null));

        cleanupService.triggerCleanup();

        assertThat(directory.size()).isEqualTo(1);
        assertThat(cleanupService.getRetentionMinutes()).isEqualTo(30);
    }
}
