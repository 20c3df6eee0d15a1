package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.enums.Slot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot turn deadlines per (session, slot).
 *
 * <p>A binding exists only while the slot's move is pending. Cancelling is best effort: a callback
 * that already started keeps running, so the callback itself must re-check session state under the
 * session lock before acting.
 */
@Service
@Slf4j
public class TurnTimerService {

    private final TaskScheduler taskScheduler;
    private final ConcurrentMap<TimerKey, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public TurnTimerService(TaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    /**
     * Arms the deadline of a slot, replacing an earlier binding for the same slot.
     *
     * @param sessionId session identity
     * @param slot      slot whose move is pending
     * @param deadline  instant at which {@code onExpire} runs
     * @param onExpire  expiry callback
     */
    public void arm(String sessionId, Slot slot, Instant deadline, Runnable onExpire) {
        TimerKey key = new TimerKey(sessionId, slot);

        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            timers.remove(key);
            try {
                onExpire.run();
            } catch (RuntimeException e) {
                log.error("Turn timer of session {} slot {} failed", sessionId, slot, e);
            }
        }, deadline);

        if (future == null) {
            return;
        }
        ScheduledFuture<?> previous = timers.put(key, future);
        if (previous != null) {
            previous.cancel(false);
        }
        if (future.isDone()) {
            // fired before it was registered
            timers.remove(key, future);
        }
        log.debug("Armed turn timer for session {} slot {} at {}", sessionId, slot, deadline);
    }

    /**
     * Cancels the deadline of one slot, if armed.
     *
     * @return {@code true} if a binding was removed
     */
    public boolean cancel(String sessionId, Slot slot) {
        ScheduledFuture<?> future = timers.remove(new TimerKey(sessionId, slot));
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Cancelled turn timer for session {} slot {}", sessionId, slot);
        return true;
    }

    public void cancelAll(String sessionId) {
        for (Slot slot : Slot.values()) {
            cancel(sessionId, slot);
        }
    }

    public boolean isArmed(String sessionId, Slot slot) {
        return timers.containsKey(new TimerKey(sessionId, slot));
    }

    public int armedCount() {
        return timers.size();
    }

    private record TimerKey(String sessionId, Slot slot) {}
}
