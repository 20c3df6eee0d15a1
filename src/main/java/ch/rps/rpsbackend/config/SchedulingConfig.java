package ch.rps.rpsbackend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for task scheduling.
 *
 * <p>Provides the {@link TaskScheduler} bean used by:
 * <ul>
 *   <li>@Scheduled methods (e.g., SessionCleanupService)</li>
 *   <li>Turn deadlines armed per session slot (TurnTimerService)</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    /**
     * Creates a task scheduler with a configurable thread pool.
     *
     * <p>Configuration:
     * <ul>
     *   <li>Pool size: {@code rps.scheduler.pool-size} threads (default 8)</li>
     *   <li>Thread name prefix: "rps-scheduler-" for easier debugging</li>
     *   <li>Cancelled turn timers are removed from the queue immediately</li>
     * </ul>
     *
     * @param poolSize number of scheduler threads
     * @return configured task scheduler
     */
    @Bean
    public TaskScheduler taskScheduler(@Value("${rps.scheduler.pool-size:8}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("rps-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }
}
