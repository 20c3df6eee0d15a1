package ch.rps;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the rock/paper/scissors backend.
 *
 * <p>Enables:
 * <ul>
 *   <li>Spring Boot auto-configuration</li>
 *   <li>Component scanning for the entire application</li>
 *   <li>Scheduled task execution ({@code @EnableScheduling}) for session housekeeping</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class RpsBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RpsBackendApplication.class, args);
    }

}
