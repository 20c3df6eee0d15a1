package ch.rps.rpsbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 *
 * <p>Only the REST surface (matchmaking, session view, leaderboard, lobby) is documented here.
 * The realtime protocol runs over STOMP and is not part of the OpenAPI description.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Creates the OpenAPI definition used by Swagger UI.
     *
     * @return configured {@link OpenAPI} instance with API metadata
     */
    @Bean
    public OpenAPI rpsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rock Paper Scissors API")
                        .description("Matchmaking, live sessions and ELO leaderboard")
                        .version("v1.0.0"));
    }
}
