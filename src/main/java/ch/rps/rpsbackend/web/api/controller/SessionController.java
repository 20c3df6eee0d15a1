package ch.rps.rpsbackend.web.api.controller;

import ch.rps.rpsbackend.exception.SessionNotFoundException;
import ch.rps.rpsbackend.service.GameSessionService;
import ch.rps.rpsbackend.web.api.dto.SessionViewDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final GameSessionService gameSessionService;

    public SessionController(GameSessionService gameSessionService) {
        this.gameSessionService = gameSessionService;
    }

    @Operation(summary = "Get the public state of a session")
    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionViewDto> getSession(@PathVariable String sessionId) {
        try {
            return ResponseEntity.ok(SessionViewDto.from(gameSessionService.snapshot(sessionId)));
        } catch (SessionNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }
}
