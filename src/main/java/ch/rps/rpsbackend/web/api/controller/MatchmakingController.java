package ch.rps.rpsbackend.web.api.controller;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.exception.GameRuleException;
import ch.rps.rpsbackend.service.Matchmaker;
import ch.rps.rpsbackend.web.api.dto.ErrorAckDto;
import ch.rps.rpsbackend.web.api.dto.QuickMatchRequest;
import ch.rps.rpsbackend.web.api.dto.QuickMatchResponseDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/matchmaking")
public class MatchmakingController {

    private final Matchmaker matchmaker;

    public MatchmakingController(Matchmaker matchmaker) {
        this.matchmaker = matchmaker;
    }

    @Operation(summary = "Joins a waiting quick-play session or opens a new one")
    @PostMapping("/quick-match")
    public ResponseEntity<?> quickMatch(@RequestBody QuickMatchRequest request) {
        try {
            Matchmaker.MatchmakingResult result = matchmaker.requestQuickMatch(request.accountId());
            GameSession session = result.session();
            QuickMatchResponseDto dto = result.matched()
                    ? QuickMatchResponseDto.matched(session.getSessionId(), session.getStatus())
                    : QuickMatchResponseDto.waiting(session.getSessionId(), session.getStatus());
            return ResponseEntity.ok(dto);
        } catch (GameRuleException e) {
            return ResponseEntity.badRequest().body(ErrorAckDto.from(e));
        }
    }
}
