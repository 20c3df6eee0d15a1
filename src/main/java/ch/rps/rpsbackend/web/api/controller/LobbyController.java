package ch.rps.rpsbackend.web.api.controller;

import ch.rps.rpsbackend.service.RealtimeGateway;
import ch.rps.rpsbackend.web.api.dto.OnlineAccountDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/lobby")
public class LobbyController {

    private final RealtimeGateway realtimeGateway;

    public LobbyController(RealtimeGateway realtimeGateway) {
        this.realtimeGateway = realtimeGateway;
    }

    @Operation(summary = "Accounts currently in the lobby")
    @GetMapping("/online")
    public List<OnlineAccountDto> online() {
        return realtimeGateway.onlineInLobby();
    }
}
