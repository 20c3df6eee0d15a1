package ch.rps.rpsbackend.web.api.controller;

import ch.rps.rpsbackend.service.AccountService;
import ch.rps.rpsbackend.web.api.dto.LeaderboardEntryDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {

    private final AccountService accountService;

    public LeaderboardController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "Accounts ordered by rating, optionally filtered by name")
    @GetMapping
    public List<LeaderboardEntryDto> leaderboard(@RequestParam(required = false) String search) {
        return accountService.leaderboard(search);
    }
}
