package ch.rps.rpsbackend.application.service;

import ch.rps.rpsbackend.service.AccountService;
import ch.rps.rpsbackend.web.api.controller.LeaderboardController;
import ch.rps.rpsbackend.web.api.dto.LeaderboardEntryDto;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    AccountService accountService;

    @Test
    void leaderboard_returnsRankedEntries() throws Exception {
        when(accountService.leaderboard("ali")).thenReturn(List.of(
                new LeaderboardEntryDto(1, 1L, "alice", 1305, 4, 3, 1, 0, 75.0)
        ));

        mockMvc.perform(get("/api/leaderboard").param("search", "ali"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[0].username").value("alice"))
                .andExpect(jsonPath("$[0].rating").value(1305))
                .andExpect(jsonPath("$[0].winRate").value(75.0));
    }

    @Test
    void leaderboard_withoutSearch_passesNull() throws Exception {
        when(accountService.leaderboard(null)).thenReturn(List.of());

        mockMvc.perform(get("/api/leaderboard"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
