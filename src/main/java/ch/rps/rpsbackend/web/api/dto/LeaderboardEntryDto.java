package ch.rps.rpsbackend.web.api.dto;

import ch.rps.rpsbackend.domain.Account;

public record LeaderboardEntryDto(
        int rank,
        Long accountId,
        String username,
        int rating,
        int gamesPlayed,
        int gamesWon,
        int gamesLost,
        int gamesTied,
        double winRate
) {
    public static LeaderboardEntryDto from(int rank, Account account) {
        return new LeaderboardEntryDto(
                rank,
                account.getId(),
                account.getUsername(),
                account.getRating(),
                account.getGamesPlayed(),
                account.getGamesWon(),
                account.getGamesLost(),
                account.getGamesTied(),
                account.getWinRate()
        );
    }
}
