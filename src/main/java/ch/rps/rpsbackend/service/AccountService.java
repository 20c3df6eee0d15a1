package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.Account;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.exception.UnknownParticipantException;
import ch.rps.rpsbackend.repository.AccountRepository;
import ch.rps.rpsbackend.web.api.dto.LeaderboardEntryDto;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Read access to accounts for the session engine and the leaderboard.
 */
@Service
@Transactional(readOnly = true)
public class AccountService {

    private final AccountRepository accountRepository;

    public AccountService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    /**
     * Resolves an account to the participant shape bound into a session slot.
     *
     * @throws UnknownParticipantException if the account does not exist
     */
    public Participant participantFor(Long accountId) {
        if (accountId == null) {
            throw new UnknownParticipantException("Missing account id");
        }
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new UnknownParticipantException("Account not found: " + accountId));
        return new Participant(account.getId(), account.getUsername());
    }

    /**
     * Current rating of an account, or the default rating for accounts unknown to the store.
     */
    public int currentRating(Long accountId) {
        return accountRepository.findById(accountId)
                .map(Account::getRating)
                .orElse(Account.DEFAULT_RATING);
    }

    /**
     * Accounts ordered by rating (highest first), optionally filtered by a case-insensitive name fragment.
     */
    public List<LeaderboardEntryDto> leaderboard(String search) {
        List<Account> accounts = (search == null || search.isBlank())
                ? accountRepository.findAllByOrderByRatingDesc()
                : accountRepository.findByUsernameContainingIgnoreCaseOrderByRatingDesc(search.trim());

        List<LeaderboardEntryDto> entries = new ArrayList<>(accounts.size());
        for (int i = 0; i < accounts.size(); i++) {
            entries.add(LeaderboardEntryDto.from(i + 1, accounts.get(i)));
        }
        return entries;
    }
}
