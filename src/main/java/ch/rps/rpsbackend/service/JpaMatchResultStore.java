package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.MatchRecord;
import ch.rps.rpsbackend.domain.SessionSnapshot;
import ch.rps.rpsbackend.domain.enums.Outcome;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.domain.enums.Slot;
import ch.rps.rpsbackend.exception.PersistenceFailureException;
import ch.rps.rpsbackend.repository.AccountRepository;
import ch.rps.rpsbackend.repository.MatchRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link MatchResultStore} backed by Spring Data JPA.
 */
@Service
@Transactional
@Slf4j
public class JpaMatchResultStore implements MatchResultStore {

    private final MatchRecordRepository matchRecordRepository;
    private final AccountRepository accountRepository;

    public JpaMatchResultStore(MatchRecordRepository matchRecordRepository,
                               AccountRepository accountRepository) {
        this.matchRecordRepository = matchRecordRepository;
        this.accountRepository = accountRepository;
    }

    @Override
    public void commitCompleted(SessionSnapshot snapshot) {
        if (snapshot.status() != SessionStatus.COMPLETED) {
            throw new IllegalArgumentException("Session " + snapshot.sessionId() + " is not completed");
        }

        upsertRecord(snapshot);

        Outcome outcome = snapshot.outcome();
        applyResult(snapshot, Slot.A, snapshot.ratingDeltaA(), outcome);
        applyResult(snapshot, Slot.B, snapshot.ratingDeltaB(), outcome);

        log.debug("Persisted result of session {} ({})", snapshot.sessionId(), outcome);
    }

    @Override
    public void commitCancelled(SessionSnapshot snapshot) {
        if (snapshot.status() != SessionStatus.CANCELLED) {
            throw new IllegalArgumentException("Session " + snapshot.sessionId() + " is not cancelled");
        }
        upsertRecord(snapshot);
        log.debug("Persisted cancellation marker for session {}", snapshot.sessionId());
    }

    private void upsertRecord(SessionSnapshot snapshot) {
        MatchRecord record = matchRecordRepository.findBySessionId(snapshot.sessionId())
                .orElseGet(() -> new MatchRecord(snapshot.sessionId()));
        record.applySnapshot(snapshot);
        matchRecordRepository.save(record);
    }

    private void applyResult(SessionSnapshot snapshot, Slot slot, int delta, Outcome outcome) {
        Long accountId = snapshot.accountId(slot);
        int won = outcome == Outcome.winnerOf(slot) ? 1 : 0;
        int lost = outcome == Outcome.winnerOf(slot.other()) ? 1 : 0;
        int tied = outcome == Outcome.TIE ? 1 : 0;

        int updated = accountRepository.applyResult(accountId, delta, won, lost, tied);
        if (updated != 1) {
            // runtime exception: rolls back the match record as well
            throw new PersistenceFailureException(
                    "Account " + accountId + " of session " + snapshot.sessionId() + " could not be updated");
        }
    }
}
