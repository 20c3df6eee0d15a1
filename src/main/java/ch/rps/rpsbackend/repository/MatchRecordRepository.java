package ch.rps.rpsbackend.repository;

import ch.rps.rpsbackend.domain.MatchRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface MatchRecordRepository extends JpaRepository<MatchRecord, UUID> {

    Optional<MatchRecord> findBySessionId(String sessionId);
}
