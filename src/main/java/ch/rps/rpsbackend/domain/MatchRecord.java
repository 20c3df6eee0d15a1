package ch.rps.rpsbackend.domain;

import ch.rps.rpsbackend.domain.common.BaseEntity;
import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Persisted outcome of a terminal session: a full result for {@code COMPLETED} sessions,
 * a cancellation marker for {@code CANCELLED} ones.
 */
@Entity
@Table(name = "match_records")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MatchRecord extends BaseEntity {

    @Column(name = "session_id", nullable = false, unique = true, updatable = false, length = 64)
    private String sessionId;

    @Column(name = "account_a_id", nullable = false)
    private Long accountAId;

    /**
     * Empty for a session cancelled while still waiting for an opponent.
     */
    @Column(name = "account_b_id")
    private Long accountBId;

    @Enumerated(EnumType.STRING)
    @Column(name = "move_a", length = 10)
    private Move moveA;

    @Enumerated(EnumType.STRING)
    @Column(name = "move_b", length = 10)
    private Move moveB;

    @Column(name = "winner_account_id")
    private Long winnerAccountId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SessionStatus status;

    @Column(name = "rating_delta_a", nullable = false)
    private int ratingDeltaA;

    @Column(name = "rating_delta_b", nullable = false)
    private int ratingDeltaB;

    @Column(name = "quick_play", nullable = false)
    private boolean quickPlay;

    @Column(name = "rematch_of", length = 64)
    private String rematchOf;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    public MatchRecord(String sessionId) {
        this.sessionId = sessionId;
    }

    /**
     * Copies the final state of a session into this record.
     *
     * @param snapshot terminal session snapshot
     */
    public void applySnapshot(SessionSnapshot snapshot) {
        this.accountAId = snapshot.slotA().accountId();
        this.accountBId = snapshot.slotB() != null ? snapshot.slotB().accountId() : null;
        this.moveA = snapshot.moveA();
        this.moveB = snapshot.moveB();
        this.winnerAccountId = snapshot.winnerAccountId();
        this.status = snapshot.status();
        this.ratingDeltaA = snapshot.ratingDeltaA();
        this.ratingDeltaB = snapshot.ratingDeltaB();
        this.quickPlay = snapshot.quickPlay();
        this.rematchOf = snapshot.rematchOf();
        this.startedAt = snapshot.createdAt();
        this.completedAt = snapshot.completedAt();
    }
}
