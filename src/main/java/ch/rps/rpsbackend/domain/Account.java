package ch.rps.rpsbackend.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Registered player with rating and cumulative results.
 *
 * <p>Registration and authentication live outside this service; the session engine only reads
 * the display name and current rating, and adds rating deltas and counters when a session completes.
 */
@Entity
@Table(name = "accounts")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account {

    public static final int DEFAULT_RATING = 1200;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 80)
    private String username;

    @Column(nullable = false)
    private int rating = DEFAULT_RATING;

    @Column(name = "games_played", nullable = false)
    private int gamesPlayed;

    @Column(name = "games_won", nullable = false)
    private int gamesWon;

    @Column(name = "games_lost", nullable = false)
    private int gamesLost;

    @Column(name = "games_tied", nullable = false)
    private int gamesTied;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Account(String username) {
        this.username = username;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * Share of decided games (wins and losses, ties excluded) that were won, in percent with one decimal.
     */
    public double getWinRate() {
        int decided = gamesWon + gamesLost;
        if (decided == 0) {
            return 0.0;
        }
        return Math.round(gamesWon * 1000.0 / decided) / 10.0;
    }
}
