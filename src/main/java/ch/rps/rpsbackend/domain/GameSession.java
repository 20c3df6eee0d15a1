package ch.rps.rpsbackend.domain;

import ch.rps.rpsbackend.domain.enums.Move;
import ch.rps.rpsbackend.domain.enums.Outcome;
import ch.rps.rpsbackend.domain.enums.SessionStatus;
import ch.rps.rpsbackend.domain.enums.Slot;
import ch.rps.rpsbackend.exception.AlreadyActiveException;
import ch.rps.rpsbackend.exception.AlreadyChosenException;
import ch.rps.rpsbackend.exception.InvalidMoveException;
import ch.rps.rpsbackend.exception.NotActiveException;
import ch.rps.rpsbackend.exception.RematchUnavailableException;
import ch.rps.rpsbackend.exception.UnknownParticipantException;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Authoritative in-memory state of one two-player match.
 *
 * <p>Lifecycle: {@code WAITING -> ACTIVE -> COMPLETED | CANCELLED}. Every mutating method must be
 * called while holding the session lock ({@link #withLock} / {@link #runLocked}); the methods check
 * this and fail fast otherwise. Timer arming, event publishing and persistence are orchestrated by
 * the service layer around these transitions.
 *
 * <p>{@code status} and both slots are volatile so matchmaking scans can read them without the
 * lock; every decision based on them is re-checked under the lock.
 */
@Getter
public class GameSession {

    private final String sessionId;

    /**
     * Created by quick match and therefore eligible for pairing with any account.
     */
    private final boolean quickPlay;

    /**
     * Session this one is a rematch of, or {@code null}.
     */
    private final String rematchOf;

    private final Instant createdAt;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    private volatile SessionStatus status;
    private volatile Participant slotA;
    private volatile Participant slotB;

    private Move moveA;
    private Move moveB;
    private Instant deadlineA;
    private Instant deadlineB;
    private Instant completedAt;
    private Outcome outcome;
    private int ratingDeltaA;
    private int ratingDeltaB;

    /**
     * Session created as rematch of this one, set at most once.
     */
    private String rematchSessionId;

    /**
     * Creates a waiting session with a predefined id (e.g. for testing or deterministic setups).
     *
     * @param sessionId session identity
     * @param creator   account bound to slot A
     * @param quickPlay whether quick match may pair other accounts into this session
     * @param rematchOf previous session for a rematch, or {@code null}
     */
    public GameSession(String sessionId, Participant creator, boolean quickPlay, String rematchOf) {
        this.sessionId = Objects.requireNonNull(sessionId);
        this.slotA = Objects.requireNonNull(creator);
        this.quickPlay = quickPlay;
        this.rematchOf = rematchOf;
        this.createdAt = Instant.now();
        this.status = SessionStatus.WAITING;
    }

    /**
     * Creates a waiting session with a random id.
     */
    public static GameSession open(Participant creator, boolean quickPlay, String rematchOf) {
        return new GameSession(UUID.randomUUID().toString(), creator, quickPlay, rematchOf);
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Binds slot B and activates the session. Both slots share the same turn deadline.
     *
     * @param joiner   account for slot B
     * @param deadline turn deadline for both slots
     * @throws AlreadyActiveException if the session is no longer {@code WAITING}
     */
    public void join(Participant joiner, Instant deadline) {
        ensureLocked();
        if (status != SessionStatus.WAITING) {
            throw new AlreadyActiveException(sessionId);
        }
        if (slotA.is(joiner.accountId())) {
            throw new IllegalArgumentException("Account " + joiner.accountId() + " cannot join its own session");
        }
        this.slotB = joiner;
        this.deadlineA = deadline;
        this.deadlineB = deadline;
        this.status = SessionStatus.ACTIVE;
    }

    /**
     * Records a playable move for the slot the account is bound to. A recorded move is never overwritten.
     *
     * @return slot the move was recorded for
     */
    public Slot recordMove(Long accountId, Move move) {
        ensureLocked();
        if (move == null || !move.isPlayable()) {
            throw new InvalidMoveException(String.valueOf(move));
        }
        if (status != SessionStatus.ACTIVE) {
            throw new NotActiveException(sessionId, status);
        }
        Slot slot = slotOf(accountId)
                .orElseThrow(() -> UnknownParticipantException.notBound(sessionId, accountId));
        if (move(slot) != null) {
            throw new AlreadyChosenException(sessionId, slot);
        }
        setMove(slot, move);
        return slot;
    }

    /**
     * Records {@link Move#TIMEOUT} for a slot whose deadline expired.
     *
     * @return {@code false} if the session is not active or the slot already holds a move
     */
    public boolean recordTimeout(Slot slot) {
        ensureLocked();
        if (status != SessionStatus.ACTIVE || move(slot) != null) {
            return false;
        }
        setMove(slot, Move.TIMEOUT);
        return true;
    }

    public boolean isDecided() {
        return moveA != null && moveB != null;
    }

    public boolean bothTimedOut() {
        return moveA == Move.TIMEOUT && moveB == Move.TIMEOUT;
    }

    /**
     * Outcome of a decided session. A timed-out slot loses outright; two timeouts are a tie.
     */
    public Outcome decide() {
        ensureLocked();
        if (!isDecided()) {
            throw new IllegalStateException("Session " + sessionId + " is not decided yet");
        }
        if (bothTimedOut()) {
            return Outcome.TIE;
        }
        if (moveA == Move.TIMEOUT) {
            return Outcome.winnerOf(Slot.B);
        }
        if (moveB == Move.TIMEOUT) {
            return Outcome.winnerOf(Slot.A);
        }
        return OutcomeResolver.resolve(moveA, moveB);
    }

    /**
     * Moves a decided session to {@code COMPLETED}. Only the first call succeeds.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean complete(Outcome result, RatingUpdate ratingUpdate, Instant at) {
        ensureLocked();
        if (status != SessionStatus.ACTIVE || !isDecided()) {
            return false;
        }
        this.outcome = result;
        this.ratingDeltaA = ratingUpdate.deltaA();
        this.ratingDeltaB = ratingUpdate.deltaB();
        this.completedAt = at;
        this.status = SessionStatus.COMPLETED;
        return true;
    }

    /**
     * Cancels a waiting or active session. Recorded moves are kept, no rating delta is ever set.
     *
     * @return {@code false} if the session was already terminal
     */
    public boolean cancel(Instant at) {
        ensureLocked();
        if (status.isTerminal()) {
            return false;
        }
        this.completedAt = at;
        this.status = SessionStatus.CANCELLED;
        return true;
    }

    public void linkRematch(String nextSessionId) {
        ensureLocked();
        if (status != SessionStatus.COMPLETED) {
            throw new RematchUnavailableException(sessionId, status);
        }
        if (rematchSessionId != null) {
            throw new IllegalStateException("Session " + sessionId + " already has rematch " + rematchSessionId);
        }
        this.rematchSessionId = nextSessionId;
    }

    public Optional<Slot> slotOf(Long accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        if (slotA.is(accountId)) {
            return Optional.of(Slot.A);
        }
        Participant b = slotB;
        if (b != null && b.is(accountId)) {
            return Optional.of(Slot.B);
        }
        return Optional.empty();
    }

    public boolean isParticipant(Long accountId) {
        return slotOf(accountId).isPresent();
    }

    public Participant participant(Slot slot) {
        return slot == Slot.A ? slotA : slotB;
    }

    public Optional<Participant> opponentOf(Long accountId) {
        return slotOf(accountId).map(slot -> participant(slot.other()));
    }

    public Move move(Slot slot) {
        return slot == Slot.A ? moveA : moveB;
    }

    public SessionSnapshot snapshot() {
        return withLock(() -> new SessionSnapshot(
                sessionId,
                status,
                slotA,
                slotB,
                moveA,
                moveB,
                outcome,
                ratingDeltaA,
                ratingDeltaB,
                quickPlay,
                rematchOf,
                rematchSessionId,
                createdAt,
                completedAt,
                deadlineA,
                deadlineB
        ));
    }

    private void setMove(Slot slot, Move move) {
        if (slot == Slot.A) {
            this.moveA = move;
        } else {
            this.moveB = move;
        }
    }

    private void ensureLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session " + sessionId + " must be mutated under its lock");
        }
    }
}
