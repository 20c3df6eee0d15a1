package ch.rps.rpsbackend.application.service;

import ch.rps.rpsbackend.domain.GameSession;
import ch.rps.rpsbackend.domain.Participant;
import ch.rps.rpsbackend.domain.RatingUpdate;
import ch.rps.rpsbackend.domain.SessionSnapshot;
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
import ch.rps.rpsbackend.web.api.dto.SessionViewDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the {@link GameSession} state machine.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Transitions WAITING -> ACTIVE -> COMPLETED / CANCELLED</li>
 *   <li>Guard order of move submission</li>
 *   <li>Timeout handling and single completion</li>
 * </ul>
 */
class GameSessionTest {

    private static final Participant ALICE = new Participant(1L, "alice");
    private static final Participant BOB = new Participant(2L, "bob");

    private GameSession session;

    @BeforeEach
    void setUp() {
        session = new GameSession("S-1", ALICE, true, null);
    }

    @Test
    void newSession_isWaitingWithSlotABound() {
        assertThat(session.getStatus()).isEqualTo(SessionStatus.WAITING);
        assertThat(session.getSlotA()).isEqualTo(ALICE);
        assertThat(session.getSlotB()).isNull();
        assertThat(session.isQuickPlay()).isTrue();
    }

    @Test
    void join_activatesAndSetsBothDeadlines() {
        Instant deadline = Instant.now().plusSeconds(30);

        session.runLocked(() -> session.join(BOB, deadline));

        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.getSlotB()).isEqualTo(BOB);
        assertThat(session.getDeadlineA()).isEqualTo(deadline);
        assertThat(session.getDeadlineB()).isEqualTo(deadline);
    }

    @Test
    void join_secondJoinFailsWithAlreadyActive() {
        activate();

        assertThatThrownBy(() -> session.runLocked(() -> session.join(new Participant(3L, "carol"), Instant.now())))
                .isInstanceOf(AlreadyActiveException.class);
        assertThat(session.getSlotB()).isEqualTo(BOB);
    }

    @Test
    void join_ownSessionIsRejected() {
        assertThatThrownBy(() -> session.runLocked(() -> session.join(ALICE, Instant.now())))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(session.getStatus()).isEqualTo(SessionStatus.WAITING);
    }

    @Test
    void mutationWithoutLock_failsFast() {
        assertThatThrownBy(() -> session.join(BOB, Instant.now()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordMove_onWaitingSession_isNotActive() {
        assertThatThrownBy(() -> session.withLock(() -> session.recordMove(1L, Move.ROCK)))
                .isInstanceOf(NotActiveException.class);
    }

    @Test
    void recordMove_byStranger_isUnknownParticipant() {
        activate();

        assertThatThrownBy(() -> session.withLock(() -> session.recordMove(99L, Move.ROCK)))
                .isInstanceOf(UnknownParticipantException.class);
    }

    @Test
    void recordMove_twice_isAlreadyChosenAndKeepsFirstMove() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));

        assertThatThrownBy(() -> session.withLock(() -> session.recordMove(1L, Move.PAPER)))
                .isInstanceOf(AlreadyChosenException.class);
        assertThat(session.getMoveA()).isEqualTo(Move.ROCK);
    }

    @Test
    void recordMove_timeoutIsNotAPlayableMove() {
        activate();

        assertThatThrownBy(() -> session.withLock(() -> session.recordMove(1L, Move.TIMEOUT)))
                .isInstanceOf(InvalidMoveException.class);
    }

    @Test
    void decide_rockBeatsScissors() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));
        session.withLock(() -> session.recordMove(2L, Move.SCISSORS));

        assertThat(session.isDecided()).isTrue();
        assertThat(session.withLock(session::decide)).isEqualTo(Outcome.A);
    }

    @Test
    void decide_timedOutSlotLoses() {
        activate();
        session.withLock(() -> session.recordMove(2L, Move.PAPER));
        assertThat(session.withLock(() -> session.recordTimeout(Slot.A))).isTrue();

        assertThat(session.withLock(session::decide)).isEqualTo(Outcome.B);
    }

    @Test
    void decide_doubleTimeoutIsTie() {
        activate();
        session.withLock(() -> session.recordTimeout(Slot.A));
        session.withLock(() -> session.recordTimeout(Slot.B));

        assertThat(session.bothTimedOut()).isTrue();
        assertThat(session.withLock(session::decide)).isEqualTo(Outcome.TIE);
    }

    @Test
    void recordTimeout_afterMove_isNoOp() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));

        assertThat(session.withLock(() -> session.recordTimeout(Slot.A))).isFalse();
        assertThat(session.getMoveA()).isEqualTo(Move.ROCK);
    }

    @Test
    void complete_onlyFirstCallSucceeds() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));
        session.withLock(() -> session.recordMove(2L, Move.SCISSORS));

        boolean first = session.withLock(() -> session.complete(Outcome.A, new RatingUpdate(1205, 1195, 5, -5), Instant.now()));
        boolean second = session.withLock(() -> session.complete(Outcome.TIE, RatingUpdate.unchanged(1200, 1200), Instant.now()));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(session.getOutcome()).isEqualTo(Outcome.A);
        assertThat(session.getRatingDeltaA()).isEqualTo(5);
        assertThat(session.getCompletedAt()).isNotNull();
    }

    @Test
    void complete_undecidedSessionIsRefused() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));

        boolean completed = session.withLock(() -> session.complete(Outcome.A, RatingUpdate.unchanged(1200, 1200), Instant.now()));

        assertThat(completed).isFalse();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void cancel_fromWaitingAndActive_thenNoOpWhenTerminal() {
        assertThat(session.withLock(() -> session.cancel(Instant.now()))).isTrue();
        assertThat(session.getStatus()).isEqualTo(SessionStatus.CANCELLED);
        assertThat(session.withLock(() -> session.cancel(Instant.now()))).isFalse();

        GameSession active = new GameSession("S-2", ALICE, false, null);
        active.runLocked(() -> active.join(BOB, Instant.now().plusSeconds(30)));
        active.withLock(() -> active.recordMove(1L, Move.PAPER));

        assertThat(active.withLock(() -> active.cancel(Instant.now()))).isTrue();
        assertThat(active.getMoveA()).isEqualTo(Move.PAPER);
        assertThat(active.getRatingDeltaA()).isZero();
    }

    @Test
    void linkRematch_requiresCompletedSessionAndIsSetOnce() {
        assertThatThrownBy(() -> session.runLocked(() -> session.linkRematch("S-2")))
                .isInstanceOf(RematchUnavailableException.class);

        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));
        session.withLock(() -> session.recordMove(2L, Move.ROCK));
        session.withLock(() -> session.complete(Outcome.TIE, RatingUpdate.unchanged(1200, 1200), Instant.now()));

        session.runLocked(() -> session.linkRematch("S-2"));

        assertThat(session.getRematchSessionId()).isEqualTo("S-2");
        assertThatThrownBy(() -> session.runLocked(() -> session.linkRematch("S-3")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void opponentOf_resolvesTheOtherSlot() {
        activate();

        assertThat(session.opponentOf(1L)).contains(BOB);
        assertThat(session.opponentOf(2L)).contains(ALICE);
        assertThat(session.opponentOf(99L)).isEmpty();
    }

    @Test
    void sessionView_hidesMovesWhileActive() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));

        SessionViewDto view = SessionViewDto.from(session.snapshot());

        assertThat(view.choiceMadeA()).isTrue();
        assertThat(view.choiceMadeB()).isFalse();
        assertThat(view.moveA()).isNull();
    }

    @Test
    void snapshot_ofCompletedSessionReportsWinnerAndLoser() {
        activate();
        session.withLock(() -> session.recordMove(1L, Move.ROCK));
        session.withLock(() -> session.recordMove(2L, Move.PAPER));
        session.withLock(() -> session.complete(Outcome.B, new RatingUpdate(1195, 1205, -5, 5), Instant.now()));

        SessionSnapshot snapshot = session.snapshot();

        assertThat(snapshot.winnerAccountId()).isEqualTo(2L);
        assertThat(snapshot.loserAccountId()).isEqualTo(1L);
        assertThat(snapshot.hasTimeout()).isFalse();
        assertThat(SessionViewDto.from(snapshot).moveA()).isEqualTo("rock");
    }

    private void activate() {
        session.runLocked(() -> session.join(BOB, Instant.now().plusSeconds(30)));
    }
}
