package ch.rps.rpsbackend.application.service;

import ch.rps.rpsbackend.domain.RatingUpdate;
import ch.rps.rpsbackend.domain.enums.Outcome;
import ch.rps.rpsbackend.service.RatingEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RatingEngineTest {

    private final RatingEngine ratingEngine = new RatingEngine(10);

    @Test
    void update_equalRatings_winnerGainsHalfOfK() {
        RatingUpdate update = ratingEngine.update(1200, 1200, Outcome.A);

        assertThat(update.deltaA()).isEqualTo(5);
        assertThat(update.deltaB()).isEqualTo(-5);
        assertThat(update.newRatingA()).isEqualTo(1205);
        assertThat(update.newRatingB()).isEqualTo(1195);
    }

    @Test
    void update_equalRatings_tieChangesNothing() {
        RatingUpdate update = ratingEngine.update(1200, 1200, Outcome.TIE);

        assertThat(update.deltaA()).isZero();
        assertThat(update.deltaB()).isZero();
    }

    @Test
    void update_favouriteWins_smallGain() {
        // expectedA = 1 / (1 + 10^(-0.5)) ~ 0.7597
        RatingUpdate update = ratingEngine.update(1400, 1200, Outcome.A);

        assertThat(update.deltaA()).isEqualTo(2);
        assertThat(update.deltaB()).isEqualTo(-2);
    }

    @Test
    void update_underdogWins_largeGain() {
        RatingUpdate update = ratingEngine.update(1400, 1200, Outcome.B);

        assertThat(update.deltaA()).isEqualTo(-8);
        assertThat(update.deltaB()).isEqualTo(8);
        assertThat(update.newRatingB()).isEqualTo(1208);
    }

    @Test
    void update_tieBetweenUnequalRatings_movesTowardsEachOther() {
        RatingUpdate update = ratingEngine.update(1400, 1200, Outcome.TIE);

        assertThat(update.deltaA()).isEqualTo(-3);
        assertThat(update.deltaB()).isEqualTo(3);
    }

    @Test
    void update_isDeterministicAndSymmetricInSlots() {
        RatingUpdate first = ratingEngine.update(1337, 1111, Outcome.A);
        RatingUpdate again = ratingEngine.update(1337, 1111, Outcome.A);
        RatingUpdate swapped = ratingEngine.update(1111, 1337, Outcome.B);

        assertThat(again).isEqualTo(first);
        assertThat(swapped.deltaA()).isEqualTo(first.deltaB());
        assertThat(swapped.deltaB()).isEqualTo(first.deltaA());
    }

    @Test
    void update_neverClampsRatings() {
        RatingUpdate update = ratingEngine.update(2, 3000, Outcome.B);

        assertThat(update.newRatingA()).isLessThanOrEqualTo(2);
    }

    @Test
    void update_usesConfiguredKFactor() {
        RatingEngine engine = new RatingEngine(32);

        assertThat(engine.getKFactor()).isEqualTo(32);
        assertThat(engine.update(1200, 1200, Outcome.B).deltaB()).isEqualTo(16);
    }

    @Test
    void expectedScore_sumsToOne() {
        double a = RatingEngine.expectedScore(1500, 1300);
        double b = RatingEngine.expectedScore(1300, 1500);

        assertThat(a + b).isCloseTo(1.0, within(1e-9));
        assertThat(RatingEngine.expectedScore(1200, 1200)).isEqualTo(0.5);
    }

    @Test
    void roundHalfAwayFromZero_roundsHalvesOutwards() {
        assertThat(RatingEngine.roundHalfAwayFromZero(2.5)).isEqualTo(3);
        assertThat(RatingEngine.roundHalfAwayFromZero(-2.5)).isEqualTo(-3);
        assertThat(RatingEngine.roundHalfAwayFromZero(2.4)).isEqualTo(2);
        assertThat(RatingEngine.roundHalfAwayFromZero(-0.4)).isEqualTo(0);
        assertThat(RatingEngine.roundHalfAwayFromZero(0.0)).isEqualTo(0);
    }
}
