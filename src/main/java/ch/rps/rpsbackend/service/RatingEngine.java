package ch.rps.rpsbackend.service;

import ch.rps.rpsbackend.domain.RatingUpdate;
import ch.rps.rpsbackend.domain.enums.Outcome;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * ELO rating calculator for one session.
 *
 * <pre>
 * expectedA = 1 / (1 + 10^((ratingB - ratingA) / 400))
 * deltaA    = round(K * (scoreA - expectedA))      scoreA: 1 win, 0.5 tie, 0 loss
 * </pre>
 *
 * Each side's delta is rounded on its own (half away from zero), so the two deltas are not
 * forced to sum to zero. Ratings are not clamped.
 */
@Component
public class RatingEngine {

    private final int kFactor;

    public RatingEngine(@Value("${rps.rating.k-factor:10}") int kFactor) {
        this.kFactor = kFactor;
    }

    public RatingUpdate update(int ratingA, int ratingB, Outcome outcome) {
        double scoreA = switch (outcome) {
            case A -> 1.0;
            case B -> 0.0;
            case TIE -> 0.5;
        };
        double scoreB = 1.0 - scoreA;

        int deltaA = roundHalfAwayFromZero(kFactor * (scoreA - expectedScore(ratingA, ratingB)));
        int deltaB = roundHalfAwayFromZero(kFactor * (scoreB - expectedScore(ratingB, ratingA)));

        return new RatingUpdate(ratingA + deltaA, ratingB + deltaB, deltaA, deltaB);
    }

    public int getKFactor() {
        return kFactor;
    }

    /**
     * Probability of {@code rating} scoring against {@code opponentRating}, between 0.0 and 1.0.
     */
    public static double expectedScore(int rating, int opponentRating) {
        return 1.0 / (1.0 + Math.pow(10.0, (opponentRating - rating) / 400.0));
    }

    public static int roundHalfAwayFromZero(double value) {
        return (int) (Math.signum(value) * Math.round(Math.abs(value)));
    }
}
