package ch.rps.rpsbackend.domain;

/**
 * Ratings of both slots after a completed session.
 *
 * @param newRatingA rating of slot A after the match
 * @param newRatingB rating of slot B after the match
 * @param deltaA     signed change applied to slot A
 * @param deltaB     signed change applied to slot B
 */
public record RatingUpdate(int newRatingA, int newRatingB, int deltaA, int deltaB) {

    public static RatingUpdate unchanged(int ratingA, int ratingB) {
        return new RatingUpdate(ratingA, ratingB, 0, 0);
    }
}
