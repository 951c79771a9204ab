package com.vcarda.loyaltyqrbackend.directory;

/**
 * Credits loyalty points to a card.
 *
 * Scans never call this on their own; points are awarded by an explicit operator action.
 */
public interface PointsAwarder {

    /**
     * @param cardId card to credit
     * @param amount positive number of points
     * @param source free-text origin of the award, kept in logs
     * @return the card balance after the award
     */
    long awardPoints(Long cardId, int amount, String source);
}
