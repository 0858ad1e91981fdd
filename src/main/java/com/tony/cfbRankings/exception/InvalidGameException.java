package com.tony.cfbRankings.exception;

import lombok.Getter;

/**
 * Match refusé par le moteur. La raison indique l'invariant violé pour corriger la donnée en amont.
 */
@Getter
public class InvalidGameException extends RuntimeException {

    public enum Reason {
        UNPLAYED,
        MISSING_TEAM,
        WEEK_OUT_OF_RANGE,
        ALREADY_PROCESSED,
        EXCLUDED_FROM_RANKINGS,
        TIED_SCORE,
        INVALID_RATING,
        NOT_SEEDED
    }

    private final Long gameId;
    private final Reason reason;

    public InvalidGameException(Long gameId, Reason reason, String message) {
        super(String.format("Game %s rejected (%s): %s", gameId, reason, message));
        this.gameId = gameId;
        this.reason = reason;
    }
}
