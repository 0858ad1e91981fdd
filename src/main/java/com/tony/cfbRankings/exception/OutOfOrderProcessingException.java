package com.tony.cfbRankings.exception;

import lombok.Getter;

/**
 * Le match précède le dernier match déjà traité d'une des deux équipes.
 * Les ratings dépendent du chemin : appliquer ce match corromprait l'historique.
 */
@Getter
public class OutOfOrderProcessingException extends RuntimeException {

    private final Long gameId;
    private final Long teamId;
    private final Long latestProcessedGameId;

    public OutOfOrderProcessingException(Long gameId, Long teamId, Long latestProcessedGameId, String message) {
        super(message);
        this.gameId = gameId;
        this.teamId = teamId;
        this.latestProcessedGameId = latestProcessedGameId;
    }
}
