package com.tony.cfbRankings.exception;

import lombok.Getter;

@Getter
public class AlreadyPredictedException extends RuntimeException {

    private final Long gameId;

    public AlreadyPredictedException(Long gameId) {
        super("A prediction already exists for game " + gameId);
        this.gameId = gameId;
    }

    public AlreadyPredictedException(Long gameId, Throwable cause) {
        super("A prediction already exists for game " + gameId, cause);
        this.gameId = gameId;
    }
}
