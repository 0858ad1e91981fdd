package com.tony.cfbRankings.model;

/**
 * Signal explicite "le match a-t-il été joué ?".
 * Un 0-0 SCHEDULED est un match futur, un 0-0 COMPLETED est un vrai résultat.
 */
public enum GameStatus {
    SCHEDULED,
    COMPLETED
}
