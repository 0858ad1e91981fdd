package com.tony.cfbRankings.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Résultat du traitement ELO d'un match.
 */
@Data
@Builder
@AllArgsConstructor
public class GameResult {
    private Long gameId;
    private Long winnerId;
    private Long loserId;
    private String winnerName;
    private String loserName;
    private String score;

    private double homeDelta;
    private double awayDelta;

    private double winnerExpected;  // Probabilité de victoire attendue (avec avantage terrain)
    private double movMultiplier;
    private double tierMultiplier;

    private double winnerNewRating;
    private double loserNewRating;
}
