package com.tony.cfbRankings.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class TeamAccuracy {
    private Long teamId;
    private String teamName;
    private int season;
    private int totalPredictions;
    private int evaluatedPredictions;
    private int correctPredictions;
    private double accuracy;

    // Équipe donnée gagnante (favori) vs perdante (outsider)
    private int asFavoriteGames;
    private double asFavoriteAccuracy;
    private int asUnderdogGames;
    private double asUnderdogAccuracy;
}
