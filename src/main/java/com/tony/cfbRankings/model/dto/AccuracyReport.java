package com.tony.cfbRankings.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccuracyReport {
    private int season;
    private AccuracyScope scope;

    // --- Précision globale (toutes les prédictions évaluées) ---
    private int totalPredictions;
    private int evaluatedPredictions;
    private int correctPredictions;
    private double accuracy;          // 0.0 - 1.0
    private double averageBrierScore; // 0 = parfait

    // --- Comparaison avec le classement de référence ---
    private ReferenceComparison referenceComparison;

    @Builder.Default
    private List<WeekAccuracy> byWeek = new ArrayList<>();

    @Builder.Default
    private List<TierAccuracy> byTier = new ArrayList<>();

    @Builder.Default
    private List<Disagreement> disagreements = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReferenceComparison {
        private int gamesCompared;
        private int engineCorrect;
        private int referenceCorrect;
        private int bothCorrect;
        private int engineOnlyCorrect;
        private int referenceOnlyCorrect;
        private int bothWrong;
        private double engineAccuracy;
        private double referenceAccuracy;
        private double engineAdvantage;
    }

    @Data
    @AllArgsConstructor
    public static class WeekAccuracy {
        private int week;
        private int games;
        private int correct;
        private double accuracy;
        private int referenceGames;
        private double referenceAccuracy;
    }

    @Data
    @AllArgsConstructor
    public static class TierAccuracy {
        private String matchup; // ex: "P5 vs G5"
        private int games;
        private int correct;
        private double accuracy;
    }

    @Data
    @Builder
    @AllArgsConstructor
    public static class Disagreement {
        private Long gameId;
        private int week;
        private String matchup;
        private String enginePredicted;
        private String referencePredicted;
        private String actualWinner;
        private boolean engineCorrect;
        private boolean referenceCorrect;
    }
}
