package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "predictions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prediction_game", columnNames = {"game_id"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Prediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Unicité portée par uk_prediction_game
    @ManyToOne(optional = false)
    @JoinColumn(name = "game_id", nullable = false, updatable = false)
    private Game game;

    @ManyToOne(optional = false)
    @JoinColumn(name = "predicted_winner_id", nullable = false, updatable = false)
    private Team predictedWinner;

    @Column(nullable = false, updatable = false)
    private Integer predictedHomeScore;

    @Column(nullable = false, updatable = false)
    private Integer predictedAwayScore;

    // Probabilité du vainqueur prédit (0.0 - 1.0)
    @Column(nullable = false, updatable = false)
    private Double winProbability;

    @Embedded
    private RatingSnapshot ratingSnapshot;

    @Enumerated(EnumType.STRING)
    @Column(length = 10, updatable = false)
    private ConfidenceLevel confidence;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    // Null tant que le match n'est pas traité
    private Boolean wasCorrect;

    private Double brierScore;

    public boolean isEvaluated() {
        return wasCorrect != null;
    }

    public int getPredictedMargin() {
        return Math.abs(predictedHomeScore - predictedAwayScore);
    }

    /**
     * Seule écriture autorisée après création, et une seule fois.
     */
    public void markEvaluated(boolean correct, double brier) {
        if (this.wasCorrect != null) {
            throw new IllegalStateException("Prediction " + id + " has already been evaluated");
        }
        this.wasCorrect = correct;
        this.brierScore = brier;
    }
}
