package com.tony.cfbRankings.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Valeur figée des ratings des deux équipes au moment de la prédiction.
 * Aucune référence vers l'entité Team : la dérive des ratings ne doit pas réécrire le passé.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class RatingSnapshot {

    @Column(name = "home_rating_at_prediction", nullable = false, updatable = false)
    private double homeRating;

    @Column(name = "away_rating_at_prediction", nullable = false, updatable = false)
    private double awayRating;

    public static RatingSnapshot of(Team home, Team away) {
        return new RatingSnapshot(home.getRating(), away.getRating());
    }

    public double getGap() {
        return homeRating - awayRating;
    }
}
