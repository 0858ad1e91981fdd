package com.tony.cfbRankings.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "rankings")
@Data
public class RatingProperties {

    private Elo elo = new Elo();
    private Preseason preseason = new Preseason();
    private Prediction prediction = new Prediction();
    private Schedule schedule = new Schedule();

    @Data
    public static class Elo {
        // Facteur K : volatilité des ratings
        private double baseK = 32.0;
        private double ratingScale = 400.0;
        private double homeFieldAdvantage = 65.0;
        // Plafond du multiplicateur de marge (ln(écart + 1) sature ici)
        private double maxMovMultiplier = 2.5;
        // Amortissement des gros écarts de rating : 2.2 / (0.001 * écart + 2.2)
        private double autocorrelationBase = 2.2;
        private double autocorrelationScale = 0.001;
        private int minWeek = 0;
        private int maxWeek = 20;
    }

    @Data
    public static class Preseason {
        private double baseRating = 1500.0;
        private double subDivisionBaseRating = 1300.0;
        // Bande autour de la base : [base - maxOffset, base + maxOffset].
        // Avec les poids par défaut les bonus vont de -40 à +340 : la borne ne joue qu'avec des poids modifiés
        private double maxOffset = 350.0;
        private int unrankedSentinel = 999;
        private double neutralReturningProduction = 0.5;
        // (fraction - 0.5) * poids => ±40 au maximum
        private double returningProductionWeight = 80.0;
    }

    @Data
    public static class Prediction {
        private double baseScore = 30.0;
        // Points d'écart par tranche de 100 points de rating
        private double pointsPer100Rating = 3.5;
        private int minScore = 0;
        private int maxScore = 150;
    }

    @Data
    public static class Schedule {
        // Valeur neutre du SOS pour une équipe sans match
        private double neutralSos = 0.0;
    }
}
