package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.model.ConferenceTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Mathématiques ELO partagées par le traitement des matchs et les prédictions.
 * Aucune dépendance à la persistance : tout est déterministe à ratings égaux.
 */
@Service
@RequiredArgsConstructor
public class RatingCalculator {

    // Écart de rating plancher pour l'amortissement (évite un dénominateur négatif sur un upset énorme)
    private static final double MIN_DAMPING_GAP = -1000.0;

    private final RatingProperties properties;

    /**
     * Espérance de victoire de A contre B : 1 / (1 + 10^((B - A) / 400)).
     */
    public double expectedScore(double ratingA, double ratingB) {
        double exponent = (ratingB - ratingA) / properties.getElo().getRatingScale();
        return 1.0 / (1.0 + Math.pow(10.0, exponent));
    }

    public double adjustedHomeRating(double homeRating, boolean neutralSite) {
        return neutralSite ? homeRating : homeRating + properties.getElo().getHomeFieldAdvantage();
    }

    public double homeWinProbability(double homeRating, double awayRating, boolean neutralSite) {
        return expectedScore(adjustedHomeRating(homeRating, neutralSite), awayRating);
    }

    /**
     * Multiplicateur de marge : ln(écart + 1) plafonné, puis amorti quand le vainqueur
     * était déjà nettement mieux classé.
     *
     * @param pointDifferential écart de points (valeur absolue)
     * @param winnerRatingGap   rating ajusté du vainqueur moins celui du perdant
     */
    public double movMultiplier(int pointDifferential, double winnerRatingGap) {
        RatingProperties.Elo elo = properties.getElo();

        double raw = 1.0;
        if (pointDifferential > 0) {
            raw = Math.min(Math.log(Math.abs(pointDifferential) + 1.0), elo.getMaxMovMultiplier());
        }

        double gap = Math.max(winnerRatingGap, MIN_DAMPING_GAP);
        double damping = elo.getAutocorrelationBase() / (elo.getAutocorrelationScale() * gap + elo.getAutocorrelationBase());
        return raw * damping;
    }

    /**
     * Multiplicateur d'affiche, vu du vainqueur. Le même facteur s'applique au perdant
     * pour que la somme des deltas reste nulle.
     */
    public double tierMultiplier(ConferenceTier winnerTier, ConferenceTier loserTier) {
        if (winnerTier == null || loserTier == null || winnerTier == loserTier) return 1.0;

        // FBS vs FCS
        if (!winnerTier.isSubDivision() && loserTier.isSubDivision()) return 0.5;
        if (winnerTier.isSubDivision() && !loserTier.isSubDivision()) return 2.0;

        // P5 vs G5
        if (winnerTier == ConferenceTier.POWER_5 && loserTier == ConferenceTier.GROUP_5) return 0.9;
        if (winnerTier == ConferenceTier.GROUP_5 && loserTier == ConferenceTier.POWER_5) return 1.1;

        return 1.0;
    }

    /**
     * Delta du vainqueur = K * MOV * tier * (1 - espérance). Le perdant reçoit l'opposé exact.
     */
    public double winnerDelta(double winnerExpected, double movMultiplier, double tierMultiplier) {
        return properties.getElo().getBaseK() * movMultiplier * tierMultiplier * (1.0 - winnerExpected);
    }

    public boolean isWeekInRange(Integer week) {
        if (week == null) return false;
        RatingProperties.Elo elo = properties.getElo();
        return week >= elo.getMinWeek() && week <= elo.getMaxWeek();
    }
}
