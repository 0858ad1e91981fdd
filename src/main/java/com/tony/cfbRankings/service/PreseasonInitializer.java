package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.exception.MissingPreseasonDataException;
import com.tony.cfbRankings.model.Team;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Rating de départ d'une équipe à partir du recrutement, du portail des transferts
 * et de la production revenante.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PreseasonInitializer {

    private final TeamRatingStore ratingStore;
    private final RatingProperties properties;

    record PreseasonFactors(int recruitingRank, int transferRank, double returningProduction) {}

    /**
     * Calcule le seed sans rien écrire. Les facteurs manquants prennent des valeurs neutres.
     */
    public double initialize(Team team, Integer recruitingRank, Integer transferRank, Double returningProduction) {
        RatingProperties.Preseason cfg = properties.getPreseason();

        PreseasonFactors factors;
        try {
            factors = resolveFactors(team, recruitingRank, transferRank, returningProduction);
        } catch (MissingPreseasonDataException e) {
            log.warn("⚠️ Présaison incomplète pour {} ({}), valeurs neutres appliquées",
                    e.getTeamName(), String.join(", ", e.getMissingFields()));
            factors = new PreseasonFactors(
                    recruitingRank != null && recruitingRank > 0 ? recruitingRank : cfg.getUnrankedSentinel(),
                    transferRank != null && transferRank > 0 ? transferRank : cfg.getUnrankedSentinel(),
                    returningProduction != null ? clampFraction(returningProduction) : cfg.getNeutralReturningProduction());
        }

        double base = baseRating(team);
        double seed = base
                + recruitingBonus(factors.recruitingRank())
                + transferBonus(factors.transferRank())
                + returningProductionBonus(factors.returningProduction());

        double clamped = Math.max(base - cfg.getMaxOffset(), Math.min(base + cfg.getMaxOffset(), seed));
        if (clamped != seed) {
            log.debug("Seed de {} borné : {} -> {}", team.getName(), seed, clamped);
        }
        return clamped;
    }

    /**
     * Applique le seed de la saison. Sans effet si l'équipe est déjà initialisée pour cette saison.
     */
    @Transactional
    public double seedTeam(Team team, int season) {
        if (team.getSeededSeason() != null && team.getSeededSeason() == season) {
            log.debug("{} déjà initialisée pour {}, seed conservé", team.getName(), season);
            return team.getRating();
        }
        return applySeed(team, season);
    }

    /**
     * Ré-initialisation explicite : écrase rating, rating initial et bilan.
     */
    @Transactional
    public double resetTeam(Team team, int season) {
        log.info("♻️ Reset présaison de {} pour {}", team.getName(), season);
        return applySeed(team, season);
    }

    @Transactional
    public int seedSeason(int season) {
        int seeded = 0;
        for (Team team : ratingStore.findAll()) {
            if (team.getSeededSeason() == null || team.getSeededSeason() != season) {
                applySeed(team, season);
                seeded++;
            }
        }
        log.info("🌱 Saison {} : {} équipes initialisées", season, seeded);
        return seeded;
    }

    private double applySeed(Team team, int season) {
        double seed = initialize(team, team.getRecruitingRank(), team.getTransferPortalRank(), team.getReturningProduction());
        ratingStore.seed(team, seed, season);
        return seed;
    }

    PreseasonFactors resolveFactors(Team team, Integer recruitingRank, Integer transferRank, Double returningProduction) {
        List<String> missing = new ArrayList<>();
        if (recruitingRank == null || recruitingRank <= 0) missing.add("recruitingRank");
        if (transferRank == null || transferRank <= 0) missing.add("transferPortalRank");
        if (returningProduction == null || returningProduction.isNaN()) missing.add("returningProduction");

        if (!missing.isEmpty()) {
            throw new MissingPreseasonDataException(team.getName(), missing);
        }
        return new PreseasonFactors(recruitingRank, transferRank, clampFraction(returningProduction));
    }

    double baseRating(Team team) {
        RatingProperties.Preseason cfg = properties.getPreseason();
        return team.getTier() != null && team.getTier().isSubDivision()
                ? cfg.getSubDivisionBaseRating()
                : cfg.getBaseRating();
    }

    // Meilleur rang => plus gros bonus
    double recruitingBonus(int rank) {
        if (rank <= 5) return 200;
        if (rank <= 10) return 150;
        if (rank <= 25) return 100;
        if (rank <= 50) return 50;
        if (rank <= 75) return 25;
        return 0;
    }

    double transferBonus(int rank) {
        if (rank <= 5) return 100;
        if (rank <= 10) return 75;
        if (rank <= 25) return 50;
        if (rank <= 50) return 25;
        return 0;
    }

    double returningProductionBonus(double fraction) {
        return (fraction - 0.5) * properties.getPreseason().getReturningProductionWeight();
    }

    private double clampFraction(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
