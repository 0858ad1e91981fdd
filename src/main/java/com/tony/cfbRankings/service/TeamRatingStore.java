package com.tony.cfbRankings.service;

import com.tony.cfbRankings.model.Team;

import java.util.List;
import java.util.Optional;

/**
 * Seul point d'écriture de {@code Team.rating}.
 * Injecté dans le moteur pour pouvoir le tester avec un store en mémoire.
 */
public interface TeamRatingStore {

    Optional<Team> findById(Long teamId);

    List<Team> findAll();

    /**
     * Applique un seed de présaison : rating = initialRating = seed, bilan remis à zéro.
     */
    Team seed(Team team, double rating, int season);

    /**
     * Ajoute un delta ELO au rating courant et incrémente le bilan.
     */
    Team applyDelta(Team team, double delta, boolean won);
}
