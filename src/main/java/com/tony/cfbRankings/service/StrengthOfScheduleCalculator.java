package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * SOS = moyenne des ratings actuels des adversaires rencontrés (matchs traités et classés).
 */
@Service
@RequiredArgsConstructor
public class StrengthOfScheduleCalculator {

    private final GameRepository gameRepository;
    private final TeamRatingStore ratingStore;
    private final RatingProperties properties;

    @Transactional(readOnly = true)
    public double calculateSos(Long teamId, int season, int asOfWeek) {
        SummaryStatistics stats = new SummaryStatistics();

        for (Game game : gameRepository.findProcessedByTeamAndSeason(teamId, season)) {
            if (game.isExcludedFromRankings() || game.getWeek() > asOfWeek) continue;
            Team opponent = teamId.equals(game.getHomeTeam().getId()) ? game.getAwayTeam() : game.getHomeTeam();
            stats.addValue(currentRating(opponent));
        }

        return neutralIfEmpty(stats);
    }

    /**
     * Toutes les équipes en une passe. Une équipe sans match reçoit la valeur neutre.
     */
    @Transactional(readOnly = true)
    public Map<Long, Double> calculateAll(int season, int asOfWeek) {
        Map<Long, Double> ratings = new HashMap<>();
        List<Team> teams = ratingStore.findAll();
        teams.forEach(t -> ratings.put(t.getId(), t.getRating()));

        Map<Long, SummaryStatistics> byTeam = new HashMap<>();
        for (Game game : gameRepository.findRankedProcessedUpToWeek(season, asOfWeek)) {
            Long homeId = game.getHomeTeam().getId();
            Long awayId = game.getAwayTeam().getId();
            byTeam.computeIfAbsent(homeId, id -> new SummaryStatistics())
                    .addValue(ratings.getOrDefault(awayId, game.getAwayTeam().getRating()));
            byTeam.computeIfAbsent(awayId, id -> new SummaryStatistics())
                    .addValue(ratings.getOrDefault(homeId, game.getHomeTeam().getRating()));
        }

        Map<Long, Double> sos = new HashMap<>();
        for (Team team : teams) {
            SummaryStatistics stats = byTeam.get(team.getId());
            sos.put(team.getId(), stats == null ? properties.getSchedule().getNeutralSos() : neutralIfEmpty(stats));
        }
        return sos;
    }

    private double currentRating(Team opponent) {
        return ratingStore.findById(opponent.getId())
                .map(Team::getRating)
                .orElse(opponent.getRating());
    }

    private double neutralIfEmpty(SummaryStatistics stats) {
        return stats.getN() == 0 ? properties.getSchedule().getNeutralSos() : stats.getMean();
    }
}
