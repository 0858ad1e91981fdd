package com.tony.cfbRankings.service;

import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.exception.InvalidGameException.Reason;
import com.tony.cfbRankings.exception.OutOfOrderProcessingException;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.model.dto.GameResult;
import com.tony.cfbRankings.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Applique le résultat d'un match joué aux ratings des deux équipes.
 * Un match n'est traité qu'une fois ; la somme des deux deltas est toujours nulle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameProcessor {

    private final GameRepository gameRepository;
    private final TeamRatingStore ratingStore;
    private final RatingCalculator calculator;

    @Transactional
    public GameResult process(Long gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new ResourceNotFoundException("Game", gameId));

        validate(game);

        Team home = ratingStore.findById(game.getHomeTeam().getId())
                .orElseThrow(() -> new InvalidGameException(gameId, Reason.MISSING_TEAM, "home team not found"));
        Team away = ratingStore.findById(game.getAwayTeam().getId())
                .orElseThrow(() -> new InvalidGameException(gameId, Reason.MISSING_TEAM, "away team not found"));

        checkRating(game, home);
        checkRating(game, away);
        checkSeason(game, home);
        checkSeason(game, away);
        checkOrdering(game, home);
        checkOrdering(game, away);

        boolean homeWon = game.getHomeScore() > game.getAwayScore();
        Team winner = homeWon ? home : away;
        Team loser = homeWon ? away : home;

        // 1. Ratings ajustés (avantage du terrain sauf site neutre)
        double homeAdjusted = calculator.adjustedHomeRating(home.getRating(), game.isNeutralSite());
        double awayAdjusted = away.getRating();
        double winnerAdjusted = homeWon ? homeAdjusted : awayAdjusted;
        double loserAdjusted = homeWon ? awayAdjusted : homeAdjusted;

        // 2. Espérance, marge, affiche
        double winnerExpected = calculator.expectedScore(winnerAdjusted, loserAdjusted);
        int pointDiff = Math.abs(game.getHomeScore() - game.getAwayScore());
        double mov = calculator.movMultiplier(pointDiff, winnerAdjusted - loserAdjusted);
        double tier = calculator.tierMultiplier(winner.getTier(), loser.getTier());

        // 3. Delta unique, appliqué en négatif au perdant
        double delta = calculator.winnerDelta(winnerExpected, mov, tier);

        ratingStore.applyDelta(winner, delta, true);
        ratingStore.applyDelta(loser, -delta, false);

        game.setHomeRatingChange(homeWon ? delta : -delta);
        game.setAwayRatingChange(homeWon ? -delta : delta);
        game.setProcessed(true);
        gameRepository.save(game);

        log.info("🏈 {} ({}) : {} {} / {} {} (exp={}, mov={}, tier={})",
                game.getMatchup(), game.getScoreLine(),
                winner.getName(), String.format("%+.2f", delta),
                loser.getName(), String.format("%+.2f", -delta),
                String.format("%.3f", winnerExpected), String.format("%.3f", mov), tier);

        return GameResult.builder()
                .gameId(game.getId())
                .winnerId(winner.getId())
                .loserId(loser.getId())
                .winnerName(winner.getName())
                .loserName(loser.getName())
                .score(game.getScoreLine())
                .homeDelta(game.getHomeRatingChange())
                .awayDelta(game.getAwayRatingChange())
                .winnerExpected(winnerExpected)
                .movMultiplier(mov)
                .tierMultiplier(tier)
                .winnerNewRating(winner.getRating())
                .loserNewRating(loser.getRating())
                .build();
    }

    private void validate(Game game) {
        Long id = game.getId();
        if (game.isProcessed()) {
            throw new InvalidGameException(id, Reason.ALREADY_PROCESSED, "ratings already applied");
        }
        if (game.isExcludedFromRankings()) {
            throw new InvalidGameException(id, Reason.EXCLUDED_FROM_RANKINGS, "game is excluded from rankings");
        }
        if (game.getHomeTeam() == null || game.getAwayTeam() == null) {
            throw new InvalidGameException(id, Reason.MISSING_TEAM, "both teams are required");
        }
        if (game.getHomeTeam().getId() != null && game.getHomeTeam().getId().equals(game.getAwayTeam().getId())) {
            throw new InvalidGameException(id, Reason.MISSING_TEAM, "a team cannot play itself");
        }
        if (!game.isPlayed()) {
            throw new InvalidGameException(id, Reason.UNPLAYED, "no final score recorded (status " + game.getStatus() + ")");
        }
        if (!calculator.isWeekInRange(game.getWeek())) {
            throw new InvalidGameException(id, Reason.WEEK_OUT_OF_RANGE, "week " + game.getWeek());
        }
        if (game.getHomeScore() < 0 || game.getAwayScore() < 0) {
            throw new InvalidGameException(id, Reason.UNPLAYED, "negative score " + game.getScoreLine());
        }
        if (game.getHomeScore().equals(game.getAwayScore())) {
            throw new InvalidGameException(id, Reason.TIED_SCORE, "tied at " + game.getScoreLine());
        }
    }

    private void checkRating(Game game, Team team) {
        Double rating = team.getRating();
        if (rating == null || rating.isNaN() || rating.isInfinite() || rating <= 0) {
            throw new InvalidGameException(game.getId(), Reason.INVALID_RATING,
                    team.getName() + " has rating " + rating);
        }
    }

    /**
     * Le rating, le rating initial et le bilan valent pour une saison : l'équipe doit
     * avoir reçu le seed de la saison du match.
     */
    private void checkSeason(Game game, Team team) {
        Integer seeded = team.getSeededSeason();
        if (seeded != null && game.getSeason() < seeded) {
            throw new OutOfOrderProcessingException(game.getId(), team.getId(), null,
                    String.format("Game %d (season %d) precedes the %d season already seeded for %s",
                            game.getId(), game.getSeason(), seeded, team.getName()));
        }
        if (seeded == null || !seeded.equals(game.getSeason())) {
            throw new InvalidGameException(game.getId(), Reason.NOT_SEEDED,
                    team.getName() + " is seeded for " + seeded + ", not " + game.getSeason());
        }
    }

    /**
     * Les ratings dépendent de l'ordre : un match ne peut pas passer après un match
     * plus récent de la même équipe.
     */
    private void checkOrdering(Game game, Team team) {
        Optional<Game> latest = gameRepository.findProcessedByTeamAndSeason(team.getId(), game.getSeason())
                .stream()
                .max(Game.CHRONOLOGICAL);

        if (latest.isPresent() && precedes(game, latest.get())) {
            Game last = latest.get();
            throw new OutOfOrderProcessingException(game.getId(), team.getId(), last.getId(),
                    String.format("Game %d (week %d) precedes game %d (week %d) already processed for %s",
                            game.getId(), game.getWeek(), last.getId(), last.getWeek(), team.getName()));
        }
    }

    // Même semaine sans date : l'ordre réel est inconnu, on accepte
    private boolean precedes(Game candidate, Game latest) {
        if (candidate.getWeek() < latest.getWeek()) return true;
        if (candidate.getWeek() > latest.getWeek()) return false;
        return candidate.getGameDate() != null && latest.getGameDate() != null
                && candidate.getGameDate().isBefore(latest.getGameDate());
    }
}
