package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.exception.AlreadyPredictedException;
import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.exception.InvalidGameException.Reason;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.ConfidenceLevel;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.GameStatus;
import com.tony.cfbRankings.model.Prediction;
import com.tony.cfbRankings.model.RatingSnapshot;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.repository.GameRepository;
import com.tony.cfbRankings.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Prédiction d'un match futur à partir des ratings du moment.
 * Les ratings utilisés sont copiés dans la prédiction et ne bougent plus ensuite.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PredictionService {

    private final GameRepository gameRepository;
    private final PredictionRepository predictionRepository;
    private final TeamRatingStore ratingStore;
    private final RatingCalculator calculator;
    private final RatingProperties properties;
    private final Clock clock;

    @Transactional
    public Prediction predict(Long gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new ResourceNotFoundException("Game", gameId));

        if (predictionRepository.existsByGameId(gameId)) {
            throw new AlreadyPredictedException(gameId);
        }
        validate(game);

        Team home = ratingStore.findById(game.getHomeTeam().getId())
                .orElseThrow(() -> new InvalidGameException(gameId, Reason.MISSING_TEAM, "home team not found"));
        Team away = ratingStore.findById(game.getAwayTeam().getId())
                .orElseThrow(() -> new InvalidGameException(gameId, Reason.MISSING_TEAM, "away team not found"));
        checkRating(gameId, home);
        checkRating(gameId, away);
        checkSeeded(game, home);
        checkSeeded(game, away);

        RatingSnapshot ratings = RatingSnapshot.of(home, away);
        Prediction prediction = buildPrediction(game, home, away, ratings);

        try {
            // saveAndFlush : la contrainte d'unicité doit sauter ici, pas au commit
            Prediction saved = predictionRepository.saveAndFlush(prediction);
            log.info("🔮 {} : {} ({}%, {}) {}-{}", game.getMatchup(),
                    saved.getPredictedWinner().getName(),
                    Math.round(saved.getWinProbability() * 1000) / 10.0, saved.getConfidence(),
                    saved.getPredictedAwayScore(), saved.getPredictedHomeScore());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyPredictedException(gameId, e);
        }
    }

    /**
     * Prédit tous les matchs programmés de la semaine qui n'ont pas encore de prédiction.
     */
    @Transactional
    public List<Prediction> generateForWeek(int season, int week) {
        List<Game> games = new ArrayList<>(gameRepository.findUnprocessedBySeasonWeekAndStatus(season, week, GameStatus.SCHEDULED));
        games.sort(Game.CHRONOLOGICAL);

        List<Prediction> created = new ArrayList<>();
        int skipped = 0;
        for (Game game : games) {
            if (predictionRepository.existsByGameId(game.getId())) {
                skipped++;
                continue;
            }
            try {
                created.add(predict(game.getId()));
            } catch (InvalidGameException e) {
                log.warn("⚠️ Prédiction impossible pour le match {} : {}", game.getId(), e.getMessage());
            }
        }
        log.info("✅ Semaine {} / {} : {} prédictions créées, {} déjà existantes", week, season, created.size(), skipped);
        return created;
    }

    @Transactional(readOnly = true)
    public List<Prediction> getPredictions(int season, int week) {
        return predictionRepository.findBySeasonAndWeek(season, week);
    }

    Prediction buildPrediction(Game game, Team home, Team away, RatingSnapshot ratings) {
        RatingProperties.Prediction cfg = properties.getPrediction();

        double homeAdjusted = calculator.adjustedHomeRating(ratings.getHomeRating(), game.isNeutralSite());
        double pHome = calculator.expectedScore(homeAdjusted, ratings.getAwayRating());
        boolean homeFavored = pHome > 0.5;

        // Écart de points proportionnel à l'écart de rating ajusté
        double spread = (homeAdjusted - ratings.getAwayRating()) / 100.0 * cfg.getPointsPer100Rating();
        int homeScore = clampScore(Math.round(cfg.getBaseScore() + spread));
        int awayScore = clampScore(Math.round(cfg.getBaseScore() - spread));
        // Score arrondi à égalité : le favori garde un point d'avance
        if (homeScore == awayScore) {
            if (homeFavored) {
                if (homeScore < cfg.getMaxScore()) homeScore++;
                else awayScore--;
            } else {
                if (awayScore < cfg.getMaxScore()) awayScore++;
                else homeScore--;
            }
        }

        double winnerProbability = homeFavored ? pHome : 1.0 - pHome;

        return Prediction.builder()
                .game(game)
                .predictedWinner(homeFavored ? home : away)
                .predictedHomeScore(homeScore)
                .predictedAwayScore(awayScore)
                .winProbability(winnerProbability)
                .ratingSnapshot(ratings)
                .confidence(ConfidenceLevel.fromProbability(winnerProbability))
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    private void validate(Game game) {
        Long id = game.getId();
        if (game.isProcessed()) {
            throw new InvalidGameException(id, Reason.ALREADY_PROCESSED, "cannot predict a processed game");
        }
        if (game.getStatus() == GameStatus.COMPLETED) {
            throw new InvalidGameException(id, Reason.ALREADY_PROCESSED, "cannot predict a game already played");
        }
        if (game.getHomeTeam() == null || game.getAwayTeam() == null) {
            throw new InvalidGameException(id, Reason.MISSING_TEAM, "both teams are required");
        }
        if (!calculator.isWeekInRange(game.getWeek())) {
            throw new InvalidGameException(id, Reason.WEEK_OUT_OF_RANGE, "week " + game.getWeek());
        }
    }

    private void checkRating(Long gameId, Team team) {
        Double rating = team.getRating();
        if (rating == null || rating.isNaN() || rating.isInfinite() || rating <= 0) {
            throw new InvalidGameException(gameId, Reason.INVALID_RATING, team.getName() + " has rating " + rating);
        }
    }

    private void checkSeeded(Game game, Team team) {
        if (team.getSeededSeason() == null || !team.getSeededSeason().equals(game.getSeason())) {
            throw new InvalidGameException(game.getId(), Reason.NOT_SEEDED,
                    team.getName() + " is seeded for " + team.getSeededSeason() + ", not " + game.getSeason());
        }
    }

    private int clampScore(long score) {
        RatingProperties.Prediction cfg = properties.getPrediction();
        return (int) Math.max(cfg.getMinScore(), Math.min(cfg.getMaxScore(), score));
    }
}
