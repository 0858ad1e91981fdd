package com.tony.cfbRankings.service;

import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.exception.OutOfOrderProcessingException;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.GameStatus;
import com.tony.cfbRankings.model.dto.GameResult;
import com.tony.cfbRankings.model.dto.ProcessingReport;
import com.tony.cfbRankings.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.TreeSet;

/**
 * Enchaîne traitement ELO, évaluation des prédictions et photo du classement.
 * Chaque match est sa propre transaction : un échec n'annule pas les matchs déjà passés.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingOrchestrator {

    private final GameRepository gameRepository;
    private final GameProcessor gameProcessor;
    private final AccuracyEvaluator accuracyEvaluator;
    private final RankingSnapshotService snapshotService;

    public GameResult processGame(Long gameId) {
        GameResult result = gameProcessor.process(gameId);

        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new ResourceNotFoundException("Game", gameId));
        accuracyEvaluator.evaluate(game);
        return result;
    }

    /**
     * Traite tous les matchs joués et non traités de la semaine, dans l'ordre chronologique,
     * puis fige le classement de la semaine.
     */
    public ProcessingReport processWeek(int season, int week) {
        ProcessingReport report = new ProcessingReport(season);

        List<Game> games = gameRepository.findUnprocessedBySeasonWeekAndStatus(season, week, GameStatus.COMPLETED)
                .stream()
                .filter(g -> !g.isExcludedFromRankings())
                .sorted(Game.CHRONOLOGICAL)
                .toList();

        log.info("🔄 Semaine {} / {} : {} matchs à traiter", week, season, games.size());

        for (Game game : games) {
            try {
                GameResult result = gameProcessor.process(game.getId());
                report.getProcessed().add(result);

                Game processed = gameRepository.findById(game.getId()).orElse(game);
                if (accuracyEvaluator.evaluate(processed).isPresent()) {
                    report.setPredictionsEvaluated(report.getPredictionsEvaluated() + 1);
                }
            } catch (InvalidGameException | OutOfOrderProcessingException e) {
                log.error("❌ Match {} ignoré : {}", game.getId(), e.getMessage());
                report.getErrors().add("Game " + game.getId() + ": " + e.getMessage());
            }
        }

        snapshotService.snapshot(season, week);
        report.getSnapshotWeeks().add(week);

        log.info("✅ Semaine {} / {} : {} traités, {} erreurs", week, season,
                report.getProcessedCount(), report.getErrors().size());
        return report;
    }

    /**
     * Rattrape toutes les semaines en attente de la saison, de la plus ancienne à la plus récente.
     */
    public ProcessingReport processPending(int season) {
        ProcessingReport report = new ProcessingReport(season);

        TreeSet<Integer> weeks = new TreeSet<>();
        gameRepository.findPendingBySeasonAndStatus(season, GameStatus.COMPLETED)
                .forEach(g -> weeks.add(g.getWeek()));

        if (weeks.isEmpty()) {
            log.info("Aucun match en attente pour {}", season);
            return report;
        }

        for (Integer week : weeks) {
            report.merge(processWeek(season, week));
        }
        return report;
    }
}
