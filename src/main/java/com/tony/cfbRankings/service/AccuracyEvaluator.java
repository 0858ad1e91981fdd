package com.tony.cfbRankings.service;

import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.exception.InvalidGameException.Reason;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.ConferenceTier;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.Prediction;
import com.tony.cfbRankings.model.ReferenceRankingEntry;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.model.dto.AccuracyReport;
import com.tony.cfbRankings.model.dto.AccuracyReport.Disagreement;
import com.tony.cfbRankings.model.dto.AccuracyReport.ReferenceComparison;
import com.tony.cfbRankings.model.dto.AccuracyReport.TierAccuracy;
import com.tony.cfbRankings.model.dto.AccuracyReport.WeekAccuracy;
import com.tony.cfbRankings.model.dto.AccuracyScope;
import com.tony.cfbRankings.model.dto.TeamAccuracy;
import com.tony.cfbRankings.repository.PredictionRepository;
import com.tony.cfbRankings.repository.ReferenceRankingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Vérifie les prédictions une fois les matchs traités, et compare le moteur
 * au sondage de référence (AP Top 25).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccuracyEvaluator {

    private final PredictionRepository predictionRepository;
    private final ReferenceRankingRepository referenceRepository;
    private final TeamRatingStore ratingStore;

    /**
     * Évalue la prédiction d'un match traité. Une prédiction déjà évaluée n'est jamais réécrite.
     */
    @Transactional
    public Optional<Prediction> evaluate(Game game) {
        if (!game.isProcessed() || game.getWinner() == null) {
            throw new InvalidGameException(game.getId(), Reason.UNPLAYED, "game has not been processed yet");
        }

        Optional<Prediction> found = predictionRepository.findByGameId(game.getId());
        if (found.isEmpty()) {
            log.debug("Aucune prédiction pour le match {}", game.getId());
            return Optional.empty();
        }

        Prediction prediction = found.get();
        if (prediction.isEvaluated()) {
            return found;
        }

        boolean correct = prediction.getPredictedWinner().getId().equals(game.getWinner().getId());
        // Brier sur la proba du vainqueur prédit : 0 = parfait, 1 = tout faux
        double brier = Math.pow(prediction.getWinProbability() - (correct ? 1.0 : 0.0), 2);

        prediction.markEvaluated(correct, Math.round(brier * 10000.0) / 10000.0);
        predictionRepository.save(prediction);

        log.info("{} Match {} : prédit {}, vainqueur {}", correct ? "✅" : "❌", game.getId(),
                prediction.getPredictedWinner().getName(), game.getWinner().getName());
        return Optional.of(prediction);
    }

    /**
     * Pronostic implicite du sondage : une équipe classée bat une non classée,
     * le meilleur rang bat le moins bon. Égalité ou deux équipes non classées : aucun pronostic.
     */
    @Transactional(readOnly = true)
    public Optional<Long> referencePrediction(Game game) {
        Optional<Integer> homeRank = pollRank(game.getHomeTeam(), game);
        Optional<Integer> awayRank = pollRank(game.getAwayTeam(), game);

        if (homeRank.isEmpty() && awayRank.isEmpty()) return Optional.empty();
        if (homeRank.isPresent() && awayRank.isEmpty()) return Optional.of(game.getHomeTeam().getId());
        if (homeRank.isEmpty()) return Optional.of(game.getAwayTeam().getId());

        int cmp = Integer.compare(homeRank.get(), awayRank.get());
        if (cmp == 0) return Optional.empty();
        return Optional.of(cmp < 0 ? game.getHomeTeam().getId() : game.getAwayTeam().getId());
    }

    @Transactional(readOnly = true)
    public AccuracyReport accuracyReport(int season, AccuracyScope scope) {
        List<Prediction> all = predictionRepository.findBySeason(season);
        List<Prediction> evaluated = all.stream().filter(Prediction::isEvaluated).toList();

        int correct = (int) evaluated.stream().filter(Prediction::getWasCorrect).count();
        SummaryStatistics brier = new SummaryStatistics();
        evaluated.stream().filter(p -> p.getBrierScore() != null).forEach(p -> brier.addValue(p.getBrierScore()));

        // Pronostic de référence calculé une fois par match
        Map<Long, Optional<Long>> referencePicks = new LinkedHashMap<>();
        for (Prediction p : evaluated) {
            referencePicks.put(p.getGame().getId(), referencePrediction(p.getGame()));
        }

        AccuracyReport report = AccuracyReport.builder()
                .season(season)
                .scope(scope)
                .totalPredictions(all.size())
                .evaluatedPredictions(evaluated.size())
                .correctPredictions(correct)
                .accuracy(ratio(correct, evaluated.size()))
                .averageBrierScore(brier.getN() == 0 ? 0.0 : round(brier.getMean()))
                .referenceComparison(compare(evaluated, referencePicks))
                .build();

        if (scope.includes(AccuracyScope.BY_WEEK)) report.setByWeek(byWeek(evaluated, referencePicks));
        if (scope.includes(AccuracyScope.BY_TIER)) report.setByTier(byTier(evaluated));
        if (scope.includes(AccuracyScope.DISAGREEMENTS)) report.setDisagreements(disagreements(evaluated, referencePicks));

        log.info("📊 Précision {} : {}/{} ({}%)", season, correct, evaluated.size(),
                round(report.getAccuracy() * 100));
        return report;
    }

    @Transactional(readOnly = true)
    public TeamAccuracy teamAccuracy(Long teamId, int season) {
        Team team = ratingStore.findById(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));

        List<Prediction> predictions = predictionRepository.findBySeasonAndTeam(season, teamId);
        List<Prediction> evaluated = predictions.stream().filter(Prediction::isEvaluated).toList();

        int correct = 0, favoriteGames = 0, favoriteCorrect = 0, underdogGames = 0, underdogCorrect = 0;
        for (Prediction p : evaluated) {
            boolean ok = p.getWasCorrect();
            if (ok) correct++;
            if (teamId.equals(p.getPredictedWinner().getId())) {
                favoriteGames++;
                if (ok) favoriteCorrect++;
            } else {
                underdogGames++;
                if (ok) underdogCorrect++;
            }
        }

        return TeamAccuracy.builder()
                .teamId(teamId)
                .teamName(team.getName())
                .season(season)
                .totalPredictions(predictions.size())
                .evaluatedPredictions(evaluated.size())
                .correctPredictions(correct)
                .accuracy(ratio(correct, evaluated.size()))
                .asFavoriteGames(favoriteGames)
                .asFavoriteAccuracy(ratio(favoriteCorrect, favoriteGames))
                .asUnderdogGames(underdogGames)
                .asUnderdogAccuracy(ratio(underdogCorrect, underdogGames))
                .build();
    }

    private ReferenceComparison compare(List<Prediction> evaluated, Map<Long, Optional<Long>> referencePicks) {
        int compared = 0, engine = 0, reference = 0, both = 0, engineOnly = 0, referenceOnly = 0, none = 0;

        for (Prediction p : evaluated) {
            Optional<Long> pick = referencePicks.get(p.getGame().getId());
            // Pas de pronostic de référence : match exclu du dénominateur
            if (pick.isEmpty()) continue;

            compared++;
            boolean engineOk = p.getWasCorrect();
            boolean referenceOk = pick.get().equals(p.getGame().getWinner().getId());
            if (engineOk) engine++;
            if (referenceOk) reference++;

            if (engineOk && referenceOk) both++;
            else if (engineOk) engineOnly++;
            else if (referenceOk) referenceOnly++;
            else none++;
        }

        double engineAccuracy = ratio(engine, compared);
        double referenceAccuracy = ratio(reference, compared);
        return ReferenceComparison.builder()
                .gamesCompared(compared)
                .engineCorrect(engine)
                .referenceCorrect(reference)
                .bothCorrect(both)
                .engineOnlyCorrect(engineOnly)
                .referenceOnlyCorrect(referenceOnly)
                .bothWrong(none)
                .engineAccuracy(engineAccuracy)
                .referenceAccuracy(referenceAccuracy)
                .engineAdvantage(round(engineAccuracy - referenceAccuracy))
                .build();
    }

    private List<WeekAccuracy> byWeek(List<Prediction> evaluated, Map<Long, Optional<Long>> referencePicks) {
        Map<Integer, List<Prediction>> weeks = new TreeMap<>();
        evaluated.forEach(p -> weeks.computeIfAbsent(p.getGame().getWeek(), w -> new ArrayList<>()).add(p));

        List<WeekAccuracy> result = new ArrayList<>();
        weeks.forEach((week, preds) -> {
            int correct = (int) preds.stream().filter(Prediction::getWasCorrect).count();
            int refGames = 0, refCorrect = 0;
            for (Prediction p : preds) {
                Optional<Long> pick = referencePicks.get(p.getGame().getId());
                if (pick.isEmpty()) continue;
                refGames++;
                if (pick.get().equals(p.getGame().getWinner().getId())) refCorrect++;
            }
            result.add(new WeekAccuracy(week, preds.size(), correct, ratio(correct, preds.size()),
                    refGames, ratio(refCorrect, refGames)));
        });
        return result;
    }

    private List<TierAccuracy> byTier(List<Prediction> evaluated) {
        Map<String, int[]> tiers = new TreeMap<>();
        for (Prediction p : evaluated) {
            ConferenceTier home = p.getGame().getHomeTeam().getTier();
            ConferenceTier away = p.getGame().getAwayTeam().getTier();
            int[] counts = tiers.computeIfAbsent(ConferenceTier.matchupLabel(home, away), k -> new int[2]);
            counts[0]++;
            if (p.getWasCorrect()) counts[1]++;
        }

        List<TierAccuracy> result = new ArrayList<>();
        tiers.forEach((label, c) -> result.add(new TierAccuracy(label, c[0], c[1], ratio(c[1], c[0]))));
        return result;
    }

    private List<Disagreement> disagreements(List<Prediction> evaluated, Map<Long, Optional<Long>> referencePicks) {
        List<Disagreement> result = new ArrayList<>();
        for (Prediction p : evaluated) {
            Game game = p.getGame();
            Optional<Long> pick = referencePicks.get(game.getId());
            if (pick.isEmpty() || pick.get().equals(p.getPredictedWinner().getId())) continue;

            Team referenceTeam = pick.get().equals(game.getHomeTeam().getId()) ? game.getHomeTeam() : game.getAwayTeam();
            result.add(Disagreement.builder()
                    .gameId(game.getId())
                    .week(game.getWeek())
                    .matchup(game.getMatchup())
                    .enginePredicted(p.getPredictedWinner().getName())
                    .referencePredicted(referenceTeam.getName())
                    .actualWinner(game.getWinner().getName())
                    .engineCorrect(p.getWasCorrect())
                    .referenceCorrect(referenceTeam.getId().equals(game.getWinner().getId()))
                    .build());
        }
        return result;
    }

    private Optional<Integer> pollRank(Team team, Game game) {
        if (team == null || team.getId() == null) return Optional.empty();
        return referenceRepository.findByTeamIdAndSeasonAndWeekAndPollName(
                        team.getId(), game.getSeason(), game.getWeek(), ReferenceRankingEntry.DEFAULT_POLL)
                .map(ReferenceRankingEntry::getRank);
    }

    private double ratio(int part, int total) {
        return total == 0 ? 0.0 : round((double) part / total);
    }

    private double round(double val) {
        return Math.round(val * 10000.0) / 10000.0;
    }
}
