package com.tony.cfbRankings.service;

import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.model.ConferenceTier;
import com.tony.cfbRankings.model.ConfidenceLevel;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.Prediction;
import com.tony.cfbRankings.model.RatingSnapshot;
import com.tony.cfbRankings.model.ReferenceRankingEntry;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.model.dto.AccuracyReport;
import com.tony.cfbRankings.model.dto.AccuracyScope;
import com.tony.cfbRankings.model.dto.TeamAccuracy;
import com.tony.cfbRankings.repository.PredictionRepository;
import com.tony.cfbRankings.repository.ReferenceRankingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.tony.cfbRankings.service.TestData.SEASON;
import static com.tony.cfbRankings.service.TestData.played;
import static com.tony.cfbRankings.service.TestData.team;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccuracyEvaluatorTest {

    @Mock
    private PredictionRepository predictionRepository;

    @Mock
    private ReferenceRankingRepository referenceRepository;

    private InMemoryTeamRatingStore store;
    private AccuracyEvaluator evaluator;

    // Rang AP par équipe (même semaine pour tous les tests)
    private final Map<Long, Integer> pollRanks = new HashMap<>();

    private Team georgia;
    private Team texas;
    private Team boise;
    private Team kentucky;

    @BeforeEach
    void setUp() {
        store = new InMemoryTeamRatingStore();
        evaluator = new AccuracyEvaluator(predictionRepository, referenceRepository, store);

        georgia = store.add(team(1, "Georgia", ConferenceTier.POWER_5, 1750));
        texas = store.add(team(2, "Texas", ConferenceTier.POWER_5, 1720));
        boise = store.add(team(3, "Boise St", ConferenceTier.GROUP_5, 1600));
        kentucky = store.add(team(4, "Kentucky", ConferenceTier.POWER_5, 1450));

        lenient().when(referenceRepository.findByTeamIdAndSeasonAndWeekAndPollName(anyLong(), anyInt(), anyInt(), anyString()))
                .thenAnswer(inv -> {
                    Long teamId = inv.getArgument(0);
                    Integer rank = pollRanks.get(teamId);
                    if (rank == null) return Optional.empty();
                    Team t = store.findById(teamId).orElseThrow();
                    return Optional.of(new ReferenceRankingEntry(t, (Integer) inv.getArgument(1), (Integer) inv.getArgument(2), rank));
                });
    }

    private Game processedGame(long id, Team home, Team away, int week, int hs, int as) {
        Game game = played(id, home, away, week, hs, as);
        game.setProcessed(true);
        return game;
    }

    private Prediction prediction(Game game, Team winner, double probability) {
        return Prediction.builder()
                .game(game)
                .predictedWinner(winner)
                .predictedHomeScore(30)
                .predictedAwayScore(27)
                .winProbability(probability)
                .ratingSnapshot(RatingSnapshot.of(game.getHomeTeam(), game.getAwayTeam()))
                .confidence(ConfidenceLevel.fromProbability(probability))
                .createdAt(LocalDateTime.of(2024, 9, 1, 12, 0))
                .build();
    }

    private Prediction evaluated(Game game, Team winner, double probability) {
        Prediction p = prediction(game, winner, probability);
        boolean correct = winner.equals(game.getWinner());
        p.markEvaluated(correct, Math.pow(probability - (correct ? 1 : 0), 2));
        return p;
    }

    @Test
    @DisplayName("Prédiction juste : wasCorrect = true, Brier = (1 - p)²")
    void evaluateCorrectPrediction() {
        // ARRANGE
        Game game = processedGame(10, georgia, texas, 7, 30, 15);
        Prediction p = prediction(game, georgia, 0.7);
        when(predictionRepository.findByGameId(10L)).thenReturn(Optional.of(p));

        // ACT
        Optional<Prediction> result = evaluator.evaluate(game);

        // ASSERT
        assertThat(result).isPresent();
        assertThat(p.getWasCorrect()).isTrue();
        assertThat(p.getBrierScore()).isCloseTo(0.09, within(1e-9));
        verify(predictionRepository).save(p);
    }

    @Test
    void evaluateWrongPrediction() {
        Game game = processedGame(10, georgia, texas, 7, 15, 30);
        Prediction p = prediction(game, georgia, 0.7);
        when(predictionRepository.findByGameId(10L)).thenReturn(Optional.of(p));

        evaluator.evaluate(game);

        assertThat(p.getWasCorrect()).isFalse();
        assertThat(p.getBrierScore()).isCloseTo(0.49, within(1e-9));
    }

    @Test
    @DisplayName("wasCorrect n'est écrit qu'une fois")
    void evaluationIsWrittenOnce() {
        Game game = processedGame(10, georgia, texas, 7, 15, 30);
        Prediction p = prediction(game, texas, 0.55);
        p.markEvaluated(true, 0.2025);
        when(predictionRepository.findByGameId(10L)).thenReturn(Optional.of(p));

        evaluator.evaluate(game);

        assertThat(p.getWasCorrect()).isTrue();
        assertThat(p.getBrierScore()).isEqualTo(0.2025);
        verify(predictionRepository, never()).save(any());
        assertThatThrownBy(() -> p.markEvaluated(false, 0.3)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void noPredictionMeansNothingToEvaluate() {
        Game game = processedGame(10, georgia, texas, 7, 30, 15);
        when(predictionRepository.findByGameId(10L)).thenReturn(Optional.empty());

        assertThat(evaluator.evaluate(game)).isEmpty();
    }

    @Test
    void unprocessedGameIsRejected() {
        Game game = played(10, georgia, texas, 7, 30, 15);

        assertThatThrownBy(() -> evaluator.evaluate(game)).isInstanceOf(InvalidGameException.class);
    }

    @Test
    @DisplayName("Pronostic du sondage : classé > non classé, meilleur rang > moins bon")
    void referencePredictionRules() {
        pollRanks.put(1L, 1);
        pollRanks.put(2L, 5);
        pollRanks.put(3L, 5);

        assertThat(evaluator.referencePrediction(processedGame(10, texas, georgia, 1, 10, 20))).contains(1L);
        assertThat(evaluator.referencePrediction(processedGame(11, kentucky, boise, 1, 10, 20))).contains(3L);
        assertThat(evaluator.referencePrediction(processedGame(12, texas, kentucky, 1, 10, 20))).contains(2L);
        // Rangs égaux ou deux non classés : pas de pronostic
        assertThat(evaluator.referencePrediction(processedGame(13, texas, boise, 1, 10, 20))).isEmpty();
        Team vandy = store.add(team(5, "Vanderbilt", ConferenceTier.POWER_5, 1300));
        assertThat(evaluator.referencePrediction(processedGame(14, vandy, kentucky, 1, 10, 20))).isEmpty();
    }

    @Test
    @DisplayName("Rapport complet : global, comparaison au sondage, par semaine, par affiche, désaccords")
    void fullAccuracyReport() {
        pollRanks.put(1L, 2);   // Georgia
        pollRanks.put(2L, 3);   // Texas
        pollRanks.put(3L, 20);  // Boise

        // Semaine 1 : moteur juste, sondage juste
        Game g1 = processedGame(10, georgia, kentucky, 1, 35, 10);
        // Semaine 1 : moteur juste (Texas), sondage faux (Georgia)
        Game g2 = processedGame(11, georgia, texas, 1, 20, 27);
        // Semaine 2 : moteur faux (Kentucky), sondage juste (Boise)
        Game g3 = processedGame(12, kentucky, boise, 2, 17, 24);
        // Semaine 2 : non évalué
        Game g4 = played(13, texas, kentucky, 2, 40, 7);

        when(predictionRepository.findBySeason(SEASON)).thenReturn(List.of(
                evaluated(g1, georgia, 0.9),
                evaluated(g2, texas, 0.6),
                evaluated(g3, kentucky, 0.55),
                prediction(g4, texas, 0.8)));

        AccuracyReport report = evaluator.accuracyReport(SEASON, AccuracyScope.FULL);

        assertThat(report.getTotalPredictions()).isEqualTo(4);
        assertThat(report.getEvaluatedPredictions()).isEqualTo(3);
        assertThat(report.getCorrectPredictions()).isEqualTo(2);
        assertThat(report.getAccuracy()).isCloseTo(0.6667, within(1e-4));

        AccuracyReport.ReferenceComparison cmp = report.getReferenceComparison();
        assertThat(cmp.getGamesCompared()).isEqualTo(3);
        assertThat(cmp.getEngineCorrect()).isEqualTo(2);
        assertThat(cmp.getReferenceCorrect()).isEqualTo(2);
        assertThat(cmp.getBothCorrect()).isEqualTo(1);
        assertThat(cmp.getEngineOnlyCorrect()).isEqualTo(1);
        assertThat(cmp.getReferenceOnlyCorrect()).isEqualTo(1);
        assertThat(cmp.getBothWrong()).isZero();

        assertThat(report.getByWeek()).extracting(AccuracyReport.WeekAccuracy::getWeek).containsExactly(1, 2);
        assertThat(report.getByWeek().get(0).getAccuracy()).isEqualTo(1.0);
        assertThat(report.getByWeek().get(1).getReferenceAccuracy()).isEqualTo(1.0);

        assertThat(report.getByTier()).extracting(AccuracyReport.TierAccuracy::getMatchup)
                .containsExactly("P5 vs G5", "P5 vs P5");

        assertThat(report.getDisagreements()).hasSize(2);
        assertThat(report.getDisagreements()).extracting(AccuracyReport.Disagreement::getGameId)
                .containsExactly(11L, 12L);
    }

    @Test
    @DisplayName("Un match sans pronostic du sondage sort du dénominateur de comparaison")
    void gamesWithoutReferencePickAreExcludedFromComparison() {
        Game g1 = processedGame(10, kentucky, boise, 1, 10, 24);
        when(predictionRepository.findBySeason(SEASON)).thenReturn(List.of(evaluated(g1, boise, 0.6)));

        AccuracyReport report = evaluator.accuracyReport(SEASON, AccuracyScope.OVERALL);

        assertThat(report.getCorrectPredictions()).isEqualTo(1);
        assertThat(report.getReferenceComparison().getGamesCompared()).isZero();
        assertThat(report.getReferenceComparison().getReferenceAccuracy()).isZero();
        assertThat(report.getByWeek()).isEmpty();
    }

    @Test
    void emptySeasonGivesZeroedReport() {
        when(predictionRepository.findBySeason(SEASON)).thenReturn(List.of());

        AccuracyReport report = evaluator.accuracyReport(SEASON, AccuracyScope.FULL);

        assertThat(report.getAccuracy()).isZero();
        assertThat(report.getAverageBrierScore()).isZero();
        assertThat(report.getByTier()).isEmpty();
    }

    @Test
    @DisplayName("Précision par équipe, favori vs outsider")
    void teamAccuracySplitsFavoriteAndUnderdog() {
        Game g1 = processedGame(10, georgia, kentucky, 1, 35, 10);
        Game g2 = processedGame(11, georgia, texas, 2, 20, 27);
        Game g3 = processedGame(12, boise, georgia, 3, 17, 24);
        when(predictionRepository.findBySeasonAndTeam(SEASON, 1L)).thenReturn(List.of(
                evaluated(g1, georgia, 0.9),
                evaluated(g2, georgia, 0.6),
                evaluated(g3, boise, 0.52)));

        TeamAccuracy acc = evaluator.teamAccuracy(1L, SEASON);

        assertThat(acc.getTeamName()).isEqualTo("Georgia");
        assertThat(acc.getEvaluatedPredictions()).isEqualTo(3);
        assertThat(acc.getCorrectPredictions()).isEqualTo(1);
        assertThat(acc.getAsFavoriteGames()).isEqualTo(2);
        assertThat(acc.getAsFavoriteAccuracy()).isEqualTo(0.5);
        assertThat(acc.getAsUnderdogGames()).isEqualTo(1);
        assertThat(acc.getAsUnderdogAccuracy()).isZero();
    }
}
