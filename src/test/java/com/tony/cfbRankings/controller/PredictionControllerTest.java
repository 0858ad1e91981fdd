package com.tony.cfbRankings.controller;

import com.tony.cfbRankings.exception.AlreadyPredictedException;
import com.tony.cfbRankings.exception.InvalidGameException;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.dto.AccuracyReport;
import com.tony.cfbRankings.model.dto.AccuracyScope;
import com.tony.cfbRankings.service.AccuracyEvaluator;
import com.tony.cfbRankings.service.PredictionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PredictionController.class)
class PredictionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PredictionService predictionService;

    @MockBean
    private AccuracyEvaluator accuracyEvaluator;

    @Test
    void duplicatePredictionIsAConflict() throws Exception {
        when(predictionService.predict(10L)).thenThrow(new AlreadyPredictedException(10L));

        mockMvc.perform(post("/api/v1/predictions/games/10"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("ALREADY_PREDICTED"))
                .andExpect(jsonPath("$.gameId").value(10));
    }

    @Test
    void invalidGameIsUnprocessable() throws Exception {
        when(predictionService.predict(11L)).thenThrow(
                new InvalidGameException(11L, InvalidGameException.Reason.WEEK_OUT_OF_RANGE, "week 25"));

        mockMvc.perform(post("/api/v1/predictions/games/11"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.reason").value("WEEK_OUT_OF_RANGE"));
    }

    @Test
    void processedGameIsAConflict() throws Exception {
        when(predictionService.predict(12L)).thenThrow(
                new InvalidGameException(12L, InvalidGameException.Reason.ALREADY_PROCESSED, "cannot predict a processed game"));

        mockMvc.perform(post("/api/v1/predictions/games/12"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.reason").value("ALREADY_PROCESSED"));
    }

    @Test
    void unknownTeamIsNotFound() throws Exception {
        when(accuracyEvaluator.teamAccuracy(99L, 2024)).thenThrow(new ResourceNotFoundException("Team", 99L));

        mockMvc.perform(get("/api/v1/predictions/accuracy/teams/99").param("season", "2024"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("NOT_FOUND"));
    }

    @Test
    void weekOutsideTheSeasonIsABadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/predictions").param("season", "2024").param("week", "25"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void accuracyReportDefaultsToOverallScope() throws Exception {
        when(accuracyEvaluator.accuracyReport(2024, AccuracyScope.OVERALL)).thenReturn(
                AccuracyReport.builder().season(2024).scope(AccuracyScope.OVERALL)
                        .evaluatedPredictions(10).correctPredictions(7).accuracy(0.7).build());

        mockMvc.perform(get("/api/v1/predictions/accuracy").param("season", "2024"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accuracy").value(0.7))
                .andExpect(jsonPath("$.correctPredictions").value(7));
    }
}
