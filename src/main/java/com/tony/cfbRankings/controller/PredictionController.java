package com.tony.cfbRankings.controller;

import com.tony.cfbRankings.model.Prediction;
import com.tony.cfbRankings.model.dto.AccuracyReport;
import com.tony.cfbRankings.model.dto.AccuracyScope;
import com.tony.cfbRankings.model.dto.TeamAccuracy;
import com.tony.cfbRankings.service.AccuracyEvaluator;
import com.tony.cfbRankings.service.PredictionService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/predictions")
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionService predictionService;
    private final AccuracyEvaluator accuracyEvaluator;

    @GetMapping
    public ResponseEntity<List<Prediction>> getPredictions(@RequestParam int season, @RequestParam @Min(0) @Max(20) int week) {
        return ResponseEntity.ok(predictionService.getPredictions(season, week));
    }

    @PostMapping("/games/{gameId}")
    public ResponseEntity<Prediction> predictGame(@PathVariable Long gameId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(predictionService.predict(gameId));
    }

    // Toute la semaine d'un coup, les matchs déjà prédits sont sautés
    @PostMapping("/weeks")
    public ResponseEntity<List<Prediction>> predictWeek(@RequestParam int season, @RequestParam @Min(0) @Max(20) int week) {
        return ResponseEntity.ok(predictionService.generateForWeek(season, week));
    }

    @GetMapping("/accuracy")
    public ResponseEntity<AccuracyReport> getAccuracy(
            @RequestParam int season,
            @RequestParam(defaultValue = "OVERALL") AccuracyScope scope) {
        return ResponseEntity.ok(accuracyEvaluator.accuracyReport(season, scope));
    }

    @GetMapping("/accuracy/teams/{teamId}")
    public ResponseEntity<TeamAccuracy> getTeamAccuracy(@PathVariable Long teamId, @RequestParam int season) {
        return ResponseEntity.ok(accuracyEvaluator.teamAccuracy(teamId, season));
    }
}
