package com.tony.cfbRankings.controller;

import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Season;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.model.dto.GameResult;
import com.tony.cfbRankings.model.dto.ProcessingReport;
import com.tony.cfbRankings.service.CsvImportService;
import com.tony.cfbRankings.service.PreseasonInitializer;
import com.tony.cfbRankings.service.RatingOrchestrator;
import com.tony.cfbRankings.service.SeasonService;
import com.tony.cfbRankings.service.TeamRatingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final SeasonService seasonService;
    private final RatingOrchestrator orchestrator;
    private final PreseasonInitializer preseasonInitializer;
    private final TeamRatingStore ratingStore;
    private final CsvImportService importService;

    // --- SAISONS ---

    @PostMapping("/seasons/{year}/start")
    public ResponseEntity<Season> startSeason(@PathVariable int year) {
        log.info("🏁 Ouverture de la saison {} demandée par l'admin", year);
        return ResponseEntity.ok(seasonService.startSeason(year));
    }

    @PostMapping("/seasons/{year}/weeks/{week}/advance")
    public ResponseEntity<Season> advanceWeek(@PathVariable int year, @PathVariable int week) {
        return ResponseEntity.ok(seasonService.advanceWeek(year, week));
    }

    @PostMapping("/teams/{teamId}/reset")
    public ResponseEntity<Map<String, Object>> resetTeam(@PathVariable Long teamId, @RequestParam int season) {
        Team team = ratingStore.findById(teamId)
                .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
        double seed = preseasonInitializer.resetTeam(team, season);
        return ResponseEntity.ok(Map.of("teamId", teamId, "season", season, "rating", seed));
    }

    // --- TRAITEMENT ELO ---

    @PostMapping("/games/{gameId}/process")
    public ResponseEntity<GameResult> processGame(@PathVariable Long gameId) {
        return ResponseEntity.ok(orchestrator.processGame(gameId));
    }

    @PostMapping("/seasons/{season}/weeks/{week}/process")
    public ResponseEntity<ProcessingReport> processWeek(@PathVariable int season, @PathVariable int week) {
        log.info("🚀 Traitement manuel de la semaine {} / {}", week, season);
        return ResponseEntity.ok(orchestrator.processWeek(season, week));
    }

    @PostMapping("/seasons/{season}/process-pending")
    public ResponseEntity<ProcessingReport> processPending(@PathVariable int season) {
        return ResponseEntity.ok(orchestrator.processPending(season));
    }

    // --- IMPORTS CSV ---

    @PostMapping("/import/preseason")
    public ResponseEntity<String> importPreseason(@RequestParam("file") MultipartFile file) throws IOException {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importService.importPreseasonFactors(reader));
        }
    }

    @PostMapping("/import/games")
    public ResponseEntity<String> importGames(@RequestParam("file") MultipartFile file) throws IOException {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importService.importGames(reader));
        }
    }

    @PostMapping("/import/reference-rankings")
    public ResponseEntity<String> importReferenceRankings(@RequestParam("file") MultipartFile file) throws IOException {
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(importService.importReferenceRankings(reader));
        }
    }
}
