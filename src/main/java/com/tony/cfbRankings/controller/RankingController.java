package com.tony.cfbRankings.controller;

import com.tony.cfbRankings.model.RankingSnapshot;
import com.tony.cfbRankings.model.dto.RankingEntry;
import com.tony.cfbRankings.service.RankingSnapshotService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rankings")
@RequiredArgsConstructor
public class RankingController {

    private final RankingSnapshotService snapshotService;

    // Classement live (calculé à la volée)
    @GetMapping
    public ResponseEntity<List<RankingEntry>> getCurrentRankings(@RequestParam int season) {
        return ResponseEntity.ok(snapshotService.currentRankings(season));
    }

    @GetMapping("/snapshots")
    public ResponseEntity<List<RankingSnapshot>> getSnapshot(@RequestParam int season, @RequestParam @Min(0) @Max(20) int week) {
        return ResponseEntity.ok(snapshotService.getSnapshot(season, week));
    }

    @PostMapping("/snapshots")
    public ResponseEntity<List<RankingSnapshot>> createSnapshot(@RequestParam int season, @RequestParam @Min(0) @Max(20) int week) {
        return ResponseEntity.ok(snapshotService.snapshot(season, week));
    }

    @GetMapping("/teams/{teamId}/history")
    public ResponseEntity<List<RankingSnapshot>> getTeamHistory(@PathVariable Long teamId, @RequestParam int season) {
        return ResponseEntity.ok(snapshotService.rankingHistory(teamId, season));
    }
}
