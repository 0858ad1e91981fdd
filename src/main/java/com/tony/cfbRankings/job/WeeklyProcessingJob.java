package com.tony.cfbRankings.job;

import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Season;
import com.tony.cfbRankings.model.dto.ProcessingReport;
import com.tony.cfbRankings.service.RatingOrchestrator;
import com.tony.cfbRankings.service.SeasonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class WeeklyProcessingJob {

    private final SeasonService seasonService;
    private final RatingOrchestrator orchestrator;

    /**
     * Rattrapage des matchs joués de la saison active.
     * Désactivé par défaut ("-") : à activer via rankings.processing.cron (ex: "0 0 9 * * SUN").
     */
    @Scheduled(cron = "${rankings.processing.cron:-}")
    public void processPendingGames() {
        log.info("⏰ [CRON] Démarrage du traitement des matchs en attente...");
        Season season;
        try {
            season = seasonService.activeSeason();
        } catch (ResourceNotFoundException e) {
            log.warn("⚠️ [CRON] Aucune saison active, rien à traiter");
            return;
        }

        ProcessingReport report = orchestrator.processPending(season.getYear());
        if (!report.getSnapshotWeeks().isEmpty()) {
            int lastWeek = report.getSnapshotWeeks().get(report.getSnapshotWeeks().size() - 1);
            if (lastWeek > season.getCurrentWeek()) {
                seasonService.advanceWeek(season.getYear(), lastWeek);
            }
        }
        log.info("✅ [CRON] {} matchs traités, {} erreurs, {} prédictions évaluées",
                report.getProcessedCount(), report.getErrors().size(), report.getPredictionsEvaluated());
    }
}
