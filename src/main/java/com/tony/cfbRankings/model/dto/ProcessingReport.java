package com.tony.cfbRankings.model.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Bilan d'un lot de traitement (une semaine ou une saison).
 */
@Data
@NoArgsConstructor
public class ProcessingReport {
    private int season;
    private List<GameResult> processed = new ArrayList<>();
    private List<String> errors = new ArrayList<>();
    private List<Integer> snapshotWeeks = new ArrayList<>();
    private int predictionsEvaluated;

    public ProcessingReport(int season) {
        this.season = season;
    }

    public int getProcessedCount() {
        return processed.size();
    }

    public void merge(ProcessingReport other) {
        processed.addAll(other.processed);
        errors.addAll(other.errors);
        snapshotWeeks.addAll(other.snapshotWeeks);
        predictionsEvaluated += other.predictionsEvaluated;
    }
}
