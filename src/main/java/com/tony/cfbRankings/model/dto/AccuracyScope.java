package com.tony.cfbRankings.model.dto;

/**
 * Sections calculées dans un rapport de précision. OVERALL est toujours présent.
 */
public enum AccuracyScope {
    OVERALL,
    BY_WEEK,
    BY_TIER,
    DISAGREEMENTS,
    FULL;

    public boolean includes(AccuracyScope section) {
        return this == FULL || this == section;
    }
}
