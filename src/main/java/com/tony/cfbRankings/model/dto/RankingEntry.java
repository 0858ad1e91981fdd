package com.tony.cfbRankings.model.dto;

import com.tony.cfbRankings.model.ConferenceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankingEntry {
    private Long teamId;
    private String teamName;
    private ConferenceTier tier;
    private int rank;
    private double rating;
    private int wins;
    private int losses;
    private double sos;
    private int sosRank;

    public double getWinPercentage() {
        int played = wins + losses;
        return played == 0 ? 0.0 : (double) wins / played;
    }
}
