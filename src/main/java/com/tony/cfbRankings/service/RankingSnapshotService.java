package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.model.RankingSnapshot;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.model.dto.RankingEntry;
import com.tony.cfbRankings.repository.RankingSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class RankingSnapshotService {

    // Rating (Desc) -> SOS (Desc) -> % victoires (Desc) -> Nom
    static final Comparator<RankingEntry> RANKING_ORDER = Comparator
            .comparingDouble(RankingEntry::getRating).reversed()
            .thenComparing(Comparator.comparingDouble(RankingEntry::getSos).reversed())
            .thenComparing(Comparator.comparingDouble(RankingEntry::getWinPercentage).reversed())
            .thenComparing(RankingEntry::getTeamName);

    private final TeamRatingStore ratingStore;
    private final StrengthOfScheduleCalculator sosCalculator;
    private final RankingSnapshotRepository snapshotRepository;
    private final RatingProperties properties;
    private final Clock clock;

    /**
     * Classement courant de toutes les équipes, calculé à la volée (rien n'est écrit).
     */
    @Transactional(readOnly = true)
    public List<RankingEntry> currentRankings(int season) {
        return buildRankings(sosCalculator.calculateAll(season, properties.getElo().getMaxWeek()));
    }

    /**
     * Fige le classement de la semaine. Une semaine déjà figée est renvoyée telle quelle.
     */
    @Transactional
    public List<RankingSnapshot> snapshot(int season, int week) {
        if (snapshotRepository.existsBySeasonAndWeek(season, week)) {
            log.info("📸 Classement {} semaine {} déjà figé, aucune réécriture", season, week);
            return snapshotRepository.findBySeasonAndWeekOrderByRankAsc(season, week);
        }

        List<RankingEntry> rankings = buildRankings(sosCalculator.calculateAll(season, week));
        Map<Long, Team> teams = new HashMap<>();
        ratingStore.findAll().forEach(t -> teams.put(t.getId(), t));

        LocalDateTime now = LocalDateTime.now(clock);
        List<RankingSnapshot> rows = new ArrayList<>();
        for (RankingEntry entry : rankings) {
            rows.add(RankingSnapshot.builder()
                    .team(teams.get(entry.getTeamId()))
                    .season(season)
                    .week(week)
                    .rank(entry.getRank())
                    .rating(entry.getRating())
                    .wins(entry.getWins())
                    .losses(entry.getLosses())
                    .sos(entry.getSos())
                    .sosRank(entry.getSosRank())
                    .createdAt(now)
                    .build());
        }

        List<RankingSnapshot> saved = snapshotRepository.saveAll(rows);
        log.info("🏆 Classement {} semaine {} figé ({} équipes)", season, week, saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<RankingSnapshot> getSnapshot(int season, int week) {
        return snapshotRepository.findBySeasonAndWeekOrderByRankAsc(season, week);
    }

    @Transactional(readOnly = true)
    public List<RankingSnapshot> rankingHistory(Long teamId, int season) {
        return snapshotRepository.findByTeamIdAndSeasonOrderByWeekAsc(teamId, season);
    }

    private List<RankingEntry> buildRankings(Map<Long, Double> sosByTeam) {
        List<RankingEntry> entries = new ArrayList<>();
        for (Team team : ratingStore.findAll()) {
            entries.add(RankingEntry.builder()
                    .teamId(team.getId())
                    .teamName(team.getName())
                    .tier(team.getTier())
                    .rating(team.getRating())
                    .wins(team.getWins())
                    .losses(team.getLosses())
                    .sos(sosByTeam.getOrDefault(team.getId(), properties.getSchedule().getNeutralSos()))
                    .build());
        }

        // Rang SOS (1 = calendrier le plus dur)
        List<RankingEntry> bySos = new ArrayList<>(entries);
        bySos.sort(Comparator.comparingDouble(RankingEntry::getSos).reversed()
                .thenComparing(RankingEntry::getTeamName));
        for (int i = 0; i < bySos.size(); i++) {
            bySos.get(i).setSosRank(i + 1);
        }

        entries.sort(RANKING_ORDER);
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRank(i + 1);
        }
        return entries;
    }
}
