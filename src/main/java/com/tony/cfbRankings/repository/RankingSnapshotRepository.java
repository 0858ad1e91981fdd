package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.RankingSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RankingSnapshotRepository extends JpaRepository<RankingSnapshot, Long> {

    List<RankingSnapshot> findBySeasonAndWeekOrderByRankAsc(Integer season, Integer week);

    List<RankingSnapshot> findByTeamIdAndSeasonOrderByWeekAsc(Long teamId, Integer season);

    boolean existsBySeasonAndWeek(Integer season, Integer week);
}
