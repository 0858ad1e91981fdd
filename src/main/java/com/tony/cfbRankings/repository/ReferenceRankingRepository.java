package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.ReferenceRankingEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ReferenceRankingRepository extends JpaRepository<ReferenceRankingEntry, Long> {

    Optional<ReferenceRankingEntry> findByTeamIdAndSeasonAndWeekAndPollName(Long teamId, Integer season,
                                                                           Integer week, String pollName);

    List<ReferenceRankingEntry> findBySeasonAndWeekAndPollNameOrderByRankAsc(Integer season, Integer week, String pollName);
}
