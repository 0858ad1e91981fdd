package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.ConferenceTier;
import com.tony.cfbRankings.model.Team;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface TeamRepository extends JpaRepository<Team, Long> {
    Optional<Team> findByName(String name);

    Optional<Team> findByNameIgnoreCase(String name);

    List<Team> findByTier(ConferenceTier tier);

    List<Team> findAllByOrderByRatingDesc();
}
