package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.Season;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface SeasonRepository extends JpaRepository<Season, Long> {
    Optional<Season> findByYear(Integer year);

    Optional<Season> findFirstByActiveTrueOrderByYearDesc();
}
