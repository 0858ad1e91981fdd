package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.Prediction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PredictionRepository extends JpaRepository<Prediction, Long> {

    Optional<Prediction> findByGameId(Long gameId);

    boolean existsByGameId(Long gameId);

    @Query("SELECT p FROM Prediction p WHERE p.game.season = :season AND p.game.week = :week ORDER BY p.game.id ASC")
    List<Prediction> findBySeasonAndWeek(@Param("season") Integer season, @Param("week") Integer week);

    @Query("SELECT p FROM Prediction p WHERE p.game.season = :season ORDER BY p.game.week ASC, p.game.id ASC")
    List<Prediction> findBySeason(@Param("season") Integer season);

    @Query("SELECT p FROM Prediction p WHERE p.game.season = :season " +
            "AND (p.game.homeTeam.id = :teamId OR p.game.awayTeam.id = :teamId) ORDER BY p.game.week ASC")
    List<Prediction> findBySeasonAndTeam(@Param("season") Integer season, @Param("teamId") Long teamId);
}
