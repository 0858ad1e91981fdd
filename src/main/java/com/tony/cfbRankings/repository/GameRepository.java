package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.GameStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface GameRepository extends JpaRepository<Game, Long> {

    List<Game> findBySeasonAndWeek(Integer season, Integer week);

    List<Game> findBySeason(Integer season);

    // Matchs joués mais pas encore passés dans le moteur ELO
    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.processed = false " +
            "AND g.status = :status AND g.excludedFromRankings = false")
    List<Game> findPendingBySeasonAndStatus(@Param("season") Integer season, @Param("status") GameStatus status);

    // Matchs futurs (non joués) d'une semaine, candidats à une prédiction
    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.week = :week AND g.processed = false " +
            "AND g.status = :status")
    List<Game> findUnprocessedBySeasonWeekAndStatus(@Param("season") Integer season,
                                                     @Param("week") Integer week,
                                                     @Param("status") GameStatus status);

    @Query("SELECT g FROM Game g WHERE (g.homeTeam.id = :teamId OR g.awayTeam.id = :teamId) " +
            "AND g.season = :season AND g.processed = true")
    List<Game> findProcessedByTeamAndSeason(@Param("teamId") Long teamId, @Param("season") Integer season);

    @Query("SELECT g FROM Game g WHERE g.season = :season AND g.processed = true " +
            "AND g.excludedFromRankings = false AND g.week <= :asOfWeek")
    List<Game> findRankedProcessedUpToWeek(@Param("season") Integer season, @Param("asOfWeek") Integer asOfWeek);

    @Query("SELECT MAX(g.week) FROM Game g WHERE g.season = :season AND g.processed = true")
    Integer findLatestProcessedWeek(@Param("season") Integer season);
}
