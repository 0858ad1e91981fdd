package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Comparator;

@Entity
@Table(name = "games", indexes = {
        @Index(name = "idx_games_season_week", columnList = "season, week")
})
@Getter @Setter @NoArgsConstructor
public class Game {

    // Ordre chronologique de traitement : saison, semaine, date (inconnue en dernier), id
    public static final Comparator<Game> CHRONOLOGICAL = Comparator
            .comparing(Game::getSeason)
            .thenComparing(Game::getWeek)
            .thenComparing(Game::getGameDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Game::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne
    @JoinColumn(name = "home_team_id")
    private Team homeTeam;

    @ManyToOne
    @JoinColumn(name = "away_team_id")
    private Team awayTeam;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 12)
    private GameStatus status = GameStatus.SCHEDULED;

    // Null tant que le match n'est pas COMPLETED
    private Integer homeScore;
    private Integer awayScore;

    @Column(nullable = false)
    private Integer week;

    @Column(nullable = false)
    private Integer season;

    private LocalDateTime gameDate;

    @Column(nullable = false)
    private boolean neutralSite = false;

    // Matchs hors classement (ex: affiches FCS non retenues)
    @Column(nullable = false)
    private boolean excludedFromRankings = false;

    @Column(length = 100)
    private String postseasonName;

    // --- TRAITEMENT ELO (écrit une seule fois par GameProcessor) ---
    @Column(nullable = false)
    private boolean processed = false;

    @Column(nullable = false)
    private Double homeRatingChange = 0.0;

    @Column(nullable = false)
    private Double awayRatingChange = 0.0;

    public Game(Team homeTeam, Team awayTeam, int season, int week) {
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.season = season;
        this.week = week;
    }

    /**
     * Enregistre le score final : le match passe à COMPLETED.
     */
    public void recordFinalScore(int homeScore, int awayScore) {
        this.homeScore = homeScore;
        this.awayScore = awayScore;
        this.status = GameStatus.COMPLETED;
    }

    public boolean isPlayed() {
        return status == GameStatus.COMPLETED && homeScore != null && awayScore != null;
    }

    public Team getWinner() {
        if (!isPlayed() || homeScore.equals(awayScore)) return null;
        return homeScore > awayScore ? homeTeam : awayTeam;
    }

    public Team getLoser() {
        if (!isPlayed() || homeScore.equals(awayScore)) return null;
        return homeScore > awayScore ? awayTeam : homeTeam;
    }

    public Team opponentOf(Team team) {
        if (team == null) return null;
        if (homeTeam != null && team.getId() != null && team.getId().equals(homeTeam.getId())) return awayTeam;
        return homeTeam;
    }

    public boolean involves(Team team) {
        if (team == null || team.getId() == null) return false;
        return (homeTeam != null && team.getId().equals(homeTeam.getId()))
                || (awayTeam != null && team.getId().equals(awayTeam.getId()));
    }

    public String getScoreLine() {
        if (!isPlayed()) return "-";
        return awayScore + "-" + homeScore;
    }

    public String getMatchup() {
        String away = awayTeam != null ? awayTeam.getName() : "?";
        String home = homeTeam != null ? homeTeam.getName() : "?";
        return away + (neutralSite ? " vs " : " @ ") + home;
    }
}
