package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Rang d'une équipe dans un sondage externe (AP Top 25...). Sert uniquement de point de comparaison.
 */
@Entity
@Table(name = "reference_rankings", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"team_id", "season", "week", "poll_name"})
})
@Getter @Setter @NoArgsConstructor
public class ReferenceRankingEntry {

    public static final String DEFAULT_POLL = "AP Top 25";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "team_id")
    private Team team;

    @Column(nullable = false)
    private Integer season;

    @Column(nullable = false)
    private Integer week;

    @Column(name = "poll_rank", nullable = false)
    private Integer rank;

    @Column(name = "poll_name", nullable = false, length = 50)
    private String pollName = DEFAULT_POLL;

    private Integer firstPlaceVotes;
    private Integer points;

    private LocalDateTime importedAt;

    public ReferenceRankingEntry(Team team, int season, int week, int rank) {
        this.team = team;
        this.season = season;
        this.week = week;
        this.rank = rank;
    }
}
