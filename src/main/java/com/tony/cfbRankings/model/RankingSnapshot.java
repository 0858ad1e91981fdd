package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * Photographie hebdomadaire du classement d'une équipe. Jamais modifiée après écriture.
 */
@Entity
@Immutable
@Table(name = "ranking_snapshots", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"team_id", "season", "week"})
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RankingSnapshot {

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

    @Column(name = "ranking_position", nullable = false)
    private Integer rank;

    @Column(nullable = false)
    private Double rating;

    private Integer wins;
    private Integer losses;

    private Double sos;
    private Integer sosRank;

    private LocalDateTime createdAt;
}
