package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Getter @Setter @NoArgsConstructor
@Table(name = "teams", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name"})
})
public class Team {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private ConferenceTier tier;

    // Nom réel de la conférence (ex: "SEC", "Big Ten"), purement informatif
    @Column(length = 50)
    private String conferenceName;

    // --- FACTEURS DE PRÉSAISON (null = inconnu) ---
    private Integer recruitingRank;
    private Integer transferPortalRank;
    private Double returningProduction;

    // --- ÉTAT ELO ---
    // Écrit uniquement via TeamRatingStore
    @Column(nullable = false)
    private Double rating = 1500.0;

    @Column(nullable = false)
    private Double initialRating = 1500.0;

    // Saison dont le seed de présaison est actuellement appliqué
    private Integer seededSeason;

    @Column(nullable = false)
    private Integer wins = 0;

    @Column(nullable = false)
    private Integer losses = 0;

    private LocalDateTime updatedAt;

    public Team(String name, ConferenceTier tier) {
        this.name = name;
        this.tier = tier;
    }

    public int getGamesPlayed() {
        return wins + losses;
    }

    public double getWinPercentage() {
        int played = getGamesPlayed();
        return played == 0 ? 0.0 : (double) wins / played;
    }

    public String getRecord() {
        return wins + "-" + losses;
    }

    @PreUpdate
    @PrePersist
    void touch() {
        this.updatedAt = LocalDateTime.now();
    }

    // HashCode compatible JPA (évite les bugs quand l'ID change après save)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team)) return false;
        return id != null && id.equals(((Team) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    @Override
    public String toString() {
        return "Team(" + name + ", " + String.format("%.2f", rating) + ", " + getRecord() + ")";
    }
}
