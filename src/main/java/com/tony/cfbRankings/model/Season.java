package com.tony.cfbRankings.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "seasons")
@Data
@NoArgsConstructor
public class Season {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "season_year", unique = true, nullable = false)
    private Integer year;

    @Column(nullable = false)
    private Integer currentWeek = 0;

    @Column(nullable = false)
    private boolean active = true;

    private LocalDateTime createdAt;

    public Season(int year) {
        this.year = year;
        this.createdAt = LocalDateTime.now();
    }
}
