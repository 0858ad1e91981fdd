package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Season;
import com.tony.cfbRankings.repository.SeasonRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonService {

    private final SeasonRepository seasonRepository;
    private final PreseasonInitializer preseasonInitializer;
    private final RatingProperties properties;
    private final Clock clock;

    /**
     * Ouvre (ou rouvre) une saison et initialise toutes les équipes qui ne le sont pas encore.
     */
    @Transactional
    public Season startSeason(int year) {
        Season season = seasonRepository.findByYear(year).orElseGet(() -> {
            Season created = new Season(year);
            created.setCreatedAt(LocalDateTime.now(clock));
            return created;
        });

        // Une seule saison active à la fois
        seasonRepository.findAll().stream()
                .filter(s -> s.isActive() && !s.getYear().equals(year))
                .forEach(s -> s.setActive(false));

        season.setActive(true);
        Season saved = seasonRepository.save(season);

        int seeded = preseasonInitializer.seedSeason(year);
        log.info("🏁 Saison {} ouverte ({} équipes initialisées)", year, seeded);
        return saved;
    }

    @Transactional
    public Season advanceWeek(int year, int week) {
        if (week < properties.getElo().getMinWeek() || week > properties.getElo().getMaxWeek()) {
            throw new IllegalArgumentException("Week " + week + " is outside "
                    + properties.getElo().getMinWeek() + ".." + properties.getElo().getMaxWeek());
        }
        Season season = seasonRepository.findByYear(year)
                .orElseThrow(() -> new ResourceNotFoundException("Season", year));
        if (week < season.getCurrentWeek()) {
            log.warn("⚠️ Saison {} : retour de la semaine {} à {}", year, season.getCurrentWeek(), week);
        }
        season.setCurrentWeek(week);
        return seasonRepository.save(season);
    }

    @Transactional(readOnly = true)
    public Season activeSeason() {
        return seasonRepository.findFirstByActiveTrueOrderByYearDesc()
                .orElseThrow(() -> new ResourceNotFoundException("No active season"));
    }
}
