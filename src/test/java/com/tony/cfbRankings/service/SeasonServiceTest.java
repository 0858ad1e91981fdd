package com.tony.cfbRankings.service;

import com.tony.cfbRankings.config.RatingProperties;
import com.tony.cfbRankings.exception.ResourceNotFoundException;
import com.tony.cfbRankings.model.Season;
import com.tony.cfbRankings.repository.SeasonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SeasonServiceTest {

    @Mock
    private SeasonRepository seasonRepository;

    @Mock
    private PreseasonInitializer preseasonInitializer;

    private SeasonService seasonService;

    @BeforeEach
    void setUp() {
        seasonService = new SeasonService(seasonRepository, preseasonInitializer, new RatingProperties(),
                Clock.fixed(Instant.parse("2024-08-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void startSeasonDeactivatesThePreviousOneAndSeedsTeams() {
        Season previous = new Season(2023);
        when(seasonRepository.findByYear(2024)).thenReturn(Optional.empty());
        when(seasonRepository.findAll()).thenReturn(List.of(previous));
        when(seasonRepository.save(any(Season.class))).thenAnswer(inv -> inv.getArgument(0));

        Season season = seasonService.startSeason(2024);

        assertThat(season.getYear()).isEqualTo(2024);
        assertThat(season.isActive()).isTrue();
        assertThat(previous.isActive()).isFalse();
        verify(preseasonInitializer).seedSeason(2024);
    }

    @Test
    void advanceWeekRejectsWeeksOutsideTheSeason() {
        assertThatThrownBy(() -> seasonService.advanceWeek(2024, 21)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void advanceWeekUpdatesCurrentWeek() {
        Season season = new Season(2024);
        when(seasonRepository.findByYear(2024)).thenReturn(Optional.of(season));
        when(seasonRepository.save(season)).thenReturn(season);

        assertThat(seasonService.advanceWeek(2024, 6).getCurrentWeek()).isEqualTo(6);
    }

    @Test
    void noActiveSeasonIsNotFound() {
        when(seasonRepository.findFirstByActiveTrueOrderByYearDesc()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> seasonService.activeSeason()).isInstanceOf(ResourceNotFoundException.class);
    }
}
