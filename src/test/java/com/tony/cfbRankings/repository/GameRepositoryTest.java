package com.tony.cfbRankings.repository;

import com.tony.cfbRankings.model.ConferenceTier;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.GameStatus;
import com.tony.cfbRankings.model.Team;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class GameRepositoryTest {

    @Autowired
    private GameRepository gameRepository;

    @Autowired
    private TeamRepository teamRepository;

    private Team ohio;
    private Team michigan;
    private Team akron;

    @BeforeEach
    void setUp() {
        ohio = teamRepository.save(new Team("Ohio State", ConferenceTier.POWER_5));
        michigan = teamRepository.save(new Team("Michigan", ConferenceTier.POWER_5));
        akron = teamRepository.save(new Team("Akron", ConferenceTier.GROUP_5));
    }

    private Game game(Team home, Team away, int week, boolean played, boolean processed) {
        Game game = new Game(home, away, 2024, week);
        if (played) game.recordFinalScore(30, 20);
        game.setProcessed(processed);
        return gameRepository.save(game);
    }

    @Test
    void pendingGamesArePlayedUnprocessedAndRanked() {
        Game pending = game(ohio, akron, 1, true, false);
        game(ohio, michigan, 2, true, true);
        game(michigan, akron, 3, false, false);
        Game excluded = game(michigan, akron, 1, true, false);
        excluded.setExcludedFromRankings(true);
        gameRepository.save(excluded);

        List<Game> result = gameRepository.findPendingBySeasonAndStatus(2024, GameStatus.COMPLETED);

        assertThat(result).extracting(Game::getId).containsExactly(pending.getId());
    }

    @Test
    void processedGamesOfATeam() {
        Game g1 = game(ohio, akron, 1, true, true);
        Game g2 = game(michigan, ohio, 2, true, true);
        game(michigan, akron, 2, true, true);
        game(ohio, michigan, 3, true, false);

        List<Game> result = gameRepository.findProcessedByTeamAndSeason(ohio.getId(), 2024);

        assertThat(result).extracting(Game::getId).containsExactlyInAnyOrder(g1.getId(), g2.getId());
        assertThat(gameRepository.findLatestProcessedWeek(2024)).isEqualTo(2);
        assertThat(gameRepository.findLatestProcessedWeek(2023)).isNull();
    }

    @Test
    void rankedProcessedGamesUpToWeek() {
        Game g1 = game(ohio, akron, 1, true, true);
        game(michigan, ohio, 4, true, true);

        assertThat(gameRepository.findRankedProcessedUpToWeek(2024, 3))
                .extracting(Game::getId).containsExactly(g1.getId());
    }

    @Test
    void scheduledGamesOfAWeek() {
        Game scheduled = game(ohio, michigan, 5, false, false);
        game(akron, michigan, 5, true, false);

        assertThat(gameRepository.findUnprocessedBySeasonWeekAndStatus(2024, 5, GameStatus.SCHEDULED))
                .extracting(Game::getId).containsExactly(scheduled.getId());
    }
}
