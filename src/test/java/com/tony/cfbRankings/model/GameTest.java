package com.tony.cfbRankings.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameTest {

    private Team team(long id, String name, ConferenceTier tier) {
        Team t = new Team(name, tier);
        t.setId(id);
        return t;
    }

    @Test
    void scoresAloneDoNotMakeAGamePlayed() {
        Game game = new Game(team(1, "Iowa", ConferenceTier.POWER_5), team(2, "Iowa St", ConferenceTier.POWER_5), 2024, 2);
        game.setHomeScore(0);
        game.setAwayScore(0);

        assertThat(game.isPlayed()).isFalse();
        assertThat(game.getWinner()).isNull();

        game.recordFinalScore(13, 20);
        assertThat(game.isPlayed()).isTrue();
        assertThat(game.getWinner().getName()).isEqualTo("Iowa St");
        assertThat(game.getLoser().getName()).isEqualTo("Iowa");
        assertThat(game.getScoreLine()).isEqualTo("20-13");
    }

    @Test
    void chronologicalOrderPutsUndatedGamesLastInTheirWeek() {
        Team a = team(1, "A", ConferenceTier.GROUP_5);
        Team b = team(2, "B", ConferenceTier.GROUP_5);
        Game undated = new Game(a, b, 2024, 3);
        undated.setId(1L);
        Game dated = new Game(b, a, 2024, 3);
        dated.setId(2L);
        dated.setGameDate(LocalDateTime.of(2024, 9, 14, 12, 0));
        Game earlier = new Game(a, b, 2024, 2);
        earlier.setId(3L);

        List<Game> games = new ArrayList<>(List.of(undated, dated, earlier));
        games.sort(Game.CHRONOLOGICAL);

        assertThat(games).extracting(Game::getId).containsExactly(3L, 2L, 1L);
    }

    @Test
    void matchupLabelIgnoresWhoIsHome() {
        assertThat(ConferenceTier.matchupLabel(ConferenceTier.GROUP_5, ConferenceTier.POWER_5)).isEqualTo("P5 vs G5");
        assertThat(ConferenceTier.matchupLabel(ConferenceTier.FCS, ConferenceTier.FCS)).isEqualTo("FCS vs FCS");
        assertThat(ConferenceTier.fromCode("g5")).isEqualTo(ConferenceTier.GROUP_5);
        assertThatThrownBy(() -> ConferenceTier.fromCode("D2")).isInstanceOf(IllegalArgumentException.class);
    }
}
