package com.tony.cfbRankings.service;

import com.opencsv.bean.CsvBindByName;
import com.opencsv.bean.CsvToBeanBuilder;
import com.tony.cfbRankings.model.ConferenceTier;
import com.tony.cfbRankings.model.Game;
import com.tony.cfbRankings.model.ReferenceRankingEntry;
import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.repository.GameRepository;
import com.tony.cfbRankings.repository.ReferenceRankingRepository;
import com.tony.cfbRankings.repository.TeamRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.Reader;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Imports CSV : facteurs de présaison, calendrier/résultats, sondage de référence.
 * Une ligne invalide est journalisée et ignorée, le reste du fichier passe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CsvImportService {

    private final TeamRepository teamRepository;
    private final GameRepository gameRepository;
    private final ReferenceRankingRepository referenceRepository;
    private final Clock clock;

    /**
     * Colonnes : team, tier, conference, recruitingRank, transferRank, returningProduction.
     * Crée l'équipe si besoin, sinon met à jour ses facteurs (le rating n'est pas touché).
     */
    @Transactional
    public String importPreseasonFactors(Reader reader) {
        List<PreseasonRow> rows = parse(reader, PreseasonRow.class);
        int created = 0, updated = 0, errors = 0;

        for (PreseasonRow row : rows) {
            try {
                if (row.getTeam() == null || row.getTeam().isBlank()) continue;
                ConferenceTier tier = ConferenceTier.fromCode(row.getTier());

                Optional<Team> existing = teamRepository.findByNameIgnoreCase(row.getTeam().trim());
                Team team = existing.orElseGet(() -> new Team(row.getTeam().trim(), tier));
                if (existing.isPresent()) updated++;
                else created++;

                if (tier != null) team.setTier(tier);
                if (team.getTier() == null) {
                    throw new IllegalArgumentException("tier is required for new team " + team.getName());
                }
                team.setConferenceName(row.getConference());
                team.setRecruitingRank(row.getRecruitingRank());
                team.setTransferPortalRank(row.getTransferRank());
                team.setReturningProduction(row.getReturningProduction());
                teamRepository.save(team);
            } catch (RuntimeException e) {
                errors++;
                log.warn("Ligne présaison ignorée ({}) : {}", row.getTeam(), e.getMessage());
            }
        }

        log.info("📥 Présaison : {} créées, {} mises à jour, {} erreurs", created, updated, errors);
        return String.format("✅ %d équipes créées, %d mises à jour (%d erreurs).", created, updated, errors);
    }

    /**
     * Colonnes : season, week, date, home, away, homeScore, awayScore, neutral, excluded, postseason.
     * Un match existant non traité reçoit son score ; un match déjà traité n'est jamais modifié.
     */
    @Transactional
    public String importGames(Reader reader) {
        List<GameRow> rows = parse(reader, GameRow.class);
        Map<String, Team> teamCache = new HashMap<>();
        int created = 0, scored = 0, skipped = 0, errors = 0;

        for (GameRow row : rows) {
            try {
                Team home = resolveTeam(row.getHome(), teamCache);
                Team away = resolveTeam(row.getAway(), teamCache);
                if (home == null || away == null) {
                    skipped++;
                    log.warn("⚠️ Équipe inconnue : {} @ {}", row.getAway(), row.getHome());
                    continue;
                }

                Game game = gameRepository.findBySeasonAndWeek(row.getSeason(), row.getWeek()).stream()
                        .filter(g -> g.getHomeTeam().getId().equals(home.getId()) && g.getAwayTeam().getId().equals(away.getId()))
                        .findFirst()
                        .orElse(null);

                if (game == null) {
                    game = new Game(home, away, row.getSeason(), row.getWeek());
                    created++;
                } else if (game.isProcessed()) {
                    skipped++;
                    continue;
                }

                if (row.getDate() != null && !row.getDate().isBlank()) game.setGameDate(parseDate(row.getDate().trim()));
                game.setNeutralSite(Boolean.TRUE.equals(row.getNeutral()));
                game.setExcludedFromRankings(Boolean.TRUE.equals(row.getExcluded()));
                game.setPostseasonName(row.getPostseason());

                if (row.getHomeScore() != null && row.getAwayScore() != null && !game.isPlayed()) {
                    game.recordFinalScore(row.getHomeScore(), row.getAwayScore());
                    scored++;
                }
                gameRepository.save(game);
            } catch (RuntimeException e) {
                errors++;
                log.warn("Ligne match ignorée ({} @ {}) : {}", row.getAway(), row.getHome(), e.getMessage());
            }
        }

        log.info("📥 Matchs : {} créés, {} scores enregistrés, {} ignorés, {} erreurs", created, scored, skipped, errors);
        return String.format("✅ %d matchs créés, %d scores enregistrés, %d ignorés (%d erreurs).", created, scored, skipped, errors);
    }

    /**
     * Colonnes : season, week, team, rank, poll (AP Top 25 par défaut). Les équipes inconnues sont ignorées.
     */
    @Transactional
    public String importReferenceRankings(Reader reader) {
        List<ReferenceRow> rows = parse(reader, ReferenceRow.class);
        Map<String, Team> teamCache = new HashMap<>();
        int imported = 0, skipped = 0;
        LocalDateTime now = LocalDateTime.now(clock);

        for (ReferenceRow row : rows) {
            Team team = resolveTeam(row.getTeam(), teamCache);
            if (team == null || row.getRank() == null) {
                skipped++;
                log.warn("⚠️ Sondage : équipe inconnue ou rang absent ({})", row.getTeam());
                continue;
            }
            String poll = row.getPoll() == null || row.getPoll().isBlank() ? ReferenceRankingEntry.DEFAULT_POLL : row.getPoll().trim();

            ReferenceRankingEntry entry = referenceRepository
                    .findByTeamIdAndSeasonAndWeekAndPollName(team.getId(), row.getSeason(), row.getWeek(), poll)
                    .orElseGet(() -> new ReferenceRankingEntry(team, row.getSeason(), row.getWeek(), row.getRank()));
            entry.setRank(row.getRank());
            entry.setPollName(poll);
            entry.setPoints(row.getPoints());
            entry.setFirstPlaceVotes(row.getFirstPlaceVotes());
            entry.setImportedAt(now);
            referenceRepository.save(entry);
            imported++;
        }

        log.info("📥 Sondage de référence : {} rangs importés, {} ignorés", imported, skipped);
        return String.format("✅ %d rangs importés (%d ignorés).", imported, skipped);
    }

    private <T> List<T> parse(Reader reader, Class<T> type) {
        return new CsvToBeanBuilder<T>(reader)
                .withType(type).withSeparator(',').withIgnoreLeadingWhiteSpace(true).build().parse();
    }

    private Team resolveTeam(String name, Map<String, Team> cache) {
        if (name == null || name.isBlank()) return null;
        String key = name.trim().toLowerCase();
        if (cache.containsKey(key)) return cache.get(key);
        Team team = teamRepository.findByNameIgnoreCase(name.trim()).orElse(null);
        cache.put(key, team);
        return team;
    }

    // "2024-09-07" ou "2024-09-07T19:30"
    private LocalDateTime parseDate(String value) {
        if (value.length() <= 10) return LocalDate.parse(value).atStartOfDay();
        return LocalDateTime.parse(value);
    }

    @Data
    public static class PreseasonRow {
        @CsvBindByName(column = "team") private String team;
        @CsvBindByName(column = "tier") private String tier;
        @CsvBindByName(column = "conference") private String conference;
        @CsvBindByName(column = "recruitingRank") private Integer recruitingRank;
        @CsvBindByName(column = "transferRank") private Integer transferRank;
        @CsvBindByName(column = "returningProduction") private Double returningProduction;
    }

    @Data
    public static class GameRow {
        @CsvBindByName(column = "season", required = true) private Integer season;
        @CsvBindByName(column = "week", required = true) private Integer week;
        @CsvBindByName(column = "date") private String date;
        @CsvBindByName(column = "home", required = true) private String home;
        @CsvBindByName(column = "away", required = true) private String away;
        @CsvBindByName(column = "homeScore") private Integer homeScore;
        @CsvBindByName(column = "awayScore") private Integer awayScore;
        @CsvBindByName(column = "neutral") private Boolean neutral;
        @CsvBindByName(column = "excluded") private Boolean excluded;
        @CsvBindByName(column = "postseason") private String postseason;
    }

    @Data
    public static class ReferenceRow {
        @CsvBindByName(column = "season", required = true) private Integer season;
        @CsvBindByName(column = "week", required = true) private Integer week;
        @CsvBindByName(column = "team", required = true) private String team;
        @CsvBindByName(column = "rank") private Integer rank;
        @CsvBindByName(column = "poll") private String poll;
        @CsvBindByName(column = "points") private Integer points;
        @CsvBindByName(column = "firstPlaceVotes") private Integer firstPlaceVotes;
    }
}
