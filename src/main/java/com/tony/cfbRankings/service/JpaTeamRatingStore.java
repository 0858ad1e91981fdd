package com.tony.cfbRankings.service;

import com.tony.cfbRankings.model.Team;
import com.tony.cfbRankings.repository.TeamRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaTeamRatingStore implements TeamRatingStore {

    private final TeamRepository teamRepository;

    @Override
    public Optional<Team> findById(Long teamId) {
        return teamId == null ? Optional.empty() : teamRepository.findById(teamId);
    }

    @Override
    public List<Team> findAll() {
        return teamRepository.findAll();
    }

    @Override
    @Transactional
    public Team seed(Team team, double rating, int season) {
        team.setRating(rating);
        team.setInitialRating(rating);
        team.setSeededSeason(season);
        team.setWins(0);
        team.setLosses(0);
        return teamRepository.save(team);
    }

    @Override
    @Transactional
    public Team applyDelta(Team team, double delta, boolean won) {
        team.setRating(team.getRating() + delta);
        if (won) team.setWins(team.getWins() + 1);
        else team.setLosses(team.getLosses() + 1);
        return teamRepository.save(team);
    }
}
