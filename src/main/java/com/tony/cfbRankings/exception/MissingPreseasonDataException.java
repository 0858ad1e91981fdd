package com.tony.cfbRankings.exception;

import lombok.Getter;

import java.util.List;

/**
 * Facteurs de présaison absents. Jamais fatal : le seed bascule sur des valeurs neutres.
 */
@Getter
public class MissingPreseasonDataException extends RuntimeException {

    private final String teamName;
    private final List<String> missingFields;

    public MissingPreseasonDataException(String teamName, List<String> missingFields) {
        super("Missing preseason data for " + teamName + ": " + String.join(", ", missingFields));
        this.teamName = teamName;
        this.missingFields = List.copyOf(missingFields);
    }
}
