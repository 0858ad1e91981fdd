package com.tony.cfbRankings.model;

import lombok.Getter;

/**
 * Classification compétitive d'une équipe.
 * POWER_5 = top-tier, GROUP_5 = mid-tier, FCS = sous-division.
 */
@Getter
public enum ConferenceTier {
    POWER_5("P5", 2),
    GROUP_5("G5", 1),
    FCS("FCS", 0);

    private final String code;
    private final int level;

    ConferenceTier(String code, int level) {
        this.code = code;
        this.level = level;
    }

    public boolean isSubDivision() {
        return this == FCS;
    }

    /**
     * Libellé stable d'une affiche, indépendant de qui reçoit (ex: "G5 vs P5" -> "P5 vs G5").
     */
    public static String matchupLabel(ConferenceTier a, ConferenceTier b) {
        if (a.level >= b.level) return a.code + " vs " + b.code;
        return b.code + " vs " + a.code;
    }

    public static ConferenceTier fromCode(String value) {
        if (value == null) return null;
        String normalized = value.trim().toUpperCase();
        for (ConferenceTier tier : values()) {
            if (tier.code.equals(normalized) || tier.name().equals(normalized)) return tier;
        }
        throw new IllegalArgumentException("Unknown conference tier: " + value);
    }
}
