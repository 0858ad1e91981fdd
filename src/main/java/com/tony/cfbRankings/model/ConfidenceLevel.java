package com.tony.cfbRankings.model;

public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW;

    public static ConfidenceLevel fromProbability(double winProbability) {
        if (winProbability >= 0.80) return HIGH;
        if (winProbability >= 0.65) return MEDIUM;
        return LOW;
    }
}
