package com.tokenvest.core.ledger;

import com.tokenvest.core.error.ValidationException;

import java.util.Locale;

/**
 * The eight allocation pools seeded at deployment, with their default share of the total
 * supply in basis points.
 */
public enum PoolLabel {
    SEED("Seed", 500),
    PRIVATE_SALE("PrivateSale", 1_000),
    PUBLIC_SALE("PublicSale", 500),
    TEAM("Team", 1_500),
    ADVISORS("Advisors", 500),
    GAME_TREASURY("GameTreasury", 2_000),
    PLAY_REWARDS("PlayRewards", 2_500),
    RESERVE("Reserve", 1_500);

    private final String label;
    private final int defaultShareBps;

    PoolLabel(String label, int defaultShareBps) {
        this.label = label;
        this.defaultShareBps = defaultShareBps;
    }

    public String label() {
        return label;
    }

    public int defaultShareBps() {
        return defaultShareBps;
    }

    /**
     * Resolves either the display label ({@code GameTreasury}) or the constant name
     * ({@code GAME_TREASURY}), ignoring case.
     */
    public static PoolLabel fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Pool label cannot be empty");
        }
        String normalized = value.trim().replace("-", "_").replace(" ", "_");
        for (PoolLabel pool : values()) {
            if (pool.label.equalsIgnoreCase(normalized) || pool.name().equalsIgnoreCase(normalized)) {
                return pool;
            }
        }
        throw new ValidationException("Unknown pool: " + value.toUpperCase(Locale.ROOT));
    }
}
