package com.example.trackscheduler.domain;

/**
 * Discrete per-track selection bias. {@link #GREEN} is the default and is never
 * persisted.
 */
public enum WeightLevel {

    GREEN(0, 1.0D),
    BLUE(1, 1.6D),
    PURPLE(2, 3.2D),
    GOLD(3, 4.8D),
    RED(4, 6.4D);

    public static final int MIN_VALUE = 0;
    public static final int MAX_VALUE = 4;

    private final int value;
    private final double multiplier;

    WeightLevel(int value, double multiplier) {
        this.value = value;
        this.multiplier = multiplier;
    }

    public int getValue() {
        return value;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public static int clamp(int raw) {
        return Math.max(MIN_VALUE, Math.min(MAX_VALUE, raw));
    }

    /**
     * Out-of-range values are clamped rather than rejected.
     */
    public static WeightLevel fromValue(int raw) {
        return values()[clamp(raw)];
    }
}
