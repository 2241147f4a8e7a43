package com.giftcalc.domain.model;

/**
 * Bounds of the cache staleness window, in hours
 */
public final class TtlPolicy {

    public static final int DEFAULT_TTL_HOURS = 24;
    public static final int MIN_TTL_HOURS = 1;
    public static final int MAX_TTL_HOURS = 168; // one week
    public static final long MILLIS_PER_HOUR = 60L * 60 * 1000;

    private TtlPolicy() {
    }

    public static boolean isWithinBounds(int hours) {
        return hours >= MIN_TTL_HOURS && hours <= MAX_TTL_HOURS;
    }
}
