package com.giftcalc.domain.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Outcome of one provider call
 * A failure with a null reason means the provider answered but gave no usable rates
 */
public record RateFetchResult(boolean ok, Map<String, BigDecimal> rates, String reason) {

    public static RateFetchResult success(Map<String, BigDecimal> rates) {
        return new RateFetchResult(true, Map.copyOf(rates), null);
    }

    public static RateFetchResult unavailable() {
        return new RateFetchResult(false, Map.of(), null);
    }

    public static RateFetchResult failure(String reason) {
        return new RateFetchResult(false, Map.of(), reason);
    }
}
