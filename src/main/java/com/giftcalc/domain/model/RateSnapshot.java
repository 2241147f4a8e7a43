package com.giftcalc.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Rate Snapshot - complete rate table returned by the provider for one base currency
 * Value object - replaced as a whole, never merged
 */
@Value
public class RateSnapshot {
    Map<String, BigDecimal> rates;
    long timestamp;  // epoch millis of the fetch

    public RateSnapshot(Map<String, BigDecimal> rates, long timestamp) {
        this.rates = Map.copyOf(rates);
        this.timestamp = timestamp;
    }

    public boolean hasRate(String currency) {
        return rates.containsKey(currency);
    }

    public BigDecimal getRate(String currency) {
        return rates.get(currency);
    }

    public boolean isFresh(long nowMillis, int ttlHours) {
        return nowMillis - timestamp < ttlHours * TtlPolicy.MILLIS_PER_HOUR;
    }
}
