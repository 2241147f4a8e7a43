package com.giftcalc.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Cache Status - read-only view of one base currency's cache entry
 */
@Value
@Builder
public class CacheStatus {
    boolean exists;
    boolean expired;
    Long age;          // whole hours since fetch, null when absent
    Integer ttl;       // hours, null when absent
    String timestamp;  // ISO-8601, null when absent
    String error;      // set only when the cache file is corrupted

    public static CacheStatus absent() {
        return CacheStatus.builder()
                .exists(false)
                .expired(true)
                .build();
    }

    public static CacheStatus corrupted(String error) {
        return CacheStatus.builder()
                .exists(false)
                .expired(true)
                .error(error)
                .build();
    }
}
