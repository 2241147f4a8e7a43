package com.giftcalc.application.port.out;

import com.giftcalc.domain.model.CacheStatus;
import com.giftcalc.domain.model.RateSnapshot;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for the persistent rate cache
 * Futures returned here never fail: storage problems degrade to "empty" or "no-op"
 */
public interface RateCacheRepository {

    /**
     * Read the snapshot stored for a base currency, regardless of its age
     */
    Future<Optional<RateSnapshot>> readSnapshot(String baseCurrency);

    /**
     * Replace the snapshot for a base currency, keeping entries of other base currencies
     */
    Future<Void> writeSnapshot(String baseCurrency, RateSnapshot snapshot);

    /**
     * Delete the whole cache file
     */
    Future<Void> clear();

    Future<CacheStatus> status(String baseCurrency, int ttlHours);
}
