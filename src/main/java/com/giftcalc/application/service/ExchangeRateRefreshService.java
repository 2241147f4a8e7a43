package com.giftcalc.application.service;

import com.giftcalc.application.port.in.ExchangeRateRefreshUseCase;
import com.giftcalc.application.port.out.ExchangeRateProvider;
import com.giftcalc.application.port.out.RateCacheRepository;
import com.giftcalc.domain.model.RateFetchResult;
import com.giftcalc.domain.model.RateSnapshot;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Use case implementation for exchange rate refresh operations
 * Owns the provider call followed by the cache write; used directly by the conversion engine
 * Depends only on ports (interfaces), not concrete adapters
 */
@Slf4j
public class ExchangeRateRefreshService implements ExchangeRateRefreshUseCase {

    private final ExchangeRateProvider rateProvider;
    private final RateCacheRepository cacheRepository;
    private final Clock clock;

    public ExchangeRateRefreshService(
            ExchangeRateProvider rateProvider,
            RateCacheRepository cacheRepository,
            Clock clock
    ) {
        this.rateProvider = rateProvider;
        this.cacheRepository = cacheRepository;
        this.clock = clock;
    }

    @Override
    public Future<Boolean> refreshRates(String baseCurrency) {
        log.info("Refreshing exchange rates for {}...", baseCurrency);

        return fetchAndStore(baseCurrency)
                .map(RateFetchResult::ok)
                .onSuccess(ok -> {
                    if (ok) {
                        log.info("Exchange rates for {} refreshed successfully", baseCurrency);
                    } else {
                        log.warn("Failed to refresh exchange rates for {}, keeping previous cache entry", baseCurrency);
                    }
                });
    }

    /**
     * Call the provider once and, on success, replace the cached snapshot with the full rate table.
     * Failed fetches leave the cache untouched.
     */
    public Future<RateFetchResult> fetchAndStore(String baseCurrency) {
        return rateProvider.fetchRates(baseCurrency)
                .otherwise(error -> RateFetchResult.failure("Conversion failed: " + error.getMessage()))
                .compose(result -> {
                    if (!result.ok()) {
                        return Future.succeededFuture(result);
                    }
                    RateSnapshot snapshot = new RateSnapshot(result.rates(), clock.millis());
                    log.debug("Caching {} rates for base {}", result.rates().size(), baseCurrency);
                    return cacheRepository.writeSnapshot(baseCurrency, snapshot)
                            .map(result);
                });
    }
}
