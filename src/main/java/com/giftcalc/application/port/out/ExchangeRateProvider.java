package com.giftcalc.application.port.out;

import com.giftcalc.domain.model.RateFetchResult;
import io.vertx.core.Future;

/**
 * Output port for fetching exchange rates from an external source
 * Part of hexagonal architecture - defines what the application needs
 */
public interface ExchangeRateProvider {

    /**
     * Fetch all rates relative to the given base currency with a single request.
     * No retries and no caching.
     * @param baseCurrency upper-case currency code
     * @return a future that always succeeds; failures are carried in the result
     */
    Future<RateFetchResult> fetchRates(String baseCurrency);
}
