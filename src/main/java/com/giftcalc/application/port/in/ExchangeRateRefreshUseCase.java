package com.giftcalc.application.port.in;

import io.vertx.core.Future;

/**
 * Input port for exchange rate refresh operations
 */
public interface ExchangeRateRefreshUseCase {

    /**
     * Fetch and cache rates for a base currency, ignoring the freshness of any existing entry
     * @return true on success; false leaves the previous entry in place
     */
    Future<Boolean> refreshRates(String baseCurrency);
}
