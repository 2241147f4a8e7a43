package com.giftcalc.application.port.in;

import com.giftcalc.domain.model.ConversionResult;
import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Input port for converting an amount between currencies
 * Part of hexagonal architecture - defines what the application can do
 */
public interface CurrencyConversionUseCase {

    /**
     * Convert an amount, serving the rate from a fresh cache entry when possible.
     * Currency codes are expected to be upper-case already.
     * @return a future that always succeeds; provider failures give success=false
     */
    Future<ConversionResult> convert(BigDecimal amount, String fromCurrency, String toCurrency, int decimals);
}
