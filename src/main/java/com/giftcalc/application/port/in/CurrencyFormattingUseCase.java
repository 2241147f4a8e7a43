package com.giftcalc.application.port.in;

import io.vertx.core.Future;

import java.math.BigDecimal;

/**
 * Input port for rendering amounts as text
 */
public interface CurrencyFormattingUseCase {

    int DEFAULT_DECIMALS = 2;

    String formatSingle(BigDecimal amount, String currency, int decimals);

    /**
     * Render the base amount, plus the converted amount when a different display currency is given
     * @param displayCurrency may be null
     * @param recipientName may be null
     * @param decimals may be null, meaning the default of 2
     */
    Future<String> formatOutput(BigDecimal amount, String baseCurrency, String displayCurrency,
                                String recipientName, Integer decimals);
}
