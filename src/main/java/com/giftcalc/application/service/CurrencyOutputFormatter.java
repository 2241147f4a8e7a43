package com.giftcalc.application.service;

import com.giftcalc.application.port.in.CurrencyConversionUseCase;
import com.giftcalc.application.port.in.CurrencyFormattingUseCase;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders single- and dual-currency amounts.
 * With the default of 2 decimals whole amounts print without a fraction ("100 USD");
 * any other decimals setting always prints that many digits ("100.000 USD").
 */
@RequiredArgsConstructor
public class CurrencyOutputFormatter implements CurrencyFormattingUseCase {

    private static final String CONVERSION_UNAVAILABLE = "conversion unavailable";

    private final CurrencyConversionUseCase conversionUseCase;

    @Override
    public String formatSingle(BigDecimal amount, String currency, int decimals) {
        return formatNumber(amount, decimals) + " " + currency;
    }

    @Override
    public Future<String> formatOutput(BigDecimal amount, String baseCurrency, String displayCurrency,
                                       String recipientName, Integer decimals) {
        int places = decimals == null ? DEFAULT_DECIMALS : decimals;
        String base = formatSingle(amount, baseCurrency, places);

        if (displayCurrency == null || displayCurrency.isEmpty() || displayCurrency.equals(baseCurrency)) {
            return Future.succeededFuture(withRecipient(base, recipientName));
        }

        return conversionUseCase.convert(amount, baseCurrency, displayCurrency, places)
                .map(result -> {
                    String converted = result.isSuccess()
                            ? formatSingle(result.getConvertedAmount(), displayCurrency, places)
                            : CONVERSION_UNAVAILABLE;
                    return withRecipient(base + " (" + converted + ")", recipientName);
                });
    }

    private String formatNumber(BigDecimal amount, int decimals) {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative: " + decimals);
        }
        BigDecimal rounded = amount.setScale(decimals, RoundingMode.HALF_UP);
        if (decimals == DEFAULT_DECIMALS && rounded.stripTrailingZeros().scale() <= 0) {
            return rounded.setScale(0, RoundingMode.HALF_UP).toPlainString();
        }
        return rounded.toPlainString();
    }

    private String withRecipient(String text, String recipientName) {
        if (recipientName == null || recipientName.isEmpty()) {
            return text;
        }
        return text + " for " + recipientName;
    }
}
