package com.giftcalc.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Conversion Result - outcome of a single convert call
 * Value object - never persisted
 */
@Value
@Builder
public class ConversionResult {
    boolean success;
    BigDecimal originalAmount;
    String fromCurrency;
    String toCurrency;
    BigDecimal convertedAmount;  // null on failure
    BigDecimal rate;             // null on failure
    Boolean cached;              // null on failure
    String error;                // null on success

    public static ConversionResult converted(BigDecimal amount, String from, String to,
                                             BigDecimal convertedAmount, BigDecimal rate, boolean cached) {
        return ConversionResult.builder()
                .success(true)
                .originalAmount(amount)
                .fromCurrency(from)
                .toCurrency(to)
                .convertedAmount(convertedAmount)
                .rate(rate)
                .cached(cached)
                .build();
    }

    public static ConversionResult failed(BigDecimal amount, String from, String to, String error) {
        return ConversionResult.builder()
                .success(false)
                .originalAmount(amount)
                .fromCurrency(from)
                .toCurrency(to)
                .error(error)
                .build();
    }
}
