package com.giftcalc.domain.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Currency Registry - static table of advertised currency codes
 * Validation is a format check only; membership is not required
 */
public final class CurrencyRegistry {

    // ISO 4217 codes, in display order
    private static final List<String> SUPPORTED_CURRENCIES = List.of(
            "USD", "EUR", "GBP", "JPY", "SEK", "NOK", "DKK", "CHF", "CAD", "AUD",
            "NZD", "CNY", "INR", "KRW", "SGD", "HKD", "PLN", "CZK", "HUF", "RON",
            "BGN", "HRK", "RUB", "TRY", "BRL", "MXN", "ZAR", "ISK", "THB", "MYR"
    );

    private static final Pattern CODE_FORMAT = Pattern.compile("^[A-Z]{3}$");

    private CurrencyRegistry() {
    }

    public static List<String> listSupportedCurrencies() {
        return SUPPORTED_CURRENCIES;
    }

    /**
     * Check whether the input looks like a currency code (three letters, any case)
     * @param input candidate value, may be null or a non-string
     * @return true if the upper-cased value is exactly three letters
     */
    public static boolean isValidCode(Object input) {
        if (!(input instanceof String code) || code.isEmpty()) {
            return false;
        }
        return CODE_FORMAT.matcher(code.toUpperCase()).matches();
    }

    public static boolean isSupported(String code) {
        return SUPPORTED_CURRENCIES.contains(normalize(code));
    }

    /**
     * Trim and upper-case a code as read from user input
     */
    public static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase();
    }
}
