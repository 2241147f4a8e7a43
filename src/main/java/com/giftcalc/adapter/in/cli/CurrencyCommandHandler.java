package com.giftcalc.adapter.in.cli;

import com.giftcalc.application.port.in.CurrencyFormattingUseCase;
import com.giftcalc.application.port.in.ExchangeRateRefreshUseCase;
import com.giftcalc.application.port.in.RateCacheUseCase;
import com.giftcalc.domain.model.CacheStatus;
import com.giftcalc.domain.model.CurrencyRegistry;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;

/**
 * Dispatches positional command-line arguments to the currency use cases.
 * Returns the process exit code: 0 success, 1 operation failed, 2 usage error.
 */
@Slf4j
@RequiredArgsConstructor
public class CurrencyCommandHandler {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  convert <amount> <FROM> <TO> [decimals]",
            "  refresh <BASE>",
            "  status <BASE>",
            "  clear",
            "  currencies");

    private final CurrencyFormattingUseCase formattingUseCase;
    private final ExchangeRateRefreshUseCase refreshUseCase;
    private final RateCacheUseCase cacheUseCase;
    private final PrintStream out;
    private final PrintStream err;

    public Future<Integer> handle(List<String> args) {
        if (args.isEmpty()) {
            return usage("No command given");
        }

        String command = args.get(0);
        List<String> params = args.subList(1, args.size());
        log.debug("Handling command '{}' with {} parameter(s)", command, params.size());

        switch (command) {
            case "convert":
                return convert(params);
            case "refresh":
                return refresh(params);
            case "status":
                return status(params);
            case "clear":
                return clear();
            case "currencies":
                out.println(String.join(", ", CurrencyRegistry.listSupportedCurrencies()));
                return Future.succeededFuture(EXIT_OK);
            default:
                return usage("Unknown command: " + command);
        }
    }

    private Future<Integer> convert(List<String> params) {
        if (params.size() < 3 || params.size() > 4) {
            return usage("convert expects <amount> <FROM> <TO> [decimals]");
        }

        BigDecimal amount;
        Integer decimals = null;
        try {
            amount = new BigDecimal(params.get(0));
            if (params.size() == 4) {
                decimals = Integer.parseInt(params.get(3));
            }
        } catch (NumberFormatException e) {
            return usage("Invalid number: " + e.getMessage());
        }
        if (decimals != null && decimals < 0) {
            return usage("decimals must not be negative");
        }

        String from = CurrencyRegistry.normalize(params.get(1));
        String to = CurrencyRegistry.normalize(params.get(2));
        if (!CurrencyRegistry.isValidCode(from) || !CurrencyRegistry.isValidCode(to)) {
            return usage("Currency codes must be three letters");
        }

        return formattingUseCase.formatOutput(amount, from, to, null, decimals)
                .map(line -> {
                    out.println(line);
                    return EXIT_OK;
                });
    }

    private Future<Integer> refresh(List<String> params) {
        if (params.size() != 1 || !CurrencyRegistry.isValidCode(params.get(0))) {
            return usage("refresh expects a three-letter base currency");
        }
        String base = CurrencyRegistry.normalize(params.get(0));

        return refreshUseCase.refreshRates(base)
                .map(ok -> {
                    if (ok) {
                        out.println("Refreshed rates for " + base);
                        return EXIT_OK;
                    }
                    err.println("Failed to refresh rates for " + base);
                    return EXIT_FAILED;
                });
    }

    private Future<Integer> status(List<String> params) {
        if (params.size() != 1 || !CurrencyRegistry.isValidCode(params.get(0))) {
            return usage("status expects a three-letter base currency");
        }
        String base = CurrencyRegistry.normalize(params.get(0));

        return cacheUseCase.getStatus(base)
                .map(status -> {
                    out.println(describe(base, status));
                    return EXIT_OK;
                });
    }

    private Future<Integer> clear() {
        return cacheUseCase.clear()
                .map(v -> {
                    out.println("Currency cache cleared");
                    return EXIT_OK;
                });
    }

    static String describe(String base, CacheStatus status) {
        if (status.getError() != null) {
            return base + ": cache unavailable (" + status.getError() + ")";
        }
        if (!status.isExists()) {
            return base + ": no cached rates";
        }
        return String.format("%s: %s, fetched %s (%dh old, ttl %dh)",
                base,
                status.isExpired() ? "expired" : "fresh",
                status.getTimestamp(),
                status.getAge(),
                status.getTtl());
    }

    private Future<Integer> usage(String message) {
        err.println(message);
        err.println(USAGE);
        return Future.succeededFuture(EXIT_USAGE);
    }
}
