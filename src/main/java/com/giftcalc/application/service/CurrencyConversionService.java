package com.giftcalc.application.service;

import com.giftcalc.application.port.in.CurrencyConversionUseCase;
import com.giftcalc.application.port.out.RateCacheRepository;
import com.giftcalc.domain.model.ConversionResult;
import com.giftcalc.domain.model.RateFetchResult;
import com.giftcalc.domain.model.RateSnapshot;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Conversion engine: cache lookup, staleness check, provider fallback, cache update, arithmetic.
 * Converted amounts are rounded HALF_UP to the requested number of decimals.
 */
@Slf4j
public class CurrencyConversionService implements CurrencyConversionUseCase {

    private final RateCacheRepository cacheRepository;
    private final ExchangeRateRefreshService refreshService;
    private final TtlPolicyResolver ttlResolver;
    private final Clock clock;

    public CurrencyConversionService(
            RateCacheRepository cacheRepository,
            ExchangeRateRefreshService refreshService,
            TtlPolicyResolver ttlResolver,
            Clock clock
    ) {
        this.cacheRepository = cacheRepository;
        this.refreshService = refreshService;
        this.ttlResolver = ttlResolver;
        this.clock = clock;
    }

    @Override
    public Future<ConversionResult> convert(BigDecimal amount, String fromCurrency, String toCurrency, int decimals) {
        if (fromCurrency.equals(toCurrency)) {
            // No I/O: reported as cached even though nothing was ever stored
            return Future.succeededFuture(
                    ConversionResult.converted(amount, fromCurrency, toCurrency, amount, BigDecimal.ONE, true));
        }

        return ttlResolver.resolveTtlHours()
                .compose(ttlHours -> cacheRepository.readSnapshot(fromCurrency)
                        .map(cached -> freshRate(cached, toCurrency, ttlHours)))
                .compose(cachedRate -> {
                    if (cachedRate.isPresent()) {
                        log.debug("Cache hit for {} -> {}", fromCurrency, toCurrency);
                        return Future.succeededFuture(
                                fromRate(cachedRate.get(), true, amount, fromCurrency, toCurrency, decimals));
                    }
                    log.debug("Cache miss for {} -> {}, fetching from provider", fromCurrency, toCurrency);
                    return refreshService.fetchAndStore(fromCurrency)
                            .map(fetched -> fromProvider(fetched, amount, fromCurrency, toCurrency, decimals));
                });
    }

    private Optional<BigDecimal> freshRate(Optional<RateSnapshot> snapshot, String toCurrency, int ttlHours) {
        return snapshot
                .filter(s -> s.isFresh(clock.millis(), ttlHours))
                .filter(s -> s.hasRate(toCurrency))
                .map(s -> s.getRate(toCurrency));
    }

    private ConversionResult fromProvider(RateFetchResult fetched, BigDecimal amount,
                                          String fromCurrency, String toCurrency, int decimals) {
        if (!fetched.ok() || !fetched.rates().containsKey(toCurrency)) {
            String error = fetched.reason() != null
                    ? fetched.reason()
                    : unavailableMessage(fromCurrency, toCurrency);
            log.warn("Conversion {} -> {} failed: {}", fromCurrency, toCurrency, error);
            return ConversionResult.failed(amount, fromCurrency, toCurrency, error);
        }
        return fromRate(fetched.rates().get(toCurrency), false, amount, fromCurrency, toCurrency, decimals);
    }

    /**
     * A zero rate is no rate at all: the conversion fails instead of yielding 0
     */
    private ConversionResult fromRate(BigDecimal rate, boolean cached, BigDecimal amount,
                                      String fromCurrency, String toCurrency, int decimals) {
        if (rate.signum() == 0) {
            String error = unavailableMessage(fromCurrency, toCurrency);
            log.warn("Conversion {} -> {} failed: zero rate ({})", fromCurrency, toCurrency,
                    cached ? "cache" : "provider");
            return ConversionResult.failed(amount, fromCurrency, toCurrency, error);
        }
        return success(amount, fromCurrency, toCurrency, rate, cached, decimals);
    }

    private ConversionResult success(BigDecimal amount, String fromCurrency, String toCurrency,
                                     BigDecimal rate, boolean cached, int decimals) {
        BigDecimal converted = amount.multiply(rate).setScale(decimals, RoundingMode.HALF_UP);
        return ConversionResult.converted(amount, fromCurrency, toCurrency, converted, rate, cached);
    }

    static String unavailableMessage(String fromCurrency, String toCurrency) {
        return "Unable to get conversion rate from " + fromCurrency + " to " + toCurrency;
    }
}
