package com.giftcalc.infrastructure.config;

import com.giftcalc.adapter.out.config.JsonFileUserConfigAdapter;
import com.giftcalc.adapter.out.http.ExchangeRateHttpAdapter;
import com.giftcalc.adapter.out.persistence.JsonFileRateCacheAdapter;
import com.giftcalc.application.port.in.CurrencyConversionUseCase;
import com.giftcalc.application.port.in.CurrencyFormattingUseCase;
import com.giftcalc.application.port.in.ExchangeRateRefreshUseCase;
import com.giftcalc.application.port.in.RateCacheUseCase;
import com.giftcalc.application.port.out.ExchangeRateProvider;
import com.giftcalc.application.port.out.RateCacheRepository;
import com.giftcalc.application.port.out.UserConfigRepository;
import com.giftcalc.application.service.CurrencyConversionService;
import com.giftcalc.application.service.CurrencyOutputFormatter;
import com.giftcalc.application.service.ExchangeRateRefreshService;
import com.giftcalc.application.service.RateCacheService;
import com.giftcalc.application.service.TtlPolicyResolver;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.function.Function;

/**
 * Wires adapters and services together (hexagonal architecture)
 * Exposes only the input ports
 */
@Slf4j
@Getter
public class CurrencyModule implements AutoCloseable {

    private final WebClient webClient;
    private final CurrencyConversionUseCase conversionUseCase;
    private final CurrencyFormattingUseCase formattingUseCase;
    private final ExchangeRateRefreshUseCase refreshUseCase;
    private final RateCacheUseCase cacheUseCase;

    public CurrencyModule(Vertx vertx, CurrencyServiceConfig config, Function<String, String> env, Clock clock) {
        this.webClient = WebClient.create(vertx);

        // Output ports (adapters)
        ExchangeRateProvider rateProvider = new ExchangeRateHttpAdapter(webClient, config.getApiBaseUrl());
        RateCacheRepository cacheRepository = new JsonFileRateCacheAdapter(vertx.fileSystem(), config.getCacheFile(), clock);
        UserConfigRepository userConfig = new JsonFileUserConfigAdapter(vertx.fileSystem(), config.getConfigFile());

        // Application services (use cases)
        TtlPolicyResolver ttlResolver = new TtlPolicyResolver(env, config.getTtlEnvVariable(), userConfig);
        ExchangeRateRefreshService refreshService = new ExchangeRateRefreshService(rateProvider, cacheRepository, clock);
        CurrencyConversionService conversionService =
                new CurrencyConversionService(cacheRepository, refreshService, ttlResolver, clock);

        this.conversionUseCase = conversionService;
        this.formattingUseCase = new CurrencyOutputFormatter(conversionService);
        this.refreshUseCase = refreshService;
        this.cacheUseCase = new RateCacheService(cacheRepository, ttlResolver);

        log.debug("Currency module wired (cache={}, api={})", config.getCacheFile(), config.getApiBaseUrl());
    }

    @Override
    public void close() {
        webClient.close();
    }
}
