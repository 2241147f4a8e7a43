package com.giftcalc.infrastructure.config;

import com.giftcalc.domain.model.CacheStatus;
import com.giftcalc.domain.model.ConversionResult;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.giftcalc.support.TestFutures.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end wiring test: real adapters, stub rate API over HTTP, cache in a temporary directory
 */
class CurrencyModuleIntegrationTest {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    @TempDir
    Path tempDir;

    private Vertx vertx;
    private HttpServer server;
    private CurrencyModule module;
    private CurrencyServiceConfig config;

    private final AtomicInteger providerCalls = new AtomicInteger();
    private final AtomicInteger providerStatus = new AtomicInteger(200);
    private final Map<String, String> env = new HashMap<>();

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();

        Router router = Router.router(vertx);
        router.get("/latest/:base").handler(ctx -> {
            providerCalls.incrementAndGet();
            ctx.response()
                    .setStatusCode(providerStatus.get())
                    .putHeader("Content-Type", "application/json")
                    .end("{\"result\":\"success\",\"base_code\":\"" + ctx.pathParam("base")
                            + "\",\"rates\":{\"EUR\":0.85,\"SEK\":10.5}}");
        });
        server = await(vertx.createHttpServer().requestHandler(router).listen(0));

        config = CurrencyServiceConfig.builder()
                .apiBaseUrl("http://localhost:" + server.actualPort() + "/latest")
                .configDir(tempDir.resolve("gift-calc"))
                .cacheFileName(".currency-cache.json")
                .configFileName(".config.json")
                .ttlEnvVariable("GIFT_CALC_CACHE_TTL_HOURS")
                .build();
        module = new CurrencyModule(vertx, config, env::get, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        module.close();
        await(vertx.close());
    }

    @Test
    void convert_shouldHitProviderOnceThenServeFromCache() {
        ConversionResult first = await(module.getConversionUseCase().convert(HUNDRED, "USD", "EUR", 2));
        ConversionResult second = await(module.getConversionUseCase().convert(HUNDRED, "USD", "EUR", 2));

        assertTrue(first.isSuccess());
        assertEquals(0, new BigDecimal("85").compareTo(first.getConvertedAmount()));
        assertFalse(first.getCached());
        assertTrue(second.isSuccess());
        assertTrue(second.getCached());
        assertEquals(0, first.getRate().compareTo(second.getRate()));
        assertEquals(1, providerCalls.get());
        assertTrue(Files.exists(config.getCacheFile()));
    }

    @Test
    void convert_providerNotFound_shouldFailWithoutCreatingCache() {
        providerStatus.set(404);

        ConversionResult result = await(module.getConversionUseCase().convert(HUNDRED, "USD", "EUR", 2));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("Unable to get conversion rate"));
        assertFalse(Files.exists(config.getCacheFile()));
    }

    @Test
    void formatOutput_shouldRenderDualCurrency() {
        String output = await(module.getFormattingUseCase().formatOutput(HUNDRED, "USD", "EUR", "Alice", 2));

        assertEquals("100 USD (85 EUR) for Alice", output);
    }

    @Test
    void refreshStatusAndClear_shouldWorkTogether() {
        env.put("GIFT_CALC_CACHE_TTL_HOURS", "12");

        assertTrue(await(module.getRefreshUseCase().refreshRates("USD")));
        CacheStatus status = await(module.getCacheUseCase().getStatus("USD"));
        assertTrue(status.isExists());
        assertFalse(status.isExpired());
        assertEquals(0L, status.getAge());
        assertEquals(12, status.getTtl());

        await(module.getCacheUseCase().clear());
        assertFalse(Files.exists(config.getCacheFile()));
        assertFalse(await(module.getCacheUseCase().getStatus("USD")).isExists());
    }

    @Test
    void userConfigTtl_shouldBeReadFromConfigFile() throws Exception {
        Files.createDirectories(config.getConfigDir());
        Files.writeString(config.getConfigFile(), "{\"cacheTTLHours\": 48}");

        await(module.getRefreshUseCase().refreshRates("USD"));

        assertEquals(48, await(module.getCacheUseCase().getStatus("USD")).getTtl());
    }
}
