package com.giftcalc.infrastructure.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.function.Function;

/**
 * Settings for the currency subsystem, read from the "currency" section of application.yml
 */
@Value
@Builder
public class CurrencyServiceConfig {

    public static final String DEFAULT_API_BASE_URL = "https://open.er-api.com/v6/latest";
    public static final String DEFAULT_TTL_ENV_VARIABLE = "GIFT_CALC_CACHE_TTL_HOURS";

    String apiBaseUrl;
    Path configDir;
    String cacheFileName;
    String configFileName;
    String ttlEnvVariable;

    public Path getCacheFile() {
        return configDir.resolve(cacheFileName);
    }

    public Path getConfigFile() {
        return configDir.resolve(configFileName);
    }

    /**
     * Build from the merged configuration
     * @param root whole configuration, expected to contain a "currency" object
     * @param env environment lookup, used for HOME
     */
    public static CurrencyServiceConfig fromJson(JsonObject root, Function<String, String> env) {
        JsonObject currency = root.getJsonObject("currency", new JsonObject());

        String explicitDir = currency.getString("config-dir");
        Path configDir = explicitDir != null && !explicitDir.isBlank()
                ? Path.of(explicitDir)
                : homeDirectory(env).resolve(currency.getString("config-dir-name", ".config/gift-calc"));

        return CurrencyServiceConfig.builder()
                .apiBaseUrl(currency.getString("api-base-url", DEFAULT_API_BASE_URL))
                .configDir(configDir)
                .cacheFileName(currency.getString("cache-file", ".currency-cache.json"))
                .configFileName(currency.getString("config-file", ".config.json"))
                .ttlEnvVariable(currency.getString("ttl-env-variable", DEFAULT_TTL_ENV_VARIABLE))
                .build();
    }

    private static Path homeDirectory(Function<String, String> env) {
        String home = env.apply("HOME");
        return Path.of(home != null && !home.isBlank() ? home : System.getProperty("user.home"));
    }
}
