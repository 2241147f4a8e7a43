package com.giftcalc.infrastructure.config;

import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads application.yml from the classpath
 */
@Slf4j
public final class ConfigLoader {

    private static final String CONFIG_FILE = "application.yml";

    private ConfigLoader() {
    }

    public static Future<JsonObject> load(Vertx vertx) {
        ConfigStoreOptions yamlStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", CONFIG_FILE));

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .setScanPeriod(0)
                .addStore(yamlStore));

        return retriever.getConfig()
                .onSuccess(config -> log.debug("Loaded configuration from {}", CONFIG_FILE))
                .onFailure(error -> log.error("Failed to load {}: {}", CONFIG_FILE, error.getMessage()))
                .onComplete(ar -> retriever.close());
    }
}
