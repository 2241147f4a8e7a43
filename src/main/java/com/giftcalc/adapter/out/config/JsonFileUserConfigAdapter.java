package com.giftcalc.adapter.out.config;

import com.giftcalc.application.port.out.UserConfigRepository;
import io.vertx.core.Future;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads fields from the per-user JSON config file.
 * The file is re-read on every call; a missing or broken file simply yields no value.
 */
@Slf4j
public class JsonFileUserConfigAdapter implements UserConfigRepository {

    static final String CACHE_TTL_HOURS = "cacheTTLHours";

    private final FileSystem fileSystem;
    private final Path configFile;

    public JsonFileUserConfigAdapter(FileSystem fileSystem, Path configFile) {
        this.fileSystem = fileSystem;
        this.configFile = configFile;
    }

    @Override
    public Future<Optional<Object>> getCacheTtlHours() {
        return load().map(config -> config.map(c -> c.getValue(CACHE_TTL_HOURS)));
    }

    private Future<Optional<JsonObject>> load() {
        String path = configFile.toString();
        return fileSystem.exists(path)
                .compose(exists -> {
                    if (!exists) {
                        return Future.succeededFuture(Optional.<JsonObject>empty());
                    }
                    return fileSystem.readFile(path)
                            .map(buffer -> Optional.of(new JsonObject(buffer)));
                })
                .otherwise(error -> {
                    if (error instanceof DecodeException) {
                        log.warn("Could not parse config file at {}, using defaults: {}", configFile, error.getMessage());
                    } else {
                        log.warn("Could not read config file at {}, using defaults: {}", configFile, error.getMessage());
                    }
                    return Optional.empty();
                });
    }
}
