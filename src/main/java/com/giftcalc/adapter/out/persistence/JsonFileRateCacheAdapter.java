package com.giftcalc.adapter.out.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.giftcalc.application.port.out.RateCacheRepository;
import com.giftcalc.domain.model.CacheStatus;
import com.giftcalc.domain.model.RateSnapshot;
import com.giftcalc.domain.model.TtlPolicy;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.FileSystem;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed implementation of RateCacheRepository
 * Layout: { "USD": { "rates": { "EUR": 0.85, ... }, "timestamp": 1700000000000 }, ... }
 * A missing, unreadable or malformed file is treated as an empty cache.
 * No cross-process locking: concurrent writers race and the last one wins.
 */
@Slf4j
public class JsonFileRateCacheAdapter implements RateCacheRepository {

    private static final String RATES = "rates";
    private static final String TIMESTAMP = "timestamp";
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final FileSystem fileSystem;
    private final Path cacheFile;
    private final Clock clock;

    public JsonFileRateCacheAdapter(FileSystem fileSystem, Path cacheFile, Clock clock) {
        this.fileSystem = fileSystem;
        this.cacheFile = cacheFile;
        this.clock = clock;
    }

    @Override
    public Future<Optional<RateSnapshot>> readSnapshot(String baseCurrency) {
        return loadCacheFile()
                .map(cache -> cache.flatMap(c -> toSnapshot(c.getValue(baseCurrency))))
                .otherwise(error -> {
                    log.warn("Ignoring unreadable currency cache {}: {}", cacheFile, error.getMessage());
                    return Optional.empty();
                });
    }

    @Override
    public Future<Void> writeSnapshot(String baseCurrency, RateSnapshot snapshot) {
        String directory = cacheFile.toAbsolutePath().getParent().toString();

        return fileSystem.mkdirs(directory)
                .compose(v -> loadCacheFile()
                        .map(existing -> existing.orElseGet(JsonObject::new))
                        .otherwise(error -> {
                            log.warn("Currency cache {} is corrupted, starting fresh: {}", cacheFile, error.getMessage());
                            return new JsonObject();
                        }))
                .compose(cache -> {
                    cache.put(baseCurrency, toJson(snapshot));
                    return fileSystem.writeFile(cacheFile.toString(), Buffer.buffer(cache.encodePrettily()));
                })
                .onSuccess(v -> log.debug("Saved {} rates for {} to {}", snapshot.getRates().size(), baseCurrency, cacheFile))
                .otherwise(error -> {
                    log.warn("Failed to save currency cache {}: {}", cacheFile, error.getMessage());
                    return null;
                });
    }

    @Override
    public Future<Void> clear() {
        String path = cacheFile.toString();
        return fileSystem.exists(path)
                .compose(exists -> exists ? fileSystem.delete(path) : Future.<Void>succeededFuture())
                .onSuccess(v -> log.debug("Currency cache {} cleared", cacheFile))
                .otherwise(error -> {
                    log.warn("Failed to clear currency cache {}: {}", cacheFile, error.getMessage());
                    return null;
                });
    }

    @Override
    public Future<CacheStatus> status(String baseCurrency, int ttlHours) {
        return loadCacheFile()
                .map(cache -> cache
                        .flatMap(c -> toSnapshot(c.getValue(baseCurrency)))
                        .map(snapshot -> toStatus(snapshot, ttlHours))
                        .orElseGet(CacheStatus::absent))
                .otherwise(error -> CacheStatus.corrupted(
                        "Currency cache " + cacheFile + " could not be read: " + error.getMessage()));
    }

    private CacheStatus toStatus(RateSnapshot snapshot, int ttlHours) {
        long ageMillis = clock.millis() - snapshot.getTimestamp();
        long ageHours = Math.floorDiv(ageMillis, TtlPolicy.MILLIS_PER_HOUR);
        return CacheStatus.builder()
                .exists(true)
                .expired(ageMillis >= ttlHours * TtlPolicy.MILLIS_PER_HOUR)
                .age(ageHours)
                .ttl(ttlHours)
                .timestamp(ISO_MILLIS.format(Instant.ofEpochMilli(snapshot.getTimestamp())))
                .build();
    }

    /**
     * Empty when the file does not exist; fails when it cannot be read or is not a JSON object
     */
    private Future<Optional<JsonObject>> loadCacheFile() {
        String path = cacheFile.toString();
        return fileSystem.exists(path)
                .compose(exists -> {
                    if (!exists) {
                        return Future.succeededFuture(Optional.empty());
                    }
                    return fileSystem.readFile(path)
                            .map(buffer -> Optional.of(decode(buffer)));
                });
    }

    /**
     * Rates are decoded as BigDecimal so cached values keep every digit and their scale
     */
    @SuppressWarnings("unchecked")
    private JsonObject decode(Buffer buffer) {
        Map<String, Object> root;
        try {
            root = MAPPER.readValue(buffer.getBytes(), Map.class);
        } catch (IOException e) {
            throw new DecodeException("Failed to decode currency cache: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new DecodeException("Currency cache does not hold a JSON object");
        }
        return new JsonObject(root);
    }

    private Optional<RateSnapshot> toSnapshot(Object entry) {
        if (!(entry instanceof JsonObject json)) {
            return Optional.empty();
        }
        Object timestamp = json.getValue(TIMESTAMP);
        Object rates = json.getValue(RATES);
        if (!(timestamp instanceof Number stamp) || stamp.longValue() == 0 || !(rates instanceof JsonObject table)) {
            return Optional.empty();
        }

        Map<String, BigDecimal> parsed = new HashMap<>();
        for (Map.Entry<String, Object> rate : table) {
            if (rate.getValue() instanceof Number number) {
                parsed.put(rate.getKey(), new BigDecimal(number.toString()));
            }
        }
        return Optional.of(new RateSnapshot(parsed, stamp.longValue()));
    }

    private JsonObject toJson(RateSnapshot snapshot) {
        JsonObject rates = new JsonObject();
        snapshot.getRates().forEach(rates::put);
        return new JsonObject()
                .put(RATES, rates)
                .put(TIMESTAMP, snapshot.getTimestamp());
    }
}
