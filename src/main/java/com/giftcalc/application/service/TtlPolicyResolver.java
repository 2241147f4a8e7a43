package com.giftcalc.application.service;

import com.giftcalc.application.port.out.UserConfigRepository;
import com.giftcalc.domain.model.TtlPolicy;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves the cache TTL in hours.
 * Precedence: environment override, then the cacheTTLHours config field, then the default.
 * Each source is range-checked against [1, 168] on its own; an out-of-range source is skipped,
 * never clamped. Resolution happens on every call so changes to env or config are picked up.
 */
@Slf4j
public class TtlPolicyResolver {

    // Leading integer, as lenient as a shell user expects: "12h" means 12
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private final Function<String, String> envLookup;
    private final String envVariable;
    private final UserConfigRepository userConfig;

    public TtlPolicyResolver(Function<String, String> envLookup, String envVariable,
                             UserConfigRepository userConfig) {
        this.envLookup = envLookup;
        this.envVariable = envVariable;
        this.userConfig = userConfig;
    }

    public Future<Integer> resolveTtlHours() {
        String envOverride = envLookup.apply(envVariable);
        return userConfig.getCacheTtlHours()
                .map(configField -> {
                    Object raw = configField.orElse(null);
                    int hours = resolveTtlHours(envOverride, raw);
                    log.debug("Resolved cache TTL: {} hours (env={}, config={})", hours, envOverride, raw);
                    return hours;
                });
    }

    /**
     * Pure precedence and range rule
     * @param envOverride raw environment value, may be null
     * @param configField raw config value, may be null or of any JSON type
     */
    public static int resolveTtlHours(String envOverride, Object configField) {
        return parseEnvHours(envOverride)
                .filter(TtlPolicy::isWithinBounds)
                .or(() -> parseConfigHours(configField).filter(TtlPolicy::isWithinBounds))
                .orElse(TtlPolicy.DEFAULT_TTL_HOURS);
    }

    static Optional<Integer> parseEnvHours(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = LEADING_INTEGER.matcher(raw);
        if (!matcher.find()) {
            log.debug("Ignoring non-numeric TTL override: {}", raw);
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException e) {
            log.debug("Ignoring out-of-range TTL override: {}", raw);
            return Optional.empty();
        }
    }

    static Optional<Integer> parseConfigHours(Object raw) {
        if (raw instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric cacheTTLHours: {}", text);
            }
        }
        return Optional.empty();
    }
}
