package com.giftcalc.application.port.out;

import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for the per-user configuration file
 */
public interface UserConfigRepository {

    /**
     * Raw value of the cacheTTLHours field, if the file exists, parses and carries the field.
     * Never fails: an unreadable file completes with an empty value.
     */
    Future<Optional<Object>> getCacheTtlHours();
}
