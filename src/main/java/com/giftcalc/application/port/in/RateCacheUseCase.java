package com.giftcalc.application.port.in;

import com.giftcalc.domain.model.CacheStatus;
import io.vertx.core.Future;

/**
 * Input port for cache inspection and maintenance
 */
public interface RateCacheUseCase {

    Future<CacheStatus> getStatus(String baseCurrency);

    Future<Void> clear();
}
