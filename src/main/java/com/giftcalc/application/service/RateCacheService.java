package com.giftcalc.application.service;

import com.giftcalc.application.port.in.RateCacheUseCase;
import com.giftcalc.application.port.out.RateCacheRepository;
import com.giftcalc.domain.model.CacheStatus;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cache inspection and maintenance
 */
@Slf4j
@RequiredArgsConstructor
public class RateCacheService implements RateCacheUseCase {

    private final RateCacheRepository cacheRepository;
    private final TtlPolicyResolver ttlResolver;

    @Override
    public Future<CacheStatus> getStatus(String baseCurrency) {
        return ttlResolver.resolveTtlHours()
                .compose(ttlHours -> cacheRepository.status(baseCurrency, ttlHours));
    }

    @Override
    public Future<Void> clear() {
        log.info("Clearing currency cache");
        return cacheRepository.clear();
    }
}
