package com.exrate.application.port.in;

import com.exrate.domain.model.FreshnessResult;
import io.vertx.core.Future;

/**
 * Input port for making sure today's rates are loaded before a rate-dependent write
 */
public interface RateFreshnessUseCase {

    /**
     * Refresh rates if they were not refreshed today, waiting at most timeoutMs
     * @return Future failed with API_UNAVAILABLE if the refresh fails before the timeout
     */
    Future<FreshnessResult> ensureFreshRates(long timeoutMs);
}
