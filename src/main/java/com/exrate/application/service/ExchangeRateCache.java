package com.exrate.application.service;

import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.model.CacheMetrics;
import com.exrate.domain.model.CachedRate;
import com.exrate.domain.model.CurrencyPair;
import com.exrate.domain.model.RateSource;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local, time-bounded cache of exchange rates keyed by currency pair.
 * <p>
 * Entries are kept in access order so the eldest entry is always the least recently accessed one.
 * Every read and write of the map happens under a single lock; fetches for {@link #getOrFetch}
 * run outside of it.
 * <p>
 * The cleanup timer is an explicit resource: call {@link #start()} after construction and
 * {@link #stop()} on shutdown.
 */
@Slf4j
public class ExchangeRateCache {

    private final Vertx vertx;
    private final Clock clock;
    private final int maxEntries;
    private final long defaultTtlMs;
    private final long historicalTtlMs;
    private final long cleanupIntervalMs;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<CurrencyPair, CachedRate> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hitCount;
    private long missCount;
    private long apiCallsSaved;
    private Long cleanupTimerId;

    public ExchangeRateCache(Vertx vertx, ExchangeRateConfig config, Clock clock) {
        this.vertx = vertx;
        this.clock = clock;
        this.maxEntries = config.getCacheMaxEntries();
        this.defaultTtlMs = config.getCacheTtlMs();
        this.historicalTtlMs = config.getCacheHistoricalTtlMs();
        this.cleanupIntervalMs = config.getCacheCleanupIntervalMs();
    }

    /**
     * Start the periodic cleanup sweep
     */
    public void start() {
        lock.lock();
        try {
            if (cleanupTimerId != null) {
                return;
            }
            cleanupTimerId = vertx.setPeriodic(cleanupIntervalMs, id -> cleanup());
        } finally {
            lock.unlock();
        }
        log.info("Exchange rate cache started (max entries: {}, cleanup every {} ms)", maxEntries, cleanupIntervalMs);
    }

    /**
     * Stop the cleanup sweep and drop all entries
     */
    public void stop() {
        lock.lock();
        try {
            if (cleanupTimerId != null) {
                vertx.cancelTimer(cleanupTimerId);
                cleanupTimerId = null;
            }
        } finally {
            lock.unlock();
        }
        clear();
        log.info("Exchange rate cache stopped");
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return cleanupTimerId != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Look up a rate; an entry older than the applicable TTL is removed and reported as a miss
     * @param historical true to apply the (longer) historical TTL
     */
    public Optional<Double> get(String fromCurrency, String toCurrency, boolean historical) {
        CurrencyPair key = CurrencyPair.of(fromCurrency, toCurrency);
        long now = clock.millis();
        long ttl = historical ? historicalTtlMs : defaultTtlMs;

        lock.lock();
        try {
            CachedRate entry = entries.get(key);
            if (entry == null) {
                missCount++;
                return Optional.empty();
            }
            if (entry.ageMillis(now) > ttl) {
                entries.remove(key);
                missCount++;
                log.debug("Cache entry {} expired", key);
                return Optional.empty();
            }

            entry.setAccessCount(entry.getAccessCount() + 1);
            entry.setLastAccessedAt(now);
            hitCount++;
            apiCallsSaved++;
            return Optional.of(entry.getRate());
        } finally {
            lock.unlock();
        }
    }

    public Optional<Double> get(String fromCurrency, String toCurrency) {
        return get(fromCurrency, toCurrency, false);
    }

    /**
     * Copy of the entry for a pair without touching access stats, counters or expiry
     */
    Optional<CachedRate> peek(String fromCurrency, String toCurrency) {
        lock.lock();
        try {
            CachedRate entry = entries.get(CurrencyPair.of(fromCurrency, toCurrency));
            return Optional.ofNullable(entry).map(e -> e.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert or replace a rate, resetting its timestamps and access stats.
     * Non-positive rates are never cached.
     */
    public void set(String fromCurrency, String toCurrency, double rate, RateSource source) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            log.warn("Refusing to cache unusable rate {} for {}->{}", rate, fromCurrency, toCurrency);
            return;
        }

        CurrencyPair key = CurrencyPair.of(fromCurrency, toCurrency);
        long now = clock.millis();
        CachedRate entry = CachedRate.builder()
                .fromCurrency(fromCurrency)
                .toCurrency(toCurrency)
                .rate(rate)
                .fetchedAt(now)
                .source(source)
                .accessCount(0)
                .lastAccessedAt(now)
                .build();

        lock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxEntries) {
                evictLeastRecentlyAccessed();
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Return the cached rate, or fetch it, cache it with source API and return it.
     * A fetch failure is propagated unchanged and nothing is cached.
     */
    public Future<Double> getOrFetch(String fromCurrency, String toCurrency,
                                     Supplier<Future<Double>> fetchFn, boolean historical) {
        Optional<Double> cached = get(fromCurrency, toCurrency, historical);
        if (cached.isPresent()) {
            return Future.succeededFuture(cached.get());
        }

        Future<Double> fetched;
        try {
            fetched = fetchFn.get();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        return fetched
                .onSuccess(rate -> set(fromCurrency, toCurrency, rate, RateSource.API))
                .onFailure(error -> log.debug("Fetch for {}->{} failed: {}", fromCurrency, toCurrency, error.getMessage()));
    }

    /**
     * Remove every entry where the currency is either side of the pair
     */
    public int invalidate(String currency) {
        int removed = 0;
        lock.lock();
        try {
            Iterator<CachedRate> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().involves(currency)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Invalidated {} cache entries for currency {}", removed, currency);
        return removed;
    }

    /**
     * Load a set of known rates, e.g. after a refresh
     */
    public void warm(Map<CurrencyPair, Double> rates) {
        rates.forEach((pair, rate) -> set(pair.fromCurrency(), pair.toCurrency(), rate, RateSource.API));
        log.info("Cache warmed with {} rates", rates.size());
    }

    /**
     * Remove all entries and reset counters
     */
    public int clear() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            hitCount = 0;
            missCount = 0;
            apiCallsSaved = 0;
            if (removed > 0) {
                log.info("Cache cleared: {} entries removed", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheMetrics metrics() {
        long now = clock.millis();
        lock.lock();
        try {
            long totalAccesses = hitCount + missCount;
            double hitRate = totalAccesses > 0 ? (double) hitCount / totalAccesses : 0.0;

            long accessSum = 0;
            long oldest = now;
            long newest = now;
            boolean first = true;
            for (CachedRate entry : entries.values()) {
                accessSum += entry.getAccessCount();
                if (first) {
                    oldest = entry.getFetchedAt();
                    newest = entry.getFetchedAt();
                    first = false;
                } else {
                    oldest = Math.min(oldest, entry.getFetchedAt());
                    newest = Math.max(newest, entry.getFetchedAt());
                }
            }
            double averageAccessCount = entries.isEmpty() ? 0.0 : (double) accessSum / entries.size();

            return new CacheMetrics(
                    entries.size(),
                    hitCount,
                    missCount,
                    hitRate,
                    apiCallsSaved,
                    averageAccessCount,
                    now - oldest,
                    now - newest
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sweep entries older than the default TTL, whatever TTL they were read with
     */
    int cleanup() {
        long now = clock.millis();
        int removed = 0;
        lock.lock();
        try {
            Iterator<CachedRate> it = entries.values().iterator();
            while (it.hasNext()) {
                if (it.next().ageMillis(now) > defaultTtlMs) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            log.info("Cache cleanup: {} expired entries removed", removed);
        }
        return removed;
    }

    // caller holds the lock
    private void evictLeastRecentlyAccessed() {
        Iterator<Map.Entry<CurrencyPair, CachedRate>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            CurrencyPair evicted = it.next().getKey();
            it.remove();
            log.debug("Cache full, evicted {}", evicted);
        }
    }
}
