package com.exrate.config;

import com.exrate.domain.model.CurrencyPair;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed settings for the exchange rate subsystem
 * Bound from the "exchange-rate" section of application.yml, every value has a default
 */
@Value
@Builder(toBuilder = true)
public class ExchangeRateConfig {

    public static final List<String> DEFAULT_SUPPORTED_CURRENCIES =
            List.of("EUR", "ZAR", "USD", "GBP", "JPY", "CHF", "CAD", "AUD");

    @Builder.Default
    String baseCurrency = "EUR";

    @Builder.Default
    List<String> supportedCurrencies = DEFAULT_SUPPORTED_CURRENCIES;

    // Cache
    @Builder.Default
    int cacheMaxEntries = 1000;
    @Builder.Default
    long cacheTtlMs = 60 * 60 * 1000L;                 // 1 hour
    @Builder.Default
    long cacheHistoricalTtlMs = 24 * 60 * 60 * 1000L;  // 24 hours
    @Builder.Default
    long cacheCleanupIntervalMs = 5 * 60 * 1000L;      // 5 minutes

    // Backfill
    @Builder.Default
    int migrationBatchSize = 50;
    @Builder.Default
    int migrationWindowDays = 30;

    // Freshness guard
    @Builder.Default
    long freshnessTimeoutMs = 5000L;

    // Periodic refresh
    @Builder.Default
    boolean refreshEnabled = true;
    @Builder.Default
    long refreshIntervalMs = 12 * 60 * 60 * 1000L;     // 12 hours

    // Live rate provider
    @Builder.Default
    String providerBaseUrl = "https://api.exchangerate-api.com/v4/latest";
    @Builder.Default
    long providerTimeoutMs = 5000L;

    // Static last-resort rates, used when the provider and the rate history both have nothing
    @Builder.Default
    Map<CurrencyPair, Double> fallbackRates = Map.of();

    public static ExchangeRateConfig defaults() {
        return ExchangeRateConfig.builder().build();
    }

    /**
     * Bind from the "exchange-rate" JSON section; missing keys keep their defaults
     */
    public static ExchangeRateConfig fromJson(JsonObject json) {
        ExchangeRateConfig defaults = defaults();
        if (json == null) {
            return defaults;
        }

        JsonObject cache = section(json, "cache");
        JsonObject migration = section(json, "migration");
        JsonObject freshness = section(json, "freshness");
        JsonObject refresh = section(json, "refresh");
        JsonObject provider = section(json, "provider");

        return ExchangeRateConfig.builder()
                .baseCurrency(json.getString("base-currency", defaults.getBaseCurrency()))
                .supportedCurrencies(currencies(json.getJsonArray("supported-currencies"), defaults.getSupportedCurrencies()))
                .cacheMaxEntries(cache.getInteger("max-entries", defaults.getCacheMaxEntries()))
                .cacheTtlMs(cache.getLong("ttl-ms", defaults.getCacheTtlMs()))
                .cacheHistoricalTtlMs(cache.getLong("historical-ttl-ms", defaults.getCacheHistoricalTtlMs()))
                .cacheCleanupIntervalMs(cache.getLong("cleanup-interval-ms", defaults.getCacheCleanupIntervalMs()))
                .migrationBatchSize(migration.getInteger("batch-size", defaults.getMigrationBatchSize()))
                .migrationWindowDays(migration.getInteger("window-days", defaults.getMigrationWindowDays()))
                .freshnessTimeoutMs(freshness.getLong("timeout-ms", defaults.getFreshnessTimeoutMs()))
                .refreshEnabled(refresh.getBoolean("enabled", defaults.isRefreshEnabled()))
                .refreshIntervalMs(refresh.getLong("interval-ms", defaults.getRefreshIntervalMs()))
                .providerBaseUrl(provider.getString("base-url", defaults.getProviderBaseUrl()))
                .providerTimeoutMs(provider.getLong("timeout-ms", defaults.getProviderTimeoutMs()))
                .fallbackRates(fallbackRates(json.getJsonObject("fallback-rates"), defaults.getFallbackRates()))
                .build();
    }

    private static JsonObject section(JsonObject json, String name) {
        JsonObject section = json.getJsonObject(name);
        return section != null ? section : new JsonObject();
    }

    private static List<String> currencies(JsonArray array, List<String> fallback) {
        if (array == null || array.isEmpty()) {
            return fallback;
        }
        return array.stream().map(String::valueOf).toList();
    }

    /**
     * Read {@code {from: {to: rate}}}; non-numeric and non-positive rates are dropped
     */
    private static Map<CurrencyPair, Double> fallbackRates(JsonObject json, Map<CurrencyPair, Double> fallback) {
        if (json == null || json.isEmpty()) {
            return fallback;
        }
        Map<CurrencyPair, Double> rates = new LinkedHashMap<>();
        for (String from : json.fieldNames()) {
            Object targets = json.getValue(from);
            if (!(targets instanceof JsonObject)) {
                continue;
            }
            JsonObject byTarget = (JsonObject) targets;
            for (String to : byTarget.fieldNames()) {
                Object value = byTarget.getValue(to);
                if (value instanceof Number && ((Number) value).doubleValue() > 0
                        && !Double.isInfinite(((Number) value).doubleValue())) {
                    rates.put(CurrencyPair.of(from, to), ((Number) value).doubleValue());
                }
            }
        }
        return Collections.unmodifiableMap(rates);
    }
}
