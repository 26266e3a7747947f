package com.exrate.adapter.in.eventbus;

import com.exrate.application.port.in.CurrencyConversionUseCase;
import com.exrate.application.port.in.ExchangeRateCacheUseCase;
import com.exrate.application.port.in.HistoricalRateUseCase;
import com.exrate.application.port.in.RateFreshnessUseCase;
import com.exrate.application.port.in.RateMigrationUseCase;
import com.exrate.domain.model.CacheMetrics;
import com.exrate.domain.model.ConversionRequest;
import com.exrate.domain.model.ConversionResult;
import com.exrate.domain.model.FreshnessResult;
import com.exrate.domain.model.MigrationResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Exposes the exchange rate operations on the event bus, request/reply with JSON bodies
 * Part of hexagonal architecture - input adapter
 */
@Slf4j
public class ExchangeRateEventBusHandler {

    public static final String CONVERT = "exchange-rate.convert";
    public static final String SAVE_RATES = "exchange-rate.save-rates";
    public static final String MIGRATE = "exchange-rate.migrate";
    public static final String ENSURE_FRESH = "exchange-rate.ensure-fresh";
    public static final String CACHE_METRICS = "exchange-rate.cache-metrics";
    public static final String INVALIDATE_CACHE = "exchange-rate.invalidate-cache";

    private final Vertx vertx;
    private final CurrencyConversionUseCase conversionUseCase;
    private final HistoricalRateUseCase historicalRateUseCase;
    private final RateMigrationUseCase migrationUseCase;
    private final RateFreshnessUseCase freshnessUseCase;
    private final ExchangeRateCacheUseCase cacheUseCase;
    private final long defaultFreshnessTimeoutMs;
    private final List<MessageConsumer<JsonObject>> consumers = new ArrayList<>();

    public ExchangeRateEventBusHandler(
            Vertx vertx,
            CurrencyConversionUseCase conversionUseCase,
            HistoricalRateUseCase historicalRateUseCase,
            RateMigrationUseCase migrationUseCase,
            RateFreshnessUseCase freshnessUseCase,
            ExchangeRateCacheUseCase cacheUseCase,
            long defaultFreshnessTimeoutMs
    ) {
        this.vertx = vertx;
        this.conversionUseCase = conversionUseCase;
        this.historicalRateUseCase = historicalRateUseCase;
        this.migrationUseCase = migrationUseCase;
        this.freshnessUseCase = freshnessUseCase;
        this.cacheUseCase = cacheUseCase;
        this.defaultFreshnessTimeoutMs = defaultFreshnessTimeoutMs;
    }

    /**
     * Register a consumer for every address
     */
    public void register() {
        consume(CONVERT, this::convert);
        consume(SAVE_RATES, this::saveRates);
        consume(MIGRATE, body -> migrationUseCase.migrateExistingExpenses().map(ExchangeRateEventBusHandler::toJson));
        consume(ENSURE_FRESH, this::ensureFresh);
        consume(CACHE_METRICS, body -> Future.succeededFuture(toJson(cacheUseCase.getCacheMetrics())));
        consume(INVALIDATE_CACHE, body -> {
            String currency = body != null ? body.getString("currency") : null;
            int removed = cacheUseCase.invalidateCache(currency);
            return Future.succeededFuture(new JsonObject().put("removed", removed));
        });
        log.info("Registered {} exchange rate event bus consumers", consumers.size());
    }

    public Future<Void> unregister() {
        List<Future<Void>> pending = new ArrayList<>();
        consumers.forEach(consumer -> pending.add(consumer.unregister()));
        consumers.clear();
        return Future.all(pending).mapEmpty();
    }

    private void consume(String address, Function<JsonObject, Future<JsonObject>> operation) {
        consumers.add(vertx.eventBus().<JsonObject>consumer(address, message -> handle(address, message, operation)));
    }

    private void handle(String address, Message<JsonObject> message, Function<JsonObject, Future<JsonObject>> operation) {
        log.debug("Received {} request: {}", address, message.body());

        Future<JsonObject> reply;
        try {
            reply = operation.apply(message.body());
        } catch (RuntimeException e) {
            reply = Future.failedFuture(e);
        }

        reply.onSuccess(message::reply)
                .onFailure(error -> {
                    log.error("Failed to process {} request", address, error);
                    message.fail(500, error.getMessage());
                });
    }

    private Future<JsonObject> convert(JsonObject body) {
        if (body == null || body.getValue("amount") == null
                || body.getString("fromCurrency") == null || body.getString("toCurrency") == null) {
            return Future.failedFuture(new IllegalArgumentException("amount, fromCurrency and toCurrency are required"));
        }
        ConversionRequest request = new ConversionRequest(
                body.getDouble("amount"),
                body.getString("fromCurrency"),
                body.getString("toCurrency"),
                body.getLong("expenseId"));
        return conversionUseCase.convertDetailed(request).map(ExchangeRateEventBusHandler::toJson);
    }

    private Future<JsonObject> saveRates(JsonObject body) {
        if (body == null || body.getLong("expenseId") == null) {
            return Future.failedFuture(new IllegalArgumentException("expenseId is required"));
        }
        long expenseId = body.getLong("expenseId");
        String date = body.getString("expenseDate");
        LocalDateTime expenseDate = date != null ? LocalDateTime.parse(date) : LocalDateTime.now();
        return historicalRateUseCase.saveRatesForExpense(expenseId, expenseDate)
                .map(v -> new JsonObject().put("expenseId", expenseId).put("status", "OK"));
    }

    private Future<JsonObject> ensureFresh(JsonObject body) {
        long timeoutMs = body != null ? body.getLong("timeoutMs", defaultFreshnessTimeoutMs) : defaultFreshnessTimeoutMs;
        return freshnessUseCase.ensureFreshRates(timeoutMs).map(ExchangeRateEventBusHandler::toJson);
    }

    static JsonObject toJson(ConversionResult result) {
        return new JsonObject()
                .put("originalAmount", result.originalAmount())
                .put("convertedAmount", result.convertedAmount())
                .put("fromCurrency", result.fromCurrency())
                .put("toCurrency", result.toCurrency())
                .put("rate", result.rate())
                .put("source", result.source().name());
    }

    static JsonObject toJson(MigrationResult result) {
        return new JsonObject()
                .put("totalExpenses", result.totalExpenses())
                .put("migratedExpenses", result.migratedExpenses())
                .put("skippedExpenses", result.skippedExpenses())
                .put("errors", new JsonArray(result.errors()))
                .put("warnings", new JsonArray(result.warnings()))
                .put("durationMs", result.durationMs());
    }

    static JsonObject toJson(FreshnessResult result) {
        return new JsonObject()
                .put("success", result.success())
                .put("updated", result.updated())
                .put("timedOut", result.timedOut());
    }

    static JsonObject toJson(CacheMetrics metrics) {
        return new JsonObject()
                .put("totalEntries", metrics.totalEntries())
                .put("hitCount", metrics.hitCount())
                .put("missCount", metrics.missCount())
                .put("hitRate", metrics.hitRate())
                .put("apiCallsSaved", metrics.apiCallsSaved())
                .put("averageAccessCount", metrics.averageAccessCount())
                .put("oldestEntryAgeMs", metrics.oldestEntryAgeMs())
                .put("newestEntryAgeMs", metrics.newestEntryAgeMs());
    }
}
