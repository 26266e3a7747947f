package com.exrate;

import com.exrate.adapter.in.eventbus.ExchangeRateEventBusHandler;
import com.exrate.adapter.out.http.ExchangeRateHttpAdapter;
import com.exrate.adapter.out.persistence.JdbcExchangeRateHistoryPersistenceAdapter;
import com.exrate.adapter.out.persistence.JdbcExpensePersistenceAdapter;
import com.exrate.adapter.out.persistence.JdbcHistoricalRatePersistenceAdapter;
import com.exrate.application.port.in.CurrencyConversionUseCase;
import com.exrate.application.port.in.ExchangeRateCacheUseCase;
import com.exrate.application.port.in.ExchangeRateRefreshUseCase;
import com.exrate.application.port.in.HistoricalRateUseCase;
import com.exrate.application.port.in.RateFreshnessUseCase;
import com.exrate.application.port.in.RateMigrationUseCase;
import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.application.port.out.ExpenseRepository;
import com.exrate.application.port.out.HistoricalRateRepository;
import com.exrate.application.service.CurrencyConversionService;
import com.exrate.application.service.ExchangeRateCache;
import com.exrate.application.service.ExchangeRateCacheAdminService;
import com.exrate.application.service.ExchangeRateRefreshService;
import com.exrate.application.service.HistoricalRateStore;
import com.exrate.application.service.LiveRateResolver;
import com.exrate.application.service.RateFreshnessGuard;
import com.exrate.application.service.RateMigrationService;
import com.exrate.config.ExchangeRateConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.SqlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Exchange Rate Verticle - wires the rate subsystem and owns its lifecycle
 * (database pool, cache cleanup timer, periodic refresh, event bus consumers)
 */
public class ExchangeRateVerticle extends AbstractVerticle {
    private static final Logger log = LoggerFactory.getLogger(ExchangeRateVerticle.class);

    private SqlClient sqlClient;
    private ExchangeRateHttpAdapter rateProvider;
    private ExchangeRateCache cache;
    private ExchangeRateRefreshUseCase refreshUseCase;
    private ExchangeRateEventBusHandler eventBusHandler;

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting Exchange Rate Verticle...");

        ExchangeRateConfig rateConfig = ExchangeRateConfig.fromJson(config().getJsonObject("exchange-rate"));

        initializeDatabase()
                .compose(v -> {
                    log.info("Database initialized successfully");
                    initializeServices(rateConfig);
                    if (!rateConfig.isRefreshEnabled()) {
                        log.info("Periodic exchange rate refresh disabled");
                        return Future.<Void>succeededFuture();
                    }
                    return refreshUseCase.startPeriodicRefresh();
                })
                .onSuccess(v -> {
                    log.info("Exchange Rate Verticle started successfully (base currency: {})", rateConfig.getBaseCurrency());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start Exchange Rate Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (refreshUseCase != null) {
            refreshUseCase.stopPeriodicRefresh();
        }
        if (eventBusHandler != null) {
            eventBusHandler.unregister();
        }
        if (cache != null) {
            cache.stop();
        }
        if (rateProvider != null) {
            rateProvider.close();
        }
        if (sqlClient != null) {
            sqlClient.close();
        }
        log.info("Exchange Rate Verticle stopped");
    }

    private Future<Void> initializeDatabase() {
        Promise<Void> promise = Promise.promise();

        try {
            JsonObject dbConfig = config().getJsonObject("database");
            if (dbConfig == null) {
                promise.fail("Database configuration not found in application.yml");
                return promise.future();
            }

            log.info("Connecting to database: {}", dbConfig.getString("url"));

            JsonObject poolConfig = new JsonObject()
                    .put("url", dbConfig.getString("url"))
                    .put("user", dbConfig.getString("user"))
                    .put("password", dbConfig.getString("password"))
                    .put("driver_class", dbConfig.getString("driver_class"))
                    .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

            sqlClient = JDBCPool.pool(vertx, poolConfig);

            // Test connection (schema is created by schema.sql)
            sqlClient.query("SELECT 1 FROM DUAL").execute()
                    .onSuccess(result -> {
                        log.info("Database connection test successful");
                        promise.complete();
                    })
                    .onFailure(error -> {
                        log.error("Database connection failed", error);
                        promise.fail(error);
                    });

        } catch (Exception e) {
            log.error("Error initializing database", e);
            promise.fail(e);
        }

        return promise.future();
    }

    private void initializeServices(ExchangeRateConfig rateConfig) {
        Clock clock = Clock.systemDefaultZone();

        // Repositories
        ExpenseRepository expenseRepository = new JdbcExpensePersistenceAdapter(sqlClient);
        HistoricalRateRepository historicalRateRepository = new JdbcHistoricalRatePersistenceAdapter(sqlClient);
        ExchangeRateHistoryRepository historyRepository = new JdbcExchangeRateHistoryPersistenceAdapter(sqlClient);

        // Live rates
        rateProvider = new ExchangeRateHttpAdapter(vertx, rateConfig);
        cache = new ExchangeRateCache(vertx, rateConfig, clock);
        cache.start();
        LiveRateResolver liveRateResolver = new LiveRateResolver(cache, rateProvider, historyRepository, rateConfig.getFallbackRates());

        // Use cases
        HistoricalRateStore historicalRateStore = new HistoricalRateStore(
                historicalRateRepository, expenseRepository, liveRateResolver, rateConfig.getBaseCurrency(), clock);
        CurrencyConversionUseCase conversionUseCase = new CurrencyConversionService(historicalRateStore, liveRateResolver);
        HistoricalRateUseCase historicalRateUseCase = historicalRateStore;
        RateMigrationUseCase migrationUseCase = new RateMigrationService(
                expenseRepository, historicalRateRepository, historyRepository, liveRateResolver, rateConfig, clock);
        refreshUseCase = new ExchangeRateRefreshService(
                vertx, liveRateResolver, historyRepository, cache, rateConfig, clock);
        RateFreshnessUseCase freshnessUseCase = new RateFreshnessGuard(vertx, historyRepository, refreshUseCase, clock);
        ExchangeRateCacheUseCase cacheUseCase = new ExchangeRateCacheAdminService(cache);

        // Event bus exposure
        eventBusHandler = new ExchangeRateEventBusHandler(vertx, conversionUseCase, historicalRateUseCase,
                migrationUseCase, freshnessUseCase, cacheUseCase, rateConfig.getFreshnessTimeoutMs());
        eventBusHandler.register();

        log.info("Services initialized successfully");
    }
}
