package com.exrate.adapter.out.http;

import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test for ExchangeRateHttpAdapter against a local stub of the rate API
 */
class ExchangeRateHttpAdapterTest {

    private Vertx vertx;
    private HttpServer server;
    private ExchangeRateHttpAdapter adapter;
    private final AtomicReference<String> lastUri = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        server = vertx.createHttpServer().requestHandler(request -> {
            lastUri.set(request.uri());
            switch (request.path()) {
                case "/latest/EUR":
                    request.response()
                            .putHeader("Content-Type", "application/json")
                            .end(new JsonObject()
                                    .put("base", "EUR")
                                    .put("rates", new JsonObject().put("EUR", 1).put("USD", 1.0842).put("ZAR", 19.87))
                                    .encode());
                    break;
                case "/latest/SLOW":
                    vertx.setTimer(2000, id -> request.response().end("{}"));
                    break;
                case "/latest/BAD":
                    request.response().putHeader("Content-Type", "application/json").end("not json");
                    break;
                default:
                    request.response().setStatusCode(404).end();
            }
        });

        CountDownLatch latch = new CountDownLatch(1);
        server.listen(0).onComplete(ar -> latch.countDown());
        assertTrue(latch.await(5, TimeUnit.SECONDS));

        ExchangeRateConfig config = ExchangeRateConfig.builder()
                .providerBaseUrl("http://localhost:" + server.actualPort() + "/latest/")
                .providerTimeoutMs(500)
                .build();
        adapter = new ExchangeRateHttpAdapter(vertx, config);
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.close();
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
    }

    private AsyncResult<Double> await(Future<Double> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<AsyncResult<Double>> outcome = new AtomicReference<>();
        future.onComplete(ar -> {
            outcome.set(ar);
            latch.countDown();
        });
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        return outcome.get();
    }

    private static ExchangeRateError errorOf(AsyncResult<Double> result) {
        assertTrue(result.failed());
        assertInstanceOf(ExchangeRateException.class, result.cause());
        return ((ExchangeRateException) result.cause()).getError();
    }

    @Test
    void fetchLiveRate_shouldReadTargetCurrencyFromRates() throws InterruptedException {
        AsyncResult<Double> result = await(adapter.fetchLiveRate("EUR", "USD"));

        assertTrue(result.succeeded());
        assertEquals(1.0842, result.result());
    }

    @Test
    void fetchLiveRate_shouldReportMissingCurrencyAsRateNotFound() throws InterruptedException {
        assertEquals(ExchangeRateError.RATE_NOT_FOUND, errorOf(await(adapter.fetchLiveRate("EUR", "XYZ"))));
    }

    @Test
    void fetchLiveRate_shouldReportHttpErrorAsApiUnavailable() throws InterruptedException {
        assertEquals(ExchangeRateError.API_UNAVAILABLE, errorOf(await(adapter.fetchLiveRate("GBP", "EUR"))));
    }

    @Test
    void fetchLiveRate_shouldReportMalformedBodyAsApiUnavailable() throws InterruptedException {
        assertEquals(ExchangeRateError.API_UNAVAILABLE, errorOf(await(adapter.fetchLiveRate("BAD", "EUR"))));
    }

    @Test
    void fetchLiveRate_shouldTimeOut() throws InterruptedException {
        assertEquals(ExchangeRateError.API_UNAVAILABLE, errorOf(await(adapter.fetchLiveRate("SLOW", "EUR"))));
    }

    @Test
    void fetchLiveRate_shouldSendCurrencyAsSinglePathSegment() throws InterruptedException {
        AsyncResult<Double> result = await(adapter.fetchLiveRate("EUR?base=GBP", "USD"));

        assertEquals(ExchangeRateError.API_UNAVAILABLE, errorOf(result));
        assertEquals("/latest/EUR%3Fbase%3DGBP", lastUri.get());
    }

    @Test
    void fetchLiveRate_shouldNotLetCurrencyClimbOutOfBasePath() throws InterruptedException {
        AsyncResult<Double> result = await(adapter.fetchLiveRate("../latest/EUR", "USD"));

        assertEquals(ExchangeRateError.API_UNAVAILABLE, errorOf(result));
        assertEquals("/latest/..%2Flatest%2FEUR", lastUri.get());
    }

    @Test
    void jacksonModules_shouldShareOneVersion() {
        // a mismatched jackson-core breaks bodyAsJsonObject at runtime
        assertEquals(com.fasterxml.jackson.core.json.PackageVersion.VERSION,
                com.fasterxml.jackson.databind.cfg.PackageVersion.VERSION);
    }
}
