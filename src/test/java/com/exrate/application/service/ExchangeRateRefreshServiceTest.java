package com.exrate.application.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import org.mockito.Mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import org.mockito.MockitoAnnotations;

import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.application.port.out.ExchangeRateProvider;
import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;

import io.vertx.core.Future;
import io.vertx.core.Vertx;

/**
 * Unit test for ExchangeRateRefreshService
 * Tests the use case implementation in isolation using mocks
 */
class ExchangeRateRefreshServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private ExchangeRateProvider rateProvider;

    @Mock
    private ExchangeRateHistoryRepository repository;

    private Vertx vertx;
    private ExchangeRateCache cache;
    private ExchangeRateRefreshService service;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        MutableClock clock = MutableClock.at("2026-03-10T10:00:00Z");
        ExchangeRateConfig config = ExchangeRateConfig.builder()
                .baseCurrency("EUR")
                .supportedCurrencies(List.of("EUR", "USD", "GBP"))
                .build();
        cache = new ExchangeRateCache(vertx, config, clock);
        service = new ExchangeRateRefreshService(vertx, new LiveRateResolver(cache, rateProvider, repository, Map.of()), repository, cache, config, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        service.stopPeriodicRefresh();
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
        if (mocks != null) {
            mocks.close();
        }
    }

    private void givenProviderRates() {
        when(rateProvider.fetchLiveRate("EUR", "USD")).thenReturn(Future.succeededFuture(1.08));
        when(rateProvider.fetchLiveRate("USD", "EUR")).thenReturn(Future.succeededFuture(0.925));
        when(rateProvider.fetchLiveRate("EUR", "GBP")).thenReturn(Future.succeededFuture(0.85));
        when(rateProvider.fetchLiveRate("GBP", "EUR")).thenReturn(Future.succeededFuture(1.17));
    }

    @Test
    void refreshRates_shouldFetchAndSaveRates() throws InterruptedException {
        // Given
        givenProviderRates();
        when(repository.saveRate(anyString(), anyString(), anyDouble(), any())).thenReturn(Future.succeededFuture());

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.refreshRates()
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.succeeded());
                    verify(repository, times(1)).saveRate(eq("EUR"), eq("USD"), eq(1.08), eq(TODAY));
                    verify(repository, times(1)).saveRate(eq("USD"), eq("EUR"), eq(0.925), eq(TODAY));
                    verify(repository, times(1)).saveRate(eq("EUR"), eq("GBP"), eq(0.85), eq(TODAY));
                    verify(repository, times(1)).saveRate(eq("GBP"), eq("EUR"), eq(1.17), eq(TODAY));
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        // And the cache is warm
        assertEquals(Optional.of(1.17), cache.get("GBP", "EUR"));
    }

    @Test
    void refreshRates_shouldBypassCachedRates() throws InterruptedException {
        // Given a cached rate that is still within its TTL
        cache.getOrFetch("EUR", "USD", () -> Future.succeededFuture(1.01), false);
        givenProviderRates();
        when(repository.saveRate(anyString(), anyString(), anyDouble(), any())).thenReturn(Future.succeededFuture());

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.refreshRates()
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.succeeded());
                    verify(rateProvider, times(1)).fetchLiveRate("EUR", "USD");
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(1.08), cache.get("EUR", "USD"));
    }

    @Test
    void refreshRates_shouldHandleProviderFailure() throws InterruptedException {
        // Given
        when(rateProvider.fetchLiveRate(anyString(), anyString())).thenReturn(Future.failedFuture("Network error"));

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.refreshRates()
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.failed());
                    assertEquals(ExchangeRateError.API_UNAVAILABLE, ((ExchangeRateException) ar.cause()).getError());
                    verify(repository, never()).saveRate(anyString(), anyString(), anyDouble(), any());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void fetchLatestRates_shouldTolerateSinglePairFailure() throws InterruptedException {
        // Given
        givenProviderRates();
        when(rateProvider.fetchLiveRate("GBP", "EUR")).thenReturn(Future.failedFuture("Not quoted"));

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.fetchLatestRates()
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.succeeded());
                    Map<CurrencyPair, Double> rates = ar.result();
                    assertEquals(3, rates.size());
                    assertEquals(0.85, rates.get(CurrencyPair.of("EUR", "GBP")));
                    assertTrue(!rates.containsKey(CurrencyPair.of("GBP", "EUR")));
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void refreshRates_shouldHandleRepositoryFailure() throws InterruptedException {
        // Given
        givenProviderRates();
        when(repository.saveRate(anyString(), anyString(), anyDouble(), any())).thenReturn(Future.failedFuture("Database error"));

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.refreshRates()
                .onComplete(ar -> {
                    // Then - sequential saves stop at the first failure
                    assertTrue(ar.failed());
                    verify(repository, times(1)).saveRate(anyString(), anyString(), anyDouble(), any());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals(0, cache.size());
    }

    @Test
    void startPeriodicRefresh_shouldPerformInitialRefresh() throws InterruptedException {
        // Given
        givenProviderRates();
        when(repository.saveRate(anyString(), anyString(), anyDouble(), any())).thenReturn(Future.succeededFuture());

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.startPeriodicRefresh()
                .onComplete(ar -> {
                    // Then - initial refresh should have been called
                    assertTrue(ar.succeeded());
                    verify(rateProvider, times(1)).fetchLiveRate("EUR", "USD");
                    verify(repository, times(1)).saveRate(eq("EUR"), eq("USD"), eq(1.08), eq(TODAY));
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void startPeriodicRefresh_shouldStartEvenIfInitialRefreshFails() throws InterruptedException {
        // Given
        when(rateProvider.fetchLiveRate(anyString(), anyString())).thenReturn(Future.failedFuture("Network error"));

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.startPeriodicRefresh()
                .onComplete(ar -> {
                    // Then
                    assertTrue(ar.succeeded());
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    void stopPeriodicRefresh_shouldCancelTimer() throws InterruptedException {
        // Given
        givenProviderRates();
        when(repository.saveRate(anyString(), anyString(), anyDouble(), any())).thenReturn(Future.succeededFuture());

        CountDownLatch latch = new CountDownLatch(1);

        // When
        service.startPeriodicRefresh()
                .onComplete(ar -> {
                    assertTrue(ar.succeeded());

                    // Stop the service
                    service.stopPeriodicRefresh();

                    // Then - should be able to call stop multiple times safely
                    service.stopPeriodicRefresh();
                    latch.countDown();
                });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }
}
