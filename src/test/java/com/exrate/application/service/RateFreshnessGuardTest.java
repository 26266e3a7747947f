package com.exrate.application.service;

import com.exrate.application.port.in.ExchangeRateRefreshUseCase;
import com.exrate.application.port.out.ExchangeRateHistoryRepository;
import com.exrate.domain.exception.ExchangeRateError;
import com.exrate.domain.exception.ExchangeRateException;
import com.exrate.domain.model.CurrencyPair;
import com.exrate.domain.model.FreshnessResult;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit test for RateFreshnessGuard
 * Uses a real Vertx instance so the timeout timer actually fires
 */
class RateFreshnessGuardTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final Map<CurrencyPair, Double> RATES = Map.of(CurrencyPair.of("EUR", "USD"), 1.08);

    @Mock
    private ExchangeRateHistoryRepository historyRepository;

    @Mock
    private ExchangeRateRefreshUseCase refreshUseCase;

    private Vertx vertx;
    private RateFreshnessGuard guard;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
        guard = new RateFreshnessGuard(vertx, historyRepository, refreshUseCase, MutableClock.at("2026-03-10T10:00:00Z"));
    }

    @AfterEach
    void tearDown() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        vertx.close().onComplete(ar -> latch.countDown());
        latch.await(5, TimeUnit.SECONDS);
        mocks.close();
    }

    private AsyncResult<FreshnessResult> await(Future<FreshnessResult> future) throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<AsyncResult<FreshnessResult>> outcome = new AtomicReference<>();
        future.onComplete(ar -> {
            outcome.set(ar);
            latch.countDown();
        });
        assertTrue(latch.await(5, TimeUnit.SECONDS));
        return outcome.get();
    }

    @Test
    void ensureFreshRates_shouldDoNothingWhenUpdatedToday() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.of(TODAY)));

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.succeeded());
        assertEquals(new FreshnessResult(true, false, false), result.result());
        verifyNoInteractions(refreshUseCase);
    }

    @Test
    void ensureFreshRates_shouldRefreshStaleRates() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.of(TODAY.minusDays(1))));
        when(refreshUseCase.fetchLatestRates()).thenReturn(Future.succeededFuture(RATES));
        when(refreshUseCase.applyRates(RATES)).thenReturn(Future.succeededFuture());

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.succeeded());
        assertEquals(new FreshnessResult(true, true, false), result.result());
        verify(refreshUseCase, times(1)).applyRates(RATES);
    }

    @Test
    void ensureFreshRates_shouldRefreshWhenHistoryIsEmpty() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.empty()));
        when(refreshUseCase.fetchLatestRates()).thenReturn(Future.succeededFuture(RATES));
        when(refreshUseCase.applyRates(RATES)).thenReturn(Future.succeededFuture());

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.result().updated());
    }

    @Test
    void ensureFreshRates_lookupFailureShouldNotBlockWrite() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.failedFuture("ORA-01017"));

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.succeeded());
        assertEquals(FreshnessResult.alreadyFresh(), result.result());
        verifyNoInteractions(refreshUseCase);
    }

    @Test
    void ensureFreshRates_shouldTimeOutAndDiscardLateRefresh() throws InterruptedException {
        Promise<Map<CurrencyPair, Double>> slowFetch = Promise.promise();
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.of(TODAY.minusDays(3))));
        when(refreshUseCase.fetchLatestRates()).thenReturn(slowFetch.future());

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(100));

        assertTrue(result.succeeded());
        assertEquals(FreshnessResult.deadlineExceeded(), result.result());

        slowFetch.complete(RATES);
        Thread.sleep(100);
        verify(refreshUseCase, never()).applyRates(any());
    }

    @Test
    void ensureFreshRates_fetchFailureShouldSurfaceAsApiUnavailable() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.of(TODAY.minusDays(1))));
        when(refreshUseCase.fetchLatestRates()).thenReturn(Future.failedFuture("connection refused"));

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.failed());
        assertEquals(ExchangeRateError.API_UNAVAILABLE, ((ExchangeRateException) result.cause()).getError());
        verify(refreshUseCase, never()).applyRates(any());
    }

    @Test
    void ensureFreshRates_applyFailureShouldReportUnsuccessful() throws InterruptedException {
        when(historyRepository.findLastUpdateDate()).thenReturn(Future.succeededFuture(Optional.of(TODAY.minusDays(1))));
        when(refreshUseCase.fetchLatestRates()).thenReturn(Future.succeededFuture(RATES));
        when(refreshUseCase.applyRates(RATES)).thenReturn(Future.failedFuture("ORA-00001"));

        AsyncResult<FreshnessResult> result = await(guard.ensureFreshRates(5000));

        assertTrue(result.succeeded());
        assertEquals(new FreshnessResult(false, false, false), result.result());
    }
}
