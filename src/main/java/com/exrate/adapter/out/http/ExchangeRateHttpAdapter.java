package com.exrate.adapter.out.http;

import com.exrate.application.port.out.ExchangeRateProvider;
import com.exrate.config.ExchangeRateConfig;
import com.exrate.domain.exception.ExchangeRateException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * HTTP adapter to fetch exchange rates from an external rate API
 * Implements ExchangeRateProvider output port
 * Part of hexagonal architecture - adapter layer
 * <p>
 * Calls {@code GET {baseUrl}/{from}} and reads {@code rates.{to}} from the JSON body.
 */
@Slf4j
public class ExchangeRateHttpAdapter implements ExchangeRateProvider {

    private final WebClient webClient;
    private final String baseUrl;
    private final long timeoutMs;

    public ExchangeRateHttpAdapter(Vertx vertx, ExchangeRateConfig config) {
        this(WebClient.create(vertx, new WebClientOptions().setUserAgent("expense-exchange-rates")),
                config.getProviderBaseUrl(), config.getProviderTimeoutMs());
    }

    ExchangeRateHttpAdapter(WebClient webClient, String baseUrl, long timeoutMs) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public Future<Double> fetchLiveRate(String fromCurrency, String toCurrency) {
        String url = baseUrl + "/" + pathSegment(fromCurrency);
        log.debug("Fetching exchange rate {}->{} from {}", fromCurrency, toCurrency, url);

        return webClient.getAbs(url)
                .timeout(timeoutMs)
                .send()
                .recover(error -> Future.failedFuture(ExchangeRateException.apiUnavailable(fromCurrency, toCurrency, error)))
                .compose(response -> readRate(response, fromCurrency, toCurrency))
                .onSuccess(rate -> log.debug("Fetched rate {}->{}: {}", fromCurrency, toCurrency, rate))
                .onFailure(error -> log.error("Failed to fetch rate {}->{}: {}", fromCurrency, toCurrency, error.getMessage()));
    }

    /**
     * Release the underlying HTTP connections
     */
    public void close() {
        webClient.close();
    }

    // currency codes are opaque, so they may not add path segments or a query
    private static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private Future<Double> readRate(HttpResponse<?> response, String fromCurrency, String toCurrency) {
        if (response.statusCode() != 200) {
            return Future.failedFuture(ExchangeRateException.apiUnavailable(fromCurrency, toCurrency,
                    new IllegalStateException("HTTP " + response.statusCode())));
        }

        JsonObject rates;
        try {
            JsonObject body = response.bodyAsJsonObject();
            rates = body != null ? body.getJsonObject("rates") : null;
        } catch (RuntimeException e) {
            return Future.failedFuture(ExchangeRateException.apiUnavailable(fromCurrency, toCurrency, e));
        }

        Number rate = rates != null ? rates.getNumber(toCurrency) : null;
        if (rate == null) {
            return Future.failedFuture(ExchangeRateException.rateNotFound(fromCurrency, toCurrency));
        }
        return Future.succeededFuture(rate.doubleValue());
    }
}
