package com.exrate;

import com.exrate.config.ConfigLoader;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        log.info("Starting Expense Exchange Rates...");

        // Load configuration from application.yml
        JsonObject config = ConfigLoader.load();

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        vertx.deployVerticle(new ExchangeRateVerticle(), new DeploymentOptions()
                        .setConfig(config)
                        .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("Exchange Rate Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Expense Exchange Rates...");
                        vertx.close();
                    }));

                    log.info("Expense Exchange Rates is ready, listening on event bus addresses exchange-rate.*");
                })
                .onFailure(error -> {
                    log.error("Failed to deploy Exchange Rate Verticle", error);
                    vertx.close();
                });
    }
}
