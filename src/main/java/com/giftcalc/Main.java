package com.giftcalc;

import com.giftcalc.adapter.in.cli.CurrencyCommandHandler;
import com.giftcalc.infrastructure.config.ConfigLoader;
import com.giftcalc.infrastructure.config.CurrencyModule;
import com.giftcalc.infrastructure.config.CurrencyServiceConfig;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.ExecutionException;

/**
 * Command-line entry point: one invocation, one command, then exit
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Vertx vertx = Vertx.vertx();
        try {
            return ConfigLoader.load(vertx)
                    .map(json -> CurrencyServiceConfig.fromJson(json, System::getenv))
                    .compose(config -> {
                        CurrencyModule module = new CurrencyModule(vertx, config, System::getenv, Clock.systemUTC());
                        CurrencyCommandHandler handler = new CurrencyCommandHandler(
                                module.getFormattingUseCase(),
                                module.getRefreshUseCase(),
                                module.getCacheUseCase(),
                                System.out,
                                System.err);
                        return handler.handle(Arrays.asList(args))
                                .onComplete(ar -> module.close());
                    })
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while running command");
            return CurrencyCommandHandler.EXIT_FAILED;
        } catch (ExecutionException e) {
            log.error("Command failed", e.getCause());
            System.err.println("Error: " + e.getCause().getMessage());
            return CurrencyCommandHandler.EXIT_FAILED;
        } finally {
            vertx.close();
        }
    }
}
