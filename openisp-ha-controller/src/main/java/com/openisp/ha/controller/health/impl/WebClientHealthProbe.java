package com.openisp.ha.controller.health.impl;

import com.openisp.ha.controller.health.HealthCheckResult;
import com.openisp.ha.controller.health.IMainHealthProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;

/**
 * Health probe issuing {@code GET http://host:port/health} with a bounded timeout.
 * Only HTTP 200 counts as healthy.
 */
@Slf4j
public class WebClientHealthProbe implements IMainHealthProbe {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientHealthProbe(WebClient webClient, Duration timeout) {
        this.webClient = Objects.requireNonNull(webClient);
        this.timeout = Objects.requireNonNull(timeout);
    }

    @Override
    public Mono<HealthCheckResult> check(String host, int port) {
        String url = "http://" + host + ":" + port + "/health";
        return webClient.get()
                .uri(url)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().value() == 200
                                ? HealthCheckResult.healthy()
                                : HealthCheckResult.unhealthyStatus(response.statusCode().value())))
                .timeout(timeout)
                .onErrorResume(error -> {
                    log.debug("Health check against {} failed", url, error);
                    String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
                    return Mono.just(HealthCheckResult.unreachable(reason));
                });
    }
}
