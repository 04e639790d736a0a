package com.openisp.ha.controller.health;

import reactor.core.publisher.Mono;

/**
 * Polls the liveness endpoint of the current main server.
 *
 * Implementations never signal an error: network failures and non-200 answers
 * are both reported as an unhealthy {@link HealthCheckResult}.
 */
public interface IMainHealthProbe {

    Mono<HealthCheckResult> check(String host, int port);
}
