package com.openisp.ha.controller.service;

import reactor.core.publisher.Mono;

/**
 * Trigger point for services that must pick up a new write target after promotion.
 */
public interface IDependentServiceController {

    /**
     * Restarts the authentication/accounting service.
     */
    Mono<Void> restartAuthenticationService();
}
