package com.openisp.ha.controller.rest;

import com.openisp.ha.controller.exception.ClusterControllerException;
import com.openisp.ha.controller.rest.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Maps controller errors onto HTTP answers.
 *
 * <ul>
 *   <li>CONFIGURATION - 400</li>
 *   <li>AUTHENTICATION - 401</li>
 *   <li>FATAL_PIPELINE, PEER - 502</li>
 *   <li>anything else - 500</li>
 * </ul>
 */
@Slf4j
final class ClusterErrorResponses {

    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private ClusterErrorResponses() {
    }

    static <T> Mono<ResponseEntity<ApiResponse<T>>> of(String operation, Throwable error) {
        if (error instanceof ClusterControllerException clusterError) {
            HttpStatus status = statusFor(clusterError);
            if (status.is5xxServerError()) {
                log.error("{} failed: {}", operation, error.getMessage());
            } else {
                log.warn("{} rejected: {}", operation, error.getMessage());
            }
            return Mono.just(ResponseEntity.status(status)
                    .body(ApiResponse.error(error.getMessage(), clusterError.getCategory().name())));
        }
        log.error("{} failed unexpectedly", operation, error);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(error.getMessage(), INTERNAL_ERROR)));
    }

    static HttpStatus statusFor(ClusterControllerException error) {
        return switch (error.getCategory()) {
            case CONFIGURATION -> HttpStatus.BAD_REQUEST;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case FATAL_PIPELINE, PEER -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
