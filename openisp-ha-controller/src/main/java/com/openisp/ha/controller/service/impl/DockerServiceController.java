package com.openisp.ha.controller.service.impl;

import com.openisp.ha.controller.process.CommandRunner;
import com.openisp.ha.controller.service.IDependentServiceController;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Restarts dependent services by restarting their containers with the docker CLI.
 */
@Slf4j
public class DockerServiceController implements IDependentServiceController {

    private final String authServiceContainer;
    private final CommandRunner commandRunner;
    private final List<String> dockerCommand;

    public DockerServiceController(String authServiceContainer, Duration timeout) {
        this(authServiceContainer, timeout, List.of("docker"));
    }

    DockerServiceController(String authServiceContainer, Duration timeout, List<String> dockerCommand) {
        this.authServiceContainer = Objects.requireNonNull(authServiceContainer);
        this.commandRunner = new CommandRunner(timeout);
        this.dockerCommand = List.copyOf(dockerCommand);
    }

    @Override
    public Mono<Void> restartAuthenticationService() {
        return Mono.<Void>fromRunnable(() -> restartContainer(authServiceContainer))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void restartContainer(String container) {
        List<String> command = new ArrayList<>(dockerCommand);
        command.add("restart");
        command.add(container);

        log.info("Restarting container {}", container);
        commandRunner.run("Restart of " + container, command);
        log.info("Container {} restarted", container);
    }
}
