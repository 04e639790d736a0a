package com.openisp.ha.controller.process;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command to completion and returns its combined output.
 *
 * Blocking: callers on a reactive path must run it on a worker scheduler.
 */
@Slf4j
public class CommandRunner {

    private final Duration timeout;

    public CommandRunner(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout);
    }

    /**
     * Runs {@code command} and waits for it.
     *
     * @param action what the command does, used as the subject of error messages
     * @return trimmed stdout and stderr
     * @throws IllegalStateException if the command cannot start, times out or exits non-zero
     */
    public String run(String action, List<String> command) {
        return run(action, command, Map.of());
    }

    /**
     * Runs {@code command} with extra environment variables. Secrets go here rather than on
     * the command line, which is logged.
     */
    public String run(String action, List<String> command, Map<String, String> environment) {
        log.debug("{}: {}", action, String.join(" ", command));
        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
            builder.environment().putAll(environment);
            process = builder.start();
        } catch (IOException e) {
            throw new IllegalStateException("Could not run " + String.join(" ", command), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IllegalStateException(action + " timed out after " + timeout);
            }
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                throw new IllegalStateException(action + " exited with " + process.exitValue() + ": " + output);
            }
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IllegalStateException("Interrupted: " + action, e);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read output of " + action, e);
        }
    }

    public Duration getTimeout() {
        return timeout;
    }
}
