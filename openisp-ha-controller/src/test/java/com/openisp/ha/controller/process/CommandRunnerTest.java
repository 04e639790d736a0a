package com.openisp.ha.controller.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandRunnerTest {

    private final CommandRunner runner = new CommandRunner(Duration.ofSeconds(10));

    @Test
    @DisplayName("should return the trimmed output")
    void shouldReturnOutput() {
        assertEquals("hello world", runner.run("Greeting", List.of("echo", "hello", "world")));
    }

    @Test
    @DisplayName("should include stderr in the output")
    void shouldMergeStderr() {
        assertEquals("oops", runner.run("Complaint", List.of("sh", "-c", "echo oops >&2")));
    }

    @Test
    @DisplayName("should expose extra environment variables to the command")
    void shouldPassEnvironment() {
        assertEquals("s3cret", runner.run("Lookup", List.of("sh", "-c", "echo $TOKEN"), Map.of("TOKEN", "s3cret")));
    }

    @Test
    @DisplayName("should report the exit code and output of a failed command")
    void shouldFailOnNonZeroExit() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> runner.run("Cleanup", List.of("sh", "-c", "echo no space left; exit 3")));

        assertEquals("Cleanup exited with 3: no space left", error.getMessage());
    }

    @Test
    @DisplayName("should kill a command that outlives the timeout")
    void shouldTimeOut() {
        CommandRunner impatient = new CommandRunner(Duration.ofMillis(200));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> impatient.run("Slow start", List.of("sleep", "5")));

        assertEquals("Slow start timed out after PT0.2S", error.getMessage());
    }

    @Test
    @DisplayName("should fail when the binary does not exist")
    void shouldFailWhenBinaryMissing() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> runner.run("Nothing", List.of("/nonexistent/binary")));

        assertEquals("Could not run /nonexistent/binary", error.getMessage());
    }
}
