package com.openisp.ha.controller.replication.impl;

import com.openisp.ha.controller.process.CommandRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class RedisCliCacheReplicatorTest {

    private final CommandRunner runner = new CommandRunner(Duration.ofSeconds(10));

    private RedisCliCacheReplicator replicatorRunning(String script) {
        return new RedisCliCacheReplicator(List.of("sh", "-c", script, "redis-cli"), 6379, runner);
    }

    @Test
    @DisplayName("should append REPLICAOF and the main's address to the cli command")
    void shouldFollowMain() {
        RedisCliCacheReplicator replicator = new RedisCliCacheReplicator(List.of("echo"), 6380, runner);

        assertEquals("REPLICAOF 10.0.0.1 6380", replicator.follow("10.0.0.1", ""));
        assertEquals("REPLICAOF NO ONE", replicator.detach(""));
    }

    @Test
    @DisplayName("should pass the credential in the environment, not on the command line")
    void shouldPassCredentialInEnvironment() {
        RedisCliCacheReplicator replicator = replicatorRunning("echo \"$REDISCLI_AUTH|$*\"");

        assertEquals("hunter2|REPLICAOF NO ONE", replicator.detach("hunter2"));
    }

    @Test
    @DisplayName("should fail when the server rejects the command")
    void shouldFailOnErrorReply() {
        RedisCliCacheReplicator replicator = replicatorRunning("echo 'NOAUTH Authentication required.'");

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> replicator.follow("10.0.0.1", ""));
        assertEquals("REPLICAOF 10.0.0.1 6379 rejected: NOAUTH Authentication required.", error.getMessage());
    }

    @Test
    @DisplayName("should fail when redis-cli exits non-zero")
    void shouldFailOnExitCode() {
        RedisCliCacheReplicator replicator = replicatorRunning("echo 'Could not connect to Redis'; exit 1");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> replicator.detach(""));
        assertTrue(error.getMessage().startsWith("REPLICAOF NO ONE exited with 1"));
    }

    @Test
    @DisplayName("should recognise error replies")
    void shouldRecogniseErrorReplies() {
        assertTrue(RedisCliCacheReplicator.isErrorReply("ERR unknown command"));
        assertTrue(RedisCliCacheReplicator.isErrorReply("(error) READONLY You can't write against a read only replica."));
        assertTrue(RedisCliCacheReplicator.isErrorReply("WRONGPASS invalid username-password pair"));
        assertFalse(RedisCliCacheReplicator.isErrorReply("OK"));
        assertFalse(RedisCliCacheReplicator.isErrorReply("OK Already connected to specified master"));
    }
}
