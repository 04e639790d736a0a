package com.openisp.ha.controller.replication.impl;

import com.openisp.ha.controller.process.CommandRunner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Points the local Redis at a primary, or detaches it, with {@code redis-cli REPLICAOF}.
 *
 * The CLI prefix is configurable so the call can go through {@code docker exec} when
 * Redis runs in a container. The credential is handed over in {@code REDISCLI_AUTH};
 * through {@code docker exec} it needs {@code -e REDISCLI_AUTH} in the prefix. redis-cli
 * exits 0 even when the server rejects a command, so the reply text is checked as well.
 *
 * Blocking: run on a worker scheduler.
 */
@Slf4j
public class RedisCliCacheReplicator {

    static final String AUTH_VARIABLE = "REDISCLI_AUTH";

    private final List<String> cliCommand;
    private final int cachePort;
    private final CommandRunner commandRunner;

    public RedisCliCacheReplicator(List<String> cliCommand, int cachePort, CommandRunner commandRunner) {
        if (cliCommand == null || cliCommand.isEmpty()) {
            throw new IllegalArgumentException("cliCommand must not be empty");
        }
        this.cliCommand = List.copyOf(cliCommand);
        this.cachePort = cachePort;
        this.commandRunner = Objects.requireNonNull(commandRunner);
    }

    /**
     * @return the server's reply
     */
    public String follow(String mainHost, String credential) {
        String reply = replicaOf(credential, mainHost, Integer.toString(cachePort));
        log.info("Cache now replicating from {}:{} ({})", mainHost, cachePort, reply);
        return reply;
    }

    /**
     * @return the server's reply
     */
    public String detach(String credential) {
        String reply = replicaOf(credential, "NO", "ONE");
        log.info("Cache replication stopped ({})", reply);
        return reply;
    }

    private String replicaOf(String credential, String host, String port) {
        List<String> command = new ArrayList<>(cliCommand);
        command.add("REPLICAOF");
        command.add(host);
        command.add(port);
        Map<String, String> environment = credential != null && !credential.isEmpty()
                ? Map.of(AUTH_VARIABLE, credential)
                : Map.of();

        String reply = commandRunner.run("REPLICAOF " + host + " " + port, command, environment);
        if (isErrorReply(reply)) {
            throw new IllegalStateException("REPLICAOF " + host + " " + port + " rejected: " + reply);
        }
        return reply;
    }

    static boolean isErrorReply(String reply) {
        return reply.startsWith("ERR") || reply.startsWith("(error)") || reply.startsWith("NOAUTH")
                || reply.startsWith("WRONGPASS");
    }
}
