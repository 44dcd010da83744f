package com.mk.fx.qa.kv.bench.wire.model;

import java.util.Objects;

/**
 * Single-operation request of the fast-path protocol. Operations of one batch share the timestamp.
 *
 * @param commandId client-side command counter
 * @param command the operation
 * @param timestamp submission time in epoch milliseconds
 */
public record ProposeMessage(int commandId, Command command, long timestamp) {

    public ProposeMessage {
        Objects.requireNonNull(command, "command");
    }
}
