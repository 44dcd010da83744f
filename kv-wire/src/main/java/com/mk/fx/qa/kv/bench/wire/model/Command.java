package com.mk.fx.qa.kv.bench.wire.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

/**
 * Atomic unit of work against a single register.
 *
 * @param operation what to do with the register
 * @param key register identifier
 * @param value payload for a PUT, ignored otherwise
 */
public record Command(Operation operation, long key, long value) {

    public Command {
        Objects.requireNonNull(operation, "operation");
    }

    public static Command get(long key) {
        return new Command(Operation.GET, key, 0L);
    }

    public static Command put(long key, long value) {
        return new Command(Operation.PUT, key, value);
    }

    @JsonIgnore
    public boolean isRead() {
        return operation == Operation.GET;
    }
}
