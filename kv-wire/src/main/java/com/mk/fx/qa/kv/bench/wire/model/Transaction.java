package com.mk.fx.qa.kv.bench.wire.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Batch unit of the quorum register protocol.
 *
 * <p>Commands are kept in ascending key order. The server acquires per-key locks in that order, so
 * an unsorted batch could deadlock against a concurrent transaction touching the same keys. Use
 * {@link #of(List, long, long)} to build one from an arbitrary batch.
 *
 * @param commands the batch, sorted by key
 * @param readOnly true iff every command is a GET
 * @param timestamp submission time in epoch milliseconds, echoed back by the server
 * @param transactionId cumulative operation index reached after this batch
 */
public record Transaction(List<Command> commands, boolean readOnly, long timestamp, long transactionId) {

    private static final Comparator<Command> BY_KEY = Comparator.comparingLong(Command::key);

    public Transaction {
        commands = List.copyOf(Objects.requireNonNull(commands, "commands"));
    }

    /**
     * Builds a transaction from a batch, sorting it by key and deriving the read-only flag.
     *
     * @param batch commands in workload order
     * @param timestamp submission time in epoch milliseconds
     * @param transactionId id to stamp on the transaction
     * @return the sorted transaction
     */
    public static Transaction of(List<Command> batch, long timestamp, long transactionId) {
        List<Command> sorted = new ArrayList<>(batch);
        sorted.sort(BY_KEY);
        boolean readOnly = !sorted.isEmpty() && sorted.stream().allMatch(Command::isRead);
        return new Transaction(sorted, readOnly, timestamp, transactionId);
    }

    public int size() {
        return commands.size();
    }
}
