package com.mk.fx.qa.kv.bench.wire.model;

import java.util.List;

/**
 * Acknowledgement of (part of) a {@link Transaction}. A transaction may be acknowledged by several
 * responses whose sizes add up to the original batch size.
 *
 * @param transactionId id of the acknowledged transaction
 * @param timestamp the transaction's submission timestamp, echoed unchanged
 * @param size number of operations acknowledged by this response
 * @param values values returned by read operations, empty for writes
 * @param fastPath true when the server completed on the fast path
 * @param watermark opaque byte passed through as received
 */
public record Response(
        long transactionId, long timestamp, int size, List<Long> values, boolean fastPath, byte watermark) {

    public Response {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean carriesValues() {
        return !values.isEmpty();
    }

    public boolean tookSlowPath() {
        return !fastPath;
    }
}
