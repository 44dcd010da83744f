package com.mk.fx.qa.kv.bench.wire.model;

/**
 * Reply to a {@link ProposeMessage}.
 *
 * @param ok 1 when the command committed
 * @param commandId id of the proposal
 * @param value value read, 0 for writes
 * @param timestamp the proposal's timestamp, echoed unchanged
 */
public record ProposeReply(byte ok, int commandId, long value, long timestamp) {}
