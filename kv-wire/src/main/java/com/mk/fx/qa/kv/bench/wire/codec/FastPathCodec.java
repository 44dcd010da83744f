package com.mk.fx.qa.kv.bench.wire.codec;

import com.mk.fx.qa.kv.bench.wire.model.Command;
import com.mk.fx.qa.kv.bench.wire.model.MessageType;
import com.mk.fx.qa.kv.bench.wire.model.Operation;
import com.mk.fx.qa.kv.bench.wire.model.ProposeMessage;
import com.mk.fx.qa.kv.bench.wire.model.ProposeReply;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-layout little-endian codec for the fast-path protocol.
 *
 * <pre>
 * Propose:      tag(1) commandId(4) op(1) key(8) value(8) timestamp(8)
 * ProposeReply: ok(1) commandId(4) value(8) timestamp(8)
 * </pre>
 */
public final class FastPathCodec {

    /** Propose body length, excluding the message-kind tag. */
    public static final int PROPOSE_BYTES = 4 + 1 + 8 + 8 + 8;

    public static final int REPLY_BYTES = 1 + 4 + 8 + 8;

    private FastPathCodec() {
        throw new UnsupportedOperationException("FastPathCodec cannot be instantiated");
    }

    /** Writes the {@code PROPOSE} tag followed by the proposal record. Does not flush. */
    public static void writePropose(OutputStream out, ProposeMessage propose) throws IOException {
        out.write(MessageType.PROPOSE.getValue());
        ByteBuffer buffer = ByteBuffer.allocate(PROPOSE_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(propose.commandId());
        buffer.put(propose.command().operation().getValue());
        buffer.putLong(propose.command().key());
        buffer.putLong(propose.command().value());
        buffer.putLong(propose.timestamp());
        out.write(buffer.array());
    }

    /**
     * Reads the leading message-kind byte.
     *
     * @throws EOFException at end of stream
     * @throws WireFormatException if the byte is not a known kind
     */
    public static MessageType readMessageType(InputStream in) throws IOException {
        int tag = in.read();
        if (tag < 0) {
            throw new EOFException("Stream ended before message tag");
        }
        try {
            return MessageType.fromValue((byte) tag);
        } catch (IllegalArgumentException e) {
            throw new WireFormatException(e.getMessage(), e);
        }
    }

    /** Reads a proposal body; the tag must already have been consumed. */
    public static ProposeMessage readPropose(InputStream in) throws IOException {
        ByteBuffer buffer = readRecord(in, PROPOSE_BYTES);
        int commandId = buffer.getInt();
        byte op = buffer.get();
        long key = buffer.getLong();
        long value = buffer.getLong();
        long timestamp = buffer.getLong();
        Operation operation;
        try {
            operation = Operation.fromValue(op);
        } catch (IllegalArgumentException e) {
            throw new WireFormatException(e.getMessage(), e);
        }
        return new ProposeMessage(commandId, new Command(operation, key, value), timestamp);
    }

    public static void writeProposeReply(OutputStream out, ProposeReply reply) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(REPLY_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(reply.ok());
        buffer.putInt(reply.commandId());
        buffer.putLong(reply.value());
        buffer.putLong(reply.timestamp());
        out.write(buffer.array());
    }

    /**
     * Reads one reply record.
     *
     * @throws WireFormatException if the status byte is neither 0 nor 1; the record is consumed
     */
    public static ProposeReply readProposeReply(InputStream in) throws IOException {
        ByteBuffer buffer = readRecord(in, REPLY_BYTES);
        byte ok = buffer.get();
        int commandId = buffer.getInt();
        long value = buffer.getLong();
        long timestamp = buffer.getLong();
        if (ok != 0 && ok != 1) {
            throw new WireFormatException("Invalid reply status " + ok + " for command " + commandId);
        }
        return new ProposeReply(ok, commandId, value, timestamp);
    }

    private static ByteBuffer readRecord(InputStream in, int length) throws IOException {
        byte[] bytes = new byte[length];
        new DataInputStream(in).readFully(bytes);
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }
}
