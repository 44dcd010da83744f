package com.mk.fx.qa.kv.bench.wire.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import com.mk.fx.qa.kv.bench.wire.model.Response;
import com.mk.fx.qa.kv.bench.wire.model.Transaction;
import lombok.extern.slf4j.Slf4j;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Codec for the quorum register protocol. Every message is a self-describing CBOR document
 * preceded by its length as a 4-byte big-endian integer.
 *
 * <p>A frame whose payload does not decode raises {@link WireFormatException} after the whole
 * frame has been consumed. End of stream and out-of-range lengths surface as plain {@link
 * IOException}s, after which the stream cannot be trusted.
 */
@Slf4j
public class AbdCodec {

    /** Upper bound for a single frame. */
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final ObjectMapper mapper;

    public AbdCodec() {
        this.mapper = CBORMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public void writeTransaction(OutputStream out, Transaction transaction) throws IOException {
        writeFrame(out, transaction);
    }

    public Transaction readTransaction(InputStream in) throws IOException {
        return readFrame(in, Transaction.class);
    }

    public void writeResponse(OutputStream out, Response response) throws IOException {
        writeFrame(out, response);
    }

    public Response readResponse(InputStream in) throws IOException {
        return readFrame(in, Response.class);
    }

    private void writeFrame(OutputStream out, Object message) throws IOException {
        Objects.requireNonNull(message, "message");
        byte[] payload = mapper.writeValueAsBytes(message);
        var data = new DataOutputStream(out);
        data.writeInt(payload.length);
        data.write(payload);
    }

    private <T> T readFrame(InputStream in, Class<T> type) throws IOException {
        var data = new DataInputStream(in);
        int length = data.readInt();
        if (length < 0 || length > MAX_FRAME_BYTES) {
            throw new IOException("Frame length out of range: " + length);
        }
        byte[] payload = new byte[length];
        data.readFully(payload);
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.debug("Undecodable {} frame of {} bytes", type.getSimpleName(), length);
            throw new WireFormatException(
                    "Malformed " + type.getSimpleName() + " frame: " + e.getOriginalMessage(), e);
        }
    }
}
