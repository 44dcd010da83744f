package com.mk.fx.qa.kv.bench.wire.codec;

import java.io.IOException;

/**
 * A frame or record was fully consumed from the stream but its content could not be decoded. The
 * stream stays aligned, so the reader may continue with the next message.
 */
public class WireFormatException extends IOException {

    public WireFormatException(String message) {
        super(message);
    }

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
