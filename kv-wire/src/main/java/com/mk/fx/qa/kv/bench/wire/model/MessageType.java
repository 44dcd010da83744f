package com.mk.fx.qa.kv.bench.wire.model;

/** Leading message-kind byte of the fast-path protocol frames. */
public enum MessageType {
    PROPOSE((byte) 0),
    PROPOSE_REPLY((byte) 1);

    private final byte value;

    MessageType(byte value) {
        this.value = value;
    }

    public byte getValue() {
        return value;
    }

    public static MessageType fromValue(byte value) {
        for (MessageType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
