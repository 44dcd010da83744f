package com.mk.fx.qa.kv.bench.wire.model;

/** Operation carried by a {@link Command}. The byte code is what travels on the wire. */
public enum Operation {
    NONE((byte) 0),
    GET((byte) 1),
    PUT((byte) 2);

    private final byte value;

    Operation(byte value) {
        this.value = value;
    }

    public byte getValue() {
        return value;
    }

    /**
     * Resolves a wire code.
     *
     * @param value the byte read from the stream
     * @return the matching operation
     * @throws IllegalArgumentException if no operation uses that code
     */
    public static Operation fromValue(byte value) {
        for (Operation operation : values()) {
            if (operation.value == value) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unknown operation code: " + value);
    }
}
