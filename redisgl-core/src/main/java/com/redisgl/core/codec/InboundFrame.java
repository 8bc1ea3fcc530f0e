package com.redisgl.core.codec;

import lombok.Getter;

/**
 * A decoded client frame: the opcode from the header and the unmasked payload.
 * The payload is handed to the application as-is; the opcode is informational.
 */
@Getter
public class InboundFrame {

    private final int opcode;
    private final byte[] payload;

    public InboundFrame(int opcode, byte[] payload) {
        this.opcode = opcode;
        this.payload = payload;
    }

    public boolean isText() {
        return opcode == FrameOpcode.TEXT;
    }

    @Override
    public String toString() {
        return "InboundFrame[opcode=" + opcode + ", length=" + payload.length + "]";
    }
}
