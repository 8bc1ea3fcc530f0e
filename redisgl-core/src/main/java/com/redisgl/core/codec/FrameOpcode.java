package com.redisgl.core.codec;

/**
 * Frame header constants.
 */
public final class FrameOpcode {

    public static final int TEXT = 0x1;
    public static final int BINARY = 0x2;
    public static final int CLOSE = 0x8;

    /** Final-fragment flag, always set on frames this server emits. */
    public static final int FIN = 0x80;

    public static final int OPCODE_MASK = 0x0F;
    public static final int LENGTH_MASK = 0x7F;

    /** 7-bit length indicator announcing a 16-bit extended length. */
    public static final int LENGTH_16 = 126;
    /** 7-bit length indicator announcing a 64-bit extended length. */
    public static final int LENGTH_64 = 127;

    private FrameOpcode() {
    }
}
