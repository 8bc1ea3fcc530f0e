package com.redisgl.core.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.redisgl.core.message.BinaryMessage;
import com.redisgl.core.message.DeltaMessage;
import com.redisgl.core.message.Message;
import com.redisgl.core.message.TextMessage;

/**
 * Stateless conversion between application messages and single, unfragmented WebSocket frames.
 *
 * <p>Outbound frames are never masked. Inbound frames are always expected to carry a
 * 4-byte mask key; the mask bit itself is not checked.
 */
public final class FrameCodec {

    /** Payload of a close frame carrying status code 1001 (0x03E9) and no reason. */
    public static final byte[] CLOSE_SENTINEL = {0x03, (byte) 0xE9};

    public static final int MASK_LENGTH = 4;

    private static final int BASE_HEADER_LENGTH = 2;
    private static final int MAX_16_BIT_LENGTH = 0xFFFF;

    private FrameCodec() {
    }

    /**
     * Encodes a message as one frame with the FIN bit set. Text messages use the text
     * opcode, everything else (including flattened delta messages) the binary opcode.
     */
    public static byte[] encode(Message message) {
        switch (message.getType()) {
            case TEXT:
                return encodeFrame(FrameOpcode.TEXT,
                        ((TextMessage) message).getText().getBytes(StandardCharsets.UTF_8));
            case BINARY:
                return encodeFrame(FrameOpcode.BINARY, ((BinaryMessage) message).getData());
            case DELTA:
                return encodeFrame(FrameOpcode.BINARY, flatten((DeltaMessage) message));
            default:
                throw new IllegalArgumentException("Unsupported message type: " + message.getType());
        }
    }

    /**
     * Emits control byte, tiered length field and the payload verbatim.
     */
    public static byte[] encodeFrame(int opcode, byte[] payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(headerLength(payload.length) + payload.length);
        out.write(FrameOpcode.FIN | (opcode & FrameOpcode.OPCODE_MASK));
        writeLength(out, payload.length);
        out.write(payload, 0, payload.length);
        return out.toByteArray();
    }

    /**
     * Lays out a delta as: 32-bit big-endian update count, each key then value as a nested
     * binary frame, 32-bit delete count, each deleted key as a nested binary frame.
     */
    public static byte[] flatten(DeltaMessage delta) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<DeltaMessage.KeyValue> updates = delta.getUpdates();
        writeInt(out, updates.size());
        for (DeltaMessage.KeyValue update : updates) {
            writeField(out, update.getKey());
            writeField(out, update.getValue());
        }
        List<byte[]> deletes = delta.getDeletes();
        writeInt(out, deletes.size());
        for (byte[] key : deletes) {
            writeField(out, key);
        }
        return out.toByteArray();
    }

    /**
     * Decodes one client frame.
     *
     * @param raw the bytes of exactly one frame; trailing bytes past the declared payload are ignored
     * @return the unmasked frame, or empty when the input is empty or the payload is the close sentinel
     * @throws MalformedFrameException if the header, mask key or payload is truncated
     */
    public static Optional<InboundFrame> decode(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return Optional.empty();
        }
        if (raw.length < BASE_HEADER_LENGTH) {
            throw new MalformedFrameException("Frame header truncated: " + raw.length + " byte(s)");
        }
        int opcode = raw[0] & FrameOpcode.OPCODE_MASK;
        int indicator = raw[1] & FrameOpcode.LENGTH_MASK;
        int maskOffset = BASE_HEADER_LENGTH + extendedLengthSize(indicator);
        if (raw.length < maskOffset + MASK_LENGTH) {
            throw new MalformedFrameException("Frame truncated before end of mask key: " + raw.length + " byte(s)");
        }

        long payloadLength;
        if (indicator == FrameOpcode.LENGTH_16) {
            payloadLength = ((raw[2] & 0xFF) << 8) | (raw[3] & 0xFF);
        } else if (indicator == FrameOpcode.LENGTH_64) {
            payloadLength = readLong(raw, BASE_HEADER_LENGTH);
        } else {
            payloadLength = indicator;
        }

        int dataOffset = maskOffset + MASK_LENGTH;
        if (payloadLength < 0 || payloadLength > raw.length - dataOffset) {
            throw new MalformedFrameException("Frame declares " + payloadLength + " payload byte(s) but only "
                    + (raw.length - dataOffset) + " are present");
        }

        byte[] payload = Arrays.copyOfRange(raw, dataOffset, dataOffset + (int) payloadLength);
        applyMask(payload, raw, maskOffset);
        if (Arrays.equals(payload, CLOSE_SENTINEL)) {
            return Optional.empty();
        }
        return Optional.of(new InboundFrame(opcode, payload));
    }

    /**
     * XORs each byte with {@code maskKey[i % 4]}. Applying the same key twice restores the input.
     *
     * @return a new, masked copy of {@code payload}
     */
    public static byte[] mask(byte[] payload, byte[] maskKey) {
        if (maskKey.length != MASK_LENGTH) {
            throw new IllegalArgumentException("Mask key must be " + MASK_LENGTH + " bytes, got " + maskKey.length);
        }
        byte[] masked = payload.clone();
        applyMask(masked, maskKey, 0);
        return masked;
    }

    /**
     * Number of extended length bytes that follow a 7-bit length indicator: 0, 2 or 8.
     */
    public static int extendedLengthSize(int indicator) {
        if (indicator == FrameOpcode.LENGTH_16) {
            return 2;
        }
        if (indicator == FrameOpcode.LENGTH_64) {
            return 8;
        }
        return 0;
    }

    /**
     * Header size of an unmasked frame carrying {@code payloadLength} bytes.
     */
    public static int headerLength(long payloadLength) {
        if (payloadLength < FrameOpcode.LENGTH_16) {
            return BASE_HEADER_LENGTH;
        }
        if (payloadLength <= MAX_16_BIT_LENGTH) {
            return BASE_HEADER_LENGTH + 2;
        }
        return BASE_HEADER_LENGTH + 8;
    }

    private static void applyMask(byte[] payload, byte[] maskKey, int maskOffset) {
        for (int i = 0; i < payload.length; i++) {
            payload[i] ^= maskKey[maskOffset + (i % MASK_LENGTH)];
        }
    }

    private static void writeField(ByteArrayOutputStream out, byte[] field) {
        byte[] nested = encodeFrame(FrameOpcode.BINARY, field);
        out.write(nested, 0, nested.length);
    }

    private static void writeLength(ByteArrayOutputStream out, long length) {
        if (length < FrameOpcode.LENGTH_16) {
            out.write((int) length);
        } else if (length <= MAX_16_BIT_LENGTH) {
            out.write(FrameOpcode.LENGTH_16);
            out.write((int) (length >>> 8) & 0xFF);
            out.write((int) length & 0xFF);
        } else {
            out.write(FrameOpcode.LENGTH_64);
            for (int shift = 56; shift >= 0; shift -= 8) {
                out.write((int) (length >>> shift) & 0xFF);
            }
        }
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static long readLong(byte[] bytes, int offset) {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value = (value << 8) | (bytes[offset + i] & 0xFF);
        }
        return value;
    }
}
