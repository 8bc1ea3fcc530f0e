package com.redisgl.server;

import java.io.DataInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.redisgl.core.codec.FrameCodec;
import com.redisgl.core.codec.FrameOpcode;

/**
 * Builds what a browser client would put on the wire, and reads what the server sends back.
 */
public final class ClientFrames {

    public static final String SAMPLE_KEY = "dGhlIHNhbXBsZSBub25jZQ==";
    public static final String SAMPLE_ACCEPT = "s3pPLMBiTxaQ9kYGzzhZRbK+xOo=";

    private static final byte[] MASK = {0x11, 0x22, 0x33, 0x44};

    private ClientFrames() {
    }

    public static byte[] handshakeRequest() {
        return ("GET / HTTP/1.1\r\n"
                + "Host: localhost\r\n"
                + "Upgrade: websocket\r\n"
                + "Connection: Upgrade\r\n"
                + "Sec-WebSocket-Key: " + SAMPLE_KEY + "\r\n"
                + "Sec-WebSocket-Version: 13\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
    }

    public static byte[] requestWithoutKey() {
        return "GET / HTTP/1.1\r\nHost: localhost\r\nUpgrade: websocket\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
    }

    public static byte[] masked(int opcode, byte[] payload) {
        byte[] plain = FrameCodec.encodeFrame(opcode, payload);
        int headerLength = FrameCodec.headerLength(payload.length);

        byte[] frame = new byte[plain.length + FrameCodec.MASK_LENGTH];
        System.arraycopy(plain, 0, frame, 0, headerLength);
        frame[1] |= (byte) 0x80;
        System.arraycopy(MASK, 0, frame, headerLength, FrameCodec.MASK_LENGTH);
        byte[] maskedPayload = FrameCodec.mask(payload, MASK);
        System.arraycopy(maskedPayload, 0, frame, headerLength + FrameCodec.MASK_LENGTH, maskedPayload.length);
        return frame;
    }

    public static byte[] binary(byte... payload) {
        return masked(FrameOpcode.BINARY, payload);
    }

    public static byte[] text(String text) {
        return masked(FrameOpcode.TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] close() {
        return masked(FrameOpcode.CLOSE, FrameCodec.CLOSE_SENTINEL);
    }

    public static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        byte[] joined = new byte[length];
        int offset = 0;
        for (byte[] part : parts) {
            System.arraycopy(part, 0, joined, offset, part.length);
            offset += part.length;
        }
        return joined;
    }

    /**
     * Reads an HTTP response head up to and including the blank line.
     */
    public static String readResponseHead(InputStream in) throws IOException {
        StringBuilder sb = new StringBuilder();
        while (!sb.toString().endsWith("\r\n\r\n")) {
            int b = in.read();
            if (b < 0) {
                throw new IOException("Connection closed after " + sb.length() + " byte(s) of response");
            }
            sb.append((char) b);
        }
        return sb.toString();
    }

    /**
     * Reads one unmasked server frame and returns it re-encoded, header included, for
     * comparison with {@link FrameCodec#encode}.
     */
    public static byte[] readServerFrame(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        int first = data.readUnsignedByte();
        int indicator = data.readUnsignedByte() & FrameOpcode.LENGTH_MASK;
        long length;
        if (indicator == FrameOpcode.LENGTH_16) {
            length = data.readUnsignedShort();
        } else if (indicator == FrameOpcode.LENGTH_64) {
            length = data.readLong();
        } else {
            length = indicator;
        }
        byte[] payload = new byte[(int) length];
        data.readFully(payload);
        return FrameCodec.encodeFrame(first & FrameOpcode.OPCODE_MASK, payload);
    }
}
