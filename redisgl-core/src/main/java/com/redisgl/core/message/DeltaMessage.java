package com.redisgl.core.message;

import java.nio.charset.StandardCharsets;
import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.Value;

/**
 * Incremental key/value state update: an ordered list of keys to upsert with their
 * values, followed by a list of keys to delete. Sent to clients as one binary frame.
 */
@Getter
public class DeltaMessage extends Message {

    private final List<KeyValue> updates;
    private final List<byte[]> deletes;

    @Builder
    private DeltaMessage(@Singular("updateEntry") List<KeyValue> updates,
            @Singular("deleteKey") List<byte[]> deletes) {
        super(MessageType.DELTA);
        this.updates = updates;
        this.deletes = deletes;
    }

    @Override
    public String toString() {
        return "DeltaMessage[updates=" + updates.size() + ", deletes=" + deletes.size() + "]";
    }

    @Value
    public static class KeyValue {
        byte[] key;
        byte[] value;
    }

    public static class DeltaMessageBuilder {

        public DeltaMessageBuilder update(byte[] key, byte[] value) {
            return updateEntry(new KeyValue(key, value));
        }

        public DeltaMessageBuilder update(String key, String value) {
            return update(key.getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
        }

        public DeltaMessageBuilder delete(byte[] key) {
            return deleteKey(key);
        }

        public DeltaMessageBuilder delete(String key) {
            return delete(key.getBytes(StandardCharsets.UTF_8));
        }
    }
}
