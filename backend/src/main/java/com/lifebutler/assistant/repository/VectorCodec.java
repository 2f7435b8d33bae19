package com.lifebutler.assistant.repository;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted vector format: raw little-endian IEEE-754 float64 values, 8 bytes each.
 */
public final class VectorCodec {

    private VectorCodec() {
    }

    public static byte[] toBytes(List<Double> vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.size() * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (Double value : vector) {
            buffer.putDouble(value != null ? value : 0.0);
        }
        return buffer.array();
    }

    public static List<Double> fromBytes(byte[] bytes) {
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Vector blob length " + bytes.length + " is not a multiple of 8");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        List<Double> vector = new ArrayList<>(bytes.length / Double.BYTES);
        while (buffer.hasRemaining()) {
            vector.add(buffer.getDouble());
        }
        return vector;
    }
}
