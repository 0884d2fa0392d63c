package com.yoursp.ledger.modules.biometric;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Vector helpers for face encodings: byte packing for storage and the distance
 * metric used for matching.
 */
public final class FaceEncodings {

    private FaceEncodings() {
        // utility class
    }

    /** Pack as little-endian float64. */
    public static byte[] toBytes(double[] encoding) {
        ByteBuffer buffer = ByteBuffer.allocate(encoding.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (double value : encoding) {
            buffer.putDouble(value);
        }
        return buffer.array();
    }

    public static double[] fromBytes(byte[] bytes) {
        if (bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Encoding length " + bytes.length + " is not a multiple of 8");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        double[] encoding = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < encoding.length; i++) {
            encoding[i] = buffer.getDouble();
        }
        return encoding;
    }

    /**
     * Euclidean (L2) distance. Lower is more similar; 0 means identical.
     */
    public static double euclideanDistance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
