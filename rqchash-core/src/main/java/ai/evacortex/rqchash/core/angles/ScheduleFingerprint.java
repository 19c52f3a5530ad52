/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import net.jpountz.xxhash.StreamingXXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;

/**
 * XXHash64 digest of an {@link AngleSchedule}.
 *
 * <p>Input layout (big-endian): {@code depth:int32}, {@code nQubits:int32}, then every
 * rz angle row-major followed by every rx angle row-major, each as IEEE-754 {@code float64}.
 * Two schedules share a fingerprint only if they are bit-identical (up to hash collisions).</p>
 *
 * <p>The input is streamed through a fixed chunk, so memory use does not grow with depth.</p>
 */
public final class ScheduleFingerprint {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;
    static final int CHUNK_BYTES = 8 * 1024;

    private ScheduleFingerprint() {}

    public static long compute(AngleSchedule schedule) {
        int depth = schedule.depth();
        int n = schedule.nQubits();
        ByteBuffer chunk = ByteBuffer.allocate(CHUNK_BYTES);
        try (StreamingXXHash64 hash = XX_HASH.newStreamingHash64(SEED)) {
            chunk.putInt(depth);
            chunk.putInt(n);
            for (int layer = 0; layer < depth; layer++) {
                for (int q = 0; q < n; q++) put(hash, chunk, schedule.rz(layer, q));
            }
            for (int layer = 0; layer < depth; layer++) {
                for (int q = 0; q < n; q++) put(hash, chunk, schedule.rx(layer, q));
            }
            hash.update(chunk.array(), 0, chunk.position());
            return hash.getValue();
        }
    }

    private static void put(StreamingXXHash64 hash, ByteBuffer chunk, double angle) {
        if (chunk.remaining() < Double.BYTES) {
            hash.update(chunk.array(), 0, chunk.position());
            chunk.clear();
        }
        chunk.putDouble(angle);
    }
}
