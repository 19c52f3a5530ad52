/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import net.jpountz.xxhash.XXHashFactory;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleFingerprintTest {

    private final JavaRandomAngleGenerator generator = new JavaRandomAngleGenerator();

    private static long oneShot(AngleSchedule s) {
        ByteBuffer buffer = ByteBuffer.allocate(8 + s.depth() * s.nQubits() * 2 * Double.BYTES);
        buffer.putInt(s.depth()).putInt(s.nQubits());
        for (int l = 0; l < s.depth(); l++) for (int q = 0; q < s.nQubits(); q++) buffer.putDouble(s.rz(l, q));
        for (int l = 0; l < s.depth(); l++) for (int q = 0; q < s.nQubits(); q++) buffer.putDouble(s.rx(l, q));
        byte[] bytes = buffer.array();
        return XXHashFactory.fastestInstance().hash64().hash(bytes, 0, bytes.length, 0x9747b28cL);
    }

    @Test
    void deepSchedule_spanningManyChunks_matchesSinglePassDigest() {
        AngleSchedule deep = generator.generate(77L, 700, 16);
        assertTrue(8L + 700 * 16 * 2 * Double.BYTES > 10L * ScheduleFingerprint.CHUNK_BYTES);
        assertEquals(oneShot(deep), deep.fingerprint());
    }

    @Test
    void chunkAlignedAndEmptySchedules_matchSinglePassDigest() {
        // header plus 1023 doubles fills the first chunk exactly; the last angle spills over
        AngleSchedule aligned = new AngleSchedule(1, filled(512, 1), filled(512, 1));
        assertEquals(oneShot(aligned), ScheduleFingerprint.compute(aligned));

        AngleSchedule empty = generator.generate(5L, 0, 3);
        assertEquals(oneShot(empty), empty.fingerprint());
    }

    @Test
    void helloSchedule_keepsRecordedFingerprint() {
        assertEquals(-745322337740920445L, ScheduleFingerprint.compute(generator.generate(12345L, 12, 16)));
    }

    private static double[][] filled(int depth, int n) {
        double[][] m = new double[depth][n];
        for (int l = 0; l < depth; l++) for (int q = 0; q < n; q++) m[l][q] = (l * 0.001 + q * 0.01) % AngleSchedule.TWO_PI;
        return m;
    }
}
