/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AngleScheduleTest {

    @Test
    void matrices_areCopiedInAndOut() {
        double[][] rz = {{0.1, 0.2}};
        double[][] rx = {{0.3, 0.4}};
        AngleSchedule s = new AngleSchedule(2, rz, rx);

        rz[0][0] = 1.0;
        assertEquals(0.1, s.rz(0, 0), 0.0);

        double[][] out = s.rxMatrix();
        out[0][1] = 2.0;
        assertEquals(0.4, s.rx(0, 1), 0.0);
    }

    @Test
    void malformedMatrices_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AngleSchedule(2, new double[][]{{0.1}}, new double[][]{{0.1}}));
        assertThrows(IllegalArgumentException.class, () -> new AngleSchedule(1, new double[][]{{0.1}}, new double[0][]));
        assertThrows(IllegalArgumentException.class, () -> new AngleSchedule(1, new double[][]{{-0.1}}, new double[][]{{0.1}}));
        assertThrows(IllegalArgumentException.class, () -> new AngleSchedule(1, new double[][]{{AngleSchedule.TWO_PI}}, new double[][]{{0.1}}));
        assertThrows(IllegalArgumentException.class, () -> new AngleSchedule(1, new double[][]{{Double.NaN}}, new double[][]{{0.1}}));
        assertThrows(NullPointerException.class, () -> new AngleSchedule(1, null, new double[0][]));
    }

    @Test
    void fingerprint_isContentSensitive() {
        AngleSchedule a = new AngleSchedule(2, new double[][]{{0.1, 0.2}}, new double[][]{{0.3, 0.4}});
        AngleSchedule same = new AngleSchedule(2, new double[][]{{0.1, 0.2}}, new double[][]{{0.3, 0.4}});
        AngleSchedule swapped = new AngleSchedule(2, new double[][]{{0.3, 0.4}}, new double[][]{{0.1, 0.2}});

        assertEquals(a.fingerprint(), same.fingerprint());
        assertEquals(a.fingerprint(), ScheduleFingerprint.compute(a));
        assertNotEquals(a.fingerprint(), swapped.fingerprint(), "rz and rx must not be interchangeable");
        assertNotEquals(new AngleSchedule(2, new double[0][], new double[0][]).fingerprint(),
                new AngleSchedule(3, new double[0][], new double[0][]).fingerprint());
    }
}
