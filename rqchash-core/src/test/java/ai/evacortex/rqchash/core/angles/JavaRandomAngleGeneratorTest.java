/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import ai.evacortex.rqchash.core.exceptions.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class JavaRandomAngleGeneratorTest {

    private final AngleGenerator generator = new JavaRandomAngleGenerator();

    @Test
    void sameArguments_yieldBitIdenticalSchedules() {
        AngleSchedule a = generator.generate(42L, 8, 6);
        AngleSchedule b = generator.generate(42L, 8, 6);
        assertNotSame(a, b);
        assertEquals(a, b);
        assertEquals(a.fingerprint(), b.fingerprint());
        for (int layer = 0; layer < 8; layer++) {
            for (int q = 0; q < 6; q++) {
                assertEquals(Double.doubleToRawLongBits(a.rz(layer, q)), Double.doubleToRawLongBits(b.rz(layer, q)));
                assertEquals(Double.doubleToRawLongBits(a.rx(layer, q)), Double.doubleToRawLongBits(b.rx(layer, q)));
            }
        }
    }

    @Test
    void anglesLieInHalfOpenTurn() {
        AngleSchedule s = generator.generate(-7L, 50, 20);
        for (int layer = 0; layer < 50; layer++) {
            for (int q = 0; q < 20; q++) {
                assertTrue(s.rz(layer, q) >= 0.0 && s.rz(layer, q) < AngleSchedule.TWO_PI);
                assertTrue(s.rx(layer, q) >= 0.0 && s.rx(layer, q) < AngleSchedule.TWO_PI);
            }
        }
    }

    @Test
    void rzAndRxMatrices_useDistinctSequences() {
        AngleSchedule s = generator.generate(0L, 4, 4);
        assertNotEquals(s.rz(0, 0), s.rx(0, 0));
        assertFalse(Arrays.deepEquals(s.rzMatrix(), s.rxMatrix()));
    }

    @Test
    void differentSeeds_yieldDifferentSchedules() {
        AngleSchedule a = generator.generate(1L, 3, 5);
        AngleSchedule b = generator.generate(2L, 3, 5);
        assertNotEquals(a, b);
        assertNotEquals(a.fingerprint(), b.fingerprint());
    }

    @Test
    void zeroDepth_yieldsEmptySchedule() {
        AngleSchedule s = generator.generate(9L, 0, 3);
        assertEquals(0, s.depth());
        assertEquals(3, s.nQubits());
        assertEquals(0, s.rzMatrix().length);
    }

    @Test
    void invalidShape_isRejected() {
        assertThrows(InvalidConfigurationException.class, () -> generator.generate(1L, -1, 4));
        assertThrows(InvalidConfigurationException.class, () -> generator.generate(1L, 4, 0));
    }

    @Test
    @DisplayName("Regression fixture: seed=12345, depth=12, nQubits=16")
    void regressionFixture_helloSchedule() {
        AngleSchedule s = generator.generate(12345L, 12, 16);
        assertEquals(2.274964543627326, s.rz(0, 0), 0.0);
        assertEquals(1.692408416898821, s.rx(0, 0), 0.0);
        assertEquals(0.2766524412161841, s.rz(11, 15), 0.0);
        assertEquals(-745322337740920445L, s.fingerprint());
    }
}
