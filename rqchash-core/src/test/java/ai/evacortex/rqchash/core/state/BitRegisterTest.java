/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BitRegisterTest {

    @Test
    void valueAndBits_agree() {
        BitRegister reg = BitRegister.fromBits(new boolean[]{true, false, true, true});
        assertEquals(0b1101L, reg.value());
        assertEquals("1101", reg.toBitString());
        assertEquals("d", reg.toHex());
        assertArrayEquals(new boolean[]{true, false, true, true}, reg.toBooleanArray());
        assertEquals(reg, BitRegister.fromValue(13L, 4));
    }

    @Test
    void hex_isPaddedToNibbleCount() {
        assertEquals("0905", BitRegister.fromValue(2309L, 16).toHex());
        assertEquals("001", BitRegister.fromValue(1L, 9).toHex());
        assertEquals("0", BitRegister.fromValue(0L, 1).toHex());
    }

    @Test
    void ordering_followsNumericValue() {
        List<BitRegister> regs = new ArrayList<>(List.of(
                BitRegister.fromValue(5L, 3), BitRegister.fromValue(0L, 3), BitRegister.fromValue(7L, 3)));
        Collections.sort(regs);
        assertEquals(List.of(BitRegister.fromValue(0L, 3), BitRegister.fromValue(5L, 3), BitRegister.fromValue(7L, 3)), regs);
    }

    @Test
    void invalidShapes_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> BitRegister.fromValue(8L, 3));
        assertThrows(IllegalArgumentException.class, () -> BitRegister.fromValue(-1L, 3));
        assertThrows(IllegalArgumentException.class, () -> BitRegister.fromValue(0L, 0));
        assertThrows(IllegalArgumentException.class, () -> BitRegister.fromBits(new boolean[64]));
        assertThrows(IndexOutOfBoundsException.class, () -> BitRegister.fromValue(1L, 3).get(3));
    }
}
