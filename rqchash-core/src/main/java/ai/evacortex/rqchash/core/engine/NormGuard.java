/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.engine;

import java.util.Locale;

/**
 * How often {@link CircuitSimulator} verifies the norm invariant. Each check costs one
 * {@code O(2^n)} pass over the amplitudes.
 */
public enum NormGuard {
    /** After every single-qubit and entangling gate. */
    PER_GATE,
    /** After every complete layer. */
    PER_LAYER,
    OFF;

    public static NormGuard parse(String value) {
        try {
            return NormGuard.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown norm guard: " + value, e);
        }
    }
}
