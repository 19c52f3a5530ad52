/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.state;

import ai.evacortex.rqchash.core.exceptions.InvalidConfigurationException;

import java.util.Objects;

/**
 * Maps an input message onto the initial computational basis state of the circuit.
 */
public final class StatePreparation {

    private StatePreparation() {}

    /**
     * Unpacks the first {@code nQubits} message bits, LSB-first per byte and in byte order.
     * Qubits past the end of the message are {@code false}.
     */
    public static BitRegister prepare(Message message, int nQubits) {
        Objects.requireNonNull(message, "message must not be null");
        if (nQubits <= 0) {
            throw new InvalidConfigurationException("nQubits must be > 0, got " + nQubits);
        }
        if (nQubits > BitRegister.MAX_LENGTH) {
            throw new InvalidConfigurationException("nQubits must be <= " + BitRegister.MAX_LENGTH + ", got " + nQubits);
        }
        boolean[] bits = new boolean[nQubits];
        for (int i = 0; i < nQubits; i++) {
            bits[i] = message.bit(i);
        }
        return BitRegister.fromBits(bits);
    }

    public static StateVector toBasisState(BitRegister register) {
        Objects.requireNonNull(register, "register must not be null");
        return StateVector.basis(register.length(), register.value());
    }
}
