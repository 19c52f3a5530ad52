/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.engine;

import ai.evacortex.rqchash.core.math.GateMatrix;
import ai.evacortex.rqchash.core.state.StateVector;

/**
 * {@code CircuitKernel} applies elementary gates to a {@link StateVector} in place.
 *
 * <p>A single-qubit gate on qubit {@code q} is a local 2×2 map over each of the {@code 2^(n-1)}
 * amplitude pairs whose indices differ only in bit {@code q}:</p>
 * <pre>
 *     | a0' |   | m00  m01 | | a0 |
 *     | a1' | = | m10  m11 | | a1 |,    a0 = ψ[i],  a1 = ψ[i | 1 &lt;&lt; q],  bit q of i clear
 * </pre>
 *
 * <p>The controlled NOT is a pure permutation: for every index with the control bit set,
 * the amplitudes at target bit 0 and 1 are swapped.</p>
 *
 * <p>Both operations cost {@code O(2^n)}. Given a unitary matrix they preserve the squared-magnitude
 * norm up to floating-point rounding; implementations must not renormalize.</p>
 *
 * @see JavaCircuitKernel
 * @see CircuitSimulator
 */
public interface CircuitKernel {

    /**
     * Applies a 2×2 gate to one qubit.
     *
     * @param state  state to update in place
     * @param gate   gate matrix
     * @param qubit  target qubit in {@code [0, n)}
     * @throws IllegalArgumentException if the qubit is out of range
     * @throws NullPointerException if {@code state} or {@code gate} is {@code null}
     */
    void applySingleQubit(StateVector state, GateMatrix gate, int qubit);

    /**
     * Applies a controlled NOT as an amplitude permutation.
     *
     * @param state   state to update in place
     * @param control control qubit in {@code [0, n)}
     * @param target  target qubit in {@code [0, n)}, distinct from {@code control}
     * @throws IllegalArgumentException if a qubit is out of range or control equals target
     * @throws NullPointerException if {@code state} is {@code null}
     */
    void applyControlledNot(StateVector state, int control, int target);
}
