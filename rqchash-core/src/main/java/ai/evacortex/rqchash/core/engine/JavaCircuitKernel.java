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

public final class JavaCircuitKernel implements CircuitKernel {

    @Override
    public void applySingleQubit(StateVector state, GateMatrix gate, int qubit) {
        if (state == null || gate == null) {
            throw new NullPointerException("state and gate must not be null");
        }
        checkQubit(state, qubit);

        final double m00r = gate.m00().real, m00i = gate.m00().imag;
        final double m01r = gate.m01().real, m01i = gate.m01().imag;
        final double m10r = gate.m10().real, m10i = gate.m10().imag;
        final double m11r = gate.m11().real, m11i = gate.m11().imag;

        double[] re = state.real();
        double[] im = state.imag();
        int dim = state.dimension();
        int bit = 1 << qubit;
        int stride = bit << 1;

        for (int block = 0; block < dim; block += stride) {
            int end = block + bit;
            for (int i0 = block; i0 < end; i0++) {
                int i1 = i0 | bit;
                double a0r = re[i0], a0i = im[i0];
                double a1r = re[i1], a1i = im[i1];

                re[i0] = m00r * a0r - m00i * a0i + m01r * a1r - m01i * a1i;
                im[i0] = m00r * a0i + m00i * a0r + m01r * a1i + m01i * a1r;
                re[i1] = m10r * a0r - m10i * a0i + m11r * a1r - m11i * a1i;
                im[i1] = m10r * a0i + m10i * a0r + m11r * a1i + m11i * a1r;
            }
        }
    }

    @Override
    public void applyControlledNot(StateVector state, int control, int target) {
        if (state == null) {
            throw new NullPointerException("state must not be null");
        }
        checkQubit(state, control);
        checkQubit(state, target);
        if (control == target) {
            throw new IllegalArgumentException("control and target must differ: " + control);
        }

        double[] re = state.real();
        double[] im = state.imag();
        int dim = state.dimension();
        int controlBit = 1 << control;
        int targetBit = 1 << target;

        for (int i = 0; i < dim; i++) {
            if ((i & controlBit) == 0 || (i & targetBit) != 0) continue;
            int j = i | targetBit;
            double tr = re[i];
            re[i] = re[j];
            re[j] = tr;
            double ti = im[i];
            im[i] = im[j];
            im[j] = ti;
        }
    }

    private static void checkQubit(StateVector state, int qubit) {
        if (qubit < 0 || qubit >= state.nQubits()) {
            throw new IllegalArgumentException("qubit " + qubit + " out of range [0, " + state.nQubits() + ")");
        }
    }
}
