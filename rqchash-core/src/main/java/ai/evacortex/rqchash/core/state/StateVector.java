/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.state;

import ai.evacortex.rqchash.core.exceptions.ResourceLimitExceededException;
import ai.evacortex.rqchash.core.math.Complex;

import java.util.Arrays;

/**
 * Owned amplitude buffer of an {@code n}-qubit pure state: {@code 2^n} complex amplitudes kept as
 * split real/imaginary arrays. Index bit {@code i} is qubit {@code i} (LSB-first).
 *
 * <p>A {@code StateVector} belongs to exactly one trial at a time. Workers reuse one buffer across
 * their trials through {@link #resetToBasis(long)}; the backing arrays returned by {@link #real()}
 * and {@link #imag()} are exposed without copying so gate kernels can update them in place.</p>
 */
public final class StateVector {

    /** Largest register whose amplitude arrays are addressable with {@code int} indices. */
    public static final int MAX_SUPPORTED_QUBITS = 30;

    private final int nQubits;
    private final double[] re;
    private final double[] im;

    private StateVector(int nQubits) {
        this.nQubits = nQubits;
        int dim = 1 << nQubits;
        this.re = new double[dim];
        this.im = new double[dim];
    }

    /**
     * Allocates a buffer set to the basis state {@code |index⟩}.
     *
     * @throws ResourceLimitExceededException if {@code nQubits} exceeds {@link #MAX_SUPPORTED_QUBITS}
     */
    public static StateVector basis(int nQubits, long index) {
        if (nQubits <= 0) {
            throw new IllegalArgumentException("nQubits must be > 0, got " + nQubits);
        }
        if (nQubits > MAX_SUPPORTED_QUBITS) {
            throw new ResourceLimitExceededException("statevector of " + nQubits + " qubits exceeds hard limit of "
                    + MAX_SUPPORTED_QUBITS + " (" + bytesFor(nQubits) + " bytes)");
        }
        StateVector state = new StateVector(nQubits);
        state.resetToBasis(index);
        return state;
    }

    /**
     * Heap footprint of the amplitude buffers for {@code nQubits}: {@code 2^n} × 16 bytes.
     */
    public static long bytesFor(int nQubits) {
        return 16L << nQubits;
    }

    public void resetToBasis(long index) {
        if (index < 0 || index >= re.length) {
            throw new IndexOutOfBoundsException("basis index " + index + " outside [0, " + re.length + ")");
        }
        Arrays.fill(re, 0.0);
        Arrays.fill(im, 0.0);
        re[(int) index] = 1.0;
    }

    public int nQubits() {
        return nQubits;
    }

    public int dimension() {
        return re.length;
    }

    public double[] real() {
        return re;
    }

    public double[] imag() {
        return im;
    }

    public Complex amplitude(int index) {
        return new Complex(re[index], im[index]);
    }

    public double probability(int index) {
        return re[index] * re[index] + im[index] * im[index];
    }

    /**
     * Sum of squared magnitudes, accumulated in index order.
     */
    public double norm() {
        double sum = 0.0;
        for (int i = 0; i < re.length; i++) {
            sum += re[i] * re[i] + im[i] * im[i];
        }
        return sum;
    }

    public StateVector copy() {
        StateVector copy = new StateVector(nQubits);
        System.arraycopy(re, 0, copy.re, 0, re.length);
        System.arraycopy(im, 0, copy.im, 0, im.length);
        return copy;
    }
}
