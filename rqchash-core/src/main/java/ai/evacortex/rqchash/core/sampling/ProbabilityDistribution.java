/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.sampling;

import ai.evacortex.rqchash.core.state.StateVector;

import java.util.Objects;

/**
 * Cumulative outcome distribution of a statevector, built once and sampled many times with a
 * binary search. Immutable and safe to share across workers.
 */
public final class ProbabilityDistribution {

    private final int nQubits;
    private final double[] cumulative;
    private final double total;
    private final int lastNonZero;

    private ProbabilityDistribution(int nQubits, double[] cumulative, int lastNonZero) {
        this.nQubits = nQubits;
        this.cumulative = cumulative;
        this.total = cumulative[cumulative.length - 1];
        this.lastNonZero = lastNonZero;
    }

    public static ProbabilityDistribution of(StateVector state) {
        Objects.requireNonNull(state, "state must not be null");
        double[] re = state.real();
        double[] im = state.imag();
        double[] cumulative = new double[re.length];
        double acc = 0.0;
        int lastNonZero = -1;
        for (int i = 0; i < re.length; i++) {
            double p = re[i] * re[i] + im[i] * im[i];
            acc += p;
            if (p > 0.0) lastNonZero = i;
            cumulative[i] = acc;
        }
        MeasurementSampler.checkedTotal(acc);
        return new ProbabilityDistribution(state.nQubits(), cumulative, lastNonZero);
    }

    /**
     * Maps a uniform draw {@code u} in [0, 1) to the first index whose cumulative mass exceeds
     * {@code u · total}.
     */
    public int indexOf(double u) {
        double target = u * total;
        int lo = 0;
        int hi = cumulative.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cumulative[mid] > target) hi = mid;
            else lo = mid + 1;
        }
        return lo < cumulative.length ? lo : lastNonZero;
    }

    public double probability(int index) {
        double below = index == 0 ? 0.0 : cumulative[index - 1];
        return (cumulative[index] - below) / total;
    }

    public double total() {
        return total;
    }

    public int nQubits() {
        return nQubits;
    }

    public int size() {
        return cumulative.length;
    }
}
