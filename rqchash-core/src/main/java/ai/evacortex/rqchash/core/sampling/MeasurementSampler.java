/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.sampling;

import ai.evacortex.rqchash.core.state.BitRegister;
import ai.evacortex.rqchash.core.state.StateVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Collapses a statevector into one classical outcome.
 *
 * <p>The outcome index is the first {@code i} with {@code u · total < Σ_{j<=i} |ψ_j|²}, where
 * {@code u} is uniform in [0, 1) and {@code total} is the full squared-magnitude sum; scaling
 * {@code u} by the total renormalizes the distribution. The index decodes to a register with
 * bit {@code i = (index >> i) & 1}.</p>
 */
public final class MeasurementSampler {

    private static final Logger LOG = LoggerFactory.getLogger(MeasurementSampler.class);

    /** Drift of the total probability beyond which sampling reports a renormalization. */
    public static final double SAMPLING_TOLERANCE = 1e-6;

    private MeasurementSampler() {}

    /**
     * Samples directly from the amplitudes without allocating; two passes over the state.
     */
    public static BitRegister sample(StateVector state, RandomGenerator random) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(random, "random must not be null");

        double total = checkedTotal(state.norm());
        double target = random.nextDouble() * total;

        double[] re = state.real();
        double[] im = state.imag();
        double acc = 0.0;
        int lastNonZero = -1;
        for (int i = 0; i < re.length; i++) {
            double p = re[i] * re[i] + im[i] * im[i];
            acc += p;
            if (p > 0.0) lastNonZero = i;
            if (target < acc) {
                return BitRegister.fromValue(i, state.nQubits());
            }
        }
        return BitRegister.fromValue(lastNonZero, state.nQubits());
    }

    /**
     * Samples from a precomputed distribution; yields the same outcome as
     * {@link #sample(StateVector, RandomGenerator)} for the same random draw.
     */
    public static BitRegister sample(ProbabilityDistribution distribution, RandomGenerator random) {
        Objects.requireNonNull(distribution, "distribution must not be null");
        Objects.requireNonNull(random, "random must not be null");
        return BitRegister.fromValue(distribution.indexOf(random.nextDouble()), distribution.nQubits());
    }

    static double checkedTotal(double total) {
        if (!(total > 0.0) || Double.isInfinite(total)) {
            throw new IllegalStateException("Cannot sample from a state with total probability " + total);
        }
        if (Math.abs(total - 1.0) > SAMPLING_TOLERANCE) {
            LOG.warn("Total probability {} deviates from 1 beyond {}; renormalizing before sampling",
                    total, SAMPLING_TOLERANCE);
        }
        return total;
    }
}
