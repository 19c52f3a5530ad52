/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.sampling;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

/**
 * Supplies the measurement randomness of each trial. Deliberately separate from the angle
 * generator: sampling must vary from shot to shot while the circuit stays fixed.
 *
 * <p>{@link #forTrial(long)} may be called concurrently from several workers.</p>
 */
@FunctionalInterface
public interface TrialRandomSource {

    long GOLDEN_GAMMA = 0x9e3779b97f4a7c15L;

    RandomGenerator forTrial(long trialIndex);

    /**
     * Non-reproducible source; every trial gets a freshly seeded {@link SplittableRandom}.
     */
    static TrialRandomSource entropy() {
        return trialIndex -> new SplittableRandom();
    }

    /**
     * Reproducible source for tests and fixtures. Trial {@code t} draws from
     * {@code new SplittableRandom(seed + t * 0x9e3779b97f4a7c15)}, which depends only on the
     * trial index, never on which worker runs the trial.
     */
    static TrialRandomSource seeded(long seed) {
        return trialIndex -> new SplittableRandom(seed + trialIndex * GOLDEN_GAMMA);
    }
}
