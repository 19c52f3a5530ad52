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

import java.util.Random;

/**
 * Angle generator backed by {@link java.util.Random}, whose algorithm (48-bit LCG) is fixed by its
 * specification and therefore stable across JVMs.
 *
 * <p>Seed derivation: the rz matrix uses {@code seed + 1}, the rx matrix {@code seed + 1000}, so the
 * two matrices never share a sequence. Angles are drawn row-major (layer, then qubit) as
 * {@code nextDouble() * 2π}.</p>
 */
public final class JavaRandomAngleGenerator implements AngleGenerator {

    public static final long RZ_SEED_OFFSET = 1L;
    public static final long RX_SEED_OFFSET = 1000L;

    @Override
    public AngleSchedule generate(long seed, int depth, int nQubits) {
        if (depth < 0) {
            throw new InvalidConfigurationException("depth must be >= 0, got " + depth);
        }
        if (nQubits <= 0) {
            throw new InvalidConfigurationException("nQubits must be > 0, got " + nQubits);
        }
        double[][] rz = fill(new Random(seed + RZ_SEED_OFFSET), depth, nQubits);
        double[][] rx = fill(new Random(seed + RX_SEED_OFFSET), depth, nQubits);
        return new AngleSchedule(nQubits, rz, rx);
    }

    private static double[][] fill(Random rng, int depth, int nQubits) {
        double[][] angles = new double[depth][nQubits];
        for (int layer = 0; layer < depth; layer++) {
            for (int q = 0; q < nQubits; q++) {
                double angle = rng.nextDouble() * AngleSchedule.TWO_PI;
                angles[layer][q] = angle < AngleSchedule.TWO_PI ? angle : Math.nextDown(AngleSchedule.TWO_PI);
            }
        }
        return angles;
    }
}
