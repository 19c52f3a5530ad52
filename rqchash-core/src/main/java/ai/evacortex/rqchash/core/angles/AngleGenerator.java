/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

/**
 * {@code AngleGenerator} produces the rotation parameters of a circuit from a seed.
 *
 * <p>Implementations must be pure functions of {@code (seed, depth, nQubits)}: identical
 * arguments yield bit-identical schedules in every process and on every call, independent of
 * any other run state. Reproducibility across implementations is only guaranteed when they share
 * the same pseudo-random algorithm and seed-derivation rule; each implementation documents its own.</p>
 *
 * @see JavaRandomAngleGenerator
 * @see AngleScheduleCache
 */
public interface AngleGenerator {

    /**
     * @param seed    circuit seed
     * @param depth   number of layers, {@code >= 0}
     * @param nQubits number of qubits, {@code > 0}
     * @return schedule with angles in [0, 2π)
     * @throws ai.evacortex.rqchash.core.exceptions.InvalidConfigurationException on negative depth or non-positive qubit count
     */
    AngleSchedule generate(long seed, int depth, int nQubits);
}
