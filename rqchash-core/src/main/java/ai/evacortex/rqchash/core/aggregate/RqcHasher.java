/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.aggregate;

import ai.evacortex.rqchash.core.config.HashRunConfig;
import ai.evacortex.rqchash.core.exceptions.InvalidConfigurationException;
import ai.evacortex.rqchash.core.exceptions.NormInvariantViolationException;
import ai.evacortex.rqchash.core.exceptions.ResourceLimitExceededException;
import ai.evacortex.rqchash.core.state.Message;

/**
 * {@code RqcHasher} is the single entry point of the random-quantum-circuit hash: it derives a
 * circuit from a seed, encodes a message into its initial basis state, and measures the evolved
 * state over many independent trials.
 *
 * <p>Each trial prepares the basis state of the message's first {@code nQubits} bits, evolves it
 * through {@code depth} layers of seeded Rz/Rx rotations and CNOT entanglers, and samples one
 * classical outcome. Outcomes accumulate in a histogram whose most frequent entry (ties resolved
 * by the smallest value) is the final hash.</p>
 *
 * <p>The circuit is a pure function of {@code (seed, depth, nQubits)}. Measurement is stochastic:
 * repeated runs agree on the final hash only when the sampling seed is fixed, or when the
 * distribution is sharp enough for the mode to be stable. No cryptographic property is implied.</p>
 *
 * <p>Implementations must be thread-safe; concurrent runs share no mutable state.</p>
 *
 * @see HashResult
 * @see HashRunConfig
 */
public interface RqcHasher {

    /**
     * Runs with default parallelism, entropy-seeded sampling and per-trial evolution.
     *
     * @param message input bytes
     * @param nQubits register width, {@code > 0}
     * @param depth   number of layers, {@code >= 0}
     * @param seed    circuit seed
     * @param shots   number of trials, {@code > 0}
     * @return final hash, ranked histogram and top-K entries
     * @throws InvalidConfigurationException  if a parameter is out of range
     * @throws ResourceLimitExceededException if the statevectors would exceed the configured ceiling
     * @throws NormInvariantViolationException if gate arithmetic breaks normalization
     */
    HashResult run(Message message, int nQubits, int depth, long seed, int shots);

    /**
     * Runs with every parameter taken from {@code config}.
     *
     * @param config validated before anything is allocated
     * @return final hash, ranked histogram and top-K entries
     * @throws InvalidConfigurationException  if a parameter is out of range
     * @throws ResourceLimitExceededException if the statevectors would exceed the configured ceiling
     * @throws NormInvariantViolationException if gate arithmetic breaks normalization
     */
    HashResult run(HashRunConfig config);
}
