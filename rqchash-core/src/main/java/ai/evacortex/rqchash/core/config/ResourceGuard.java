/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.config;

import ai.evacortex.rqchash.core.exceptions.ResourceLimitExceededException;
import ai.evacortex.rqchash.core.state.StateVector;

/**
 * Rejects runs whose buffers would not fit the configured budget, before anything is allocated,
 * and sizes the worker pool to what the budget can hold.
 *
 * <p>Every run keeps its angle schedule ({@code 2 × depth × nQubits} doubles). Per-trial evolution
 * adds one amplitude buffer per worker; shared evolution adds one buffer plus a cumulative
 * distribution table of {@code 2^n} doubles. A run is rejected only when its minimal footprint,
 * a single worker, does not fit.</p>
 */
public final class ResourceGuard {

    private final int maxQubits;
    private final long memoryBudgetBytes;

    public ResourceGuard(int maxQubits, long memoryBudgetBytes) {
        if (maxQubits <= 0) throw new IllegalArgumentException("maxQubits must be > 0");
        if (memoryBudgetBytes <= 0) throw new IllegalArgumentException("memoryBudgetBytes must be > 0");
        this.maxQubits = Math.min(maxQubits, StateVector.MAX_SUPPORTED_QUBITS);
        this.memoryBudgetBytes = memoryBudgetBytes;
    }

    public static ResourceGuard fromDefaults() {
        long budget = (long) (Runtime.getRuntime().maxMemory() * RqcHashDefaults.HEAP_FRACTION);
        return new ResourceGuard(RqcHashDefaults.MAX_QUBITS, Math.max(1L, budget));
    }

    public void check(HashRunConfig config) {
        int n = config.nQubits();
        if (n > maxQubits) {
            throw new ResourceLimitExceededException("nQubits " + n + " exceeds configured maximum " + maxQubits);
        }
        long required = minimumBytes(config);
        if (required > memoryBudgetBytes) {
            throw new ResourceLimitExceededException(String.format(
                    "Run needs at least ~%,d bytes (nQubits=%d, depth=%d, mode=%s), budget is %,d",
                    required, n, config.depth(), config.evolutionMode(), memoryBudgetBytes));
        }
    }

    /**
     * Worker count for a run: the requested parallelism, no more than one worker per shot, and in
     * per-trial mode no more amplitude buffers than fit the budget next to the schedule.
     */
    public int effectiveWorkers(HashRunConfig config) {
        int requested = Math.max(1, Math.min(config.parallelism(), config.shots()));
        if (config.evolutionMode() == EvolutionMode.SHARED) {
            return requested;
        }
        long fitting = (memoryBudgetBytes - scheduleBytes(config)) / StateVector.bytesFor(config.nQubits());
        return (int) Math.max(1L, Math.min(requested, fitting));
    }

    static long minimumBytes(HashRunConfig config) {
        long perState = StateVector.bytesFor(config.nQubits());
        long fixed = scheduleBytes(config) + perState;
        if (config.evolutionMode() == EvolutionMode.SHARED) {
            return fixed + (8L << config.nQubits());
        }
        return fixed;
    }

    static long scheduleBytes(HashRunConfig config) {
        return 2L * config.depth() * config.nQubits() * Double.BYTES;
    }

    public int maxQubits() {
        return maxQubits;
    }

    public long memoryBudgetBytes() {
        return memoryBudgetBytes;
    }
}
