/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.config;

import ai.evacortex.rqchash.core.engine.NormGuard;
import ai.evacortex.rqchash.core.exceptions.InvalidConfigurationException;
import ai.evacortex.rqchash.core.state.Message;

/**
 * Parameters of one hashing run.
 *
 * @param message      input bytes
 * @param nQubits      register width, {@code > 0}
 * @param depth        number of circuit layers, {@code >= 0}
 * @param seed         circuit seed for the angle generator
 * @param shots        number of trials, {@code > 0}
 * @param parallelism  upper bound on worker threads, {@code > 0}
 * @param samplingSeed seed for reproducible measurement draws, {@code null} for entropy-seeded sampling
 * @param evolutionMode per-trial or shared evolution
 * @param normGuard    norm check frequency during evolution
 * @param topK         number of ranked entries reported, {@code > 0}
 */
public record HashRunConfig(
        Message message,
        int nQubits,
        int depth,
        long seed,
        int shots,
        int parallelism,
        Long samplingSeed,
        EvolutionMode evolutionMode,
        NormGuard normGuard,
        int topK
) {

    public static Builder builder(Message message) {
        return new Builder(message);
    }

    public boolean deterministicSampling() {
        return samplingSeed != null;
    }

    /**
     * @throws InvalidConfigurationException on the first invalid parameter
     */
    public HashRunConfig validate() {
        if (message == null) throw new InvalidConfigurationException("message must not be null");
        if (nQubits <= 0) throw new InvalidConfigurationException("nQubits must be > 0, got " + nQubits);
        if (depth < 0) throw new InvalidConfigurationException("depth must be >= 0, got " + depth);
        if (shots <= 0) throw new InvalidConfigurationException("shots must be > 0, got " + shots);
        if (parallelism <= 0) throw new InvalidConfigurationException("parallelism must be > 0, got " + parallelism);
        if (topK <= 0) throw new InvalidConfigurationException("topK must be > 0, got " + topK);
        if (evolutionMode == null) throw new InvalidConfigurationException("evolutionMode must not be null");
        if (normGuard == null) throw new InvalidConfigurationException("normGuard must not be null");
        return this;
    }

    public static final class Builder {
        private final Message message;
        private int nQubits = 6;
        private int depth = 6;
        private long seed = 12345L;
        private int shots = 2048;
        private int parallelism = RqcHashDefaults.WORKERS;
        private Long samplingSeed;
        private EvolutionMode evolutionMode = EvolutionMode.PER_TRIAL;
        private NormGuard normGuard = RqcHashDefaults.NORM_GUARD;
        private int topK = RqcHashDefaults.TOP_K;

        private Builder(Message message) {
            this.message = message;
        }

        public Builder nQubits(int nQubits) { this.nQubits = nQubits; return this; }
        public Builder depth(int depth) { this.depth = depth; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder shots(int shots) { this.shots = shots; return this; }
        public Builder parallelism(int parallelism) { this.parallelism = parallelism; return this; }
        public Builder samplingSeed(long samplingSeed) { this.samplingSeed = samplingSeed; return this; }
        public Builder evolutionMode(EvolutionMode mode) { this.evolutionMode = mode; return this; }
        public Builder normGuard(NormGuard normGuard) { this.normGuard = normGuard; return this; }
        public Builder topK(int topK) { this.topK = topK; return this; }

        public HashRunConfig build() {
            return new HashRunConfig(message, nQubits, depth, seed, shots, parallelism,
                    samplingSeed, evolutionMode, normGuard, topK);
        }
    }
}
