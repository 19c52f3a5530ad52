/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.config;

/**
 * How trials obtain the state they measure.
 */
public enum EvolutionMode {
    /** Every trial prepares a fresh basis state and evolves it through the full circuit. */
    PER_TRIAL,
    /**
     * The circuit is evolved once and every trial samples the resulting distribution. Evolution is
     * deterministic, so outcomes equal {@link #PER_TRIAL} for the same random draws.
     */
    SHARED
}
