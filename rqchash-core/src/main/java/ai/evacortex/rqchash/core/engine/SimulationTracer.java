/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.engine;

import ai.evacortex.rqchash.core.state.StateVector;

/**
 * Observes circuit evolution. Invoked on the simulating thread; implementations shared across
 * workers must be thread-safe and must not mutate the state.
 */
public interface SimulationTracer {

    void layerCompleted(int layer, StateVector state);
}
