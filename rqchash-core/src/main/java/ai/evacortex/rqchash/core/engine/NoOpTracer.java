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

public class NoOpTracer implements SimulationTracer {
    @Override
    public void layerCompleted(int layer, StateVector state) {
        // no-op
    }
}
