/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.engine;

import ai.evacortex.rqchash.core.angles.AngleSchedule;
import ai.evacortex.rqchash.core.exceptions.NormInvariantViolationException;
import ai.evacortex.rqchash.core.math.GateMatrix;
import ai.evacortex.rqchash.core.state.StateVector;

import java.util.Objects;

/**
 * Evolves a statevector through the layered random circuit described by an {@link AngleSchedule}.
 *
 * <p>Each layer applies, in order:</p>
 * <ol>
 *     <li>{@code Rz(rz[layer][q])} then {@code Rx(rx[layer][q])} on every qubit {@code q};</li>
 *     <li>CNOT(i, i+1) for even {@code i} with {@code i+1 < n};</li>
 *     <li>CNOT(i, i+1) for odd {@code i} with {@code i+1 < n};</li>
 *     <li>CNOT(n-1, 0) when {@code n > 2}.</li>
 * </ol>
 *
 * <p>The simulator holds no per-state data and may be shared by all workers of a run.</p>
 */
public final class CircuitSimulator {

    public static final double NORM_TOLERANCE = 1e-9;

    private final CircuitKernel kernel;
    private final NormGuard normGuard;
    private final SimulationTracer tracer;

    public CircuitSimulator() {
        this(new JavaCircuitKernel(), NormGuard.PER_LAYER, new NoOpTracer());
    }

    public CircuitSimulator(CircuitKernel kernel, NormGuard normGuard, SimulationTracer tracer) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.normGuard = Objects.requireNonNull(normGuard, "normGuard must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    /**
     * Applies every layer of {@code schedule} to {@code state} in place.
     *
     * @return the same {@code state} instance
     * @throws IllegalArgumentException if the schedule width differs from the state's qubit count
     * @throws NormInvariantViolationException if the norm guard detects drift beyond {@link #NORM_TOLERANCE}
     */
    public StateVector evolve(StateVector state, AngleSchedule schedule) {
        Objects.requireNonNull(state, "state must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        int n = state.nQubits();
        if (schedule.nQubits() != n) {
            throw new IllegalArgumentException("Schedule has " + schedule.nQubits() + " qubits, state has " + n);
        }

        for (int layer = 0; layer < schedule.depth(); layer++) {
            for (int q = 0; q < n; q++) {
                kernel.applySingleQubit(state, GateMatrix.rz(schedule.rz(layer, q)), q);
                afterGate(state, layer, "rz", q);
                kernel.applySingleQubit(state, GateMatrix.rx(schedule.rx(layer, q)), q);
                afterGate(state, layer, "rx", q);
            }
            for (int i = 0; i + 1 < n; i += 2) {
                cnot(state, layer, i, i + 1);
            }
            for (int i = 1; i + 1 < n; i += 2) {
                cnot(state, layer, i, i + 1);
            }
            if (n > 2) {
                cnot(state, layer, n - 1, 0);
            }

            if (normGuard != NormGuard.OFF) {
                checkNorm(state, "layer " + layer);
            }
            tracer.layerCompleted(layer, state);
        }
        return state;
    }

    private void cnot(StateVector state, int layer, int control, int target) {
        kernel.applyControlledNot(state, control, target);
        if (normGuard == NormGuard.PER_GATE) {
            checkNorm(state, "cx(" + control + ", " + target + ") in layer " + layer);
        }
    }

    private void afterGate(StateVector state, int layer, String gate, int qubit) {
        if (normGuard == NormGuard.PER_GATE) {
            checkNorm(state, gate + " on qubit " + qubit + " in layer " + layer);
        }
    }

    private static void checkNorm(StateVector state, String where) {
        double norm = state.norm();
        if (!(Math.abs(norm - 1.0) <= NORM_TOLERANCE)) {
            throw new NormInvariantViolationException(where, norm, NORM_TOLERANCE);
        }
    }
}
