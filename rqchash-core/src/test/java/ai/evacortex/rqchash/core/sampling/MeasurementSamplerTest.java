/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.sampling;

import ai.evacortex.rqchash.core.angles.JavaRandomAngleGenerator;
import ai.evacortex.rqchash.core.engine.CircuitSimulator;
import ai.evacortex.rqchash.core.engine.JavaCircuitKernel;
import ai.evacortex.rqchash.core.math.GateMatrix;
import ai.evacortex.rqchash.core.state.BitRegister;
import ai.evacortex.rqchash.core.state.StateVector;
import org.junit.jupiter.api.Test;

import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class MeasurementSamplerTest {

    @Test
    void basisState_isSampledWithCertainty() {
        StateVector state = StateVector.basis(5, 0b10110);
        SplittableRandom random = new SplittableRandom(3);
        for (int i = 0; i < 500; i++) {
            BitRegister outcome = MeasurementSampler.sample(state, random);
            assertEquals(0b10110L, outcome.value());
            assertEquals(5, outcome.length());
        }
    }

    @Test
    void evenSuperposition_isSampledEvenly() {
        StateVector state = StateVector.basis(1, 0);
        new JavaCircuitKernel().applySingleQubit(state, GateMatrix.rx(Math.PI / 2), 0);

        SplittableRandom random = new SplittableRandom(11);
        int ones = 0;
        int draws = 20_000;
        for (int i = 0; i < draws; i++) {
            if (MeasurementSampler.sample(state, random).get(0)) ones++;
        }
        // 0.5 ± 5σ, σ ≈ 0.0035
        assertEquals(0.5, ones / (double) draws, 0.018);
    }

    @Test
    void distributionAndDirectSampling_agreeDrawForDraw() {
        StateVector state = new CircuitSimulator().evolve(StateVector.basis(7, 3),
                new JavaRandomAngleGenerator().generate(21L, 5, 7));
        ProbabilityDistribution dist = ProbabilityDistribution.of(state);

        SplittableRandom a = new SplittableRandom(77);
        SplittableRandom b = new SplittableRandom(77);
        for (int i = 0; i < 2000; i++) {
            assertEquals(MeasurementSampler.sample(state, a), MeasurementSampler.sample(dist, b), "draw " + i);
        }
    }

    @Test
    void unnormalizedState_isRenormalizedBeforeSampling() {
        StateVector state = StateVector.basis(2, 0);
        // |ψ|² = 4 + 4 = 8, equal mass on indices 0 and 3
        state.real()[0] = 2.0;
        state.real()[3] = 2.0;

        ProbabilityDistribution dist = ProbabilityDistribution.of(state);
        assertEquals(8.0, dist.total(), 0.0);
        assertEquals(0.5, dist.probability(0), 1e-12);
        assertEquals(0.0, dist.probability(1), 0.0);
        assertEquals(0.5, dist.probability(3), 1e-12);

        assertEquals(0, dist.indexOf(0.0));
        assertEquals(0, dist.indexOf(0.49));
        assertEquals(3, dist.indexOf(0.5));
        assertEquals(3, dist.indexOf(Math.nextDown(1.0)));

        RandomGenerator high = fixedDraw(0.75);
        assertEquals(3L, MeasurementSampler.sample(state, high).value());
    }

    @Test
    void zeroState_cannotBeSampled() {
        StateVector state = StateVector.basis(2, 0);
        state.real()[0] = 0.0;
        assertThrows(IllegalStateException.class, () -> MeasurementSampler.sample(state, new SplittableRandom(1)));
        assertThrows(IllegalStateException.class, () -> ProbabilityDistribution.of(state));
    }

    @Test
    void seededSource_dependsOnlyOnTrialIndex() {
        TrialRandomSource a = TrialRandomSource.seeded(5L);
        TrialRandomSource b = TrialRandomSource.seeded(5L);
        assertEquals(a.forTrial(17).nextLong(), b.forTrial(17).nextLong());
        assertNotEquals(a.forTrial(17).nextLong(), a.forTrial(18).nextLong());
        assertNotEquals(a.forTrial(0).nextLong(), TrialRandomSource.seeded(6L).forTrial(0).nextLong());
    }

    @Test
    void entropySource_variesBetweenTrials() {
        TrialRandomSource source = TrialRandomSource.entropy();
        assertNotEquals(source.forTrial(0).nextLong(), source.forTrial(0).nextLong());
    }

    private static RandomGenerator fixedDraw(double u) {
        return new RandomGenerator() {
            @Override
            public long nextLong() {
                throw new UnsupportedOperationException();
            }

            @Override
            public double nextDouble() {
                return u;
            }
        };
    }
}
