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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashRunConfigTest {

    private static final Message MSG = Message.ofUtf8("abc");

    @Test
    void builderDefaults_areValid() {
        HashRunConfig config = HashRunConfig.builder(MSG).build().validate();
        assertEquals(6, config.nQubits());
        assertEquals(6, config.depth());
        assertEquals(12345L, config.seed());
        assertEquals(2048, config.shots());
        assertEquals(RqcHashDefaults.TOP_K, config.topK());
        assertEquals(EvolutionMode.PER_TRIAL, config.evolutionMode());
        assertFalse(config.deterministicSampling());
        assertNull(config.samplingSeed());
    }

    @Test
    void samplingSeed_enablesDeterministicSampling() {
        HashRunConfig config = HashRunConfig.builder(MSG).samplingSeed(0L).build();
        assertTrue(config.deterministicSampling());
        assertEquals(0L, config.samplingSeed());
    }

    @Test
    void zeroDepth_isAccepted() {
        assertDoesNotThrow(() -> HashRunConfig.builder(MSG).depth(0).build().validate());
    }

    @Test
    void invalidValues_areRejectedWithFieldName() {
        assertMessage("nQubits", HashRunConfig.builder(MSG).nQubits(0));
        assertMessage("depth", HashRunConfig.builder(MSG).depth(-1));
        assertMessage("shots", HashRunConfig.builder(MSG).shots(0));
        assertMessage("parallelism", HashRunConfig.builder(MSG).parallelism(-2));
        assertMessage("topK", HashRunConfig.builder(MSG).topK(0));
        assertMessage("message", HashRunConfig.builder(null));
        assertMessage("evolutionMode", HashRunConfig.builder(MSG).evolutionMode(null));
        assertMessage("normGuard", HashRunConfig.builder(MSG).normGuard(null));
    }

    @Test
    void normGuard_parsesCaseInsensitively() {
        assertEquals(NormGuard.PER_GATE, NormGuard.parse("per_gate"));
        assertEquals(NormGuard.OFF, NormGuard.parse(" Off "));
        assertThrows(IllegalArgumentException.class, () -> NormGuard.parse("sometimes"));
    }

    private static void assertMessage(String field, HashRunConfig.Builder builder) {
        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class,
                () -> builder.build().validate());
        assertTrue(ex.getMessage().contains(field), ex.getMessage());
    }
}
