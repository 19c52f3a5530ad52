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

/**
 * JVM-wide defaults, read once from system properties. Out-of-range values are clamped to the
 * nearest usable setting.
 */
public final class RqcHashDefaults {

    static final double DEFAULT_HEAP_FRACTION = 0.5;

    public static final int MAX_QUBITS = Math.max(1, Integer.getInteger("rqchash.qubits.max", 24));
    public static final double HEAP_FRACTION = heapFraction(System.getProperty("rqchash.memory.heapFraction"));
    public static final int WORKERS = Math.max(1, Integer.getInteger("rqchash.workers", Runtime.getRuntime().availableProcessors()));
    public static final NormGuard NORM_GUARD = NormGuard.parse(System.getProperty("rqchash.norm.guard", "PER_LAYER"));
    public static final long SCHEDULE_CACHE_SIZE = Math.max(0L, Long.getLong("rqchash.cache.schedules", 64L));
    public static final int TOP_K = 10;

    private RqcHashDefaults() {}

    /**
     * Parses a heap fraction in (0, 1]. Values above 1 are capped; missing, non-numeric, zero or
     * negative values fall back to {@value #DEFAULT_HEAP_FRACTION}.
     */
    static double heapFraction(String raw) {
        if (raw == null) return DEFAULT_HEAP_FRACTION;
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_HEAP_FRACTION;
        }
        if (!(value > 0.0)) return DEFAULT_HEAP_FRACTION;
        return Math.min(1.0, value);
    }
}
