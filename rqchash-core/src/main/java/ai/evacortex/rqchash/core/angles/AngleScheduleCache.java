/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;

/**
 * Bounded memo of generated schedules keyed by {@code (seed, depth, nQubits)}.
 * Safe because generation is a pure function of the key.
 */
public final class AngleScheduleCache implements AngleGenerator {

    private record ScheduleKey(long seed, int depth, int nQubits) {}

    private final LoadingCache<ScheduleKey, AngleSchedule> cache;

    public AngleScheduleCache(AngleGenerator delegate, long maxEntries) {
        if (delegate == null) {
            throw new NullPointerException("delegate must not be null");
        }
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build(key -> delegate.generate(key.seed(), key.depth(), key.nQubits()));
    }

    @Override
    public AngleSchedule generate(long seed, int depth, int nQubits) {
        return cache.get(new ScheduleKey(seed, depth, nQubits));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
