/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.aggregate;

import ai.evacortex.rqchash.core.state.BitRegister;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome counts of a run. Not thread-safe: each worker fills its own instance and the
 * aggregator merges them once all workers have finished.
 */
public final class HashHistogram {

    private final int nQubits;
    private final Map<Long, Long> counts = new HashMap<>();
    private long total;

    public HashHistogram(int nQubits) {
        if (nQubits <= 0 || nQubits > BitRegister.MAX_LENGTH) {
            throw new IllegalArgumentException("nQubits out of range: " + nQubits);
        }
        this.nQubits = nQubits;
    }

    public void record(BitRegister outcome) {
        if (outcome.length() != nQubits) {
            throw new IllegalArgumentException("Outcome width " + outcome.length() + " != " + nQubits);
        }
        counts.merge(outcome.value(), 1L, Long::sum);
        total++;
    }

    public void merge(HashHistogram other) {
        if (other.nQubits != nQubits) {
            throw new IllegalArgumentException("Cannot merge histograms of width " + other.nQubits + " and " + nQubits);
        }
        other.counts.forEach((value, count) -> counts.merge(value, count, Long::sum));
        total += other.total;
    }

    public long count(BitRegister outcome) {
        return counts.getOrDefault(outcome.value(), 0L);
    }

    public long totalCount() {
        return total;
    }

    public int distinctOutcomes() {
        return counts.size();
    }

    public int nQubits() {
        return nQubits;
    }

    /**
     * All entries ordered by count descending, ties by outcome value ascending.
     */
    public List<HashEntry> ranked() {
        List<HashEntry> entries = new ArrayList<>(counts.size());
        counts.forEach((value, count) -> entries.add(new HashEntry(BitRegister.fromValue(value, nQubits), count)));
        entries.sort(HashEntry.RANKING);
        return entries;
    }

    /**
     * The most frequent outcome; among equally frequent ones the numerically smallest.
     *
     * @throws IllegalStateException if nothing was recorded
     */
    public HashEntry mode() {
        long bestValue = -1L;
        long bestCount = 0L;
        for (Map.Entry<Long, Long> e : counts.entrySet()) {
            long value = e.getKey();
            long count = e.getValue();
            if (count > bestCount || (count == bestCount && value < bestValue)) {
                bestValue = value;
                bestCount = count;
            }
        }
        if (bestValue < 0) {
            throw new IllegalStateException("Histogram is empty");
        }
        return new HashEntry(BitRegister.fromValue(bestValue, nQubits), bestCount);
    }
}
