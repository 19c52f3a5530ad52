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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one hashing run.
 *
 * @param nQubits             register width
 * @param depth               circuit depth
 * @param seed                circuit seed
 * @param shots               number of trials
 * @param scheduleFingerprint fingerprint of the angle schedule used
 * @param finalHash           most frequent outcome, ties broken by smallest value
 * @param ranking             every observed outcome, count descending then value ascending
 * @param topK                number of entries exposed by {@link #topEntries()}
 */
public record HashResult(
        int nQubits,
        int depth,
        long seed,
        int shots,
        long scheduleFingerprint,
        HashEntry finalHash,
        List<HashEntry> ranking,
        int topK
) {

    public HashResult {
        ranking = List.copyOf(ranking);
    }

    public List<HashEntry> topEntries() {
        return ranking.subList(0, Math.min(topK, ranking.size()));
    }

    /**
     * Histogram view in ranking order.
     */
    public Map<BitRegister, Long> histogram() {
        Map<BitRegister, Long> view = new LinkedHashMap<>();
        for (HashEntry e : ranking) view.put(e.outcome(), e.count());
        return Collections.unmodifiableMap(view);
    }

    public long totalCount() {
        long sum = 0L;
        for (HashEntry e : ranking) sum += e.count();
        return sum;
    }

    public int distinctOutcomes() {
        return ranking.size();
    }
}
