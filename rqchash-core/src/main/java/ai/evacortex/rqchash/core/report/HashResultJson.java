/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.report;

import ai.evacortex.rqchash.core.aggregate.HashEntry;
import ai.evacortex.rqchash.core.aggregate.HashResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link HashResult} as a JSON document. Bitstrings are MSB-first (qubit {@code n-1}
 * leftmost); {@code hash_hex} is the LSB-first integer value of the final outcome.
 */
public final class HashResultJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonPropertyOrder({"n_qubits", "depth", "seed", "shots", "top_bitstring", "hash_hex", "top_count",
            "schedule_fingerprint", "top_k", "counts"})
    public record Summary(
            @JsonProperty("n_qubits") int nQubits,
            @JsonProperty("depth") int depth,
            @JsonProperty("seed") long seed,
            @JsonProperty("shots") int shots,
            @JsonProperty("top_bitstring") String topBitstring,
            @JsonProperty("hash_hex") String hashHex,
            @JsonProperty("top_count") long topCount,
            @JsonProperty("schedule_fingerprint") String scheduleFingerprint,
            @JsonProperty("top_k") List<Outcome> topK,
            @JsonProperty("counts") Map<String, Long> counts
    ) {}

    @JsonPropertyOrder({"bitstring", "hex", "count"})
    public record Outcome(
            @JsonProperty("bitstring") String bitstring,
            @JsonProperty("hex") String hex,
            @JsonProperty("count") long count
    ) {}

    private HashResultJson() {}

    public static Summary summarize(HashResult result) {
        List<Outcome> top = new ArrayList<>();
        for (HashEntry e : result.topEntries()) {
            top.add(new Outcome(e.bitString(), e.hex(), e.count()));
        }
        Map<String, Long> counts = new LinkedHashMap<>();
        for (HashEntry e : result.ranking()) {
            counts.put(e.bitString(), e.count());
        }
        HashEntry fin = result.finalHash();
        return new Summary(result.nQubits(), result.depth(), result.seed(), result.shots(),
                fin.bitString(), fin.hex(), fin.count(),
                String.format("%016x", result.scheduleFingerprint()), top, counts);
    }

    public static String toJson(HashResult result) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(summarize(result));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to render hash result", e);
        }
    }
}
