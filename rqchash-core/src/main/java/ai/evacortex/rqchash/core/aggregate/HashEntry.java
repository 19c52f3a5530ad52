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

import java.util.Comparator;

public record HashEntry(BitRegister outcome, long count) {

    /** Count descending, then outcome value ascending. */
    public static final Comparator<HashEntry> RANKING =
            Comparator.comparingLong(HashEntry::count).reversed()
                    .thenComparing(HashEntry::outcome);

    public String bitString() {
        return outcome.toBitString();
    }

    public String hex() {
        return outcome.toHex();
    }
}
