/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.state;

/**
 * Fixed-length register of classical bits, one per qubit.
 *
 * <p>Bit {@code i} belongs to qubit {@code i} and carries weight {@code 2^i} in {@link #value()},
 * matching the statevector index convention. {@link #toBitString()} prints qubit {@code n-1} first,
 * so the string reads as the binary form of {@link #value()}.</p>
 */
public final class BitRegister implements Comparable<BitRegister> {

    public static final int MAX_LENGTH = 63;

    private final int length;
    private final long value;

    private BitRegister(int length, long value) {
        this.length = length;
        this.value = value;
    }

    public static BitRegister fromValue(long value, int length) {
        checkLength(length);
        if (value < 0 || (length < MAX_LENGTH && (value >>> length) != 0)) {
            throw new IllegalArgumentException("value " + value + " does not fit in " + length + " bits");
        }
        return new BitRegister(length, value);
    }

    public static BitRegister fromBits(boolean[] bits) {
        if (bits == null) throw new NullPointerException("bits must not be null");
        checkLength(bits.length);
        long v = 0L;
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) v |= 1L << i;
        }
        return new BitRegister(bits.length, v);
    }

    private static void checkLength(int length) {
        if (length <= 0 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("register length must be in [1, " + MAX_LENGTH + "], got " + length);
        }
    }

    public int length() {
        return length;
    }

    public long value() {
        return value;
    }

    public boolean get(int i) {
        if (i < 0 || i >= length) throw new IndexOutOfBoundsException("bit " + i + " of " + length);
        return ((value >>> i) & 1L) == 1L;
    }

    public boolean[] toBooleanArray() {
        boolean[] bits = new boolean[length];
        for (int i = 0; i < length; i++) bits[i] = get(i);
        return bits;
    }

    public String toBitString() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = length - 1; i >= 0; i--) sb.append(get(i) ? '1' : '0');
        return sb.toString();
    }

    /**
     * Lower-case hex of {@link #value()}, zero-padded to {@code ceil(length / 4)} digits.
     */
    public String toHex() {
        int digits = (length + 3) / 4;
        String hex = Long.toHexString(value);
        if (hex.length() >= digits) return hex;
        return "0".repeat(digits - hex.length()) + hex;
    }

    @Override
    public int compareTo(BitRegister other) {
        int byValue = Long.compare(value, other.value);
        return byValue != 0 ? byValue : Integer.compare(length, other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BitRegister that)) return false;
        return length == that.length && value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value) * 31 + length;
    }

    @Override
    public String toString() {
        return toBitString();
    }
}
