/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.state;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable input message. Bits are addressed LSB-first within each byte, bytes in order.
 */
public final class Message {

    private final byte[] bytes;

    private Message(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Message of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return new Message(bytes.clone());
    }

    public static Message ofUtf8(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Message(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    public long bitLength() {
        return bytes.length * 8L;
    }

    /**
     * @return bit {@code index} of the message, {@code false} at or beyond {@link #bitLength()}
     */
    public boolean bit(long index) {
        if (index < 0) throw new IndexOutOfBoundsException("negative bit index: " + index);
        if (index >= bitLength()) return false;
        int b = bytes[(int) (index >>> 3)] & 0xFF;
        return ((b >>> (int) (index & 7)) & 1) == 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Message(" + bytes.length + " bytes)";
    }
}
