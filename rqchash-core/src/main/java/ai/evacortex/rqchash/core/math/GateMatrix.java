/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.math;

import java.util.Objects;

/**
 * A 2×2 complex matrix acting on one qubit, laid out as
 * <pre>
 *     | m00  m01 |
 *     | m10  m11 |
 * </pre>
 * where row/column 0 is the qubit's |0⟩ component and 1 its |1⟩ component.
 *
 * <p>The rotation factories follow the usual conventions:</p>
 * <pre>
 *     Rz(φ) = diag(e^{-iφ/2}, e^{iφ/2})
 *     Rx(θ) = | cos θ/2     -i·sin θ/2 |
 *             | -i·sin θ/2   cos θ/2   |
 * </pre>
 */
public record GateMatrix(Complex m00, Complex m01, Complex m10, Complex m11) {

    public GateMatrix {
        Objects.requireNonNull(m00, "m00");
        Objects.requireNonNull(m01, "m01");
        Objects.requireNonNull(m10, "m10");
        Objects.requireNonNull(m11, "m11");
    }

    public static GateMatrix identity() {
        return new GateMatrix(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.ONE);
    }

    public static GateMatrix pauliX() {
        return new GateMatrix(Complex.ZERO, Complex.ONE, Complex.ONE, Complex.ZERO);
    }

    public static GateMatrix rz(double phi) {
        double half = phi / 2.0;
        double c = Math.cos(half);
        double s = Math.sin(half);
        return new GateMatrix(new Complex(c, -s), Complex.ZERO, Complex.ZERO, new Complex(c, s));
    }

    public static GateMatrix rx(double theta) {
        double half = theta / 2.0;
        double c = Math.cos(half);
        double s = Math.sin(half);
        Complex offDiagonal = new Complex(0.0, -s);
        return new GateMatrix(new Complex(c, 0.0), offDiagonal, offDiagonal, new Complex(c, 0.0));
    }

    /**
     * Matrix product {@code this · other}: applying the result equals applying {@code other} first.
     */
    public GateMatrix multiply(GateMatrix other) {
        return new GateMatrix(
                m00.multiply(other.m00).add(m01.multiply(other.m10)),
                m00.multiply(other.m01).add(m01.multiply(other.m11)),
                m10.multiply(other.m00).add(m11.multiply(other.m10)),
                m10.multiply(other.m01).add(m11.multiply(other.m11)));
    }

    public GateMatrix conjugateTranspose() {
        return new GateMatrix(m00.conjugate(), m10.conjugate(), m01.conjugate(), m11.conjugate());
    }

    public boolean isUnitary(double eps) {
        GateMatrix product = conjugateTranspose().multiply(this);
        GateMatrix id = identity();
        return product.m00.approximatelyEquals(id.m00, eps)
                && product.m01.approximatelyEquals(id.m01, eps)
                && product.m10.approximatelyEquals(id.m10, eps)
                && product.m11.approximatelyEquals(id.m11, eps);
    }
}
