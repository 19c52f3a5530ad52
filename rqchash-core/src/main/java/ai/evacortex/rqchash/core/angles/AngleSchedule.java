/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.angles;

import java.util.Arrays;

/**
 * Rotation angles for every layer and qubit of a circuit: one matrix for the Z-axis
 * phase rotation and one for the X-axis rotation, both {@code depth × nQubits}, values in [0, 2π).
 *
 * <p>Instances are immutable; arrays are copied on the way in and on the way out.
 * Shared read-only across all trials of a run.</p>
 */
public final class AngleSchedule {

    public static final double TWO_PI = 2.0 * Math.PI;

    private final int depth;
    private final int nQubits;
    private final double[][] rz;
    private final double[][] rx;
    private final long fingerprint;

    public AngleSchedule(int nQubits, double[][] rz, double[][] rx) {
        if (nQubits <= 0) {
            throw new IllegalArgumentException("nQubits must be > 0");
        }
        if (rz == null || rx == null) {
            throw new NullPointerException("angle matrices must not be null");
        }
        if (rz.length != rx.length) {
            throw new IllegalArgumentException("Mismatched depth: rz=" + rz.length + " vs rx=" + rx.length);
        }
        this.depth = rz.length;
        this.nQubits = nQubits;
        this.rz = copyChecked(rz, nQubits, "rz");
        this.rx = copyChecked(rx, nQubits, "rx");
        this.fingerprint = ScheduleFingerprint.compute(this);
    }

    private static double[][] copyChecked(double[][] source, int nQubits, String name) {
        double[][] copy = new double[source.length][];
        for (int layer = 0; layer < source.length; layer++) {
            double[] row = source[layer];
            if (row == null || row.length != nQubits) {
                throw new IllegalArgumentException(name + "[" + layer + "] must have length " + nQubits);
            }
            for (double angle : row) {
                if (!(angle >= 0.0 && angle < TWO_PI)) {
                    throw new IllegalArgumentException(name + "[" + layer + "] contains angle outside [0, 2π): " + angle);
                }
            }
            copy[layer] = row.clone();
        }
        return copy;
    }

    public int depth() {
        return depth;
    }

    public int nQubits() {
        return nQubits;
    }

    public double rz(int layer, int qubit) {
        return rz[layer][qubit];
    }

    public double rx(int layer, int qubit) {
        return rx[layer][qubit];
    }

    public double[][] rzMatrix() {
        return deepCopy(rz);
    }

    public double[][] rxMatrix() {
        return deepCopy(rx);
    }

    /**
     * 64-bit digest of the schedule, see {@link ScheduleFingerprint}.
     */
    public long fingerprint() {
        return fingerprint;
    }

    private static double[][] deepCopy(double[][] m) {
        double[][] copy = new double[m.length][];
        for (int i = 0; i < m.length; i++) copy[i] = m[i].clone();
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AngleSchedule that)) return false;
        return depth == that.depth
                && nQubits == that.nQubits
                && Arrays.deepEquals(rz, that.rz)
                && Arrays.deepEquals(rx, that.rx);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(fingerprint);
    }

    @Override
    public String toString() {
        return String.format("AngleSchedule(depth=%d, nQubits=%d, fingerprint=%016x)", depth, nQubits, fingerprint);
    }
}
