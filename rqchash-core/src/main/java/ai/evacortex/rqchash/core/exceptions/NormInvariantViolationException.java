/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.exceptions;

/**
 * Raised when the squared-magnitude sum of a statevector drifts away from 1 during evolution.
 * Indicates an arithmetic defect in gate application and is never recovered from.
 */
public class NormInvariantViolationException extends RuntimeException {

    private final double norm;

    public NormInvariantViolationException(String where, double norm, double tolerance) {
        super("Norm invariant violated after " + where + ": |psi|^2 = " + norm + " (tolerance " + tolerance + ")");
        this.norm = norm;
    }

    public double norm() {
        return norm;
    }
}
