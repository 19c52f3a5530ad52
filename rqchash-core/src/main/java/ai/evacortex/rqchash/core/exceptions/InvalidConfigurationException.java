/*
 * RQC-Hash — Random Quantum Circuit Hash
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.rqchash.core.exceptions;

public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super("Invalid configuration: " + message);
    }
}
