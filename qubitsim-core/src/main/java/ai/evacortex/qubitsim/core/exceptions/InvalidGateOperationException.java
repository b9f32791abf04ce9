/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.exceptions;

/**
 * Raised when a gate operation cannot be applied. Detected before any amplitude is touched.
 */
public class InvalidGateOperationException extends RuntimeException {
    public InvalidGateOperationException(String message) {
        super(message);
    }

    public InvalidGateOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
