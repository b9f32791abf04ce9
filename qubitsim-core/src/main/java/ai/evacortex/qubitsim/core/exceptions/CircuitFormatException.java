/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.exceptions;

public class CircuitFormatException extends RuntimeException {
    public CircuitFormatException(String message) {
        super("Invalid circuit document: " + message);
    }

    public CircuitFormatException(String message, Throwable cause) {
        super("Invalid circuit document: " + message, cause);
    }
}
