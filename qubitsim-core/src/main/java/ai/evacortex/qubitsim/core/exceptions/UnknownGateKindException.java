/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.exceptions;

public class UnknownGateKindException extends InvalidGateOperationException {
    public UnknownGateKindException(String name) {
        super("Unknown gate kind: '" + name + "'");
    }

    public UnknownGateKindException(String name, Throwable cause) {
        super("Unknown gate kind: '" + name + "'", cause);
    }
}
