/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.exceptions;

public class InvalidQubitIndexException extends InvalidGateOperationException {

    private final int qubit;
    private final int numQubits;

    public InvalidQubitIndexException(int qubit, int numQubits) {
        super("Qubit index " + qubit + " is out of range for " + numQubits + " qubit(s)");
        this.qubit = qubit;
        this.numQubits = numQubits;
    }

    public int qubit() {
        return qubit;
    }

    public int numQubits() {
        return numQubits;
    }
}
