/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.gate;

import ai.evacortex.qubitsim.core.exceptions.InvalidGateOperationException;
import ai.evacortex.qubitsim.core.exceptions.InvalidQubitIndexException;
import ai.evacortex.qubitsim.core.exceptions.MissingGateParameterException;

import java.util.Objects;

/**
 * One gate placed in a circuit.
 *
 * <p>{@code targetQubit} is present for two-qubit kinds only, {@code theta} (radians) for
 * rotations only; both are {@code null} otherwise. {@code position} orders operations
 * and carries no physical meaning.</p>
 */
public record GateOperation(GateKind kind, int qubit, Integer targetQubit, Double theta, int position) {

    public GateOperation {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static GateOperation single(GateKind kind, int qubit, int position) {
        return new GateOperation(kind, qubit, null, null, position);
    }

    public static GateOperation rotation(GateKind kind, int qubit, double theta, int position) {
        return new GateOperation(kind, qubit, null, theta, position);
    }

    public static GateOperation twoQubit(GateKind kind, int qubit, int targetQubit, int position) {
        return new GateOperation(kind, qubit, targetQubit, null, position);
    }

    public static GateOperation measure(int qubit, int position) {
        return new GateOperation(GateKind.MEASURE, qubit, null, null, position);
    }

    public boolean touches(int q) {
        return qubit == q || (kind.requiresTarget() && targetQubit != null && targetQubit == q);
    }

    public GateOperation withPosition(int newPosition) {
        return new GateOperation(kind, qubit, targetQubit, theta, newPosition);
    }

    /**
     * Checks the operation against a register of {@code numQubits} qubits.
     *
     * @throws InvalidQubitIndexException    if a referenced qubit is out of range
     * @throws MissingGateParameterException if θ or the target qubit is required but absent
     * @throws InvalidGateOperationException for any other structural problem
     */
    public void validate(int numQubits) {
        if (position < 0) {
            throw new InvalidGateOperationException("Position must be >= 0, got " + position + " for " + kind);
        }
        checkQubit(qubit, numQubits);
        if (kind.requiresTarget()) {
            if (targetQubit == null) {
                throw new MissingGateParameterException(kind.name(), "targetQubit");
            }
            checkQubit(targetQubit, numQubits);
            if (targetQubit == qubit) {
                throw new InvalidGateOperationException(kind + " needs two distinct qubits, got " + qubit + " twice");
            }
        }
        if (kind.requiresTheta() && theta == null) {
            throw new MissingGateParameterException(kind.name(), "theta");
        }
    }

    public static void checkQubit(int qubit, int numQubits) {
        if (qubit < 0 || qubit >= numQubits) {
            throw new InvalidQubitIndexException(qubit, numQubits);
        }
    }
}
