/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.gate;

import ai.evacortex.qubitsim.core.exceptions.UnknownGateKindException;

import java.util.Locale;
import java.util.Objects;

/**
 * Closed set of gate kinds the simulator understands.
 */
public enum GateKind {
    H("Hadamard", "H", GateCategory.SINGLE),
    X("Pauli-X (NOT)", "X", GateCategory.SINGLE),
    Y("Pauli-Y", "Y", GateCategory.SINGLE),
    Z("Pauli-Z", "Z", GateCategory.SINGLE),
    S("S Gate (Phase)", "S", GateCategory.SINGLE),
    T("T Gate", "T", GateCategory.SINGLE),
    RX("Rotation X", "Rx", GateCategory.ROTATION),
    RY("Rotation Y", "Ry", GateCategory.ROTATION),
    RZ("Rotation Z", "Rz", GateCategory.ROTATION),
    CNOT("Controlled-NOT", "CX", GateCategory.CONTROLLED),
    CZ("Controlled-Z", "CZ", GateCategory.CONTROLLED),
    SWAP("SWAP", "SWAP", GateCategory.SWAP),
    MEASURE("Measurement", "M", GateCategory.MEASURE);

    private final String displayName;
    private final String symbol;
    private final GateCategory category;

    GateKind(String displayName, String symbol, GateCategory category) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.category = category;
    }

    public String displayName() {
        return displayName;
    }

    public String symbol() {
        return symbol;
    }

    public GateCategory category() {
        return category;
    }

    /**
     * Number of qubits the gate touches.
     */
    public int arity() {
        return requiresTarget() ? 2 : 1;
    }

    public boolean requiresTarget() {
        return category == GateCategory.CONTROLLED || category == GateCategory.SWAP;
    }

    public boolean requiresTheta() {
        return category == GateCategory.ROTATION;
    }

    /**
     * Resolves a gate name case-insensitively. Accepts the enum name and the
     * short aliases {@code M} (measurement) and {@code CX} (controlled-NOT).
     *
     * @throws UnknownGateKindException if nothing matches
     */
    public static GateKind fromName(String name) {
        Objects.requireNonNull(name, "gate name must not be null");
        String key = name.trim().toUpperCase(Locale.ROOT);
        switch (key) {
            case "M":
                return MEASURE;
            case "CX":
                return CNOT;
            default:
                try {
                    return GateKind.valueOf(key);
                } catch (IllegalArgumentException e) {
                    throw new UnknownGateKindException(name, e);
                }
        }
    }
}
