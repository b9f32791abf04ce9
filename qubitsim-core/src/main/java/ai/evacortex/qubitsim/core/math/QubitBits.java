/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.math;

/**
 * Bit-level indexing over a {@code 2^n} basis. Qubit 0 is the most significant bit.
 */
public final class QubitBits {

    /** Largest qubit count whose basis still fits a Java array. */
    public static final int MAX_ADDRESSABLE_QUBITS = 30;

    private QubitBits() {}

    /**
     * @throws IllegalArgumentException if {@code numQubits} is outside {@code [0, MAX_ADDRESSABLE_QUBITS]}
     */
    public static int dimension(int numQubits) {
        if (numQubits < 0 || numQubits > MAX_ADDRESSABLE_QUBITS) {
            throw new IllegalArgumentException("numQubits must be in [0, " + MAX_ADDRESSABLE_QUBITS
                    + "], got " + numQubits);
        }
        return 1 << numQubits;
    }

    public static int mask(int numQubits, int qubit) {
        return 1 << (numQubits - 1 - qubit);
    }

    public static int bit(int index, int numQubits, int qubit) {
        return (index >> (numQubits - 1 - qubit)) & 1;
    }

    /**
     * Expands a {@code (n-1)}-bit index by inserting a zero at the position of {@code mask}.
     */
    public static int insertZero(int rest, int mask) {
        int low = rest & (mask - 1);
        int high = (rest & ~(mask - 1)) << 1;
        return high | low;
    }

    /**
     * Fixed-width binary label, e.g. {@code label(5, 4) == "0101"}.
     */
    public static String label(int index, int numQubits) {
        StringBuilder sb = new StringBuilder(numQubits);
        for (int q = 0; q < numQubits; q++) {
            sb.append((char) ('0' + bit(index, numQubits, q)));
        }
        return sb.toString();
    }
}
