/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.engine;

import ai.evacortex.qubitsim.core.math.Complex;

/**
 * {@code GateKernel} applies the two-qubit gates (controlled-X, controlled-Z, swap) to an
 * amplitude vector in place.
 *
 * <p>The amplitude vector has {@code 2^n} entries; bit {@code n-1-q} of an index is the
 * basis value of qubit {@code q}, so qubit 0 is the most significant bit. For a gate on the
 * ordered pair {@code (a, b)} the three rules are:</p>
 * <ul>
 *     <li>CNOT: for every index with bit(a) = 1, the amplitudes of the two indices that differ
 *     only in bit(b) are exchanged once</li>
 *     <li>CZ: every amplitude with bit(a) = bit(b) = 1 is negated</li>
 *     <li>SWAP: every amplitude moves to the index obtained by exchanging bit(a) and bit(b)</li>
 * </ul>
 *
 * <p>All three operations are permutations or sign flips and preserve the vector norm.
 * Implementations may assume the engine has already validated that both qubits are
 * in range and distinct. Implementations must be deterministic and hold no state between
 * calls.</p>
 *
 * @see StructuredKernel
 * @see DenseKernel
 */
public interface GateKernel {

    /**
     * Flips {@code target} on every basis state where {@code control} is 1.
     *
     * @param amplitudes vector of size {@code 2^numQubits}, modified in place
     * @param numQubits register width
     * @param control control qubit
     * @param target target qubit
     */
    void applyControlledNot(Complex[] amplitudes, int numQubits, int control, int target);

    /**
     * Applies phase −1 to every basis state where both qubits are 1. Symmetric in its arguments.
     *
     * @param amplitudes vector of size {@code 2^numQubits}, modified in place
     * @param numQubits register width
     * @param control first qubit
     * @param target second qubit
     */
    void applyControlledZ(Complex[] amplitudes, int numQubits, int control, int target);

    /**
     * Exchanges the basis values of two qubits. Applying it twice restores the input exactly.
     *
     * @param amplitudes vector of size {@code 2^numQubits}, modified in place
     * @param numQubits register width
     * @param qubitA first qubit
     * @param qubitB second qubit
     */
    void applySwap(Complex[] amplitudes, int numQubits, int qubitA, int qubitB);
}
