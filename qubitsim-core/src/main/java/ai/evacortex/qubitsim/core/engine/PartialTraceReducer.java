/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.engine;

import ai.evacortex.qubitsim.core.QubitState;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import ai.evacortex.qubitsim.core.math.Complex;
import ai.evacortex.qubitsim.core.math.QubitBits;

import java.util.Objects;

/**
 * Single-qubit reduced density matrix by partial trace over the other qubits.
 *
 * <p>The outer loop runs over the {@code 2^(n-1)} assignments of the other qubits; for each
 * assignment the two amplitudes {@code a0} (target bit 0) and {@code a1} (target bit 1)
 * contribute</p>
 * <pre>
 *     ρ00 += |a0|²    ρ11 += |a1|²    ρ01 += a0·conj(a1)
 * </pre>
 * <p>which equals the full double sum over index pairs that agree on every other bit.</p>
 */
public final class PartialTraceReducer {

    private PartialTraceReducer() {}

    /**
     * @throws ai.evacortex.qubitsim.core.exceptions.InvalidQubitIndexException if {@code qubit} is out of range
     * @throws IllegalArgumentException if the vector length is not {@code 2^numQubits}
     */
    public static QubitState reduceQubit(Complex[] stateVector, int numQubits, int qubit) {
        Objects.requireNonNull(stateVector, "stateVector must not be null");
        GateOperation.checkQubit(qubit, numQubits);
        if (stateVector.length != QubitBits.dimension(numQubits)) {
            throw new IllegalArgumentException("State vector length " + stateVector.length
                    + " does not match 2^" + numQubits);
        }

        int mask = QubitBits.mask(numQubits, qubit);
        int half = stateVector.length >> 1;

        double rho00 = 0.0;
        double rho11 = 0.0;
        double rho01Re = 0.0;
        double rho01Im = 0.0;

        for (int rest = 0; rest < half; rest++) {
            int i0 = QubitBits.insertZero(rest, mask);
            Complex a0 = stateVector[i0];
            Complex a1 = stateVector[i0 | mask];

            rho00 += a0.absSquared();
            rho11 += a1.absSquared();
            // a0 · conj(a1)
            rho01Re += a0.real * a1.real + a0.imag * a1.imag;
            rho01Im += a0.imag * a1.real - a0.real * a1.imag;
        }

        double x = 2 * rho01Re;
        double y = 2 * rho01Im;
        double z = rho00 - rho11;
        double purity = rho00 * rho00 + rho11 * rho11 + 2 * (rho01Re * rho01Re + rho01Im * rho01Im);

        return new QubitState(x, y, z, purity,
                Complex.of(rho00), new Complex(rho01Re, rho01Im), Complex.of(rho11));
    }
}
