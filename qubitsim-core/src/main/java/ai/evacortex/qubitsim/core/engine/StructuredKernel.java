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
import ai.evacortex.qubitsim.core.math.QubitBits;

/**
 * Default kernel. Two-qubit gates are applied as index permutations and sign flips
 * with no matrix arithmetic.
 */
public final class StructuredKernel implements GateKernel {

    @Override
    public void applyControlledNot(Complex[] amplitudes, int numQubits, int control, int target) {
        int controlMask = QubitBits.mask(numQubits, control);
        int targetMask = QubitBits.mask(numQubits, target);

        for (int i = 0; i < amplitudes.length; i++) {
            // visit each pair once, from its target-bit-0 member
            if ((i & controlMask) != 0 && (i & targetMask) == 0) {
                swap(amplitudes, i, i | targetMask);
            }
        }
    }

    @Override
    public void applyControlledZ(Complex[] amplitudes, int numQubits, int control, int target) {
        int both = QubitBits.mask(numQubits, control) | QubitBits.mask(numQubits, target);

        for (int i = 0; i < amplitudes.length; i++) {
            if ((i & both) == both) {
                amplitudes[i] = amplitudes[i].negate();
            }
        }
    }

    @Override
    public void applySwap(Complex[] amplitudes, int numQubits, int qubitA, int qubitB) {
        int maskA = QubitBits.mask(numQubits, qubitA);
        int maskB = QubitBits.mask(numQubits, qubitB);

        for (int i = 0; i < amplitudes.length; i++) {
            // only indices whose two bits differ move; take each pair from its (1, 0) side
            if ((i & maskA) != 0 && (i & maskB) == 0) {
                swap(amplitudes, i, (i & ~maskA) | maskB);
            }
        }
    }

    private static void swap(Complex[] amplitudes, int i, int j) {
        Complex tmp = amplitudes[i];
        amplitudes[i] = amplitudes[j];
        amplitudes[j] = tmp;
    }
}
