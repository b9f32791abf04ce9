/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.engine;

import ai.evacortex.qubitsim.core.gate.GateMatrices;
import ai.evacortex.qubitsim.core.math.Complex;
import ai.evacortex.qubitsim.core.math.Matrix4;
import ai.evacortex.qubitsim.core.math.QubitBits;

/**
 * Reference kernel: every two-qubit gate is a dense 4×4 matrix multiplied into each
 * group of four amplitudes that share all other qubits' bits.
 *
 * <p>Slower than {@link StructuredKernel} and mathematically identical to it; useful for
 * cross-checking and for arbitrary two-qubit unitaries via {@link #applyTwoQubit}.</p>
 */
public final class DenseKernel implements GateKernel {

    @Override
    public void applyControlledNot(Complex[] amplitudes, int numQubits, int control, int target) {
        applyTwoQubit(amplitudes, numQubits, control, target, GateMatrices.CNOT_4);
    }

    @Override
    public void applyControlledZ(Complex[] amplitudes, int numQubits, int control, int target) {
        applyTwoQubit(amplitudes, numQubits, control, target, GateMatrices.CZ_4);
    }

    @Override
    public void applySwap(Complex[] amplitudes, int numQubits, int qubitA, int qubitB) {
        applyTwoQubit(amplitudes, numQubits, qubitA, qubitB, GateMatrices.SWAP_4);
    }

    /**
     * Multiplies {@code matrix} into the amplitudes of the ordered pair {@code (first, second)}.
     */
    public void applyTwoQubit(Complex[] amplitudes, int numQubits, int first, int second, Matrix4 matrix) {
        int firstMask = QubitBits.mask(numQubits, first);
        int secondMask = QubitBits.mask(numQubits, second);
        int[] group = new int[Matrix4.DIM];
        Complex[] in = new Complex[Matrix4.DIM];

        for (int base = 0; base < amplitudes.length; base++) {
            if ((base & firstMask) != 0 || (base & secondMask) != 0) continue;

            group[0] = base;
            group[1] = base | secondMask;
            group[2] = base | firstMask;
            group[3] = base | firstMask | secondMask;
            for (int k = 0; k < Matrix4.DIM; k++) {
                in[k] = amplitudes[group[k]];
            }

            Complex[] out = matrix.apply(in);
            for (int k = 0; k < Matrix4.DIM; k++) {
                amplitudes[group[k]] = out[k];
            }
        }
    }
}
