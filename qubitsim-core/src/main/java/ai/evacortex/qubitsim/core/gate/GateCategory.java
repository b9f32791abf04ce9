/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.gate;

/**
 * How a gate acts on the state vector.
 * - SINGLE: fixed 2×2 unitary on one qubit.
 * - ROTATION: 2×2 unitary generated from an angle θ.
 * - CONTROLLED: two-qubit permutation or phase rule keyed on a control bit.
 * - SWAP: exchange of two qubits' bits.
 * - MEASURE: marker only, no effect on amplitudes.
 */
public enum GateCategory {
    SINGLE,
    ROTATION,
    CONTROLLED,
    SWAP,
    MEASURE
}
