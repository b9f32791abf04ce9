/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core;

import ai.evacortex.qubitsim.core.math.Complex;

/**
 * One listed basis state, e.g. {@code |01⟩ : 0.707  (p = 0.5)}.
 */
public record BasisAmplitude(String basis, int index, Complex amplitude, String amplitudeText,
                             double probability, double phase) {
}
