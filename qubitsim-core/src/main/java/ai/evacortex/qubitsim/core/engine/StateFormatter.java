/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.engine;

import ai.evacortex.qubitsim.core.BasisAmplitude;
import ai.evacortex.qubitsim.core.math.Complex;
import ai.evacortex.qubitsim.core.math.QubitBits;

import java.util.ArrayList;
import java.util.List;

public final class StateFormatter {

    private StateFormatter() {}

    /**
     * Lists basis states whose probability exceeds {@code threshold}, in index order.
     */
    public static List<BasisAmplitude> format(Complex[] stateVector, int numQubits, double threshold, int precision) {
        List<BasisAmplitude> rows = new ArrayList<>();
        for (int i = 0; i < stateVector.length; i++) {
            Complex amp = stateVector[i];
            double prob = amp.absSquared();
            if (prob > threshold) {
                rows.add(new BasisAmplitude(
                        "|" + QubitBits.label(i, numQubits) + "⟩",
                        i,
                        amp,
                        amp.toDisplayString(precision),
                        prob,
                        amp.phase()));
            }
        }
        return rows;
    }
}
