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
import ai.evacortex.qubitsim.core.math.QubitBits;

/**
 * Outcome of replaying a circuit: the final amplitudes and their measurement probabilities,
 * index-aligned. Arrays are copied in and out, so instances can be shared.
 */
public record SimulationResult(int numQubits, Complex[] stateVector, double[] probabilities) {

    public SimulationResult {
        if (stateVector.length != QubitBits.dimension(numQubits) || probabilities.length != stateVector.length) {
            throw new IllegalArgumentException("Expected 2^" + numQubits + " entries, got "
                    + stateVector.length + " amplitudes and " + probabilities.length + " probabilities");
        }
        stateVector = stateVector.clone();
        probabilities = probabilities.clone();
    }

    @Override
    public Complex[] stateVector() {
        return stateVector.clone();
    }

    @Override
    public double[] probabilities() {
        return probabilities.clone();
    }

    public int dimension() {
        return stateVector.length;
    }

    public Complex amplitude(int index) {
        return stateVector[index];
    }

    public double probability(int index) {
        return probabilities[index];
    }

    /**
     * Probability of a basis state given as a bit string, qubit 0 first.
     */
    public double probability(String basis) {
        if (basis.length() != numQubits) {
            throw new IllegalArgumentException("Expected " + numQubits + " bits, got '" + basis + "'");
        }
        return probabilities[Integer.parseInt(basis, 2)];
    }

    public double totalProbability() {
        double sum = 0.0;
        for (double p : probabilities) sum += p;
        return sum;
    }
}
