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

import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * Measurement statistics over a state vector. Sampling only reads the vector; the state
 * is never collapsed.
 *
 * <p>Not thread-safe: the random source is shared across calls on one instance.</p>
 */
public class ProbabilitySampler {

    private final Random random;

    public ProbabilitySampler() {
        this(new Random());
    }

    public ProbabilitySampler(long seed) {
        this(new Random(seed));
    }

    public ProbabilitySampler(Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * {@code |amplitude[i]|²} for every basis index.
     */
    public static double[] probabilities(Complex[] stateVector) {
        Objects.requireNonNull(stateVector, "stateVector must not be null");
        double[] probs = new double[stateVector.length];
        for (int i = 0; i < stateVector.length; i++) {
            probs[i] = stateVector[i].absSquared();
        }
        return probs;
    }

    /**
     * One weighted draw, as a {@code numQubits}-bit string.
     */
    public String sampleOne(Complex[] stateVector, int numQubits) {
        checkLength(stateVector, numQubits);
        int index = selectIndex(probabilities(stateVector), random.nextDouble());
        return QubitBits.label(index, numQubits);
    }

    /**
     * Draws {@code shots} independent outcomes and counts them per bit string.
     * Outcomes never drawn are absent from the map; keys iterate in ascending order.
     */
    public Map<String, Integer> sampleCounts(Complex[] stateVector, int numQubits, int shots) {
        checkLength(stateVector, numQubits);
        if (shots < 0) {
            throw new IllegalArgumentException("shots must be >= 0: " + shots);
        }

        CumulativeTable table = CumulativeTable.of(probabilities(stateVector));
        int[] hits = new int[stateVector.length];
        for (int s = 0; s < shots; s++) {
            hits[table.select(random.nextDouble())]++;
        }

        Map<String, Integer> counts = new TreeMap<>();
        for (int i = 0; i < hits.length; i++) {
            if (hits[i] > 0) {
                counts.put(QubitBits.label(i, numQubits), hits[i]);
            }
        }
        return counts;
    }

    /**
     * Returns the first index whose cumulative probability reaches {@code r}. Zero-probability
     * entries are never selected. If rounding leaves the total mass below {@code r}, the last
     * index carrying mass is returned.
     *
     * @param r uniform draw in [0, 1)
     */
    public static int selectIndex(double[] probabilities, double r) {
        double cumulative = 0.0;
        int last = probabilities.length - 1;
        for (int i = 0; i < probabilities.length; i++) {
            if (probabilities[i] <= 0.0) continue;
            cumulative += probabilities[i];
            last = i;
            if (cumulative >= r) return i;
        }
        return last;
    }

    private static void checkLength(Complex[] stateVector, int numQubits) {
        Objects.requireNonNull(stateVector, "stateVector must not be null");
        if (stateVector.length != QubitBits.dimension(numQubits)) {
            throw new IllegalArgumentException("State vector length " + stateVector.length
                    + " does not match 2^" + numQubits);
        }
    }

    /**
     * Same selection rule as {@link #selectIndex}, with a binary search over precomputed sums.
     */
    private record CumulativeTable(int[] indices, double[] cumulative) {

        static CumulativeTable of(double[] probabilities) {
            int n = 0;
            for (double p : probabilities) if (p > 0.0) n++;

            int[] indices = new int[n];
            double[] cumulative = new double[n];
            double sum = 0.0;
            int k = 0;
            for (int i = 0; i < probabilities.length; i++) {
                if (probabilities[i] <= 0.0) continue;
                sum += probabilities[i];
                indices[k] = i;
                cumulative[k] = sum;
                k++;
            }
            if (n == 0) {
                return new CumulativeTable(new int[]{probabilities.length - 1}, new double[]{Double.POSITIVE_INFINITY});
            }
            return new CumulativeTable(indices, cumulative);
        }

        int select(double r) {
            int lo = 0;
            int hi = cumulative.length - 1;
            if (cumulative[hi] < r) return indices[hi];
            while (lo < hi) {
                int mid = (lo + hi) >>> 1;
                if (cumulative[mid] >= r) {
                    hi = mid;
                } else {
                    lo = mid + 1;
                }
            }
            return indices[lo];
        }
    }
}
