/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.config;

import ai.evacortex.qubitsim.core.math.QubitBits;

/**
 * Simulator tunables.
 *
 * <p>{@link #fromSystemProperties()} reads {@code qubitsim.*} JVM properties; anything not
 * set falls back to {@link #defaults()}.</p>
 */
public record SimulatorConfig(
        int maxQubits,              // 0 = no ceiling beyond what an array can address
        double normTolerance,       // drift beyond this is logged, never thrown
        double displayThreshold,    // basis states at or below this probability are not listed
        int displayPrecision,       // decimals in amplitude display strings
        int cacheMaxEntries,        // simulation results kept by QuantumSimulator
        boolean cacheEnabled
) {
    public static final String MAX_QUBITS = "qubitsim.maxQubits";
    public static final String NORM_TOLERANCE = "qubitsim.normTolerance";
    public static final String DISPLAY_THRESHOLD = "qubitsim.display.threshold";
    public static final String DISPLAY_PRECISION = "qubitsim.display.precision";
    public static final String CACHE_MAX_ENTRIES = "qubitsim.cache.maxEntries";
    public static final String CACHE_ENABLED = "qubitsim.cache.enabled";

    public SimulatorConfig {
        if (maxQubits < 0 || maxQubits > QubitBits.MAX_ADDRESSABLE_QUBITS) {
            throw new IllegalArgumentException("maxQubits must be in [0, " + QubitBits.MAX_ADDRESSABLE_QUBITS + "]: " + maxQubits);
        }
        if (!(normTolerance > 0.0)) {
            throw new IllegalArgumentException("normTolerance must be > 0: " + normTolerance);
        }
        if (displayThreshold < 0.0) {
            throw new IllegalArgumentException("displayThreshold must be >= 0: " + displayThreshold);
        }
        if (displayPrecision < 0) {
            throw new IllegalArgumentException("displayPrecision must be >= 0: " + displayPrecision);
        }
        if (cacheMaxEntries < 0) {
            throw new IllegalArgumentException("cacheMaxEntries must be >= 0: " + cacheMaxEntries);
        }
    }

    public static SimulatorConfig defaults() {
        return new SimulatorConfig(0, 1e-6, 1e-4, 3, 256, true);
    }

    public static SimulatorConfig fromSystemProperties() {
        SimulatorConfig d = defaults();
        return new SimulatorConfig(
                Integer.parseInt(System.getProperty(MAX_QUBITS, String.valueOf(d.maxQubits()))),
                Double.parseDouble(System.getProperty(NORM_TOLERANCE, String.valueOf(d.normTolerance()))),
                Double.parseDouble(System.getProperty(DISPLAY_THRESHOLD, String.valueOf(d.displayThreshold()))),
                Integer.parseInt(System.getProperty(DISPLAY_PRECISION, String.valueOf(d.displayPrecision()))),
                Integer.parseInt(System.getProperty(CACHE_MAX_ENTRIES, String.valueOf(d.cacheMaxEntries()))),
                Boolean.parseBoolean(System.getProperty(CACHE_ENABLED, String.valueOf(d.cacheEnabled()))));
    }

    public int effectiveMaxQubits() {
        return maxQubits == 0 ? QubitBits.MAX_ADDRESSABLE_QUBITS : maxQubits;
    }

    public SimulatorConfig withMaxQubits(int value) {
        return new SimulatorConfig(value, normTolerance, displayThreshold, displayPrecision, cacheMaxEntries, cacheEnabled);
    }

    public SimulatorConfig withCache(boolean enabled, int maxEntries) {
        return new SimulatorConfig(maxQubits, normTolerance, displayThreshold, displayPrecision, maxEntries, enabled);
    }
}
