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
import ai.evacortex.qubitsim.core.QubitState;
import ai.evacortex.qubitsim.core.SimulationResult;
import ai.evacortex.qubitsim.core.circuit.Circuit;
import ai.evacortex.qubitsim.core.config.SimulatorConfig;
import ai.evacortex.qubitsim.core.storage.SimulationCache;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for callers that hold a {@link Circuit}.
 *
 * <p>Each simulation runs on its own {@link StateVectorEngine}, so any edit to the circuit is
 * a full replay from {@code |0…0⟩}. Results for identical circuits are served from a
 * {@link SimulationCache} when caching is enabled. Simulations are safe to run concurrently;
 * sampling calls share one random source and are not.</p>
 */
public class QuantumSimulator implements Closeable {

    private final SimulatorConfig config;
    private final GateKernel kernel;
    private final ProbabilitySampler sampler;
    private final SimulationCache cache;

    public QuantumSimulator() {
        this(SimulatorConfig.fromSystemProperties());
    }

    public QuantumSimulator(SimulatorConfig config) {
        this(config, new StructuredKernel(), new ProbabilitySampler());
    }

    public QuantumSimulator(SimulatorConfig config, GateKernel kernel, ProbabilitySampler sampler) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler must not be null");
        this.cache = config.cacheEnabled() ? new SimulationCache(config.cacheMaxEntries()) : null;
    }

    public SimulationResult simulate(Circuit circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        return cache != null ? cache.get(circuit, this::run) : run(circuit);
    }

    public QubitState qubitState(Circuit circuit, int qubit) {
        SimulationResult result = simulate(circuit);
        return PartialTraceReducer.reduceQubit(result.stateVector(), result.numQubits(), qubit);
    }

    public String sampleOne(Circuit circuit) {
        SimulationResult result = simulate(circuit);
        return sampler.sampleOne(result.stateVector(), result.numQubits());
    }

    public Map<String, Integer> sampleCounts(Circuit circuit, int shots) {
        SimulationResult result = simulate(circuit);
        return sampler.sampleCounts(result.stateVector(), result.numQubits(), shots);
    }

    public List<BasisAmplitude> formattedState(Circuit circuit) {
        SimulationResult result = simulate(circuit);
        return StateFormatter.format(result.stateVector(), result.numQubits(),
                config.displayThreshold(), config.displayPrecision());
    }

    public SimulatorConfig config() {
        return config;
    }

    /**
     * @return the result cache, or {@code null} when caching is disabled
     */
    public SimulationCache cache() {
        return cache;
    }

    @Override
    public void close() {
        if (cache != null) cache.close();
    }

    private SimulationResult run(Circuit circuit) {
        return new StateVectorEngine(0, kernel, config).simulate(circuit);
    }
}
