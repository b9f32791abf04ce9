/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.storage;

import ai.evacortex.qubitsim.core.SimulationResult;
import ai.evacortex.qubitsim.core.circuit.Circuit;
import ai.evacortex.qubitsim.core.engine.StateVectorEngine;
import ai.evacortex.qubitsim.core.gate.GateKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class SimulationCacheTest {

    private SimulationCache cache;
    private AtomicInteger runs;
    private Function<Circuit, SimulationResult> simulator;

    @BeforeEach
    void setUp() {
        cache = new SimulationCache(16);
        runs = new AtomicInteger();
        simulator = c -> {
            runs.incrementAndGet();
            return new StateVectorEngine(0).simulate(c);
        };
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void identicalCircuits_simulateOnce() {
        Circuit a = Circuit.empty(2).withGate(GateKind.H, 0);
        Circuit b = Circuit.empty(2).withGate(GateKind.H, 0);

        SimulationResult first = cache.get(a, simulator);
        SimulationResult second = cache.get(b, simulator);

        assertSame(first, second);
        assertEquals(1, runs.get());
        assertSame(first, cache.getIfPresent(a));
    }

    @Test
    void differentCircuits_areSeparateEntries() {
        Circuit a = Circuit.empty(2).withGate(GateKind.H, 0);
        cache.get(a, simulator);
        cache.get(a.withGate(GateKind.Z, 0), simulator);

        assertEquals(2, runs.get());
        cache.invalidateAll();
        assertNull(cache.getIfPresent(a));
    }

    @Test
    void closedCache_computesEveryTime() {
        Circuit a = Circuit.empty(1).withGate(GateKind.X, 0);
        cache.close();
        cache.get(a, simulator);
        cache.get(a, simulator);

        assertEquals(2, runs.get());
        assertNull(cache.getIfPresent(a));
    }

    @Test
    void negativeSize_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SimulationCache(-1));
    }
}
