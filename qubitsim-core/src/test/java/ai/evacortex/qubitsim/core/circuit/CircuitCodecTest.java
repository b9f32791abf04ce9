/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.circuit;

import ai.evacortex.qubitsim.core.SimulationResult;
import ai.evacortex.qubitsim.core.engine.StateVectorEngine;
import ai.evacortex.qubitsim.core.exceptions.CircuitFormatException;
import ai.evacortex.qubitsim.core.exceptions.MissingGateParameterException;
import ai.evacortex.qubitsim.core.exceptions.UnknownGateKindException;
import ai.evacortex.qubitsim.core.gate.GateKind;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CircuitCodecTest {

    private final CircuitCodec codec = new CircuitCodec();

    @Test
    void readsEditorDocument() {
        String json = """
                {
                  "numQubits": 2,
                  "gates": [
                    {"gate": "H",    "qubit": 0, "position": 0, "params": {}},
                    {"gate": "CNOT", "qubit": 0, "targetQubit": 1, "position": 1, "params": {}},
                    {"gate": "RZ",   "qubit": 1, "position": 2, "params": {"theta": 0.25}},
                    {"gate": "M",    "qubit": 0, "position": 3, "id": 1712.5}
                  ]
                }
                """;
        Circuit c = codec.fromJson(json);

        assertEquals(2, c.numQubits());
        assertEquals(GateOperation.single(GateKind.H, 0, 0), c.operations().get(0));
        assertEquals(GateOperation.twoQubit(GateKind.CNOT, 0, 1, 1), c.operations().get(1));
        assertEquals(GateOperation.rotation(GateKind.RZ, 1, 0.25, 2), c.operations().get(2));
        assertEquals(GateOperation.measure(0, 3), c.operations().get(3));
    }

    @Test
    void missingWidthAndPositions_fallBackToDefaults() {
        Circuit c = codec.fromJson("""
                {"gates": [{"gate": "x", "qubit": 2}, {"gate": "h", "qubit": 2}, {"gate": "h", "qubit": 0}]}
                """);
        assertEquals(3, c.numQubits());
        assertEquals(0, c.operations().get(0).position());
        assertEquals(1, c.operations().get(1).position());
        assertEquals(0, c.operations().get(2).position());
    }

    @Test
    void writtenJson_omitsAbsentFieldsAndReadsBack() {
        Circuit c = Circuit.empty(2)
                .withGate(GateKind.H, 0)
                .withGate(GateKind.RY, 1, null, 1.5);
        String json = codec.toJson(c);

        assertFalse(json.contains("targetQubit"), json);
        assertTrue(json.contains("\"theta\""), json);
        assertEquals(c, codec.fromJson(json));
    }

    @Test
    void fileRoundTrip(@TempDir Path dir) {
        Circuit c = Circuit.empty(3)
                .withGate(GateKind.H, 0)
                .withGate(GateKind.SWAP, 0, 2, null)
                .withGate(GateKind.MEASURE, 2);
        Path file = dir.resolve("circuits/bell.json");

        codec.write(c, file);
        assertEquals(c, codec.read(file));
    }

    @Test
    void decodedCircuit_simulates() {
        Circuit c = codec.fromJson("""
                {"numQubits": 2, "gates": [
                  {"gate": "H", "qubit": 0, "position": 0},
                  {"gate": "CX", "qubit": 0, "targetQubit": 1, "position": 1}
                ]}
                """);
        SimulationResult result = new StateVectorEngine(0).simulate(c);
        assertEquals(0.5, result.probability("00"), 1e-9);
        assertEquals(0.5, result.probability("11"), 1e-9);
    }

    @Test
    void badDocuments_areRejected() {
        assertThrows(CircuitFormatException.class, () -> codec.fromJson("{not json"));
        assertThrows(CircuitFormatException.class, () -> codec.fromJson("null"));
        assertThrows(CircuitFormatException.class, () -> codec.fromJson("{\"gates\": [{\"gate\": \"H\"}]}"));
        assertThrows(CircuitFormatException.class, () -> codec.fromJson("{\"gates\": [{\"qubit\": 0}]}"));
        assertThrows(CircuitFormatException.class, () -> codec.fromJson("{\"numQubits\": -2}"));
        assertThrows(UnknownGateKindException.class,
                () -> codec.fromJson("{\"gates\": [{\"gate\": \"CCX\", \"qubit\": 0}]}"));
        assertThrows(CircuitFormatException.class, () -> codec.read(Path.of("does/not/exist.json")));
    }

    @Test
    void incompleteGates_decodeButFailAtSimulation() {
        Circuit c = codec.fromJson("{\"numQubits\": 2, \"gates\": [{\"gate\": \"RX\", \"qubit\": 0, \"position\": 0}]}");
        assertNull(c.operations().get(0).theta());
        assertThrows(MissingGateParameterException.class, () -> new StateVectorEngine(2).simulate(c));
    }
}
