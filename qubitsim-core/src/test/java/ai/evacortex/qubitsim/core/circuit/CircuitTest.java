/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.circuit;

import ai.evacortex.qubitsim.core.gate.GateKind;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CircuitTest {

    private static Circuit sample() {
        return Circuit.empty(3)
                .withGate(GateKind.H, 0)                    // pos 0
                .withGate(GateKind.X, 0)                    // pos 1
                .withGate(GateKind.H, 1)                    // pos 0
                .withGate(GateKind.CNOT, 0, 1, null)        // pos 2
                .withGate(GateKind.RZ, 2, null, 0.5);       // pos 0
    }

    @Test
    void withGate_placesAfterEverythingOnTouchedQubits() {
        List<Integer> positions = sample().operations().stream().map(GateOperation::position).toList();
        assertEquals(List.of(0, 1, 0, 2, 0), positions);

        Circuit next = sample().withGate(GateKind.SWAP, 2, 1, null);
        assertEquals(3, next.operations().get(5).position());
    }

    @Test
    void depthAndQueries() {
        Circuit c = sample();
        assertEquals(3, c.depth());
        assertEquals(0, Circuit.empty(2).depth());
        assertEquals(3, c.operationsAt(0).size());
        assertEquals(List.of(GateKind.H, GateKind.CNOT),
                c.operationsOnQubit(1).stream().map(GateOperation::kind).toList());
        assertEquals(3, c.nextPosition(0));
        assertEquals(1, c.nextPosition(2));
    }

    @Test
    void scheduled_isStableByPosition() {
        List<GateKind> order = sample().scheduled().stream().map(GateOperation::kind).toList();
        assertEquals(List.of(GateKind.H, GateKind.H, GateKind.RZ, GateKind.X, GateKind.CNOT), order);
    }

    @Test
    void withNumQubits_dropsGatesOnRemovedQubits() {
        Circuit shrunk = sample().withNumQubits(1);
        assertEquals(1, shrunk.numQubits());
        assertEquals(List.of(GateKind.H, GateKind.X),
                shrunk.operations().stream().map(GateOperation::kind).toList());

        Circuit grown = sample().withNumQubits(5);
        assertEquals(sample().operations(), grown.operations());
    }

    @Test
    void edits_returnNewInstances() {
        Circuit original = sample();
        Circuit removed = original.withoutGate(0);
        Circuit replaced = original.replaceGate(1, GateOperation.single(GateKind.Z, 0, 1));

        assertEquals(5, original.operations().size());
        assertEquals(4, removed.operations().size());
        assertEquals(GateKind.Z, replaced.operations().get(1).kind());
        assertEquals(GateKind.X, original.operations().get(1).kind());
        assertTrue(original.cleared().isEmpty());
        assertEquals(3, original.cleared().numQubits());
        assertThrows(IndexOutOfBoundsException.class, () -> original.withoutGate(9));
    }

    @Test
    void operations_areDefensivelyCopied() {
        List<GateOperation> source = new ArrayList<>();
        source.add(GateOperation.single(GateKind.H, 0, 0));
        Circuit c = new Circuit(1, source);
        source.add(GateOperation.single(GateKind.X, 0, 1));

        assertEquals(1, c.operations().size());
        assertThrows(UnsupportedOperationException.class,
                () -> c.operations().add(GateOperation.single(GateKind.X, 0, 1)));
        assertThrows(IllegalArgumentException.class, () -> Circuit.empty(-1));
    }

    @Test
    void equalContent_meansEqualCircuits() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
        assertNotEquals(sample(), sample().withGate(GateKind.MEASURE, 0));
    }
}
