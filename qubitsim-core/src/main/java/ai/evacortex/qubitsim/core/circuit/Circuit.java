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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable circuit: a register width and the gate operations placed on it.
 *
 * <p>Edits return a new instance. Operations keep their insertion order, which decides ties
 * between operations that share a position. Operations are not validated here; the engine
 * rejects bad ones when the circuit is simulated.</p>
 */
public record Circuit(int numQubits, List<GateOperation> operations) {

    public Circuit {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits must be >= 0: " + numQubits);
        }
        operations = List.copyOf(Objects.requireNonNull(operations, "operations must not be null"));
    }

    public static Circuit empty(int numQubits) {
        return new Circuit(numQubits, List.of());
    }

    public static Circuit of(int numQubits, GateOperation... operations) {
        return new Circuit(numQubits, List.of(operations));
    }

    public Circuit withGate(GateOperation op) {
        Objects.requireNonNull(op, "op must not be null");
        List<GateOperation> next = new ArrayList<>(operations);
        next.add(op);
        return new Circuit(numQubits, next);
    }

    /**
     * Appends a gate after everything already placed on the qubits it touches.
     *
     * @param targetQubit second qubit for two-qubit kinds, otherwise {@code null}
     * @param theta rotation angle for rotation kinds, otherwise {@code null}
     */
    public Circuit withGate(GateKind kind, int qubit, Integer targetQubit, Double theta) {
        int position = nextPosition(qubit);
        if (targetQubit != null) {
            position = Math.max(position, nextPosition(targetQubit));
        }
        return withGate(new GateOperation(kind, qubit, targetQubit, theta, position));
    }

    public Circuit withGate(GateKind kind, int qubit) {
        return withGate(kind, qubit, null, null);
    }

    public Circuit withoutGate(int index) {
        Objects.checkIndex(index, operations.size());
        List<GateOperation> next = new ArrayList<>(operations);
        next.remove(index);
        return new Circuit(numQubits, next);
    }

    public Circuit replaceGate(int index, GateOperation op) {
        Objects.checkIndex(index, operations.size());
        Objects.requireNonNull(op, "op must not be null");
        List<GateOperation> next = new ArrayList<>(operations);
        next.set(index, op);
        return new Circuit(numQubits, next);
    }

    /**
     * Changes the register width, dropping operations that reference a removed qubit.
     */
    public Circuit withNumQubits(int n) {
        List<GateOperation> kept = operations.stream()
                .filter(op -> op.qubit() < n
                        && (!op.kind().requiresTarget() || op.targetQubit() == null || op.targetQubit() < n))
                .collect(Collectors.toList());
        return new Circuit(n, kept);
    }

    public Circuit cleared() {
        return empty(numQubits);
    }

    /**
     * Number of time slots in use: highest position + 1, or 0 when empty.
     */
    public int depth() {
        return operations.stream().mapToInt(GateOperation::position).max().orElse(-1) + 1;
    }

    /**
     * First free position on {@code qubit}.
     */
    public int nextPosition(int qubit) {
        return operations.stream()
                .filter(op -> op.touches(qubit))
                .mapToInt(GateOperation::position)
                .max()
                .orElse(-1) + 1;
    }

    public List<GateOperation> operationsAt(int position) {
        return operations.stream()
                .filter(op -> op.position() == position)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<GateOperation> operationsOnQubit(int qubit) {
        return operations.stream()
                .filter(op -> op.touches(qubit))
                .sorted(Comparator.comparingInt(GateOperation::position))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Operations in application order: ascending position, ties in insertion order.
     */
    public List<GateOperation> scheduled() {
        List<GateOperation> sorted = new ArrayList<>(operations);
        sorted.sort(Comparator.comparingInt(GateOperation::position));
        return sorted;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
