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
import ai.evacortex.qubitsim.core.exceptions.InvalidGateOperationException;
import ai.evacortex.qubitsim.core.gate.GateCategory;
import ai.evacortex.qubitsim.core.gate.GateKind;
import ai.evacortex.qubitsim.core.gate.GateMatrices;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import ai.evacortex.qubitsim.core.math.Complex;
import ai.evacortex.qubitsim.core.math.Matrix2;
import ai.evacortex.qubitsim.core.math.QubitBits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Owns a {@code 2^n} amplitude vector and applies gates to it.
 *
 * <p>Qubit 0 is the most significant bit of a basis index. Every public mutator validates
 * its arguments before touching the vector, so a rejected call leaves the state unchanged.</p>
 *
 * <p>Not thread-safe. Concurrent simulations need separate engine instances.</p>
 */
public class StateVectorEngine {

    private static final Logger log = LoggerFactory.getLogger(StateVectorEngine.class);

    private final GateKernel kernel;
    private final SimulatorConfig config;

    private int numQubits;
    private Complex[] amplitudes;

    public StateVectorEngine(int numQubits) {
        this(numQubits, new StructuredKernel(), SimulatorConfig.defaults());
    }

    public StateVectorEngine(int numQubits, GateKernel kernel, SimulatorConfig config) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        reset(numQubits);
    }

    /**
     * Replaces the vector with {@code |0…0⟩} on {@code numQubits} qubits.
     *
     * @throws IllegalArgumentException if {@code numQubits} is negative or above the configured ceiling
     */
    public void reset(int numQubits) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits must be >= 0: " + numQubits);
        }
        if (numQubits > config.effectiveMaxQubits()) {
            throw new IllegalArgumentException("numQubits " + numQubits + " exceeds the limit of "
                    + config.effectiveMaxQubits() + " (" + SimulatorConfig.MAX_QUBITS + ")");
        }
        Complex[] fresh = new Complex[QubitBits.dimension(numQubits)];
        Arrays.fill(fresh, Complex.ZERO);
        fresh[0] = Complex.ONE;
        this.numQubits = numQubits;
        this.amplitudes = fresh;
    }

    public void reset() {
        reset(numQubits);
    }

    /**
     * Applies a fixed or rotation gate to one qubit.
     *
     * @param theta rotation angle in radians; required for RX/RY/RZ, ignored otherwise
     */
    public void applySingleQubitGate(GateKind kind, int qubit, Double theta) {
        Objects.requireNonNull(kind, "kind must not be null");
        GateCategory category = kind.category();
        if (category != GateCategory.SINGLE && category != GateCategory.ROTATION) {
            throw new InvalidGateOperationException(kind + " is not a single-qubit gate");
        }
        GateOperation.checkQubit(qubit, numQubits);
        applyUnitary(qubit, GateMatrices.singleQubit(kind, theta));
    }

    /**
     * Applies an arbitrary 2×2 matrix to one qubit. For each basis index {@code i} and each
     * value {@code b'} of the target bit, {@code next[i with bit b'] += U[b'][b] · amp[i]}
     * where {@code b} is the bit in {@code i}. Writes into a fresh vector.
     */
    public void applyUnitary(int qubit, Matrix2 matrix) {
        Objects.requireNonNull(matrix, "matrix must not be null");
        GateOperation.checkQubit(qubit, numQubits);

        int mask = QubitBits.mask(numQubits, qubit);
        Complex[] next = new Complex[amplitudes.length];
        Arrays.fill(next, Complex.ZERO);

        for (int i = 0; i < amplitudes.length; i++) {
            Complex amp = amplitudes[i];
            int bit = (i & mask) != 0 ? 1 : 0;
            int cleared = i & ~mask;
            next[cleared] = next[cleared].add(matrix.get(0, bit).multiply(amp));
            next[cleared | mask] = next[cleared | mask].add(matrix.get(1, bit).multiply(amp));
        }
        amplitudes = next;
    }

    public void applyControlledNot(int control, int target) {
        checkPair(GateKind.CNOT, control, target);
        kernel.applyControlledNot(amplitudes, numQubits, control, target);
    }

    public void applyControlledZ(int control, int target) {
        checkPair(GateKind.CZ, control, target);
        kernel.applyControlledZ(amplitudes, numQubits, control, target);
    }

    public void applySwap(int qubitA, int qubitB) {
        checkPair(GateKind.SWAP, qubitA, qubitB);
        kernel.applySwap(amplitudes, numQubits, qubitA, qubitB);
    }

    /**
     * Dispatches one operation to the matching primitive. Measurement markers are accepted
     * and leave the state untouched.
     */
    public void applyGateOperation(GateOperation op) {
        Objects.requireNonNull(op, "op must not be null");
        op.validate(numQubits);

        switch (op.kind()) {
            case H, X, Y, Z, S, T, RX, RY, RZ -> applyUnitary(op.qubit(), GateMatrices.singleQubit(op.kind(), op.theta()));
            case CNOT -> kernel.applyControlledNot(amplitudes, numQubits, op.qubit(), op.targetQubit());
            case CZ -> kernel.applyControlledZ(amplitudes, numQubits, op.qubit(), op.targetQubit());
            case SWAP -> kernel.applySwap(amplitudes, numQubits, op.qubit(), op.targetQubit());
            case MEASURE -> log.trace("Measurement marker on qubit {} at position {}", op.qubit(), op.position());
        }

        if (log.isDebugEnabled()) {
            double norm = norm();
            if (Math.abs(norm - 1.0) > config.normTolerance()) {
                log.debug("Norm drift after {} on qubit {}: |ψ|² = {}", op.kind(), op.qubit(), norm);
            }
        }
    }

    /**
     * Resets to {@code |0…0⟩} on the current width and replays {@code operations} in ascending
     * position order; operations sharing a position keep their list order. All operations are
     * validated first, so a bad one leaves the previous state in place.
     */
    public SimulationResult simulate(List<GateOperation> operations) {
        return replay(numQubits, new Circuit(numQubits, operations).scheduled());
    }

    /**
     * Resets to the circuit's width and replays its operations.
     */
    public SimulationResult simulate(Circuit circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        return replay(circuit.numQubits(), circuit.scheduled());
    }

    private SimulationResult replay(int width, List<GateOperation> scheduled) {
        for (GateOperation op : scheduled) {
            op.validate(width);
        }
        reset(width);
        for (GateOperation op : scheduled) {
            applyGateOperation(op);
        }
        log.debug("Simulated {} operation(s) on {} qubit(s)", scheduled.size(), width);
        return result();
    }

    public SimulationResult result() {
        return new SimulationResult(numQubits, amplitudes, probabilities());
    }

    public double[] probabilities() {
        return ProbabilitySampler.probabilities(amplitudes);
    }

    public QubitState qubitState(int qubit) {
        return PartialTraceReducer.reduceQubit(amplitudes, numQubits, qubit);
    }

    public List<BasisAmplitude> formattedState() {
        return StateFormatter.format(amplitudes, numQubits, config.displayThreshold(), config.displayPrecision());
    }

    /**
     * Sum of squared magnitudes.
     */
    public double norm() {
        double sum = 0.0;
        for (Complex c : amplitudes) sum += c.absSquared();
        return sum;
    }

    public int numQubits() {
        return numQubits;
    }

    public int dimension() {
        return amplitudes.length;
    }

    public Complex amplitude(int index) {
        return amplitudes[index];
    }

    /**
     * Copy of the current vector.
     */
    public Complex[] stateVector() {
        return amplitudes.clone();
    }

    private void checkPair(GateKind kind, int a, int b) {
        GateOperation.checkQubit(a, numQubits);
        GateOperation.checkQubit(b, numQubits);
        if (a == b) {
            throw new InvalidGateOperationException(kind + " needs two distinct qubits, got " + a + " twice");
        }
    }
}
