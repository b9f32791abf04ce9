/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.gate;

import ai.evacortex.qubitsim.core.exceptions.InvalidGateOperationException;
import ai.evacortex.qubitsim.core.exceptions.MissingGateParameterException;
import ai.evacortex.qubitsim.core.math.Complex;
import ai.evacortex.qubitsim.core.math.Matrix2;
import ai.evacortex.qubitsim.core.math.Matrix4;

import java.util.Objects;

/**
 * Unitary action of every {@link GateKind}.
 *
 * <p>Single-qubit and rotation kinds map to a {@link Matrix2}. Two-qubit kinds are applied
 * structurally by the engine; their dense 4×4 form is kept here as the reference formulation
 * used by {@code DenseKernel}.</p>
 */
public final class GateMatrices {

    private static final double INV_SQRT2 = 1.0 / Math.sqrt(2.0);

    public static final Matrix2 HADAMARD = Matrix2.real(INV_SQRT2, INV_SQRT2, INV_SQRT2, -INV_SQRT2);
    public static final Matrix2 PAULI_X = Matrix2.real(0, 1, 1, 0);
    public static final Matrix2 PAULI_Y = new Matrix2(Complex.ZERO, Complex.of(0, -1), Complex.I, Complex.ZERO);
    public static final Matrix2 PAULI_Z = Matrix2.real(1, 0, 0, -1);
    public static final Matrix2 PHASE_S = new Matrix2(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.I);
    public static final Matrix2 PHASE_T = new Matrix2(Complex.ONE, Complex.ZERO, Complex.ZERO, Complex.expI(Math.PI / 4));

    public static final Matrix4 CNOT_4 = Matrix4.real(
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 0, 1,
            0, 0, 1, 0);
    public static final Matrix4 CZ_4 = Matrix4.real(
            1, 0, 0, 0,
            0, 1, 0, 0,
            0, 0, 1, 0,
            0, 0, 0, -1);
    public static final Matrix4 SWAP_4 = Matrix4.real(
            1, 0, 0, 0,
            0, 0, 1, 0,
            0, 1, 0, 0,
            0, 0, 0, 1);

    private GateMatrices() {}

    /**
     * Returns the 2×2 matrix of a fixed or rotation gate.
     *
     * @param theta rotation angle in radians; ignored for fixed gates, required for rotations
     * @throws MissingGateParameterException if a rotation is requested without θ
     * @throws InvalidGateOperationException if {@code kind} is not a single-qubit gate
     */
    public static Matrix2 singleQubit(GateKind kind, Double theta) {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.requiresTheta() && theta == null) {
            throw new MissingGateParameterException(kind.name(), "theta");
        }
        return switch (kind) {
            case H -> HADAMARD;
            case X -> PAULI_X;
            case Y -> PAULI_Y;
            case Z -> PAULI_Z;
            case S -> PHASE_S;
            case T -> PHASE_T;
            case RX -> rotationX(theta);
            case RY -> rotationY(theta);
            case RZ -> rotationZ(theta);
            case CNOT, CZ, SWAP, MEASURE ->
                    throw new InvalidGateOperationException(kind + " is not a single-qubit gate");
        };
    }

    /**
     * Dense 4×4 form of a two-qubit gate over {@code (qubit, targetQubit)}.
     *
     * @throws InvalidGateOperationException if {@code kind} is not a two-qubit gate
     */
    public static Matrix4 twoQubit(GateKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return switch (kind) {
            case CNOT -> CNOT_4;
            case CZ -> CZ_4;
            case SWAP -> SWAP_4;
            case H, X, Y, Z, S, T, RX, RY, RZ, MEASURE ->
                    throw new InvalidGateOperationException(kind + " is not a two-qubit gate");
        };
    }

    /** {@code [[cos θ/2, -i sin θ/2], [-i sin θ/2, cos θ/2]]} */
    public static Matrix2 rotationX(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        Complex offDiagonal = new Complex(0, -s);
        return new Matrix2(Complex.of(c), offDiagonal, offDiagonal, Complex.of(c));
    }

    /** {@code [[cos θ/2, -sin θ/2], [sin θ/2, cos θ/2]]} */
    public static Matrix2 rotationY(double theta) {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        return Matrix2.real(c, -s, s, c);
    }

    /** {@code diag(e^{-iθ/2}, e^{iθ/2})} */
    public static Matrix2 rotationZ(double theta) {
        return new Matrix2(Complex.expI(-theta / 2), Complex.ZERO, Complex.ZERO, Complex.expI(theta / 2));
    }
}
