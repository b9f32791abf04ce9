/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.math;

import java.util.Objects;

/**
 * Immutable 2×2 complex matrix, row-major: {@code [[m00, m01], [m10, m11]]}.
 */
public record Matrix2(Complex m00, Complex m01, Complex m10, Complex m11) {

    public static final Matrix2 IDENTITY = real(1, 0, 0, 1);

    public Matrix2 {
        Objects.requireNonNull(m00, "m00");
        Objects.requireNonNull(m01, "m01");
        Objects.requireNonNull(m10, "m10");
        Objects.requireNonNull(m11, "m11");
    }

    public static Matrix2 real(double m00, double m01, double m10, double m11) {
        return new Matrix2(Complex.of(m00), Complex.of(m01), Complex.of(m10), Complex.of(m11));
    }

    public Complex get(int row, int col) {
        if (row == 0) return col == 0 ? m00 : m01;
        return col == 0 ? m10 : m11;
    }

    public Matrix2 multiply(Matrix2 o) {
        return new Matrix2(
                m00.multiply(o.m00).add(m01.multiply(o.m10)),
                m00.multiply(o.m01).add(m01.multiply(o.m11)),
                m10.multiply(o.m00).add(m11.multiply(o.m10)),
                m10.multiply(o.m01).add(m11.multiply(o.m11)));
    }

    public Matrix2 conjugateTranspose() {
        return new Matrix2(m00.conjugate(), m10.conjugate(), m01.conjugate(), m11.conjugate());
    }

    public boolean isClose(Matrix2 other, double tolerance) {
        return m00.isClose(other.m00, tolerance) && m01.isClose(other.m01, tolerance)
                && m10.isClose(other.m10, tolerance) && m11.isClose(other.m11, tolerance);
    }

    /**
     * {@code U·U† == I} within tolerance.
     */
    public boolean isUnitary(double tolerance) {
        return multiply(conjugateTranspose()).isClose(IDENTITY, tolerance);
    }
}
