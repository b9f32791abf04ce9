/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.math;

import java.util.Arrays;

/**
 * Dense 4×4 complex matrix acting on an ordered qubit pair {@code (first, second)}.
 * Row and column index is {@code 2·bit(first) + bit(second)}.
 */
public final class Matrix4 {

    public static final int DIM = 4;

    private final Complex[] entries;

    private Matrix4(Complex[] entries) {
        this.entries = entries;
    }

    /**
     * @param rowMajor 16 entries in row-major order
     */
    public static Matrix4 of(Complex... rowMajor) {
        if (rowMajor.length != DIM * DIM) {
            throw new IllegalArgumentException("Expected 16 entries, got " + rowMajor.length);
        }
        return new Matrix4(rowMajor.clone());
    }

    public static Matrix4 real(double... rowMajor) {
        if (rowMajor.length != DIM * DIM) {
            throw new IllegalArgumentException("Expected 16 entries, got " + rowMajor.length);
        }
        Complex[] c = new Complex[DIM * DIM];
        for (int i = 0; i < c.length; i++) {
            c[i] = Complex.of(rowMajor[i]);
        }
        return new Matrix4(c);
    }

    public Complex get(int row, int col) {
        return entries[row * DIM + col];
    }

    /**
     * Returns {@code M · v} for a 4-element column vector.
     */
    public Complex[] apply(Complex[] v) {
        Complex[] out = new Complex[DIM];
        for (int r = 0; r < DIM; r++) {
            Complex acc = Complex.ZERO;
            for (int c = 0; c < DIM; c++) {
                acc = acc.add(get(r, c).multiply(v[c]));
            }
            out[r] = acc;
        }
        return out;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Matrix4)) return false;
        return Arrays.equals(entries, ((Matrix4) obj).entries);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(entries);
    }
}
