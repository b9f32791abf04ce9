/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.math;

import java.util.Locale;

/**
 * Immutable complex number used for state-vector amplitudes and gate matrix entries.
 * Every binary operation has a {@code double} overload that treats the argument as a
 * bare real with zero imaginary part.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0.0, 0.0);
    public static final Complex ONE = new Complex(1.0, 0.0);
    public static final Complex I = new Complex(0.0, 1.0);

    private static final double DISPLAY_EPSILON = 1e-4;

    public final double real;
    public final double imag;

    public Complex(double real, double imag) {
        this.real = real;
        this.imag = imag;
    }

    public static Complex of(double real) {
        return new Complex(real, 0.0);
    }

    public static Complex of(double real, double imag) {
        return new Complex(real, imag);
    }

    /**
     * Returns {@code e^{iθ}}.
     */
    public static Complex expI(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public Complex add(Complex other) {
        return new Complex(this.real + other.real, this.imag + other.imag);
    }

    public Complex add(double other) {
        return new Complex(this.real + other, this.imag);
    }

    public Complex subtract(Complex other) {
        return new Complex(this.real - other.real, this.imag - other.imag);
    }

    public Complex multiply(Complex other) {
        double r = this.real * other.real - this.imag * other.imag;
        double i = this.real * other.imag + this.imag * other.real;
        return new Complex(r, i);
    }

    public Complex multiply(double factor) {
        return scale(factor);
    }

    public Complex scale(double factor) {
        return new Complex(this.real * factor, this.imag * factor);
    }

    public Complex conjugate() {
        return new Complex(this.real, -this.imag);
    }

    public Complex negate() {
        return new Complex(-this.real, -this.imag);
    }

    /**
     * Magnitude {@code |z|}.
     */
    public double abs() {
        return Math.hypot(this.real, this.imag);
    }

    public double absSquared() {
        return this.real * this.real + this.imag * this.imag;
    }

    public double phase() {
        return Math.atan2(imag, real);
    }

    public boolean isClose(Complex other, double tolerance) {
        return Math.abs(real - other.real) <= tolerance && Math.abs(imag - other.imag) <= tolerance;
    }

    /**
     * Short human-readable form with a fixed number of decimals.
     * Parts smaller than {@code 1e-4} in magnitude are omitted: {@code "0.707"},
     * {@code "-1.000i"}, {@code "0.500+0.500i"}, {@code "0.500-0.500i"}.
     */
    public String toDisplayString(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be >= 0: " + precision);
        }
        String re = fixed(real, precision);
        String im = fixed(imag, precision);
        if (Math.abs(imag) < DISPLAY_EPSILON) return re;
        if (Math.abs(real) < DISPLAY_EPSILON) return im + "i";
        return re + (imag >= 0 ? "+" : "") + im + "i";
    }

    private static String fixed(double value, int precision) {
        // + 0.0 folds -0.0 into 0.0
        return String.format(Locale.ROOT, "%." + precision + "f", value + 0.0);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%f %s %fi)", real, (imag < 0 ? "-" : "+"), Math.abs(imag));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(real, other.real) == 0 && Double.compare(imag, other.imag) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(real) * 31 + Double.hashCode(imag);
    }
}
