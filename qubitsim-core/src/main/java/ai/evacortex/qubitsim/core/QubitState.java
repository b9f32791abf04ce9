/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core;

import ai.evacortex.qubitsim.core.math.Complex;

/**
 * Reduced state of one qubit after tracing out the rest of the register.
 *
 * <p>ρ01 sums {@code a0·conj(a1)} over the other qubits' assignments, where {@code a0} and
 * {@code a1} are the amplitudes with this qubit at 0 and 1. Bloch coordinates follow as:</p>
 * <pre>
 *     x = 2·Re(ρ01)    y = 2·Im(ρ01)    z = ρ00 − ρ11
 *     purity = ρ00² + ρ11² + 2·|ρ01|²
 * </pre>
 * <p>A qubit that is not entangled with the rest has purity 1 and a unit Bloch vector.</p>
 */
public record QubitState(double x, double y, double z, double purity,
                         Complex rho00, Complex rho01, Complex rho11) {

    public Complex rho10() {
        return rho01.conjugate();
    }

    public double blochLength() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    /**
     * Polar angle θ = acos(z), clamped against rounding just outside [-1, 1].
     */
    public double polarAngle() {
        return Math.acos(Math.max(-1.0, Math.min(1.0, z)));
    }

    /**
     * Azimuth φ = atan2(y, x).
     */
    public double azimuthalAngle() {
        return Math.atan2(y, x);
    }

    public boolean isPure(double tolerance) {
        return Math.abs(1.0 - purity) <= tolerance;
    }
}
