/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.math;

import org.junit.jupiter.api.Test;

import static ai.evacortex.qubitsim.core.StateTestUtils.assertComplexEquals;
import static org.junit.jupiter.api.Assertions.*;

class ComplexTest {

    @Test
    void arithmetic_matchesHandComputedValues() {
        Complex a = new Complex(1, 2);
        Complex b = new Complex(3, -1);

        assertEquals(new Complex(4, 1), a.add(b));
        assertEquals(new Complex(-2, 3), a.subtract(b));
        assertEquals(new Complex(5, 5), a.multiply(b));
        assertEquals(new Complex(1, -2), a.conjugate());
        assertEquals(new Complex(-1, -2), a.negate());
    }

    @Test
    void bareRealOverloads_treatArgumentAsZeroImaginary() {
        Complex a = new Complex(1, 2);
        assertEquals(a.add(Complex.of(2.0)), a.add(2.0));
        assertEquals(a.multiply(Complex.of(-3.0)), a.multiply(-3.0));
        assertEquals(new Complex(5, 0), Complex.of(5));
    }

    @Test
    void magnitudeAndPhase() {
        Complex c = new Complex(3, 4);
        assertEquals(5.0, c.abs(), 1e-12);
        assertEquals(25.0, c.absSquared(), 1e-12);
        assertEquals(Math.PI / 2, Complex.I.phase(), 1e-12);
        assertEquals(Math.PI, Complex.of(-1).phase(), 1e-12);
        assertEquals(0.0, Complex.ZERO.phase(), 0.0);
    }

    @Test
    void expI_liesOnUnitCircle() {
        assertComplexEquals(Complex.I, Complex.expI(Math.PI / 2), 1e-12);
        assertComplexEquals(Complex.of(-1), Complex.expI(Math.PI), 1e-12);
        for (double t = -3.0; t <= 3.0; t += 0.37) {
            assertEquals(1.0, Complex.expI(t).abs(), 1e-12);
        }
    }

    @Test
    void conjugateProduct_isSquaredMagnitude() {
        Complex c = new Complex(-0.3, 0.8);
        Complex product = c.multiply(c.conjugate());
        assertEquals(c.absSquared(), product.real, 1e-12);
        assertEquals(0.0, product.imag, 1e-12);
    }

    @Test
    void toDisplayString_dropsNegligibleParts() {
        assertEquals("0.707", Complex.of(1 / Math.sqrt(2)).toDisplayString(3));
        assertEquals("-1.000i", new Complex(0, -1).toDisplayString(3));
        assertEquals("0.500+0.500i", new Complex(0.5, 0.5).toDisplayString(3));
        assertEquals("0.500-0.500i", new Complex(0.5, -0.5).toDisplayString(3));
        assertEquals("0.00", Complex.ZERO.toDisplayString(2));
        assertEquals("0.000", new Complex(-0.0, 0.0).toDisplayString(3));
        assertEquals("1", Complex.ONE.toDisplayString(0));
    }

    @Test
    void toDisplayString_rejectsNegativePrecision() {
        assertThrows(IllegalArgumentException.class, () -> Complex.ONE.toDisplayString(-1));
    }

    @Test
    void equality_isExactAndHashConsistent() {
        Complex a = new Complex(0.1, 0.2);
        Complex b = new Complex(0.1, 0.2);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Complex(0.1, 0.2000001));
        assertTrue(a.isClose(new Complex(0.1, 0.2000001), 1e-6));
    }
}
