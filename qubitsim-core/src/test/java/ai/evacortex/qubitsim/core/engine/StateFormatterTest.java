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
import ai.evacortex.qubitsim.core.gate.GateKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateFormatterTest {

    @Test
    void listsOnlyPopulatedBasisStates() {
        StateVectorEngine engine = new StateVectorEngine(2);
        engine.applySingleQubitGate(GateKind.H, 0, null);
        engine.applyControlledNot(0, 1);

        List<BasisAmplitude> rows = engine.formattedState();
        assertEquals(2, rows.size());

        BasisAmplitude first = rows.get(0);
        assertEquals("|00⟩", first.basis());
        assertEquals(0, first.index());
        assertEquals("0.707", first.amplitudeText());
        assertEquals(0.5, first.probability(), 1e-9);
        assertEquals(0.0, first.phase(), 1e-12);

        assertEquals("|11⟩", rows.get(1).basis());
        assertEquals(3, rows.get(1).index());
    }

    @Test
    void imaginaryAmplitude_isRenderedWithSuffix() {
        StateVectorEngine engine = new StateVectorEngine(1);
        engine.applySingleQubitGate(GateKind.Y, 0, null);

        List<BasisAmplitude> rows = engine.formattedState();
        assertEquals(1, rows.size());
        assertEquals("|1⟩", rows.get(0).basis());
        assertEquals("1.000i", rows.get(0).amplitudeText());
        assertEquals(Math.PI / 2, rows.get(0).phase(), 1e-12);
    }

    @Test
    void thresholdAndPrecision_areHonoured() {
        StateVectorEngine engine = new StateVectorEngine(1);
        engine.applySingleQubitGate(GateKind.RY, 0, 0.02); // p(1) = sin²(0.01) ≈ 1e-4

        assertEquals(1, StateFormatter.format(engine.stateVector(), 1, 1e-3, 3).size());
        List<BasisAmplitude> all = StateFormatter.format(engine.stateVector(), 1, 0.0, 5);
        assertEquals(2, all.size());
        assertEquals("0.01000", all.get(1).amplitudeText());
    }
}
