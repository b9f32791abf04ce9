/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.storage;

import ai.evacortex.qubitsim.core.circuit.Circuit;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content hash of a circuit, stable across JVMs.
 *
 * <p>Canonical encoding (big-endian): {@code numQubits:int, count:int}, then per operation in
 * list order {@code kind:int, qubit:int, target:int (-1 if absent), hasTheta:byte,
 * theta:double bits (0 if absent), position:int}.</p>
 */
public final class CircuitHashing {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final int SEED = 0x9747b28c;
    private static final int OP_BYTES = 4 + 4 + 4 + 1 + 8 + 4;

    private CircuitHashing() {}

    public static byte[] canonicalBytes(Circuit circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        ByteBuffer buffer = ByteBuffer.allocate(8 + circuit.operations().size() * OP_BYTES);
        buffer.putInt(circuit.numQubits());
        buffer.putInt(circuit.operations().size());
        for (GateOperation op : circuit.operations()) {
            buffer.putInt(op.kind().ordinal());
            buffer.putInt(op.qubit());
            buffer.putInt(op.targetQubit() != null ? op.targetQubit() : -1);
            buffer.put((byte) (op.theta() != null ? 1 : 0));
            buffer.putLong(op.theta() != null ? Double.doubleToLongBits(op.theta()) : 0L);
            buffer.putInt(op.position());
        }
        return buffer.array();
    }

    public static long contentHash(Circuit circuit) {
        byte[] bytes = canonicalBytes(circuit);
        return XX_HASH.hash64().hash(bytes, 0, bytes.length, SEED);
    }

    public static String contentHashHex(Circuit circuit) {
        return HexFormat.of().toHexDigits(contentHash(circuit));
    }
}
