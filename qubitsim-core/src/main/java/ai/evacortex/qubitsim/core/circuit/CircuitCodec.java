/*
 * QubitSim — State-Vector Circuit Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qubitsim.core.circuit;

import ai.evacortex.qubitsim.core.exceptions.CircuitFormatException;
import ai.evacortex.qubitsim.core.gate.GateKind;
import ai.evacortex.qubitsim.core.gate.GateOperation;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of a {@link Circuit}:
 * <pre>
 * {
 *   "numQubits": 2,
 *   "gates": [
 *     {"gate": "H",    "qubit": 0, "position": 0},
 *     {"gate": "CNOT", "qubit": 0, "targetQubit": 1, "position": 1},
 *     {"gate": "RZ",   "qubit": 1, "position": 2, "params": {"theta": 0.785}}
 *   ]
 * }
 * </pre>
 * <p>On read, {@code numQubits} defaults to 3, gate names go through {@link GateKind#fromName}
 * and an entry without {@code position} is placed after the gates already on its qubits.</p>
 */
public class CircuitCodec {

    static final int DEFAULT_NUM_QUBITS = 3;
    static final String THETA = "theta";

    private final ObjectMapper mapper;

    public CircuitCodec() {
        this(new ObjectMapper());
    }

    public CircuitCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class JsonCircuit {
        @JsonAlias({"qubits"})
        public Integer numQubits;
        @JsonAlias({"operations"})
        public List<JsonGate> gates;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static final class JsonGate {
        @JsonAlias({"kind"})
        public String gate;
        public Integer qubit;
        @JsonAlias({"target"})
        public Integer targetQubit;
        public Integer position;
        public Map<String, Double> params;
    }

    public String toJson(Circuit circuit) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(circuit));
        } catch (JsonProcessingException e) {
            throw new CircuitFormatException("failed to serialize circuit", e);
        }
    }

    public void write(Circuit circuit, OutputStream out) {
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, toDocument(circuit));
        } catch (IOException e) {
            throw new CircuitFormatException("failed to write circuit", e);
        }
    }

    public void write(Circuit circuit, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                write(circuit, out);
            }
        } catch (IOException e) {
            throw new CircuitFormatException("failed to write " + path, e);
        }
    }

    public Circuit fromJson(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromDocument(mapper.readValue(json, JsonCircuit.class));
        } catch (IOException e) {
            throw new CircuitFormatException("malformed JSON", e);
        }
    }

    public Circuit read(InputStream in) {
        try {
            return fromDocument(mapper.readValue(in, JsonCircuit.class));
        } catch (IOException e) {
            throw new CircuitFormatException("malformed JSON", e);
        }
    }

    public Circuit read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new CircuitFormatException("failed to read " + path, e);
        }
    }

    private static JsonCircuit toDocument(Circuit circuit) {
        Objects.requireNonNull(circuit, "circuit must not be null");
        JsonCircuit doc = new JsonCircuit();
        doc.numQubits = circuit.numQubits();
        doc.gates = new ArrayList<>();
        for (GateOperation op : circuit.operations()) {
            JsonGate g = new JsonGate();
            g.gate = op.kind().name();
            g.qubit = op.qubit();
            g.targetQubit = op.targetQubit();
            g.position = op.position();
            if (op.theta() != null) {
                g.params = new LinkedHashMap<>();
                g.params.put(THETA, op.theta());
            }
            doc.gates.add(g);
        }
        return doc;
    }

    private static Circuit fromDocument(JsonCircuit doc) {
        if (doc == null) {
            throw new CircuitFormatException("empty document");
        }
        int numQubits = doc.numQubits != null ? doc.numQubits : DEFAULT_NUM_QUBITS;
        if (numQubits < 0) {
            throw new CircuitFormatException("numQubits must be >= 0, got " + numQubits);
        }

        Circuit circuit = Circuit.empty(numQubits);
        if (doc.gates == null) return circuit;

        for (int i = 0; i < doc.gates.size(); i++) {
            JsonGate g = doc.gates.get(i);
            if (g == null || g.gate == null) {
                throw new CircuitFormatException("gate #" + i + " has no 'gate' name");
            }
            if (g.qubit == null) {
                throw new CircuitFormatException("gate #" + i + " (" + g.gate + ") has no 'qubit'");
            }
            GateKind kind = GateKind.fromName(g.gate);
            Double theta = g.params != null ? g.params.get(THETA) : null;
            Integer target = kind.requiresTarget() ? g.targetQubit : null;

            circuit = g.position != null
                    ? circuit.withGate(new GateOperation(kind, g.qubit, target, theta, g.position))
                    : circuit.withGate(kind, g.qubit, target, theta);
        }
        return circuit;
    }
}
