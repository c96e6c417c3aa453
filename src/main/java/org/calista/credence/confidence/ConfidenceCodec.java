package org.calista.credence.confidence;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * ConfidenceCodec — {@code {type, ...fields}} JSON form of {@link ConfidenceValue}.
 *
 * <p>
 * Reading goes through the validating constructors, so out-of-range input fails with
 * {@link ConfidenceConstructionException}. A {@code derived} value read back has no
 * proof: it can be displayed and audited, but {@code isProven()} is false.
 * </p>
 */
public final class ConfidenceCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ConfidenceCodec() {
    }

    public static ObjectNode toJson(ConfidenceValue v) {
        ObjectNode n = NODES.objectNode();
        n.put("type", v.type().wireName());
        switch (v.type()) {
            case DETERMINISTIC -> {
                ConfidenceValue.Deterministic d = (ConfidenceValue.Deterministic) v;
                n.put("value", d.value());
                n.put("reason", d.reason());
            }
            case DERIVED -> {
                ConfidenceValue.Derived d = (ConfidenceValue.Derived) v;
                n.put("value", d.value());
                n.put("formula", d.formula());
                ArrayNode inputs = n.putArray("inputs");
                for (ConfidenceValue.NamedInput in : d.inputs()) {
                    ObjectNode i = inputs.addObject();
                    i.put("name", in.name());
                    i.set("confidence", toJson(in.value()));
                }
                n.put("calibrationStatus", d.calibrationStatus().wireName());
            }
            case MEASURED -> {
                ConfidenceValue.Measured m = (ConfidenceValue.Measured) v;
                n.put("value", m.value());
                n.put("datasetId", m.datasetId());
                n.put("sampleSize", m.sampleSize());
                n.put("accuracy", m.accuracy());
                ArrayNode ci = n.putArray("ci95");
                ci.add(m.ci95Low());
                ci.add(m.ci95High());
                if (m.measuredAt() != null) n.put("measuredAt", m.measuredAt().toString());
            }
            case BOUNDED -> {
                ConfidenceValue.Bounded b = (ConfidenceValue.Bounded) v;
                n.put("low", b.low());
                n.put("high", b.high());
                n.put("basis", b.basis().wireName());
                if (b.citation() != null) n.put("citation", b.citation());
            }
            case ABSENT -> n.put("reason", ((ConfidenceValue.Absent) v).reason().wireName());
        }
        return n;
    }

    public static ConfidenceValue fromJson(JsonNode n) {
        if (n == null || !n.isObject()) throw new ConfidenceConstructionException("confidence must be a JSON object");
        ConfidenceValue.Type type = ConfidenceValue.Type.fromWire(text(n, "type"));
        return switch (type) {
            case DETERMINISTIC -> {
                double value = number(n, "value");
                if (value != 0.0 && value != 1.0) {
                    throw new ConfidenceConstructionException("deterministic value must be 0 or 1, got " + value);
                }
                yield ConfidenceValue.deterministic(value == 1.0, text(n, "reason"));
            }
            case DERIVED -> {
                JsonNode arr = n.get("inputs");
                if (arr == null || !arr.isArray()) throw new ConfidenceConstructionException("derived.inputs must be an array");
                List<ConfidenceValue.NamedInput> inputs = new ArrayList<>(arr.size());
                for (JsonNode i : arr) inputs.add(new ConfidenceValue.NamedInput(text(i, "name"), fromJson(i.get("confidence"))));
                yield new ConfidenceValue.Derived(number(n, "value"), text(n, "formula"), inputs,
                        CalibrationStatus.fromWire(text(n, "calibrationStatus")), null);
            }
            case MEASURED -> {
                JsonNode ci = n.get("ci95");
                if (ci == null || !ci.isArray() || ci.size() != 2 || !ci.get(0).isNumber() || !ci.get(1).isNumber()) {
                    throw new ConfidenceConstructionException("measured.ci95 must be [low, high]");
                }
                JsonNode sz = n.get("sampleSize");
                if (sz == null || !sz.canConvertToLong()) throw new ConfidenceConstructionException("measured.sampleSize is required");
                yield ConfidenceValue.measured(number(n, "value"), text(n, "datasetId"), sz.asLong(),
                        n.has("accuracy") ? number(n, "accuracy") : number(n, "value"),
                        ci.get(0).asDouble(), ci.get(1).asDouble(), instant(n.get("measuredAt")));
            }
            case BOUNDED -> ConfidenceValue.bounded(number(n, "low"), number(n, "high"),
                    BoundedBasis.fromWire(text(n, "basis")),
                    n.hasNonNull("citation") ? n.get("citation").asText() : null);
            case ABSENT -> ConfidenceValue.absent(AbsentReason.fromWire(text(n, "reason")));
        };
    }

    /** Jackson module so {@link ConfidenceValue} fields serialize in the tagged form. */
    public static SimpleModule module() {
        SimpleModule m = new SimpleModule("credence-confidence");
        m.addSerializer(ConfidenceValue.class, new JsonSerializer<>() {
            @Override
            public void serialize(ConfidenceValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeTree(toJson(value));
            }
        });
        m.addDeserializer(ConfidenceValue.class, new JsonDeserializer<>() {
            @Override
            public ConfidenceValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                JsonNode node = p.readValueAsTree();
                return fromJson(node);
            }
        });
        return m;
    }

    // -------------------- Field helpers --------------------

    private static String text(JsonNode n, String field) {
        JsonNode v = n == null ? null : n.get(field);
        if (v == null || v.isNull() || !v.isTextual()) throw new ConfidenceConstructionException(field + " is required");
        return v.asText();
    }

    private static double number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || !v.isNumber()) throw new ConfidenceConstructionException(field + " must be a number");
        return v.asDouble();
    }

    private static Instant instant(JsonNode v) {
        if (v == null || v.isNull()) return null;
        try {
            return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
            throw new ConfidenceConstructionException("measuredAt is not an ISO-8601 instant: " + v.asText());
        }
    }
}
