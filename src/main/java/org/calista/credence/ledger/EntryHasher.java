package org.calista.credence.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Hash chain over ledger entries: {@code hash = sha256(canonical(fields + previousHash))}.
 * Canonical JSON sorts object keys recursively so field order never changes a hash.
 */
public final class EntryHasher {

    /** previousHash of entry #1. */
    public static final String GENESIS = "0".repeat(64);

    private static final ObjectMapper CANONICAL = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private EntryHasher() {
    }

    public static String hash(long sequence,
                              EntryKind kind,
                              JsonNode payload,
                              String correlationId,
                              long timestampEpochMs,
                              List<Long> derivedFrom,
                              Provenance provenance,
                              String previousHash) {
        ObjectNode n = NODES.objectNode();
        n.put("sequence", sequence);
        n.put("kind", kind.wireName());
        n.set("payload", payload == null ? NODES.objectNode() : payload);
        if (correlationId != null) n.put("correlationId", correlationId);
        n.put("timestamp", timestampEpochMs);
        ArrayNode df = n.putArray("derivedFrom");
        for (Long s : derivedFrom) df.add(s);
        if (provenance != null) {
            if (provenance.source() != null) n.put("source", provenance.source());
            if (provenance.method() != null) n.put("method", provenance.method());
            if (provenance.agent() != null) n.put("agent", provenance.agent());
        }
        n.put("previousHash", previousHash);
        return sha256Hex(canonical(n));
    }

    /** Recomputes the hash of {@code e} from its fields. */
    public static String recompute(LedgerEntry e) {
        return hash(e.sequence(), e.kind(), e.payload(), e.correlationId(), e.timestampEpochMs(),
                e.derivedFrom(), e.provenance(), e.previousHash());
    }

    public static String canonical(JsonNode node) {
        try {
            return CANONICAL.writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("canonical JSON failed", e);
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node == null) return NODES.nullNode();
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) names.add(it.next());
            Collections.sort(names);
            ObjectNode out = NODES.objectNode();
            for (String k : names) out.set(k, sorted(node.get(k)));
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            for (JsonNode x : node) out.add(sorted(x));
            return out;
        }
        return node;
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] d = md.digest(s.getBytes(StandardCharsets.UTF_8));
            return java.util.HexFormat.of().formatHex(d);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
