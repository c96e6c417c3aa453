package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * W3C PROV-style document (PROV-JSON layout) describing a ledger segment.
 *
 * <p>
 * Entries are entities, the act of recording each entry is an activity, provenance
 * agents are agents. Relations: {@code wasGeneratedBy} (entry ← activity),
 * {@code wasAssociatedWith} (activity ← agent), {@code wasDerivedFrom} (entry ← parent).
 * </p>
 */
public final class ProvenanceDocument {

    public static final String NS_CREDENCE = "credence";
    public static final String NS_LEDGER = "ledger";

    public record Entity(String id,
                         long sequence,
                         EntryKind kind,
                         String correlationId,
                         long timestampEpochMs,
                         JsonNode payload,
                         String hash) {
        public Entity {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(kind, "kind");
            payload = payload == null ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        }
    }

    public record Activity(String id, EntryKind kind, long startedAtEpochMs, String source, String method) {
    }

    public record Agent(String id, String name) {
    }

    public record Generation(String entity, String activity) {
    }

    public record Association(String activity, String agent) {
    }

    public record Derivation(String generatedEntity, String usedEntity) {
    }

    private final List<Entity> entities;
    private final List<Activity> activities;
    private final List<Agent> agents;
    private final List<Generation> generations;
    private final List<Association> associations;
    private final List<Derivation> derivations;

    public ProvenanceDocument(List<Entity> entities,
                              List<Activity> activities,
                              List<Agent> agents,
                              List<Generation> generations,
                              List<Association> associations,
                              List<Derivation> derivations) {
        this.entities = List.copyOf(entities);
        this.activities = List.copyOf(activities);
        this.agents = List.copyOf(agents);
        this.generations = List.copyOf(generations);
        this.associations = List.copyOf(associations);
        this.derivations = List.copyOf(derivations);
    }

    public List<Entity> entities() {
        return entities;
    }

    public List<Activity> activities() {
        return activities;
    }

    public List<Agent> agents() {
        return agents;
    }

    public List<Generation> generations() {
        return generations;
    }

    public List<Association> associations() {
        return associations;
    }

    public List<Derivation> derivations() {
        return derivations;
    }

    // -------------------- PROV-JSON --------------------

    public ObjectNode toJson() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode root = f.objectNode();

        ObjectNode prefix = root.putObject("prefix");
        prefix.put(NS_CREDENCE, "urn:credence:");
        prefix.put(NS_LEDGER, "urn:credence:ledger:");

        ObjectNode ent = root.putObject("entity");
        for (Entity e : entities) {
            ObjectNode n = ent.putObject(e.id());
            n.put("prov:type", "credence:LedgerEntry");
            n.put("credence:sequence", e.sequence());
            n.put("credence:kind", e.kind().wireName());
            if (e.correlationId() != null) n.put("credence:correlationId", e.correlationId());
            n.put("credence:timestamp", e.timestampEpochMs());
            n.set("credence:payload", e.payload());
            n.put("credence:hash", e.hash());
        }

        ObjectNode act = root.putObject("activity");
        for (Activity a : activities) {
            ObjectNode n = act.putObject(a.id());
            n.put("prov:type", "credence:" + a.kind().wireName());
            n.put("prov:startTime", java.time.Instant.ofEpochMilli(a.startedAtEpochMs()).toString());
            if (a.source() != null) n.put("credence:source", a.source());
            if (a.method() != null) n.put("credence:method", a.method());
        }

        ObjectNode ag = root.putObject("agent");
        for (Agent a : agents) {
            ObjectNode n = ag.putObject(a.id());
            n.put("prov:type", "prov:SoftwareAgent");
            n.put("credence:name", a.name());
        }

        ObjectNode gen = root.putObject("wasGeneratedBy");
        int i = 0;
        for (Generation g : generations) {
            ObjectNode n = gen.putObject("_:gen" + (++i));
            n.put("prov:entity", g.entity());
            n.put("prov:activity", g.activity());
        }

        ObjectNode assoc = root.putObject("wasAssociatedWith");
        i = 0;
        for (Association a : associations) {
            ObjectNode n = assoc.putObject("_:assoc" + (++i));
            n.put("prov:activity", a.activity());
            n.put("prov:agent", a.agent());
        }

        ObjectNode der = root.putObject("wasDerivedFrom");
        i = 0;
        for (Derivation d : derivations) {
            ObjectNode n = der.putObject("_:der" + (++i));
            n.put("prov:generatedEntity", d.generatedEntity());
            n.put("prov:usedEntity", d.usedEntity());
        }
        return root;
    }

    public static ProvenanceDocument fromJson(JsonNode root) {
        if (root == null || !root.isObject()) throw new IllegalArgumentException("PROV document must be a JSON object");

        List<Entity> entities = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("entity"))) {
            JsonNode n = e.getValue();
            entities.add(new Entity(e.getKey(),
                    required(n, "credence:sequence").asLong(),
                    EntryKind.fromWire(required(n, "credence:kind").asText()),
                    n.hasNonNull("credence:correlationId") ? n.get("credence:correlationId").asText() : null,
                    required(n, "credence:timestamp").asLong(),
                    n.get("credence:payload"),
                    n.hasNonNull("credence:hash") ? n.get("credence:hash").asText() : null));
        }

        List<Activity> activities = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("activity"))) {
            JsonNode n = e.getValue();
            String type = required(n, "prov:type").asText();
            activities.add(new Activity(e.getKey(),
                    EntryKind.fromWire(type.substring(type.indexOf(':') + 1)),
                    java.time.Instant.parse(required(n, "prov:startTime").asText()).toEpochMilli(),
                    n.hasNonNull("credence:source") ? n.get("credence:source").asText() : null,
                    n.hasNonNull("credence:method") ? n.get("credence:method").asText() : null));
        }

        List<Agent> agents = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("agent"))) {
            agents.add(new Agent(e.getKey(), required(e.getValue(), "credence:name").asText()));
        }

        List<Generation> gens = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("wasGeneratedBy"))) {
            JsonNode n = e.getValue();
            gens.add(new Generation(required(n, "prov:entity").asText(), required(n, "prov:activity").asText()));
        }

        List<Association> assocs = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("wasAssociatedWith"))) {
            JsonNode n = e.getValue();
            assocs.add(new Association(required(n, "prov:activity").asText(), required(n, "prov:agent").asText()));
        }

        List<Derivation> ders = new ArrayList<>();
        for (Map.Entry<String, JsonNode> e : fields(root.get("wasDerivedFrom"))) {
            JsonNode n = e.getValue();
            ders.add(new Derivation(required(n, "prov:generatedEntity").asText(), required(n, "prov:usedEntity").asText()));
        }
        return new ProvenanceDocument(entities, activities, agents, gens, assocs, ders);
    }

    private static List<Map.Entry<String, JsonNode>> fields(JsonNode n) {
        List<Map.Entry<String, JsonNode>> out = new ArrayList<>();
        if (n == null || !n.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) out.add(it.next());
        return out;
    }

    private static JsonNode required(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("PROV record is missing " + field);
        return v;
    }
}
