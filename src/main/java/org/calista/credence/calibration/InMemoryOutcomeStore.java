package org.calista.credence.calibration;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryOutcomeStore implements OutcomeStore {

    private final Map<String, List<Outcome>> byProducer = new ConcurrentHashMap<>();

    @Override
    public void add(Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        byProducer.computeIfAbsent(outcome.producerId(), k -> new CopyOnWriteArrayList<>()).add(outcome);
    }

    @Override
    public List<Outcome> outcomes(String producerId) {
        List<Outcome> l = byProducer.get(producerId);
        return l == null ? List.of() : List.copyOf(l);
    }

    @Override
    public Set<String> producers() {
        return new TreeSet<>(byProducer.keySet());
    }
}
