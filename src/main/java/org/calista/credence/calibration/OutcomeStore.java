package org.calista.credence.calibration;

import java.util.List;
import java.util.Set;

/**
 * Where a {@link CalibrationTracker} keeps outcomes. Implementations must be safe for
 * concurrent {@link #add} and reads; reads return a snapshot.
 */
public interface OutcomeStore {

    void add(Outcome outcome);

    /** Outcomes of one producer in recording order. */
    List<Outcome> outcomes(String producerId);

    Set<String> producers();
}
