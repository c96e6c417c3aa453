package org.calista.credence.confidence;

import java.util.List;

/**
 * Evaluation reached an absent input under a combinator that propagates absence.
 */
public class AbsentInputException extends DerivationException {

    private final List<String> absentInputs;

    public AbsentInputException(String formula, List<String> absentInputs) {
        super("Absent input(s) " + absentInputs + " leave formula without a value: " + formula, formula);
        this.absentInputs = List.copyOf(absentInputs);
    }

    public List<String> absentInputs() {
        return absentInputs;
    }
}
