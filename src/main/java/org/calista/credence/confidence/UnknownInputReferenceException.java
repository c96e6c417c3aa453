package org.calista.credence.confidence;

import java.util.List;

/**
 * The formula names inputs that were not supplied.
 */
public class UnknownInputReferenceException extends DerivationException {

    private final List<String> missing;

    public UnknownInputReferenceException(String formula, List<String> missing) {
        super("Unknown input reference(s) " + missing + " in formula: " + formula, formula);
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}
