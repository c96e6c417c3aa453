package org.calista.credence.confidence;

/**
 * A derivation was refused. No partial or guessed value is ever returned alongside it.
 */
public class DerivationException extends Exception {

    private final String formula;

    public DerivationException(String message, String formula) {
        super(message);
        this.formula = formula;
    }

    /** Formula text as supplied (may be null when the AST itself was null). */
    public String formula() {
        return formula;
    }
}
