package org.calista.credence.confidence;

/**
 * The formula does not parse, uses an unknown combinator, or passes the wrong number
 * of arguments or parameters.
 */
public class MalformedFormulaException extends DerivationException {

    private final int position;

    public MalformedFormulaException(String message, String formula) {
        this(message, formula, -1);
    }

    public MalformedFormulaException(String message, String formula, int position) {
        super(position >= 0 ? message + " at " + position : message, formula);
        this.position = position;
    }

    /** Character offset of the problem, or -1 when it is structural. */
    public int position() {
        return position;
    }
}
