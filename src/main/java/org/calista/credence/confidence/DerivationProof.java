package org.calista.credence.confidence;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DerivationProof — marker that a {@link ConfidenceValue.Derived} was produced by this
 * package from a validated formula.
 *
 * <p>
 * The constructor is package-private: only {@link ConfidenceAlgebra} and
 * {@link DerivationProofBuilder} issue proofs. A proof is bound to the formula, the
 * input names, the result and the calibration status it was issued for;
 * {@link #certifies(ConfidenceValue.Derived)} re-evaluates the formula to confirm it.
 * </p>
 */
public final class DerivationProof {

    private final Formula formula;
    private final List<String> inputNames;
    private final double value;
    private final CalibrationStatus calibrationStatus;
    private final String issuer;

    DerivationProof(Formula formula,
                    List<String> inputNames,
                    double value,
                    CalibrationStatus calibrationStatus,
                    String issuer) {
        this.formula = Objects.requireNonNull(formula, "formula");
        this.inputNames = List.copyOf(inputNames);
        this.value = value;
        this.calibrationStatus = Objects.requireNonNull(calibrationStatus, "calibrationStatus");
        this.issuer = Objects.requireNonNull(issuer, "issuer");
    }

    public Formula formula() {
        return formula;
    }

    public List<String> inputNames() {
        return inputNames;
    }

    public double value() {
        return value;
    }

    public CalibrationStatus calibrationStatus() {
        return calibrationStatus;
    }

    /** Which operation issued the proof, e.g. {@code algebra:min} or {@code builder}. */
    public String issuer() {
        return issuer;
    }

    boolean certifies(ConfidenceValue.Derived d) {
        if (!formula.render().equals(d.formula())) return false;
        if (Math.abs(value - d.value()) > ConfidenceAlgebra.EPSILON) return false;
        if (calibrationStatus != d.calibrationStatus()) return false;

        Map<String, ConfidenceValue> bound = new HashMap<>();
        for (ConfidenceValue.NamedInput in : d.inputs()) bound.put(in.name(), in.value());
        if (!bound.keySet().equals(new HashSet<>(inputNames))) return false;

        ConfidenceValue again = FormulaEvaluator.evaluate(formula, bound);
        if (again.isAbsent()) return false;
        return Math.abs(again.pointValue().getAsDouble() - value) <= ConfidenceAlgebra.EPSILON
                && again.calibrationStatus() == calibrationStatus;
    }

    @Override
    public String toString() {
        return "DerivationProof(" + formula.render() + ", by " + issuer + ")";
    }
}
