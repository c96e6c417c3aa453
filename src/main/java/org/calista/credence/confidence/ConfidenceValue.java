package org.calista.credence.confidence;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * ConfidenceValue — a degree of belief that always says where it came from.
 *
 * <p>
 * Closed sum type: the constructor is private, so the five nested variants are the only
 * subclasses. Each variant validates itself on construction and throws
 * {@link ConfidenceConstructionException} instead of clamping.
 * </p>
 *
 * <ul>
 *     <li>{@link Deterministic} — logically certain, 1.0 or 0.0</li>
 *     <li>{@link Derived} — computed from named inputs by a formula</li>
 *     <li>{@link Measured} — empirical rate with sample size and interval</li>
 *     <li>{@link Bounded} — interval estimate, low &lt;= high</li>
 *     <li>{@link Absent} — explicit "unknown", never coerced to a number</li>
 * </ul>
 */
public abstract class ConfidenceValue {

    public enum Type {
        DETERMINISTIC,
        DERIVED,
        MEASURED,
        BOUNDED,
        ABSENT;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type fromWire(String s) {
            if (s == null) throw new ConfidenceConstructionException("type is required");
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfidenceConstructionException("unknown confidence type: " + s);
            }
        }
    }

    private ConfidenceValue() {
    }

    public abstract Type type();

    /**
     * Numeric reading: bounded values use their midpoint, absent has none.
     */
    public abstract OptionalDouble pointValue();

    /**
     * Conservative reading for gating: bounded values use their lower end, absent is 0.
     */
    public abstract double effectiveValue();

    public abstract CalibrationStatus calibrationStatus();

    public final boolean isAbsent() {
        return type() == Type.ABSENT;
    }

    // -------------------- Factories --------------------

    public static Deterministic deterministic(boolean holds, String reason) {
        return new Deterministic(holds, reason);
    }

    public static Deterministic certain(String reason) {
        return new Deterministic(true, reason);
    }

    public static Deterministic impossible(String reason) {
        return new Deterministic(false, reason);
    }

    public static Measured measured(double value,
                                    String datasetId,
                                    long sampleSize,
                                    double accuracy,
                                    double ci95Low,
                                    double ci95High,
                                    Instant measuredAt) {
        return new Measured(value, datasetId, sampleSize, accuracy, ci95Low, ci95High, measuredAt);
    }

    /** Measured value whose accuracy equals its value. */
    public static Measured measured(double value, String datasetId, long sampleSize, double ci95Low, double ci95High) {
        return new Measured(value, datasetId, sampleSize, value, ci95Low, ci95High, null);
    }

    public static Bounded bounded(double low, double high, BoundedBasis basis) {
        return new Bounded(low, high, basis, null);
    }

    public static Bounded bounded(double low, double high, BoundedBasis basis, String citation) {
        return new Bounded(low, high, basis, citation);
    }

    public static Absent absent(AbsentReason reason) {
        return new Absent(reason);
    }

    // -------------------- Validation --------------------

    static double requireUnit(String field, double v) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new ConfidenceConstructionException(field + " must be within [0,1], got " + v);
        }
        return v;
    }

    static String requireText(String field, String v) {
        if (v == null || v.isBlank()) throw new ConfidenceConstructionException(field + " is required");
        return v;
    }

    // =====================================================================
    // Variants
    // =====================================================================

    public static final class Deterministic extends ConfidenceValue {
        private final boolean holds;
        private final String reason;

        private Deterministic(boolean holds, String reason) {
            this.holds = holds;
            this.reason = requireText("reason", reason);
        }

        public boolean holds() {
            return holds;
        }

        public double value() {
            return holds ? 1.0 : 0.0;
        }

        public String reason() {
            return reason;
        }

        @Override
        public Type type() {
            return Type.DETERMINISTIC;
        }

        @Override
        public OptionalDouble pointValue() {
            return OptionalDouble.of(value());
        }

        @Override
        public double effectiveValue() {
            return value();
        }

        @Override
        public CalibrationStatus calibrationStatus() {
            return CalibrationStatus.PRESERVED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Deterministic d)) return false;
            return holds == d.holds && reason.equals(d.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(holds, reason);
        }

        @Override
        public String toString() {
            return "Deterministic(" + holds + ", " + reason + ")";
        }
    }

    /**
     * Value computed from named inputs. Only this package can create one; instances
     * produced by the algebra or the {@link DerivationProofBuilder} carry a
     * {@link DerivationProof}, instances parsed from JSON do not.
     */
    public static final class Derived extends ConfidenceValue {
        private final double value;
        private final String formula;
        private final List<NamedInput> inputs;
        private final CalibrationStatus calibrationStatus;
        private final DerivationProof proof; // null => not proven

        Derived(double value,
                String formula,
                List<NamedInput> inputs,
                CalibrationStatus calibrationStatus,
                DerivationProof proof) {
            this.value = requireUnit("derived.value", value);
            this.formula = requireText("formula", formula);
            this.calibrationStatus = Objects.requireNonNull(calibrationStatus, "calibrationStatus");
            this.inputs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(inputs, "inputs")));
            this.proof = proof;
        }

        public double value() {
            return value;
        }

        public String formula() {
            return formula;
        }

        public List<NamedInput> inputs() {
            return inputs;
        }

        /** Proof attached by the builder; empty-handed for parsed or intermediate values. */
        public DerivationProof proof() {
            return proof;
        }

        /**
         * True when the attached proof was issued by this package and still certifies
         * this value (formula, inputs, result and calibration status).
         */
        public boolean isProven() {
            return proof != null && proof.certifies(this);
        }

        @Override
        public Type type() {
            return Type.DERIVED;
        }

        @Override
        public OptionalDouble pointValue() {
            return OptionalDouble.of(value);
        }

        @Override
        public double effectiveValue() {
            return value;
        }

        @Override
        public CalibrationStatus calibrationStatus() {
            return calibrationStatus;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Derived d)) return false;
            return Double.compare(value, d.value) == 0
                    && formula.equals(d.formula)
                    && inputs.equals(d.inputs)
                    && calibrationStatus == d.calibrationStatus;
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, formula, inputs, calibrationStatus);
        }

        @Override
        public String toString() {
            return "Derived(" + value + ", " + formula + ", " + calibrationStatus.wireName() + ")";
        }
    }

    public static final class Measured extends ConfidenceValue {
        private final double value;
        private final String datasetId;
        private final long sampleSize;
        private final double accuracy;
        private final double ci95Low;
        private final double ci95High;
        private final Instant measuredAt; // nullable

        private Measured(double value,
                         String datasetId,
                         long sampleSize,
                         double accuracy,
                         double ci95Low,
                         double ci95High,
                         Instant measuredAt) {
            this.value = requireUnit("measured.value", value);
            this.datasetId = requireText("datasetId", datasetId);
            if (sampleSize < 0) throw new ConfidenceConstructionException("sampleSize must be >= 0, got " + sampleSize);
            this.sampleSize = sampleSize;
            this.accuracy = requireUnit("measured.accuracy", accuracy);
            this.ci95Low = requireUnit("ci95.low", ci95Low);
            this.ci95High = requireUnit("ci95.high", ci95High);
            if (ci95Low > ci95High) {
                throw new ConfidenceConstructionException("ci95 low > high: " + ci95Low + " > " + ci95High);
            }
            this.measuredAt = measuredAt;
        }

        public double value() {
            return value;
        }

        public String datasetId() {
            return datasetId;
        }

        public long sampleSize() {
            return sampleSize;
        }

        public double accuracy() {
            return accuracy;
        }

        public double ci95Low() {
            return ci95Low;
        }

        public double ci95High() {
            return ci95High;
        }

        public Instant measuredAt() {
            return measuredAt;
        }

        @Override
        public Type type() {
            return Type.MEASURED;
        }

        @Override
        public OptionalDouble pointValue() {
            return OptionalDouble.of(value);
        }

        @Override
        public double effectiveValue() {
            return value;
        }

        @Override
        public CalibrationStatus calibrationStatus() {
            return CalibrationStatus.PRESERVED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Measured m)) return false;
            return Double.compare(value, m.value) == 0
                    && sampleSize == m.sampleSize
                    && Double.compare(accuracy, m.accuracy) == 0
                    && Double.compare(ci95Low, m.ci95Low) == 0
                    && Double.compare(ci95High, m.ci95High) == 0
                    && datasetId.equals(m.datasetId)
                    && Objects.equals(measuredAt, m.measuredAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, datasetId, sampleSize, accuracy, ci95Low, ci95High, measuredAt);
        }

        @Override
        public String toString() {
            return "Measured(" + value + ", " + datasetId + ", n=" + sampleSize + ")";
        }
    }

    public static final class Bounded extends ConfidenceValue {
        private final double low;
        private final double high;
        private final BoundedBasis basis;
        private final String citation; // nullable

        private Bounded(double low, double high, BoundedBasis basis, String citation) {
            this.low = requireUnit("bounded.low", low);
            this.high = requireUnit("bounded.high", high);
            if (low > high) throw new ConfidenceConstructionException("bounded low > high: " + low + " > " + high);
            this.basis = Objects.requireNonNull(basis, "basis");
            this.citation = (citation == null || citation.isBlank()) ? null : citation;
        }

        public double low() {
            return low;
        }

        public double high() {
            return high;
        }

        public double midpoint() {
            return (low + high) / 2.0;
        }

        public BoundedBasis basis() {
            return basis;
        }

        public String citation() {
            return citation;
        }

        @Override
        public Type type() {
            return Type.BOUNDED;
        }

        @Override
        public OptionalDouble pointValue() {
            return OptionalDouble.of(midpoint());
        }

        @Override
        public double effectiveValue() {
            return low;
        }

        @Override
        public CalibrationStatus calibrationStatus() {
            return CalibrationStatus.DEGRADED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Bounded b)) return false;
            return Double.compare(low, b.low) == 0
                    && Double.compare(high, b.high) == 0
                    && basis == b.basis
                    && Objects.equals(citation, b.citation);
        }

        @Override
        public int hashCode() {
            return Objects.hash(low, high, basis, citation);
        }

        @Override
        public String toString() {
            return "Bounded([" + low + ", " + high + "], " + basis.wireName() + ")";
        }
    }

    public static final class Absent extends ConfidenceValue {
        private final AbsentReason reason;

        private Absent(AbsentReason reason) {
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public AbsentReason reason() {
            return reason;
        }

        @Override
        public Type type() {
            return Type.ABSENT;
        }

        @Override
        public OptionalDouble pointValue() {
            return OptionalDouble.empty();
        }

        @Override
        public double effectiveValue() {
            return 0.0;
        }

        @Override
        public CalibrationStatus calibrationStatus() {
            return CalibrationStatus.DEGRADED;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            return o instanceof Absent a && reason == a.reason;
        }

        @Override
        public int hashCode() {
            return reason.hashCode();
        }

        @Override
        public String toString() {
            return "Absent(" + reason.wireName() + ")";
        }
    }

    /**
     * Named input of a derivation.
     */
    public record NamedInput(String name, ConfidenceValue value) {
        public NamedInput {
            requireText("input name", name);
            Objects.requireNonNull(value, "value");
        }
    }
}
