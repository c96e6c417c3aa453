package org.calista.credence.confidence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * ConfidenceAlgebra — pure combinators over {@link ConfidenceValue}.
 *
 * <p>
 * {@code (meet, join)} form a bounded lattice with {@link #top()} =
 * {@code Deterministic(true)} and {@link #bottom()} = {@code Absent}: meet is
 * min and absorbs Absent, join is max and ignores Absent. {@link #noisyOr} and
 * {@link #product} are the independent-probability alternatives; they are not
 * interchangeable with join and meet and do not keep calibration unless every input is
 * {@link ConfidenceValue.Measured}.
 * </p>
 *
 * <p>
 * Every present result is a {@link ConfidenceValue.Derived} carrying a
 * {@link DerivationProof}; absent results are returned as the absent input itself.
 * All methods are side-effect free.
 * </p>
 */
public final class ConfidenceAlgebra {

    /** Tolerance for numeric equivalence of point values. */
    public static final double EPSILON = 1e-9;

    private static final ConfidenceValue.Deterministic TOP = ConfidenceValue.certain("lattice_top");
    private static final ConfidenceValue.Absent BOTTOM = ConfidenceValue.absent(AbsentReason.NOT_APPLICABLE);

    private ConfidenceAlgebra() {
    }

    public static ConfidenceValue.Deterministic top() {
        return TOP;
    }

    public static ConfidenceValue.Absent bottom() {
        return BOTTOM;
    }

    // -------------------- Binary --------------------

    /** AND / sequential composition. Absent in, absent out. */
    public static ConfidenceValue meet(ConfidenceValue a, ConfidenceValue b) {
        return meet(a, b, AbsentPolicy.PROPAGATE);
    }

    /**
     * AND with explicit absent handling. {@link AbsentPolicy#NEUTRAL} skips an absent
     * side instead of returning absent; it is never the default.
     */
    public static ConfidenceValue meet(ConfidenceValue a, ConfidenceValue b, AbsentPolicy policy) {
        Combinator c = (policy == AbsentPolicy.NEUTRAL) ? Combinator.MEET_PRESENT : Combinator.MEET;
        return apply(c, List.of(a, b), List.of());
    }

    /** OR / disjunctive composition (maximum). Absent is the identity. */
    public static ConfidenceValue join(ConfidenceValue a, ConfidenceValue b) {
        return apply(Combinator.JOIN, List.of(a, b), List.of());
    }

    /** Independent OR: {@code 1-(1-a)(1-b)}. */
    public static ConfidenceValue noisyOr(ConfidenceValue a, ConfidenceValue b) {
        return apply(Combinator.NOISY_OR, List.of(a, b), List.of());
    }

    /** Independent AND. Degraded unless both sides are measured. */
    public static ConfidenceValue product(ConfidenceValue a, ConfidenceValue b) {
        return apply(Combinator.PRODUCT, List.of(a, b), List.of());
    }

    public static ConfidenceValue complement(ConfidenceValue a) {
        return apply(Combinator.COMPLEMENT, List.of(a), List.of());
    }

    // -------------------- N-ary --------------------

    /** Chain of steps: the weakest link. */
    public static ConfidenceValue sequence(List<? extends ConfidenceValue> steps) {
        return apply(Combinator.SEQUENCE, nonEmpty(steps, "steps"), List.of());
    }

    /** All independent branches must hold. */
    public static ConfidenceValue parallelAll(List<? extends ConfidenceValue> branches) {
        return apply(Combinator.PARALLEL_ALL, nonEmpty(branches, "branches"), List.of());
    }

    /** Any independent branch suffices (noisy-or). */
    public static ConfidenceValue parallelAny(List<? extends ConfidenceValue> branches, AbsentPolicy policy) {
        Combinator c = (policy == AbsentPolicy.NEUTRAL) ? Combinator.PARALLEL_ANY_RELAXED : Combinator.PARALLEL_ANY;
        return apply(c, nonEmpty(branches, "branches"), List.of());
    }

    /**
     * All branches, correlation-adjusted: {@code (1-rho)·product + rho·min}.
     * {@code rho = 0} is independence, {@code rho = 1} full correlation.
     */
    public static ConfidenceValue parallelAllCorrelated(List<? extends ConfidenceValue> branches, double rho) {
        return apply(Combinator.PARALLEL_ALL_RHO, nonEmpty(branches, "branches"), List.of(requireRho(rho)));
    }

    /** Any branch, correlation-adjusted: {@code (1-rho)·noisyOr + rho·max}. */
    public static ConfidenceValue parallelAnyCorrelated(List<? extends ConfidenceValue> branches, double rho) {
        return apply(Combinator.PARALLEL_ANY_RHO, nonEmpty(branches, "branches"), List.of(requireRho(rho)));
    }

    public static ConfidenceValue weightedAverage(List<? extends ConfidenceValue> values, List<Double> weights) {
        List<ConfidenceValue> vs = nonEmpty(values, "values");
        Objects.requireNonNull(weights, "weights");
        if (weights.size() != vs.size()) {
            throw new IllegalArgumentException("weights size " + weights.size() + " != values size " + vs.size());
        }
        double sum = 0.0;
        for (Double w : weights) {
            if (w == null || !Double.isFinite(w) || w < 0.0) throw new IllegalArgumentException("bad weight: " + w);
            sum += w;
        }
        if (sum <= 0.0) throw new IllegalArgumentException("weights must not all be zero");
        return apply(Combinator.WEIGHTED_AVERAGE, vs, weights);
    }

    /**
     * Exponential decay by age: multiplies by {@code 0.5^(age/halfLife)}. Always degraded.
     */
    public static ConfidenceValue applyDecay(ConfidenceValue value, Duration age, Duration halfLife) {
        Objects.requireNonNull(age, "age");
        Objects.requireNonNull(halfLife, "halfLife");
        if (halfLife.isZero() || halfLife.isNegative()) throw new IllegalArgumentException("halfLife must be > 0");
        double ratio = Math.max(0.0, (double) age.toMillis() / (double) halfLife.toMillis());
        return discount(value, Math.pow(0.5, ratio));
    }

    /**
     * Multiplies by {@code factor} in [0,1]. Can only lower a value; always degraded.
     */
    public static ConfidenceValue discount(ConfidenceValue value, double factor) {
        if (!Double.isFinite(factor) || factor < 0.0 || factor > 1.0) {
            throw new IllegalArgumentException("factor must be within [0,1], got " + factor);
        }
        return apply(Combinator.DECAY, List.of(value), List.of(factor));
    }

    // -------------------- Reading / selection --------------------

    /** True when the value is present and its conservative reading reaches {@code threshold}. */
    public static boolean meetsThreshold(ConfidenceValue value, double threshold) {
        Objects.requireNonNull(value, "value");
        if (value.isAbsent()) return false;
        return value.effectiveValue() >= threshold;
    }

    /**
     * Picks the first value that meets {@code threshold}; when none does, the strongest
     * present value flagged as degraded. All absent yields an absent selection.
     */
    public static Selection selectWithDegradation(List<? extends ConfidenceValue> candidates, double threshold) {
        List<ConfidenceValue> cs = nonEmpty(candidates, "candidates");
        for (int i = 0; i < cs.size(); i++) {
            if (meetsThreshold(cs.get(i), threshold)) return new Selection(cs.get(i), i, false);
        }
        int best = -1;
        double bestValue = -1.0;
        for (int i = 0; i < cs.size(); i++) {
            ConfidenceValue v = cs.get(i);
            if (v.isAbsent()) continue;
            if (v.effectiveValue() > bestValue) {
                bestValue = v.effectiveValue();
                best = i;
            }
        }
        if (best < 0) return new Selection(cs.get(0), 0, true);
        return new Selection(cs.get(best), best, true);
    }

    public record Selection(ConfidenceValue value, int index, boolean degraded) {
    }

    /**
     * Equivalence used by the lattice laws: point values within {@link #EPSILON};
     * two absent values are equivalent; absent is never equivalent to a present value.
     */
    public static boolean equivalent(ConfidenceValue a, ConfidenceValue b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        OptionalDouble x = a.pointValue();
        OptionalDouble y = b.pointValue();
        if (x.isEmpty() || y.isEmpty()) return x.isEmpty() && y.isEmpty();
        return Math.abs(x.getAsDouble() - y.getAsDouble()) <= EPSILON;
    }

    // -------------------- Internals --------------------

    private static ConfidenceValue apply(Combinator c, List<? extends ConfidenceValue> values, List<Double> params) {
        List<String> names = names(values.size());
        List<Formula> refs = new ArrayList<>(names.size());
        Map<String, ConfidenceValue> bound = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            ConfidenceValue v = Objects.requireNonNull(values.get(i), "value");
            refs.add(Formula.input(names.get(i)));
            bound.put(names.get(i), v);
        }
        Formula f = Formula.apply(c, refs, params);

        ConfidenceValue r = FormulaEvaluator.evaluate(f, bound);
        if (!(r instanceof ConfidenceValue.Derived d)) return r;

        DerivationProof proof = new DerivationProof(f, names, d.value(), d.calibrationStatus(), "algebra:" + c.symbol());
        return new ConfidenceValue.Derived(d.value(), d.formula(), d.inputs(), d.calibrationStatus(), proof);
    }

    private static List<String> names(int n) {
        if (n == 1) return List.of("a");
        if (n == 2) return List.of("a", "b");
        List<String> out = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) out.add("x" + i);
        return out;
    }

    private static List<ConfidenceValue> nonEmpty(List<? extends ConfidenceValue> values, String what) {
        Objects.requireNonNull(values, what);
        if (values.isEmpty()) throw new IllegalArgumentException(what + " must not be empty");
        return new ArrayList<>(values);
    }

    private static double requireRho(double rho) {
        if (!Double.isFinite(rho) || rho < 0.0 || rho > 1.0) {
            throw new IllegalArgumentException("rho must be within [0,1], got " + rho);
        }
        return rho;
    }
}
