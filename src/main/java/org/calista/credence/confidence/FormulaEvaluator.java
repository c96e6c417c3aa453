package org.calista.credence.confidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Single source of combinator semantics. Used by the algebra, the proof builder and
 * proof verification, so all three agree on value and calibration status.
 */
final class FormulaEvaluator {

    private FormulaEvaluator() {
    }

    /**
     * Evaluates {@code f} over bound inputs. Every referenced name must be bound and
     * the formula must already be well-formed.
     *
     * @return the input itself for a bare reference, otherwise an unproven
     * {@link ConfidenceValue.Derived} or an {@link ConfidenceValue.Absent}
     */
    static ConfidenceValue evaluate(Formula f, Map<String, ? extends ConfidenceValue> inputs) {
        if (f instanceof Formula.InputRef r) {
            ConfidenceValue v = inputs.get(r.name());
            if (v == null) throw new IllegalStateException("unbound input: " + r.name());
            return v;
        }
        Formula.Application a = (Formula.Application) f;
        List<ConfidenceValue> args = new ArrayList<>(a.args().size());
        List<String> names = new ArrayList<>(a.args().size());
        for (Formula arg : a.args()) {
            args.add(evaluate(arg, inputs));
            names.add(arg.render());
        }
        return combine(a.combinator(), args, names, a.parameters(), a.render());
    }

    static ConfidenceValue combine(Combinator c,
                                   List<ConfidenceValue> args,
                                   List<String> names,
                                   List<Double> params,
                                   String formula) {
        ConfidenceValue.Absent firstAbsent = null;
        List<Double> present = new ArrayList<>(args.size());
        for (ConfidenceValue v : args) {
            if (v instanceof ConfidenceValue.Absent ab) {
                if (firstAbsent == null) firstAbsent = ab;
            } else {
                present.add(v.pointValue().getAsDouble());
            }
        }
        if (firstAbsent != null && (c.absentPolicy() == AbsentPolicy.PROPAGATE || present.isEmpty())) {
            return firstAbsent;
        }

        double value = unit(compute(c, present, params));

        List<ConfidenceValue.NamedInput> named = new ArrayList<>(args.size());
        for (int i = 0; i < args.size(); i++) named.add(new ConfidenceValue.NamedInput(names.get(i), args.get(i)));

        return new ConfidenceValue.Derived(value, formula, named, status(c, args), null);
    }

    private static double compute(Combinator c, List<Double> xs, List<Double> params) {
        return switch (c) {
            case MEET, MEET_PRESENT, SEQUENCE -> min(xs);
            case JOIN -> max(xs);
            case COMPLEMENT -> 1.0 - xs.get(0);
            case PRODUCT, PARALLEL_ALL -> product(xs);
            case NOISY_OR, PARALLEL_ANY, PARALLEL_ANY_RELAXED -> noisyOr(xs);
            case PARALLEL_ALL_RHO -> {
                double rho = params.get(0);
                yield (1.0 - rho) * product(xs) + rho * min(xs);
            }
            case PARALLEL_ANY_RHO -> {
                double rho = params.get(0);
                yield (1.0 - rho) * noisyOr(xs) + rho * max(xs);
            }
            case WEIGHTED_AVERAGE -> {
                double num = 0.0;
                double den = 0.0;
                for (int i = 0; i < xs.size(); i++) {
                    num += params.get(i) * xs.get(i);
                    den += params.get(i);
                }
                yield num / den;
            }
            case DECAY -> xs.get(0) * params.get(0);
        };
    }

    /**
     * Calibration propagation table.
     */
    static CalibrationStatus status(Combinator c, List<ConfidenceValue> inputs) {
        if (inputs.isEmpty()) return CalibrationStatus.UNKNOWN;
        return switch (c.family()) {
            case LATTICE -> {
                for (ConfidenceValue v : inputs) {
                    if (!keepsCalibration(v)) yield CalibrationStatus.DEGRADED;
                }
                yield CalibrationStatus.PRESERVED;
            }
            case PROBABILISTIC -> {
                for (ConfidenceValue v : inputs) {
                    if (v.type() != ConfidenceValue.Type.MEASURED) yield CalibrationStatus.DEGRADED;
                }
                yield CalibrationStatus.PRESERVED;
            }
            case HEURISTIC -> CalibrationStatus.DEGRADED;
        };
    }

    private static boolean keepsCalibration(ConfidenceValue v) {
        return switch (v.type()) {
            case DETERMINISTIC, MEASURED -> true;
            case DERIVED -> v.calibrationStatus() == CalibrationStatus.PRESERVED;
            case BOUNDED, ABSENT -> false;
        };
    }

    // -------------------- Numeric kernels --------------------

    static double min(List<Double> xs) {
        double m = 1.0;
        for (double x : xs) m = Math.min(m, x);
        return m;
    }

    static double max(List<Double> xs) {
        double m = 0.0;
        for (double x : xs) m = Math.max(m, x);
        return m;
    }

    static double product(List<Double> xs) {
        double p = 1.0;
        for (double x : xs) p *= x;
        return p;
    }

    static double noisyOr(List<Double> xs) {
        double miss = 1.0;
        for (double x : xs) miss *= (1.0 - x);
        return 1.0 - miss;
    }

    // rounding only; inputs are already validated
    private static double unit(double v) {
        if (v < 0.0) return 0.0;
        return Math.min(v, 1.0);
    }
}
