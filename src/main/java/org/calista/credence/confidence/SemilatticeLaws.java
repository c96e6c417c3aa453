package org.calista.credence.confidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;

/**
 * Exhaustive law checks over a finite sample of values.
 *
 * <p>
 * Each check tries every pair or triple of the sample and stops at the first
 * counterexample. Equality is {@link ConfidenceAlgebra#equivalent}.
 * </p>
 */
public final class SemilatticeLaws {

    public enum Law {
        ASSOCIATIVITY,
        COMMUTATIVITY,
        IDEMPOTENCE,
        IDENTITY,
        ABSORPTION
    }

    public record LawCheckResult(Law law, String operation, boolean holds, int casesChecked, String counterexample) {

        static LawCheckResult ok(Law law, String op, int cases) {
            return new LawCheckResult(law, op, true, cases, null);
        }

        static LawCheckResult fail(Law law, String op, int cases, String counterexample) {
            return new LawCheckResult(law, op, false, cases, counterexample);
        }
    }

    private SemilatticeLaws() {
    }

    public static LawCheckResult associativity(String op, BinaryOperator<ConfidenceValue> f, List<ConfidenceValue> sample) {
        int n = 0;
        for (ConfidenceValue a : sample) {
            for (ConfidenceValue b : sample) {
                for (ConfidenceValue c : sample) {
                    n++;
                    ConfidenceValue left = f.apply(f.apply(a, b), c);
                    ConfidenceValue right = f.apply(a, f.apply(b, c));
                    if (!ConfidenceAlgebra.equivalent(left, right)) {
                        return LawCheckResult.fail(Law.ASSOCIATIVITY, op, n,
                                op + "(" + op + "(" + a + ", " + b + "), " + c + ") = " + left
                                        + " but " + op + "(" + a + ", " + op + "(" + b + ", " + c + ")) = " + right);
                    }
                }
            }
        }
        return LawCheckResult.ok(Law.ASSOCIATIVITY, op, n);
    }

    public static LawCheckResult commutativity(String op, BinaryOperator<ConfidenceValue> f, List<ConfidenceValue> sample) {
        int n = 0;
        for (ConfidenceValue a : sample) {
            for (ConfidenceValue b : sample) {
                n++;
                ConfidenceValue ab = f.apply(a, b);
                ConfidenceValue ba = f.apply(b, a);
                if (!ConfidenceAlgebra.equivalent(ab, ba)) {
                    return LawCheckResult.fail(Law.COMMUTATIVITY, op, n,
                            op + "(" + a + ", " + b + ") = " + ab + " but " + op + "(" + b + ", " + a + ") = " + ba);
                }
            }
        }
        return LawCheckResult.ok(Law.COMMUTATIVITY, op, n);
    }

    public static LawCheckResult idempotence(String op, BinaryOperator<ConfidenceValue> f, List<ConfidenceValue> sample) {
        int n = 0;
        for (ConfidenceValue a : sample) {
            n++;
            ConfidenceValue aa = f.apply(a, a);
            if (!ConfidenceAlgebra.equivalent(aa, a)) {
                return LawCheckResult.fail(Law.IDEMPOTENCE, op, n, op + "(" + a + ", " + a + ") = " + aa);
            }
        }
        return LawCheckResult.ok(Law.IDEMPOTENCE, op, n);
    }

    public static LawCheckResult identity(String op,
                                          BinaryOperator<ConfidenceValue> f,
                                          ConfidenceValue unit,
                                          List<ConfidenceValue> sample) {
        int n = 0;
        for (ConfidenceValue a : sample) {
            n++;
            ConfidenceValue r = f.apply(a, unit);
            if (!ConfidenceAlgebra.equivalent(r, a)) {
                return LawCheckResult.fail(Law.IDENTITY, op, n, op + "(" + a + ", " + unit + ") = " + r);
            }
        }
        return LawCheckResult.ok(Law.IDENTITY, op, n);
    }

    /** {@code outer(a, inner(a, b)) == a}. */
    public static LawCheckResult absorption(String outerName,
                                            BinaryOperator<ConfidenceValue> outer,
                                            BinaryOperator<ConfidenceValue> inner,
                                            List<ConfidenceValue> sample) {
        int n = 0;
        for (ConfidenceValue a : sample) {
            for (ConfidenceValue b : sample) {
                n++;
                ConfidenceValue r = outer.apply(a, inner.apply(a, b));
                if (!ConfidenceAlgebra.equivalent(r, a)) {
                    return LawCheckResult.fail(Law.ABSORPTION, outerName, n,
                            "absorption broken for a=" + a + ", b=" + b + ": got " + r);
                }
            }
        }
        return LawCheckResult.ok(Law.ABSORPTION, outerName, n);
    }

    /**
     * Runs every law for meet and join: associativity, commutativity, idempotence,
     * identities ({@code meet(a, top) = a}, {@code join(a, bottom) = a}) and both
     * absorption laws.
     */
    public static List<LawCheckResult> checkLattice(List<ConfidenceValue> sample) {
        Objects.requireNonNull(sample, "sample");
        BinaryOperator<ConfidenceValue> meet = ConfidenceAlgebra::meet;
        BinaryOperator<ConfidenceValue> join = ConfidenceAlgebra::join;

        List<LawCheckResult> out = new ArrayList<>();
        out.add(associativity("meet", meet, sample));
        out.add(associativity("join", join, sample));
        out.add(commutativity("meet", meet, sample));
        out.add(commutativity("join", join, sample));
        out.add(idempotence("meet", meet, sample));
        out.add(idempotence("join", join, sample));
        out.add(identity("meet", meet, ConfidenceAlgebra.top(), sample));
        out.add(identity("join", join, ConfidenceAlgebra.bottom(), sample));
        out.add(absorption("meet", meet, join, sample));
        out.add(absorption("join", join, meet, sample));
        return out;
    }

    public static boolean allHold(List<LawCheckResult> results) {
        for (LawCheckResult r : results) if (!r.holds()) return false;
        return true;
    }
}
