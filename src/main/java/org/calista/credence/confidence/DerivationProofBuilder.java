package org.calista.credence.confidence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DerivationProofBuilder — the only way to turn a formula over named inputs into a
 * proven {@link ConfidenceValue.Derived}.
 *
 * <p>
 * {@code derive} checks, in order: the formula is well-formed (known combinators,
 * matching arity and parameters, bounded depth), every referenced input was supplied,
 * and evaluation did not hit an absent input. Any failure is a
 * {@link DerivationException}; no partial value is returned.
 * </p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public final class DerivationProofBuilder {

    private static final Logger log = LoggerFactory.getLogger(DerivationProofBuilder.class);

    private static final String ISSUER = "builder";

    private final FormulaParser parser;
    private final int maxDepth;

    public DerivationProofBuilder() {
        this(FormulaParser.DEFAULT_MAX_DEPTH);
    }

    public DerivationProofBuilder(int maxDepth) {
        this.parser = new FormulaParser(maxDepth);
        this.maxDepth = maxDepth;
    }

    public Formula parse(String formula) throws MalformedFormulaException {
        return parser.parse(formula);
    }

    public ConfidenceValue.Derived derive(String formula, Map<String, ? extends ConfidenceValue> namedInputs)
            throws DerivationException {
        return derive(parser.parse(formula), namedInputs);
    }

    public ConfidenceValue.Derived derive(Formula formula, Map<String, ? extends ConfidenceValue> namedInputs)
            throws DerivationException {
        if (formula == null) throw new MalformedFormulaException("formula is required", null);
        Objects.requireNonNull(namedInputs, "namedInputs");

        // before render(): a tree built in code may be arbitrarily deep
        if (formula.depth() > maxDepth) {
            throw new MalformedFormulaException("formula nested " + formula.depth() + " deep, limit is " + maxDepth, null);
        }
        String text = formula.render();
        checkWellFormed(formula, text);

        List<String> missing = new ArrayList<>();
        Map<String, ConfidenceValue> bound = new LinkedHashMap<>();
        for (String name : formula.inputNames()) {
            ConfidenceValue v = namedInputs.get(name);
            if (v == null) missing.add(name);
            else bound.put(name, v);
        }
        if (!missing.isEmpty()) throw new UnknownInputReferenceException(text, missing);

        if (log.isDebugEnabled() && namedInputs.size() > bound.size()) {
            log.debug("derive: {} ignores {} unreferenced input(s)", text, namedInputs.size() - bound.size());
        }

        ConfidenceValue result = FormulaEvaluator.evaluate(formula, bound);
        if (result.isAbsent()) {
            List<String> absent = new ArrayList<>();
            for (Map.Entry<String, ConfidenceValue> e : bound.entrySet()) {
                if (e.getValue().isAbsent()) absent.add(e.getKey());
            }
            throw new AbsentInputException(text, absent);
        }

        double value = result.pointValue().getAsDouble();
        CalibrationStatus status = result.calibrationStatus();

        List<ConfidenceValue.NamedInput> inputs = new ArrayList<>(bound.size());
        for (Map.Entry<String, ConfidenceValue> e : bound.entrySet()) {
            inputs.add(new ConfidenceValue.NamedInput(e.getKey(), e.getValue()));
        }
        DerivationProof proof = new DerivationProof(formula, new ArrayList<>(bound.keySet()), value, status, ISSUER);
        return new ConfidenceValue.Derived(value, text, inputs, status, proof);
    }

    /**
     * Throws unless {@code d} carries a proof this package issued for exactly this value.
     */
    public static ConfidenceValue.Derived requireProven(ConfidenceValue.Derived d) {
        Objects.requireNonNull(d, "derived");
        if (!d.isProven()) throw new IllegalStateException("Derived value is not proven: " + d.formula());
        return d;
    }

    // -------------------- Well-formedness --------------------

    static void checkWellFormed(Formula root, String text) throws MalformedFormulaException {
        Deque<Formula> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Formula f = stack.pop();
            if (!(f instanceof Formula.Application a)) continue;

            Combinator c = a.combinator();
            int arity = a.args().size();
            if (!c.acceptsArity(arity)) {
                throw new MalformedFormulaException(c.symbol() + " expects " + c.arityDescription()
                        + " argument(s), got " + arity, text);
            }
            int expected = c.expectedParameters(arity);
            if (a.parameters().size() != expected) {
                throw new MalformedFormulaException(c.symbol() + " expects " + expected
                        + " parameter(s), got " + a.parameters().size(), text);
            }
            checkParameters(c, a.parameters(), text);
            for (Formula arg : a.args()) stack.push(arg);
        }
    }

    private static void checkParameters(Combinator c, List<Double> ps, String text) throws MalformedFormulaException {
        switch (c) {
            case PARALLEL_ALL_RHO, PARALLEL_ANY_RHO, DECAY -> {
                double p = ps.get(0);
                if (!Double.isFinite(p) || p < 0.0 || p > 1.0) {
                    throw new MalformedFormulaException(c.symbol() + " parameter must be within [0,1], got " + p, text);
                }
            }
            case WEIGHTED_AVERAGE -> {
                double sum = 0.0;
                for (double w : ps) {
                    if (!Double.isFinite(w) || w < 0.0) {
                        throw new MalformedFormulaException("weights must be finite and >= 0, got " + w, text);
                    }
                    sum += w;
                }
                if (sum <= 0.0) throw new MalformedFormulaException("weights must not all be zero", text);
            }
            default -> {
                // parameter-free
            }
        }
    }
}
