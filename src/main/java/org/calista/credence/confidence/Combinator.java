package org.calista.credence.confidence;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of combinators a formula may use.
 *
 * <p>
 * Each constant fixes its arity, how many numeric parameters it takes after the
 * arguments (e.g. the correlation of {@link #PARALLEL_ALL_RHO}), how it treats absent
 * inputs and which calibration rule applies to its result.
 * </p>
 */
public enum Combinator {

    MEET("min", Family.LATTICE, 2, 2, 0, AbsentPolicy.PROPAGATE, "meet", "and"),
    MEET_PRESENT("min_present", Family.LATTICE, 2, 2, 0, AbsentPolicy.NEUTRAL),
    JOIN("max", Family.LATTICE, 2, 2, 0, AbsentPolicy.NEUTRAL, "join", "or"),
    COMPLEMENT("not", Family.LATTICE, 1, 1, 0, AbsentPolicy.PROPAGATE, "complement"),
    SEQUENCE("sequence", Family.LATTICE, 1, Combinator.VARIADIC, 0, AbsentPolicy.PROPAGATE),

    PRODUCT("product", Family.PROBABILISTIC, 2, 2, 0, AbsentPolicy.PROPAGATE, "mul"),
    NOISY_OR("noisy_or", Family.PROBABILISTIC, 2, 2, 0, AbsentPolicy.PROPAGATE),
    PARALLEL_ALL("parallel_all", Family.PROBABILISTIC, 1, Combinator.VARIADIC, 0, AbsentPolicy.PROPAGATE),
    PARALLEL_ANY("parallel_any", Family.PROBABILISTIC, 1, Combinator.VARIADIC, 0, AbsentPolicy.PROPAGATE),
    PARALLEL_ANY_RELAXED("parallel_any_relaxed", Family.PROBABILISTIC, 1, Combinator.VARIADIC, 0, AbsentPolicy.NEUTRAL),
    PARALLEL_ALL_RHO("parallel_all_rho", Family.PROBABILISTIC, 1, Combinator.VARIADIC, 1, AbsentPolicy.PROPAGATE),
    PARALLEL_ANY_RHO("parallel_any_rho", Family.PROBABILISTIC, 1, Combinator.VARIADIC, 1, AbsentPolicy.PROPAGATE),
    WEIGHTED_AVERAGE("weighted_average", Family.PROBABILISTIC, 1, Combinator.VARIADIC, Combinator.PER_ARGUMENT, AbsentPolicy.PROPAGATE),

    DECAY("decay", Family.HEURISTIC, 1, 1, 1, AbsentPolicy.PROPAGATE);

    /** Calibration rule family. */
    public enum Family {
        /** Order-based (min/max): calibrated inputs stay calibrated. */
        LATTICE,
        /** Assumes independence: only all-measured inputs stay calibrated. */
        PROBABILISTIC,
        /** Heuristic adjustment: never calibrated. */
        HEURISTIC
    }

    public static final int VARIADIC = Integer.MAX_VALUE;
    /** Parameter count equals argument count. */
    public static final int PER_ARGUMENT = -1;

    private static final Map<String, Combinator> BY_NAME;

    static {
        Map<String, Combinator> m = new HashMap<>();
        for (Combinator c : values()) {
            m.put(c.symbol, c);
            for (String a : c.aliases) m.put(a, c);
        }
        BY_NAME = Collections.unmodifiableMap(m);
    }

    private final String symbol;
    private final Family family;
    private final int minArity;
    private final int maxArity;
    private final int parameterCount;
    private final AbsentPolicy absentPolicy;
    private final List<String> aliases;

    Combinator(String symbol, Family family, int minArity, int maxArity, int parameterCount,
               AbsentPolicy absentPolicy, String... aliases) {
        this.symbol = symbol;
        this.family = family;
        this.minArity = minArity;
        this.maxArity = maxArity;
        this.parameterCount = parameterCount;
        this.absentPolicy = absentPolicy;
        this.aliases = List.of(aliases);
    }

    public String symbol() {
        return symbol;
    }

    public Family family() {
        return family;
    }

    public int minArity() {
        return minArity;
    }

    public int maxArity() {
        return maxArity;
    }

    public AbsentPolicy absentPolicy() {
        return absentPolicy;
    }

    public boolean acceptsArity(int n) {
        return n >= minArity && n <= maxArity;
    }

    /** Expected number of parameters for {@code arity} arguments. */
    public int expectedParameters(int arity) {
        return parameterCount == PER_ARGUMENT ? arity : parameterCount;
    }

    public boolean isVariadic() {
        return maxArity == VARIADIC;
    }

    public String arityDescription() {
        if (minArity == maxArity) return String.valueOf(minArity);
        if (isVariadic()) return minArity + "+";
        return minArity + ".." + maxArity;
    }

    public static Optional<Combinator> bySymbol(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase(Locale.ROOT)));
    }
}
