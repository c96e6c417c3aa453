package org.calista.credence.confidence;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Formula tree over named inputs.
 *
 * <p>
 * Building a tree does not validate it: arity, parameters and input names are checked
 * by {@link DerivationProofBuilder#derive(Formula, java.util.Map)}, which is the only
 * place a formula turns into a confidence value.
 * </p>
 */
public abstract class Formula {

    private Formula() {
    }

    public static InputRef input(String name) {
        return new InputRef(name);
    }

    public static Application apply(Combinator combinator, Formula... args) {
        return new Application(combinator, List.of(args), List.of());
    }

    public static Application apply(Combinator combinator, List<? extends Formula> args) {
        return new Application(combinator, args, List.of());
    }

    public static Application apply(Combinator combinator, List<? extends Formula> args, List<Double> parameters) {
        return new Application(combinator, args, parameters);
    }

    /** Canonical text, parseable by {@link FormulaParser}. */
    public final String render() {
        StringBuilder sb = new StringBuilder();
        Deque<Object> work = new ArrayDeque<>();
        work.push(this);
        while (!work.isEmpty()) {
            Object w = work.pop();
            if (w instanceof String s) {
                sb.append(s);
            } else if (w instanceof InputRef r) {
                sb.append(r.name);
            } else {
                Application a = (Application) w;
                sb.append(a.combinator.symbol()).append('(');
                work.push(")");
                if (!a.parameters.isEmpty()) {
                    List<String> ps = new ArrayList<>(a.parameters.size());
                    for (Double p : a.parameters) ps.add(formatParameter(p));
                    work.push("; " + String.join(", ", ps));
                }
                for (int i = a.args.size() - 1; i >= 0; i--) {
                    work.push(a.args.get(i));
                    if (i > 0) work.push(", ");
                }
            }
        }
        return sb.toString();
    }

    /** Input names in order of first appearance. */
    public final Set<String> inputNames() {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        Deque<Formula> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Formula f = stack.pop();
            if (f instanceof InputRef r) {
                out.add(r.name);
            } else if (f instanceof Application a) {
                // reverse push keeps left-to-right order
                for (int i = a.args.size() - 1; i >= 0; i--) stack.push(a.args.get(i));
            }
        }
        return Collections.unmodifiableSet(out);
    }

    /** Deepest nesting level, leaves count as 1. */
    public abstract int depth();

    @Override
    public String toString() {
        return render();
    }

    // -------------------- Nodes --------------------

    public static final class InputRef extends Formula {
        private final String name;

        private InputRef(String name) {
            if (name == null || name.isBlank()) throw new IllegalArgumentException("input name is required");
            this.name = name.trim();
        }

        public String name() {
            return name;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InputRef r && r.name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Application extends Formula {
        private final Combinator combinator;
        private final List<Formula> args;
        private final List<Double> parameters;

        // cached from the children so neither walks the tree
        private final int depth;
        private final int hash;

        private Application(Combinator combinator, List<? extends Formula> args, List<Double> parameters) {
            this.combinator = Objects.requireNonNull(combinator, "combinator");
            this.args = List.copyOf(Objects.requireNonNull(args, "args"));
            this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));

            int max = 0;
            int h = 31 * combinator.hashCode() + this.parameters.hashCode();
            for (Formula f : this.args) {
                max = Math.max(max, f.depth());
                h = 31 * h + f.hashCode();
            }
            this.depth = max + 1;
            this.hash = h;
        }

        public Combinator combinator() {
            return combinator;
        }

        public List<Formula> args() {
            return args;
        }

        public List<Double> parameters() {
            return parameters;
        }

        @Override
        public int depth() {
            return depth;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Application)) return false;
            Deque<Formula[]> pairs = new ArrayDeque<>();
            pairs.push(new Formula[]{this, (Application) o});
            while (!pairs.isEmpty()) {
                Formula[] p = pairs.pop();
                Formula x = p[0];
                Formula y = p[1];
                if (x == y) continue;
                if (x instanceof InputRef) {
                    if (!x.equals(y)) return false;
                    continue;
                }
                if (!(y instanceof Application b)) return false;
                Application a = (Application) x;
                if (a.hash != b.hash || a.depth != b.depth || a.combinator != b.combinator
                        || a.args.size() != b.args.size() || !a.parameters.equals(b.parameters)) {
                    return false;
                }
                for (int i = 0; i < a.args.size(); i++) pairs.push(new Formula[]{a.args.get(i), b.args.get(i)});
            }
            return true;
        }

        @Override
        public int hashCode() {
            return hash;
        }
    }

    static String formatParameter(double p) {
        if (p == Math.rint(p) && Math.abs(p) < 1e15) return String.format(Locale.ROOT, "%.1f", p);
        return Double.toString(p);
    }
}
