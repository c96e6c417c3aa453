package org.calista.credence.confidence;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * FormulaParser — text to {@link Formula}.
 *
 * <pre>
 *   expr   := IDENT | IDENT '(' expr (',' expr)* [';' NUMBER (',' NUMBER)*] ')'
 * </pre>
 *
 * A bare identifier is an input reference. An identifier followed by '(' must name a
 * {@link Combinator}; anything else is a {@link MalformedFormulaException}. Arity and
 * parameter counts are checked here as well, so a parsed formula is well-formed.
 */
public final class FormulaParser {

    public static final int DEFAULT_MAX_DEPTH = 64;

    private final int maxDepth;

    public FormulaParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    public FormulaParser(int maxDepth) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public Formula parse(String text) throws MalformedFormulaException {
        if (text == null || text.isBlank()) throw new MalformedFormulaException("empty formula", text);
        Cursor c = new Cursor(text, tokenize(text));
        Formula f = expr(c, 1);
        Token t = c.peek();
        if (t.kind != Kind.EOF) throw new MalformedFormulaException("unexpected '" + t.text + "'", text, t.pos);
        DerivationProofBuilder.checkWellFormed(f, text);
        return f;
    }

    // -------------------- Grammar --------------------

    private Formula expr(Cursor c, int depth) throws MalformedFormulaException {
        if (depth > maxDepth) {
            throw new MalformedFormulaException("formula nested deeper than " + maxDepth, c.text, c.peek().pos);
        }
        Token id = c.next();
        if (id.kind != Kind.IDENT) {
            throw new MalformedFormulaException("expected identifier, got '" + id.text + "'", c.text, id.pos);
        }
        if (c.peek().kind != Kind.LPAREN) return Formula.input(id.text);

        Optional<Combinator> comb = Combinator.bySymbol(id.text);
        if (comb.isEmpty()) {
            throw new MalformedFormulaException("unknown combinator '" + id.text + "'", c.text, id.pos);
        }
        c.next(); // '('

        List<Formula> args = new ArrayList<>();
        List<Double> params = new ArrayList<>();
        if (c.peek().kind == Kind.RPAREN) {
            throw new MalformedFormulaException(id.text + "() needs arguments", c.text, c.peek().pos);
        }
        args.add(expr(c, depth + 1));
        while (c.peek().kind == Kind.COMMA) {
            c.next();
            args.add(expr(c, depth + 1));
        }
        if (c.peek().kind == Kind.SEMI) {
            c.next();
            params.add(number(c));
            while (c.peek().kind == Kind.COMMA) {
                c.next();
                params.add(number(c));
            }
        }
        Token close = c.next();
        if (close.kind != Kind.RPAREN) {
            throw new MalformedFormulaException("expected ')', got '" + close.text + "'", c.text, close.pos);
        }
        return Formula.apply(comb.get(), args, params);
    }

    private static double number(Cursor c) throws MalformedFormulaException {
        Token t = c.next();
        if (t.kind != Kind.NUMBER) {
            throw new MalformedFormulaException("expected number, got '" + t.text + "'", c.text, t.pos);
        }
        try {
            return Double.parseDouble(t.text);
        } catch (NumberFormatException e) {
            throw new MalformedFormulaException("bad number '" + t.text + "'", c.text, t.pos);
        }
    }

    // -------------------- Lexer --------------------

    private enum Kind {IDENT, NUMBER, LPAREN, RPAREN, COMMA, SEMI, EOF}

    private record Token(Kind kind, String text, int pos) {
    }

    private static List<Token> tokenize(String s) throws MalformedFormulaException {
        List<Token> out = new ArrayList<>();
        int i = 0;
        int n = s.length();
        while (i < n) {
            char ch = s.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            switch (ch) {
                case '(' -> out.add(new Token(Kind.LPAREN, "(", i++));
                case ')' -> out.add(new Token(Kind.RPAREN, ")", i++));
                case ',' -> out.add(new Token(Kind.COMMA, ",", i++));
                case ';' -> out.add(new Token(Kind.SEMI, ";", i++));
                default -> {
                    int start = i;
                    if (Character.isLetter(ch) || ch == '_') {
                        while (i < n && isIdentPart(s.charAt(i))) i++;
                        out.add(new Token(Kind.IDENT, s.substring(start, i), start));
                    } else if (Character.isDigit(ch) || ch == '.' || ch == '-') {
                        i++;
                        while (i < n && isNumberPart(s.charAt(i), s.charAt(i - 1))) i++;
                        out.add(new Token(Kind.NUMBER, s.substring(start, i), start));
                    } else {
                        throw new MalformedFormulaException("unexpected character '" + ch + "'", s, i);
                    }
                }
            }
        }
        out.add(new Token(Kind.EOF, "<end>", n));
        return out;
    }

    private static boolean isIdentPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '.';
    }

    private static boolean isNumberPart(char ch, char prev) {
        if (Character.isDigit(ch) || ch == '.' || ch == 'e' || ch == 'E') return true;
        return (ch == '-' || ch == '+') && (prev == 'e' || prev == 'E');
    }

    private static final class Cursor {
        final String text;
        final List<Token> tokens;
        int pos;

        Cursor(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        Token next() {
            Token t = tokens.get(pos);
            if (t.kind != Kind.EOF) pos++;
            return t;
        }
    }
}
