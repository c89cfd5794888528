package com.example.Botlyne.util;

import com.example.Botlyne.model.EvaluationResult;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Side-effect-free arithmetic evaluator.
 * <p>
 * Grammar (^ binds tighter than unary minus and is right-associative, so {@code -2^2 = -4}):
 * <pre>
 *   expr    := term (('+' | '-') term)*
 *   term    := unary (('*' | '/' | '%') unary)*
 *   unary   := ('+' | '-') unary | power
 *   power   := primary ('^' unary)?
 *   primary := number | function '(' expr (',' expr)* ')' | '(' expr ')'
 * </pre>
 * Only the functions in {@link #FUNCTIONS} are known. Every problem, including division by
 * zero and non-finite results, is reported as a failed {@link EvaluationResult}.
 */
public final class ArithmeticEvaluator {

    public static final Set<String> FUNCTIONS = Set.of("abs", "sqrt", "min", "max", "round", "pow");

    static final int MAX_LENGTH = 200;
    static final int MAX_DEPTH = 50;

    private static final MathContext DISPLAY = new MathContext(12, RoundingMode.HALF_UP);

    private ArithmeticEvaluator() {
    }

    public static EvaluationResult evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            return EvaluationResult.failure(expression, "empty expression");
        }
        String trimmed = expression.trim();
        if (trimmed.length() > MAX_LENGTH) {
            return EvaluationResult.failure(trimmed, "expression longer than " + MAX_LENGTH + " characters");
        }
        try {
            Parser parser = new Parser(trimmed);
            double value = parser.parse();
            if (!Double.isFinite(value)) {
                return EvaluationResult.failure(trimmed, "result is not a finite number");
            }
            return EvaluationResult.ok(trimmed, value, format(value));
        } catch (EvaluationException e) {
            return EvaluationResult.failure(trimmed, e.getMessage());
        }
    }

    /**
     * Twelve significant digits, no trailing zeros, never scientific notation.
     */
    public static String format(double value) {
        BigDecimal decimal = new BigDecimal(Double.toString(value)).round(DISPLAY).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.toPlainString();
    }

    private static final class EvaluationException extends RuntimeException {
        EvaluationException(String message) {
            super(message);
        }
    }

    private static final class Parser {

        private final String src;
        private int pos;
        private int depth;

        Parser(String src) {
            this.src = src;
        }

        double parse() {
            double value = expr();
            skipWhitespace();
            if (pos < src.length()) {
                throw new EvaluationException("unexpected '" + src.charAt(pos) + "' at position " + pos);
            }
            return value;
        }

        private double expr() {
            double value = term();
            while (true) {
                if (eat('+')) {
                    value += term();
                } else if (eat('-')) {
                    value -= term();
                } else {
                    return value;
                }
            }
        }

        private double term() {
            double value = unary();
            while (true) {
                if (peekDoubleStar()) {
                    return value;
                }
                if (eat('*')) {
                    value *= unary();
                } else if (eat('/')) {
                    double divisor = unary();
                    if (divisor == 0.0) {
                        throw new EvaluationException("division by zero");
                    }
                    value /= divisor;
                } else if (eat('%')) {
                    double divisor = unary();
                    if (divisor == 0.0) {
                        throw new EvaluationException("modulo by zero");
                    }
                    value %= divisor;
                } else {
                    return value;
                }
            }
        }

        private double unary() {
            enter();
            try {
                if (eat('-')) {
                    return -unary();
                }
                if (eat('+')) {
                    return unary();
                }
                return power();
            } finally {
                depth--;
            }
        }

        private double power() {
            double base = primary();
            if (eatPowerOperator()) {
                double exponent = unary();
                return Math.pow(base, exponent);
            }
            return base;
        }

        private double primary() {
            skipWhitespace();
            if (pos >= src.length()) {
                throw new EvaluationException("unexpected end of expression");
            }
            char c = src.charAt(pos);
            if (c == '(') {
                pos++;
                enter();
                try {
                    double value = expr();
                    expect(')');
                    return value;
                } finally {
                    depth--;
                }
            }
            if (Character.isDigit(c) || c == '.') {
                return number();
            }
            if (Character.isLetter(c)) {
                return function();
            }
            throw new EvaluationException("unexpected '" + c + "' at position " + pos);
        }

        private double number() {
            int start = pos;
            boolean dot = false;
            while (pos < src.length()) {
                char c = src.charAt(pos);
                if (Character.isDigit(c)) {
                    pos++;
                } else if (c == '.' && !dot) {
                    dot = true;
                    pos++;
                } else {
                    break;
                }
            }
            String literal = src.substring(start, pos);
            if (".".equals(literal)) {
                throw new EvaluationException("malformed number at position " + start);
            }
            return Double.parseDouble(literal);
        }

        private double function() {
            int start = pos;
            while (pos < src.length() && Character.isLetter(src.charAt(pos))) {
                pos++;
            }
            String name = src.substring(start, pos).toLowerCase(Locale.ROOT);
            if (!FUNCTIONS.contains(name)) {
                throw new EvaluationException("unknown function '" + name + "'");
            }
            expect('(');
            enter();
            List<Double> args = new ArrayList<>();
            try {
                args.add(expr());
                while (eat(',')) {
                    args.add(expr());
                }
                expect(')');
            } finally {
                depth--;
            }
            return apply(name, args);
        }

        private double apply(String name, List<Double> args) {
            switch (name) {
                case "abs":
                    arity(name, args, 1, 1);
                    return Math.abs(args.get(0));
                case "sqrt":
                    arity(name, args, 1, 1);
                    if (args.get(0) < 0) {
                        throw new EvaluationException("square root of a negative number");
                    }
                    return Math.sqrt(args.get(0));
                case "min":
                    arity(name, args, 1, Integer.MAX_VALUE);
                    return args.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
                case "max":
                    arity(name, args, 1, Integer.MAX_VALUE);
                    return args.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
                case "pow":
                    arity(name, args, 2, 2);
                    return Math.pow(args.get(0), args.get(1));
                case "round":
                    arity(name, args, 1, 2);
                    return round(args);
                default:
                    throw new EvaluationException("unknown function '" + name + "'");
            }
        }

        private double round(List<Double> args) {
            double value = args.get(0);
            if (!Double.isFinite(value)) {
                throw new EvaluationException("result is not a finite number");
            }
            int digits = 0;
            if (args.size() == 2) {
                double d = args.get(1);
                if (d != Math.rint(d) || Math.abs(d) > 15) {
                    throw new EvaluationException("round digits must be an integer between -15 and 15");
                }
                digits = (int) d;
            }
            return new BigDecimal(Double.toString(value)).setScale(digits, RoundingMode.HALF_UP).doubleValue();
        }

        private void arity(String name, List<Double> args, int min, int max) {
            if (args.size() < min || args.size() > max) {
                throw new EvaluationException("wrong number of arguments for " + name);
            }
        }

        private void enter() {
            if (++depth > MAX_DEPTH) {
                throw new EvaluationException("expression nested too deeply");
            }
        }

        private boolean eatPowerOperator() {
            if (eat('^')) {
                return true;
            }
            skipWhitespace();
            if (peekDoubleStar()) {
                pos += 2;
                return true;
            }
            return false;
        }

        private boolean peekDoubleStar() {
            skipWhitespace();
            return src.startsWith("**", pos);
        }

        private boolean eat(char expected) {
            skipWhitespace();
            if (pos < src.length() && src.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char expected) {
            if (!eat(expected)) {
                throw new EvaluationException("expected '" + expected + "' at position " + pos);
            }
        }

        private void skipWhitespace() {
            while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) {
                pos++;
            }
        }
    }
}
