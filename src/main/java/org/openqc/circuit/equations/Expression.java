/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import com.powsybl.commons.PowsyblException;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

import java.util.*;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * Immutable polynomial-like expression: a sum of monomials with real coefficients, kept in canonical form
 * (monomials sorted by their text, no zero coefficient). Two expressions are equal when their canonical
 * forms are equal.
 *
 * @author open-qcircuit contributors
 */
public final class Expression {

    public static final Expression ZERO = new Expression(new TreeMap<>());

    public static final Expression ONE = constant(1);

    private final SortedMap<Monomial, Double> terms;

    private Expression(SortedMap<Monomial, Double> terms) {
        this.terms = terms;
    }

    public static Expression constant(double value) {
        if (value == 0) {
            return ZERO;
        }
        return of(Monomial.ONE, value);
    }

    public static Expression of(Monomial monomial, double coefficient) {
        Objects.requireNonNull(monomial);
        if (coefficient == 0) {
            return ZERO;
        }
        SortedMap<Monomial, Double> terms = new TreeMap<>();
        terms.put(monomial, coefficient);
        return new Expression(terms);
    }

    public static Expression sum(Collection<Expression> expressions) {
        SortedMap<Monomial, Double> terms = new TreeMap<>();
        for (Expression expression : expressions) {
            expression.terms.forEach((m, c) -> accumulate(terms, m, c));
        }
        return new Expression(terms);
    }

    private static void accumulate(SortedMap<Monomial, Double> terms, Monomial monomial, double coefficient) {
        double value = terms.getOrDefault(monomial, 0.0) + coefficient;
        if (value == 0) {
            terms.remove(monomial);
        } else {
            terms.put(monomial, value);
        }
    }

    public Map<Monomial, Double> getTerms() {
        return Collections.unmodifiableMap(terms);
    }

    public double getCoefficient(Monomial monomial) {
        return terms.getOrDefault(monomial, 0.0);
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    public boolean isConstant() {
        return terms.isEmpty() || terms.size() == 1 && terms.containsKey(Monomial.ONE);
    }

    public double getConstantValue() {
        return terms.getOrDefault(Monomial.ONE, 0.0);
    }

    public boolean contains(Symbol symbol) {
        return terms.keySet().stream().anyMatch(m -> m.contains(symbol));
    }

    public Set<Symbol> getSymbols() {
        Set<Symbol> symbols = new TreeSet<>();
        for (Monomial monomial : terms.keySet()) {
            monomial.getPowers().keySet().forEach(atom -> atom.collectSymbols(symbols));
        }
        return symbols;
    }

    public Expression add(Expression other) {
        if (other.isZero()) {
            return this;
        }
        if (isZero()) {
            return other;
        }
        SortedMap<Monomial, Double> sum = new TreeMap<>(terms);
        other.terms.forEach((m, c) -> accumulate(sum, m, c));
        return new Expression(sum);
    }

    public Expression add(double value) {
        return add(constant(value));
    }

    public Expression subtract(Expression other) {
        return add(other.negate());
    }

    public Expression negate() {
        return multiply(-1);
    }

    public Expression multiply(double factor) {
        if (factor == 0) {
            return ZERO;
        }
        if (factor == 1) {
            return this;
        }
        SortedMap<Monomial, Double> scaled = new TreeMap<>();
        terms.forEach((m, c) -> accumulate(scaled, m, c * factor));
        return new Expression(scaled);
    }

    public Expression multiply(Expression other) {
        if (isZero() || other.isZero()) {
            return ZERO;
        }
        SortedMap<Monomial, Double> product = new TreeMap<>();
        for (Map.Entry<Monomial, Double> e1 : terms.entrySet()) {
            for (Map.Entry<Monomial, Double> e2 : other.terms.entrySet()) {
                accumulate(product, e1.getKey().multiply(e2.getKey()), e1.getValue() * e2.getValue());
            }
        }
        return new Expression(product);
    }

    public Expression divide(Expression other) {
        return multiply(Reciprocal.of(other));
    }

    public Expression pow(int exponent) {
        if (exponent < 0) {
            return Reciprocal.of(this).pow(-exponent);
        }
        Expression result = ONE;
        for (int i = 0; i < exponent; i++) {
            result = result.multiply(this);
        }
        return result;
    }

    public Expression derivative(Symbol symbol) {
        Expression result = ZERO;
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            Monomial monomial = term.getKey();
            for (Map.Entry<Atom, Integer> power : monomial.getPowers().entrySet()) {
                Atom atom = power.getKey();
                int exponent = power.getValue();
                Expression atomDerivative = atom.derivative(symbol);
                if (atomDerivative.isZero()) {
                    continue;
                }
                Monomial rest = monomial.without(atom).multiply(Monomial.of(atom, exponent - 1));
                result = result.add(of(rest, term.getValue() * exponent).multiply(atomDerivative));
            }
        }
        return result;
    }

    public Expression substitute(Symbol symbol, Expression replacement) {
        return substitute(Map.of(symbol, replacement));
    }

    public Expression substitute(Map<Symbol, Expression> substitutions) {
        if (substitutions.isEmpty()) {
            return this;
        }
        return transform(atom -> substitutions.keySet().stream().anyMatch(atom::contains) ? atom.substitute(substitutions) : null,
            DoubleUnaryOperator.identity());
    }

    /**
     * Rebuild every term, replacing each atom by the given function result (unchanged when the function
     * returns null) and each coefficient by the given operator.
     */
    private Expression transform(Function<Atom, Expression> atomReplacement, DoubleUnaryOperator coefficientOperator) {
        List<Expression> rebuilt = new ArrayList<>(terms.size());
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            double coefficient = coefficientOperator.applyAsDouble(term.getValue());
            if (coefficient == 0) {
                continue;
            }
            Monomial kept = Monomial.ONE;
            Expression product = constant(coefficient);
            for (Map.Entry<Atom, Integer> power : term.getKey().getPowers().entrySet()) {
                Expression replacement = atomReplacement.apply(power.getKey());
                if (replacement == null) {
                    kept = kept.multiply(Monomial.of(power.getKey(), power.getValue()));
                } else {
                    product = product.multiply(replacement.pow(power.getValue()));
                }
            }
            rebuilt.add(product.multiply(of(kept, 1)));
        }
        return sum(rebuilt);
    }

    public double evaluate(ToDoubleFunction<Symbol> values) {
        double result = 0;
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            double product = term.getValue();
            for (Map.Entry<Atom, Integer> power : term.getKey().getPowers().entrySet()) {
                product *= FastMath.pow(power.getKey().evaluate(values), power.getValue());
            }
            result += product;
        }
        return result;
    }

    public double evaluate(Map<Symbol, Double> values) {
        return evaluate(symbol -> {
            Double value = values.get(symbol);
            if (value == null) {
                throw new PowsyblException("No value for symbol '" + symbol + "'");
            }
            return value;
        });
    }

    /**
     * Solve {@code this = 0} for a symbol the expression is affine in.
     */
    public Expression solveLinear(Symbol symbol) {
        Expression slope = ZERO;
        Expression offset = ZERO;
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            Monomial monomial = term.getKey();
            for (Atom atom : monomial.getPowers().keySet()) {
                if (!atom.equals(symbol) && atom.contains(symbol)) {
                    throw new PowsyblException("Equation is not linear in " + symbol + ": " + this);
                }
            }
            int exponent = monomial.getExponent(symbol);
            if (exponent == 0) {
                offset = offset.add(of(monomial, term.getValue()));
            } else if (exponent == 1) {
                slope = slope.add(of(monomial.without(symbol), term.getValue()));
            } else {
                throw new PowsyblException("Equation is not linear in " + symbol + ": " + this);
            }
        }
        if (slope.isZero()) {
            throw new PowsyblException("Equation does not depend on " + symbol + ": " + this);
        }
        return offset.negate().divide(slope);
    }

    /**
     * Drop terms whose coefficient magnitude is below epsilon, including inside function arguments.
     */
    public Expression clean(double epsilon) {
        return transform(atom -> atom instanceof Symbol ? null : atom.map(inner -> inner.clean(epsilon)),
            c -> FastMath.abs(c) < epsilon ? 0 : c);
    }

    /**
     * Round every coefficient to the given number of decimal places, including inside function arguments.
     */
    public Expression round(int digits) {
        return transform(atom -> atom instanceof Symbol ? null : atom.map(inner -> inner.round(digits)),
            c -> Precision.round(c, digits));
    }

    boolean hasNegativeLeadingTerm() {
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            if (!term.getKey().isOne()) {
                return term.getValue() < 0;
            }
        }
        return getConstantValue() < 0;
    }

    static String formatNumber(double value) {
        if (value == FastMath.rint(value) && FastMath.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Expression other && terms.equals(other.terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<Monomial, Double> term : terms.entrySet()) {
            Monomial monomial = term.getKey();
            double coefficient = term.getValue();
            boolean negative = coefficient < 0;
            double magnitude = FastMath.abs(coefficient);
            String text;
            if (monomial.isOne()) {
                text = formatNumber(magnitude);
            } else if (magnitude == 1) {
                text = monomial.toString();
            } else {
                text = formatNumber(magnitude) + "*" + monomial;
            }
            if (builder.length() == 0) {
                builder.append(negative ? "-" : "").append(text);
            } else {
                builder.append(negative ? " - " : " + ").append(text);
            }
        }
        return builder.toString();
    }
}
