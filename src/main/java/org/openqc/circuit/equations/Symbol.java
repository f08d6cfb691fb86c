/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/**
 * Named scalar variable: node flux, transformed variable, external flux or circuit parameter.
 *
 * @author open-qcircuit contributors
 */
public final class Symbol implements Atom {

    private final String name;

    private Symbol(String name) {
        this.name = Objects.requireNonNull(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Empty symbol name");
        }
    }

    public static Symbol of(String name) {
        return new Symbol(name);
    }

    public static Symbol indexed(String prefix, int index) {
        return new Symbol(prefix + index);
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean contains(Symbol symbol) {
        return equals(symbol);
    }

    @Override
    public void collectSymbols(Set<Symbol> symbols) {
        symbols.add(this);
    }

    @Override
    public Expression derivative(Symbol symbol) {
        return equals(symbol) ? Expression.ONE : Expression.ZERO;
    }

    @Override
    public Expression substitute(Map<Symbol, Expression> substitutions) {
        Expression replacement = substitutions.get(this);
        return replacement != null ? replacement : toExpression();
    }

    @Override
    public Expression map(UnaryOperator<Expression> operator) {
        return toExpression();
    }

    @Override
    public double evaluate(ToDoubleFunction<Symbol> values) {
        return values.applyAsDouble(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Symbol other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
