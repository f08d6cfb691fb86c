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
 * Atom made of a unary function applied to an inner expression.
 *
 * @author open-qcircuit contributors
 */
abstract class AbstractFunctionAtom implements Atom {

    protected final Expression argument;

    private final String text;

    protected AbstractFunctionAtom(String functionName, Expression argument) {
        this.argument = Objects.requireNonNull(argument);
        this.text = functionName + "(" + argument + ")";
    }

    public Expression getArgument() {
        return argument;
    }

    protected abstract Expression apply(Expression newArgument);

    protected abstract double apply(double value);

    @Override
    public boolean contains(Symbol symbol) {
        return argument.contains(symbol);
    }

    @Override
    public void collectSymbols(Set<Symbol> symbols) {
        symbols.addAll(argument.getSymbols());
    }

    @Override
    public Expression substitute(Map<Symbol, Expression> substitutions) {
        return apply(argument.substitute(substitutions));
    }

    @Override
    public Expression map(UnaryOperator<Expression> operator) {
        return apply(operator.apply(argument));
    }

    @Override
    public double evaluate(ToDoubleFunction<Symbol> values) {
        return apply(argument.evaluate(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o != null && getClass() == o.getClass() && text.equals(o.toString());
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
