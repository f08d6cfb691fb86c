/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import java.util.function.UnaryOperator;

/**
 * Indivisible factor of a {@link Monomial}: a symbol or a function applied to an expression.
 * Atoms are ordered and identified by their canonical text.
 *
 * @author open-qcircuit contributors
 */
public interface Atom extends Comparable<Atom> {

    boolean contains(Symbol symbol);

    void collectSymbols(Set<Symbol> symbols);

    Expression derivative(Symbol symbol);

    Expression substitute(Map<Symbol, Expression> substitutions);

    /**
     * Rebuild this atom after applying an operator to its inner expression, if any.
     */
    Expression map(UnaryOperator<Expression> operator);

    double evaluate(ToDoubleFunction<Symbol> values);

    default Expression toExpression() {
        return Expression.of(Monomial.of(this), 1);
    }

    @Override
    default int compareTo(Atom other) {
        return toString().compareTo(other.toString());
    }
}
