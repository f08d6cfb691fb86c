/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import org.apache.commons.math3.util.FastMath;

/**
 * Cosine of an expression. The argument is stored with a positive leading coefficient, cosine being even.
 *
 * @author open-qcircuit contributors
 */
public final class Cosine extends AbstractFunctionAtom {

    private Cosine(Expression argument) {
        super("cos", argument);
    }

    public static Expression of(Expression argument) {
        if (argument.isConstant()) {
            return Expression.constant(FastMath.cos(argument.getConstantValue()));
        }
        return new Cosine(argument.hasNegativeLeadingTerm() ? argument.negate() : argument).toExpression();
    }

    @Override
    protected Expression apply(Expression newArgument) {
        return of(newArgument);
    }

    @Override
    protected double apply(double value) {
        return FastMath.cos(value);
    }

    @Override
    public Expression derivative(Symbol symbol) {
        Expression inner = argument.derivative(symbol);
        if (inner.isZero()) {
            return Expression.ZERO;
        }
        return Sine.of(argument).multiply(inner).negate();
    }
}
