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
 * Sine of an expression, with the sign of the argument factored out.
 *
 * @author open-qcircuit contributors
 */
public final class Sine extends AbstractFunctionAtom {

    private Sine(Expression argument) {
        super("sin", argument);
    }

    public static Expression of(Expression argument) {
        if (argument.isConstant()) {
            return Expression.constant(FastMath.sin(argument.getConstantValue()));
        }
        if (argument.hasNegativeLeadingTerm()) {
            return new Sine(argument.negate()).toExpression().negate();
        }
        return new Sine(argument).toExpression();
    }

    @Override
    protected Expression apply(Expression newArgument) {
        return of(newArgument);
    }

    @Override
    protected double apply(double value) {
        return FastMath.sin(value);
    }

    @Override
    public Expression derivative(Symbol symbol) {
        Expression inner = argument.derivative(symbol);
        if (inner.isZero()) {
            return Expression.ZERO;
        }
        return Cosine.of(argument).multiply(inner);
    }
}
