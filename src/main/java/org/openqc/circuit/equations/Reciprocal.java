/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import com.powsybl.commons.PowsyblException;

import java.util.Map;

/**
 * Multiplicative inverse of a sum. Inverses of a single term are expanded into negative exponents instead.
 *
 * @author open-qcircuit contributors
 */
public final class Reciprocal extends AbstractFunctionAtom {

    private Reciprocal(Expression base) {
        super("1/", base);
    }

    public static Expression of(Expression base) {
        if (base.isZero()) {
            throw new PowsyblException("Division by zero");
        }
        if (base.getTerms().size() == 1) {
            Map.Entry<Monomial, Double> term = base.getTerms().entrySet().iterator().next();
            return Expression.of(term.getKey().inverse(), 1 / term.getValue());
        }
        if (base.hasNegativeLeadingTerm()) {
            return new Reciprocal(base.negate()).toExpression().negate();
        }
        return new Reciprocal(base).toExpression();
    }

    @Override
    protected Expression apply(Expression newArgument) {
        return of(newArgument);
    }

    @Override
    protected double apply(double value) {
        return 1 / value;
    }

    @Override
    public Expression derivative(Symbol symbol) {
        Expression inner = argument.derivative(symbol);
        if (inner.isZero()) {
            return Expression.ZERO;
        }
        Expression self = toExpression();
        return self.multiply(self).multiply(inner).negate();
    }
}
