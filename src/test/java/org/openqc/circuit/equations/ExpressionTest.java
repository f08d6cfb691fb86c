/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class ExpressionTest {

    private static final double EPSILON = 1e-12;

    private final Symbol x = Symbol.of("x");

    private final Symbol y = Symbol.of("y");

    private Expression x() {
        return x.toExpression();
    }

    private Expression y() {
        return y.toExpression();
    }

    @Test
    void testCanonicalForm() {
        assertEquals(y(), x().add(y()).subtract(x()));
        assertTrue(x().subtract(x()).isZero());
        assertEquals("0", Expression.ZERO.toString());
        assertEquals("x - 2*y", y().multiply(-2).add(x()).toString());
        assertEquals("1.5 - x", x().negate().add(1.5).toString());
        assertEquals("-x", x().negate().toString());
        assertEquals(x().add(y()), y().add(x()));
    }

    @Test
    void testProduct() {
        Expression product = x().add(1).multiply(x().subtract(Expression.ONE));
        assertEquals(x().pow(2).subtract(Expression.ONE), product);
        assertEquals(1, product.getCoefficient(Monomial.of(x, 2)), EPSILON);
        assertEquals(-1, product.getConstantValue(), EPSILON);
        assertEquals("x**2", Monomial.of(x, 2).toString());
        assertEquals(Expression.ONE, x().divide(x()));
        assertEquals("x**(-1)", x().pow(-1).toString());
    }

    @Test
    void testDerivative() {
        Expression e = x().pow(2).multiply(y()).add(x().multiply(3));
        assertEquals(x().multiply(y()).multiply(2).add(3), e.derivative(x));
        assertEquals(x().pow(2), e.derivative(y));
        assertTrue(e.derivative(Symbol.of("z")).isZero());

        Expression cos = Cosine.of(x().multiply(2));
        assertEquals(Sine.of(x().multiply(2)).multiply(-2), cos.derivative(x));
        assertEquals(Cosine.of(x().multiply(2)).multiply(2), Sine.of(x().multiply(2)).derivative(x));

        Expression reciprocal = Reciprocal.of(x().add(1));
        assertEquals(-4, reciprocal.derivative(x).evaluate(Map.of(x, -0.5)), EPSILON * 10);
    }

    @Test
    void testFunctionNormalization() {
        assertEquals(Cosine.of(x()), Cosine.of(x().negate()));
        assertEquals(Sine.of(x()).negate(), Sine.of(x().negate()));
        assertEquals(Expression.constant(1), Cosine.of(Expression.ZERO));
        assertTrue(Sine.of(Expression.ZERO).isZero());
        assertEquals("cos(x)", Cosine.of(x()).toString());
        assertEquals("1/(x + y)", Reciprocal.of(x().add(y())).toString());
        assertEquals(Expression.of(Monomial.of(x, -1), 0.5), Reciprocal.of(x().multiply(2)));
    }

    @Test
    void testSubstitute() {
        Expression e = x().pow(2);
        assertEquals(y().pow(2).add(y().multiply(2)).add(1), e.substitute(x, y().add(1)));
        assertEquals(Cosine.of(y().multiply(2)), Cosine.of(x().add(y())).substitute(x, y()));
        assertEquals(y().multiply(8), Reciprocal.of(x().multiply(8)).substitute(x, Reciprocal.of(y().multiply(64))));
        assertSame(e, e.substitute(Map.of()));
    }

    @Test
    void testEvaluate() {
        Expression e = x().multiply(y()).add(Cosine.of(x()));
        assertEquals(1, e.evaluate(Map.of(x, 0.0, y, 2.0)), EPSILON);
        assertEquals(2 + Math.cos(1), e.evaluate(Map.of(x, 1.0, y, 2.0)), EPSILON);
        PowsyblException e2 = assertThrows(PowsyblException.class, () -> e.evaluate(Map.of(x, 1.0)));
        assertEquals("No value for symbol 'y'", e2.getMessage());
    }

    @Test
    void testSolveLinear() {
        Expression equation = x().multiply(2).add(y().multiply(4)).add(-2);
        assertEquals(y().multiply(-2).add(1), equation.solveLinear(x));
        assertThrows(PowsyblException.class, () -> x().pow(2).solveLinear(x));
        assertThrows(PowsyblException.class, () -> Cosine.of(x()).add(x()).solveLinear(x));
        assertThrows(PowsyblException.class, () -> y().solveLinear(x));
    }

    @Test
    void testCleanAndRound() {
        Expression e = x().multiply(1e-12).add(y()).add(Cosine.of(x().add(y().multiply(1e-13))));
        assertEquals(y().add(Cosine.of(x())), e.clean(1e-10));
        assertEquals(x().multiply(0.12), x().multiply(0.123456).round(2));
        assertEquals(Cosine.of(x().multiply(0.33)), Cosine.of(x().multiply(0.3333)).round(2));
    }

    @Test
    void testDivisionByZero() {
        PowsyblException e = assertThrows(PowsyblException.class, () -> x().divide(Expression.ZERO));
        assertEquals("Division by zero", e.getMessage());
    }

    @Test
    void testSymbols() {
        Expression e = x().add(Cosine.of(y()));
        assertEquals(2, e.getSymbols().size());
        assertTrue(e.contains(y));
        assertFalse(e.isConstant());
        assertTrue(Expression.constant(3).isConstant());
        assertEquals("θ3", Symbol.indexed("θ", 3).getName());
    }
}
