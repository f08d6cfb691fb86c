/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class SymbolicMatrixTest {

    private final Symbol a = Symbol.of("a");

    private final Symbol b = Symbol.of("b");

    private SymbolicMatrix createSymbolic() {
        // [[a, -a], [-a, a + b]]
        SymbolicMatrix m = new SymbolicMatrix(2, 2);
        m.set(0, 0, a.toExpression());
        m.set(0, 1, a.toExpression().negate());
        m.set(1, 0, a.toExpression().negate());
        m.set(1, 1, a.toExpression().add(b.toExpression()));
        return m;
    }

    @Test
    void testDeterminant() {
        assertEquals(a.toExpression().multiply(b.toExpression()), createSymbolic().determinant());

        DenseMatrix dense = new DenseMatrix(3, 3);
        dense.set(0, 0, 2);
        dense.set(1, 1, 3);
        dense.set(2, 2, 4);
        dense.set(0, 2, 1);
        assertEquals(Expression.constant(24), SymbolicMatrix.of(dense).determinant());
    }

    @Test
    void testInverse() {
        SymbolicMatrix inverse = createSymbolic().inverse();
        Map<Symbol, Double> values = Map.of(a, 2.0, b, 3.0);
        // inverse of [[2, -2], [-2, 5]] is [[5, 2], [2, 2]] / 6
        assertEquals(5. / 6, inverse.get(0, 0).evaluate(values), 1e-12);
        assertEquals(2. / 6, inverse.get(0, 1).evaluate(values), 1e-12);
        assertEquals(2. / 6, inverse.get(1, 0).evaluate(values), 1e-12);
        assertEquals(2. / 6, inverse.get(1, 1).evaluate(values), 1e-12);

        SymbolicMatrix single = new SymbolicMatrix(1, 1);
        single.set(0, 0, a.toExpression().multiply(4));
        assertEquals(Expression.of(Monomial.of(a, -1), 0.25), single.inverse().get(0, 0));

        assertThrows(PowsyblException.class, () -> new SymbolicMatrix(2, 2).inverse());
    }

    @Test
    void testCongruenceAndQuadraticForm() {
        DenseMatrix t = new DenseMatrix(2, 2);
        t.set(0, 0, 1);
        t.set(0, 1, 1);
        t.set(1, 1, 1);
        SymbolicMatrix transformed = createSymbolic().congruence(t);
        assertEquals(a.toExpression(), transformed.get(0, 0));
        assertTrue(transformed.get(0, 1).isZero());
        assertTrue(transformed.get(1, 0).isZero());
        assertEquals(b.toExpression(), transformed.get(1, 1));

        Symbol x = Symbol.of("x");
        Symbol y = Symbol.of("y");
        Expression form = transformed.quadraticForm(List.of(x.toExpression(), y.toExpression()));
        assertEquals(a.toExpression().multiply(x.toExpression().pow(2)).add(b.toExpression().multiply(y.toExpression().pow(2))), form);
        assertThrows(PowsyblException.class, () -> transformed.quadraticForm(List.of(x.toExpression())));
    }

    @Test
    void testBlocksAndConversion() {
        SymbolicMatrix m = createSymbolic();
        assertEquals(a.toExpression(), m.block(0, 0, 1, 1).get(0, 0));
        assertEquals(a.toExpression().add(b.toExpression()), m.withoutRowAndColumn(0).get(0, 0));
        assertFalse(m.isConstant());
        assertThrows(PowsyblException.class, m::toDenseMatrix);

        SymbolicMatrix numeric = m.substitute(Map.of(a, Expression.constant(1), b, Expression.constant(2)));
        assertTrue(numeric.isConstant());
        DenseMatrix dense = numeric.toDenseMatrix();
        assertEquals(-1, dense.get(0, 1), 0);
        assertEquals(3, dense.get(1, 1), 0);
        assertEquals("[[1, -1], [-1, 3]]", numeric.toString());
    }
}
