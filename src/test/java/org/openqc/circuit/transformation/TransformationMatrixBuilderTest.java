/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.Test;
import org.openqc.circuit.network.CircuitFixtures;
import org.openqc.circuit.util.MatrixUtil;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class TransformationMatrixBuilderTest {

    private static void assertColumnEquals(double[] expected, DenseMatrix matrix, int column) {
        assertArrayEquals(expected, MatrixUtil.getColumn(matrix, column), 0);
    }

    @Test
    void testGroundedLoop() {
        VariableTransformation transformation = new TransformationMatrixBuilder(CircuitFixtures.fluxQubit(), BasisCompletion.HEURISTIC)
                .build(true);
        DenseMatrix t = transformation.matrix();
        assertColumnEquals(new double[] {1, 1, 0}, t, 0);
        assertColumnEquals(new double[] {1, -1, -1}, t, 1);
        assertColumnEquals(new double[] {0, 1, 1}, t, 2);

        VariableCategories categories = transformation.categories();
        assertEquals(List.of(1), categories.getPeriodic());
        assertEquals(List.of(2), categories.getExtended());
        assertTrue(categories.getFree().isEmpty());
        assertEquals(List.of(3), categories.getFrozen());
        assertEquals(VariableCategory.FROZEN, categories.getCategory(3).orElseThrow());
        assertEquals(3, categories.size());
    }

    @Test
    void testUngroundedCircuit() {
        VariableTransformation transformation = new TransformationMatrixBuilder(CircuitFixtures.transmon(), BasisCompletion.HEURISTIC)
                .build(true);
        DenseMatrix t = transformation.matrix();
        assertColumnEquals(new double[] {1, 0}, t, 0);
        assertColumnEquals(new double[] {1, 1}, t, 1);
        assertEquals(List.of(1), transformation.categories().getPeriodic());
        // the all-ones mode is last and has no category
        assertEquals(1, transformation.categories().size());
        assertTrue(transformation.categories().getCategory(2).isEmpty());
    }

    @Test
    void testStandardBasis() {
        TransformationMatrixBuilder heuristic = new TransformationMatrixBuilder(CircuitFixtures.fluxQubit(), BasisCompletion.HEURISTIC);
        List<double[]> basis3 = heuristic.standardBasis(3);
        assertEquals(3, basis3.size());
        assertArrayEquals(new double[] {1, 1, 1}, basis3.get(0), 0);
        assertArrayEquals(new double[] {1, 0, 0}, basis3.get(1), 0);
        assertArrayEquals(new double[] {0, 1, 0}, basis3.get(2), 0);

        List<double[]> basis4 = heuristic.standardBasis(4);
        assertEquals(4, basis4.size());
        assertArrayEquals(new double[] {1, 1, 0, 0}, basis4.get(1), 0);
        assertArrayEquals(new double[] {1, 0, 1, 0}, basis4.get(2), 0);
        assertArrayEquals(new double[] {1, 0, 0, 1}, basis4.get(3), 0);

        List<double[]> canonical = new TransformationMatrixBuilder(CircuitFixtures.fluxQubit(), BasisCompletion.CANONICAL)
                .standardBasis(3);
        assertArrayEquals(new double[] {1, 0, 0}, canonical.get(0), 0);
        assertArrayEquals(new double[] {0, 0, 1}, canonical.get(2), 0);
    }

    @Test
    void testMatrixIsInvertible() {
        DenseMatrix t = new TransformationMatrixBuilder(CircuitFixtures.lcOscillator(), BasisCompletion.CANONICAL)
                .build(false)
                .matrix();
        assertEquals(1, MatrixUtil.rank(t));
        assertEquals(1, t.get(0, 0), 0);
    }
}
