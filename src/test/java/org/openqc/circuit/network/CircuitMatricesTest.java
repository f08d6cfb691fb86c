/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.Test;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Reciprocal;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.equations.SymbolicMatrix;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class CircuitMatricesTest {

    private static final double DELTA = 1e-12;

    private static void assertMatrixEquals(double[][] expected, DenseMatrix actual) {
        assertEquals(expected.length, actual.getRowCount());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i].length, actual.getColumnCount());
            for (int j = 0; j < expected[i].length; j++) {
                assertEquals(expected[i][j], actual.get(i, j), DELTA, "entry (" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void testGroundedMatrices() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        assertMatrixEquals(new double[][] {{0.25, 0, 0}, {0, 0.25, -0.25}, {0, -0.25, 0.25}},
                CircuitMatrices.numericCapacitance(network));
        assertMatrixEquals(new double[][] {{2, -2, 0}, {-2, 2, 0}, {0, 0, 2}},
                CircuitMatrices.numericInductance(network));
    }

    @Test
    void testUngroundedMatrices() {
        CircuitNetwork network = CircuitFixtures.transmon();
        assertMatrixEquals(new double[][] {{0.875, -0.875}, {-0.875, 0.875}}, CircuitMatrices.numericCapacitance(network));
        assertMatrixEquals(new double[][] {{0, 0}, {0, 0}}, CircuitMatrices.numericInductance(network));
    }

    @Test
    void testSymbolicCapacitance() {
        CircuitNetwork network = CircuitFixtures.symbolicTransmon();
        SymbolicMatrix capacitance = CircuitMatrices.capacitance(network, false);
        Expression weight = Reciprocal.of(Symbol.of("EC").toExpression().multiply(8))
                .add(Reciprocal.of(Symbol.of("ECJ").toExpression().multiply(8)));
        assertEquals(weight, capacitance.get(0, 0));
        assertEquals(weight.negate(), capacitance.get(0, 1));
        assertFalse(capacitance.isConstant());
        assertEquals(0.875, capacitance.get(1, 1).evaluate(network.getSymbolicParameters().getValues()), DELTA);
        assertEquals(0.875, CircuitMatrices.capacitance(network, true).get(1, 1).getConstantValue(), DELTA);
    }

    @Test
    void testShortedBranchIgnored() {
        CircuitNetwork network = CircuitNetwork.create(List.of(
                BranchRecord.capacitor(0, 1, BranchParameter.of(0.5)),
                BranchRecord.capacitor(1, 1, BranchParameter.of(0.1))));
        assertMatrixEquals(new double[][] {{0.25}}, CircuitMatrices.numericCapacitance(network));
    }
}
