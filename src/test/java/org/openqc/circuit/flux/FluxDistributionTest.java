/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.flux;

import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.Test;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.graph.SpanningTree;
import org.openqc.circuit.network.BranchRecord;
import org.openqc.circuit.network.CircuitFixtures;
import org.openqc.circuit.network.CircuitNetwork;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.openqc.circuit.network.BranchParameter.of;

/**
 * @author open-qcircuit contributors
 */
class FluxDistributionTest {

    private static final double DELTA = 1e-9;

    private static CircuitNetwork createTwoLoopCircuit() {
        return CircuitNetwork.create(List.of(
                BranchRecord.inductor(0, 1, of(1)),
                BranchRecord.inductor(1, 2, of(1)),
                BranchRecord.junction(2, 0, of(1), of(1)),
                BranchRecord.inductor(0, 1, of(2)),
                BranchRecord.capacitor(1, 2, of(1))));
    }

    private static FluxDistribution createDistribution(CircuitNetwork network) {
        SpanningTree tree = SpanningTree.build(network);
        return new FluxDistribution(network, tree, ClosureFluxes.of(tree.getClosureBranches()));
    }

    @Test
    void testSingleLoop() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        FluxDistribution distribution = createDistribution(network);

        DenseMatrix loops = distribution.buildLoopMatrix();
        assertEquals(4, loops.getRowCount());
        assertEquals(1, loops.getColumnCount());
        for (int b = 0; b < 4; b++) {
            assertEquals(1, loops.get(b, 0), 0);
        }

        // junctions carry charge, the flux goes to the inductors
        List<Expression> fluxes = distribution.distribute();
        Expression half = Symbol.of("Φ1").toExpression().multiply(0.5);
        assertTrue(fluxes.get(0).isZero());
        assertEquals(half, fluxes.get(1));
        assertTrue(fluxes.get(2).isZero());
        assertEquals(half, fluxes.get(3));
    }

    @Test
    void testClosureBranchMatchedById() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        SpanningTree tree = SpanningTree.build(network);
        // same topology, distinct branch objects
        CircuitNetwork twin = CircuitFixtures.fluxQubit();
        ClosureFluxes closureFluxes = ClosureFluxes.of(SpanningTree.build(twin).getClosureBranches());
        assertNotSame(tree.getClosureBranches().get(0), closureFluxes.getClosureBranches().get(0));

        DenseMatrix loops = new FluxDistribution(network, tree, closureFluxes).buildLoopMatrix();
        for (int b = 0; b < 4; b++) {
            assertEquals(1, loops.get(b, 0), 0);
        }
    }

    @Test
    void testTwoLoops() {
        CircuitNetwork network = createTwoLoopCircuit();
        FluxDistribution distribution = createDistribution(network);

        DenseMatrix loops = distribution.buildLoopMatrix();
        double[][] expectedLoops = {{1, -1}, {1, 0}, {1, 0}, {0, 1}, {0, 0}};
        for (int b = 0; b < expectedLoops.length; b++) {
            assertArrayEquals(expectedLoops[b], new double[] {loops.get(b, 0), loops.get(b, 1)}, 0, "branch " + b);
        }

        DenseMatrix allocation = distribution.computeAllocationMatrix();
        double[][] expected = {{1. / 3, -1. / 3}, {2. / 3, 1. / 3}, {0, 0}, {1. / 3, 2. / 3}, {0, 0}};
        for (int b = 0; b < expected.length; b++) {
            assertArrayEquals(expected[b], new double[] {allocation.get(b, 0), allocation.get(b, 1)}, DELTA, "branch " + b);
        }

        // each loop sees its own flux only
        for (int k = 0; k < 2; k++) {
            for (int l = 0; l < 2; l++) {
                double sum = 0;
                for (int b = 0; b < 5; b++) {
                    sum += loops.get(b, k) * allocation.get(b, l);
                }
                assertEquals(k == l ? 1 : 0, sum, DELTA);
            }
        }
    }

    @Test
    void testNoLoop() {
        CircuitNetwork network = CircuitFixtures.transmon();
        List<Expression> fluxes = createDistribution(network).distribute();
        assertEquals(2, fluxes.size());
        assertTrue(fluxes.stream().allMatch(Expression::isZero));
    }

    @Test
    void testClosureFluxes() {
        CircuitNetwork network = createTwoLoopCircuit();
        ClosureFluxes fluxes = ClosureFluxes.of(List.of(network.getBranch("4"), network.getBranch("3")));
        assertEquals(List.of(network.getBranch("3")), fluxes.getClosureBranches());
        assertEquals(List.of(Symbol.of("Φ1")), fluxes.getFluxes());

        List<Expression> allocation = fluxes.staticAllocation(network);
        assertEquals(Symbol.of("Φ1").toExpression(), allocation.get(3));
        assertTrue(allocation.get(0).isZero());
        assertTrue(ClosureFluxes.none().isEmpty());
    }
}
