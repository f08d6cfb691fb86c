/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.graph;

import org.junit.jupiter.api.Test;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.BranchType;
import org.openqc.circuit.network.CircuitFixtures;
import org.openqc.circuit.network.CircuitNetwork;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class ModeExtractorTest {

    @Test
    void testGroundedComponents() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        ModeExtractor extractor = new ModeExtractor(network);

        List<double[]> inductive = extractor.extract(network.getBranches(b -> b.getType() == BranchType.INDUCTOR), true);
        assertEquals(1, inductive.size());
        assertArrayEquals(new double[] {1, 1, 0}, inductive.get(0));

        List<double[]> junctions = extractor.extract(network.getBranches(b -> b.getType().isJunction()), true);
        assertEquals(1, junctions.size());
        assertArrayEquals(new double[] {0, 1, 1}, junctions.get(0));

        assertTrue(extractor.extract(network.getBranches(), true).isEmpty());

        List<double[]> lc = extractor.extract(network.getBranches(b -> b.getType().isJunction()), false, -1, 1);
        assertEquals(1, lc.size());
        assertArrayEquals(new double[] {1, -1, -1}, lc.get(0));
    }

    @Test
    void testUntouchedNodes() {
        CircuitNetwork network = CircuitFixtures.transmon();
        ModeExtractor extractor = new ModeExtractor(network);

        List<double[]> vectors = extractor.extract(List.of(), true);
        assertEquals(2, vectors.size());
        assertArrayEquals(new double[] {1, 1}, vectors.get(0));
        assertArrayEquals(new double[] {1, 0}, vectors.get(1));

        List<double[]> withoutSingleNodes = extractor.extract(List.of(), false);
        assertEquals(1, withoutSingleNodes.size());

        List<double[]> junction = extractor.extract(network.getBranches(b -> b.getType().isJunction()), true, -1, 1);
        assertEquals(1, junction.size());
        assertArrayEquals(new double[] {-1, -1}, junction.get(0));
    }

    @Test
    void testEmptySubset() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        ModeExtractor extractor = new ModeExtractor(network);

        // untouched nodes form a single group emitted as one vector
        List<double[]> group = extractor.extract(List.of(), false);
        assertEquals(1, group.size());
        assertArrayEquals(new double[] {1, 1, 1}, group.get(0));

        // with single node modes, one vector per unconnected node
        List<double[]> vectors = extractor.extract(List.of(), true);
        assertEquals(network.getNodeCount(), vectors.size());
        assertArrayEquals(new double[] {1, 1, 1}, vectors.get(0));
        assertArrayEquals(new double[] {1, 0, 0}, vectors.get(1));
        assertArrayEquals(new double[] {0, 1, 0}, vectors.get(2));
    }

    @Test
    void testRepeatedExtractionIsStable() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        ModeExtractor extractor = new ModeExtractor(network);
        List<List<Branch>> subsets = List.of(
                network.getBranches(b -> b.getType() == BranchType.INDUCTOR),
                network.getBranches(b -> b.getType() != BranchType.INDUCTOR),
                network.getBranches(b -> b.getType().isJunction()),
                List.of());
        for (List<Branch> subset : subsets) {
            List<double[]> first = extractor.extract(subset, true);
            List<double[]> second = extractor.extract(subset, true);
            assertEquals(first.size(), second.size());
            for (int i = 0; i < first.size(); i++) {
                assertArrayEquals(first.get(i), second.get(i));
            }
        }
    }
}
