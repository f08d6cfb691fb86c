/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import org.openqc.circuit.graph.ModeExtractor;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.BranchType;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Candidate mode vectors of each kind found from the circuit structure.
 *
 * @param periodic vectors with no variable difference across inductors
 * @param frozen vectors with no variable difference across capacitive branches, including the all-ones vector when the
 *               circuit is not grounded
 * @param free vectors with no variable difference across inductive branches
 * @param lc vectors from the junction subset, empty when not requested
 * @param sigma the all-ones vector
 *
 * @author open-qcircuit contributors
 */
public record ModeCandidates(List<double[]> periodic, List<double[]> frozen, List<double[]> free, List<double[]> lc,
                             double[] sigma) {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModeCandidates.class);

    public static ModeCandidates find(CircuitNetwork network, boolean withLc, double lcInValue, double lcOutValue) {
        ModeExtractor extractor = new ModeExtractor(network);
        List<double[]> periodic = extractor.extract(select(network, b -> b.getType() == BranchType.INDUCTOR), true);
        List<double[]> frozen = new ArrayList<>(extractor.extract(select(network, b -> b.getType() != BranchType.INDUCTOR), true));
        List<double[]> free = extractor.extract(select(network, b -> b.getType() != BranchType.CAPACITOR), true);

        double[] sigma = new double[network.getNodeCount()];
        Arrays.fill(sigma, 1);
        if (!network.isGrounded()) {
            if (MatrixUtil.increasesRank(frozen, sigma)) {
                frozen.add(sigma);
            } else {
                // sigma takes the place of the first frozen candidate
                frozen.remove(0);
                frozen.add(sigma);
            }
        }

        List<double[]> lc = withLc
                ? extractor.extract(select(network, b -> b.getType().isJunction()), false, lcInValue, lcOutValue)
                : List.of();

        LOGGER.debug("Mode candidates: {} periodic, {} frozen, {} free, {} LC",
                periodic.size(), frozen.size(), free.size(), lc.size());
        return new ModeCandidates(List.copyOf(periodic), List.copyOf(frozen), List.copyOf(free), List.copyOf(lc), sigma);
    }

    private static List<Branch> select(CircuitNetwork network, Predicate<Branch> filter) {
        return network.getBranches(filter);
    }

    public static boolean containsExactly(List<double[]> vectors, double[] vector) {
        return vectors.stream().anyMatch(v -> sameEntries(v, vector));
    }

    private static boolean sameEntries(double[] a, double[] b) {
        if (a.length != b.length) {
            return false;
        }
        for (int i = 0; i < a.length; i++) {
            if (a[i] != b[i]) {
                return false;
            }
        }
        return true;
    }
}
