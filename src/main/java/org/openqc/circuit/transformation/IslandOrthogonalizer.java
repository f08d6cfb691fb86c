/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.math.matrix.DenseMatrix;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.network.Node;
import org.openqc.circuit.util.MatrixUtil;

import java.util.*;

/**
 * @author open-qcircuit contributors
 */
public class IslandOrthogonalizer {

    private static final List<VariableCategory> ISLAND_CATEGORIES
            = List.of(VariableCategory.FREE, VariableCategory.FROZEN, VariableCategory.PERIODIC);

    private final CircuitNetwork network;

    public IslandOrthogonalizer(CircuitNetwork network) {
        this.network = Objects.requireNonNull(network);
    }

    public IslandDecomposition orthogonalize(DenseMatrix matrix, VariableCategories categories) {
        DenseMatrix orthogonalized = MatrixUtil.copy(matrix);
        Map<VariableCategory, List<List<Integer>>> islands = new EnumMap<>(VariableCategory.class);
        for (VariableCategory category : ISLAND_CATEGORIES) {
            List<Integer> variables = categories.get(category);
            if (variables.size() > 1) {
                List<double[]> vectors = new ArrayList<>();
                for (int variable : variables) {
                    vectors.add(MatrixUtil.getColumn(matrix, variable - 1));
                }
                vectors.sort(Comparator.comparingLong(IslandOrthogonalizer::countOnes));
                for (int i = 1; i < vectors.size(); i++) {
                    double[] vi = vectors.get(i);
                    for (int j = i - 1; j >= 0; j--) {
                        double[] vj = vectors.get(j);
                        if (MatrixUtil.dot(vi, vj) != 0) {
                            for (int k = 0; k < vi.length; k++) {
                                vi[k] -= vj[k];
                            }
                        }
                    }
                }
                // sorted vectors are written back in variable order
                for (int i = 0; i < variables.size(); i++) {
                    double[] vector = vectors.get(i);
                    for (int k = 0; k < vector.length; k++) {
                        orthogonalized.set(k, variables.get(i) - 1, vector[k]);
                    }
                }
            }

            List<List<Integer>> categoryIslands = new ArrayList<>();
            Set<Integer> complement = new TreeSet<>();
            network.getAllNodes().stream().map(Node::getIndex).forEach(complement::add);
            for (int variable : variables) {
                List<Integer> island = new ArrayList<>();
                double[] column = MatrixUtil.getColumn(orthogonalized, variable - 1);
                for (int k = 0; k < column.length; k++) {
                    if (column[k] == 1) {
                        island.add(k + 1);
                    }
                }
                complement.removeAll(island);
                categoryIslands.add(island);
            }
            if (!variables.isEmpty()) {
                categoryIslands.add(0, new ArrayList<>(complement));
            }
            islands.put(category, categoryIslands);
        }
        return new IslandDecomposition(orthogonalized, islands);
    }

    private static long countOnes(double[] vector) {
        return Arrays.stream(vector).filter(v -> v == 1).count();
    }
}
