/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.google.common.base.Stopwatch;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static org.openqc.circuit.util.Markers.PERFORMANCE_MARKER;

/**
 * Builds a variable transformation whose columns are, in order, the periodic, extended, free and frozen modes
 * of the circuit, followed by the all-ones mode when the circuit is not grounded.
 *
 * @author open-qcircuit contributors
 */
public class TransformationMatrixBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationMatrixBuilder.class);

    private final CircuitNetwork network;

    private final BasisCompletion basisCompletion;

    public TransformationMatrixBuilder(CircuitNetwork network, BasisCompletion basisCompletion) {
        this.network = Objects.requireNonNull(network);
        this.basisCompletion = Objects.requireNonNull(basisCompletion);
    }

    public VariableTransformation build(boolean identifyLcVariables) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        int n = network.getNodeCount();
        ModeCandidates candidates = ModeCandidates.find(network, identifyLcVariables, -1, 1);

        List<double[]> identified = new ArrayList<>();
        identified.addAll(candidates.frozen());
        identified.addAll(candidates.free());
        identified.addAll(candidates.periodic());
        identified.addAll(candidates.lc());
        List<double[]> basis = new ArrayList<>();
        for (double[] mode : identified) {
            if (MatrixUtil.rank(concat(basis, mode)) == basis.size() + 1) {
                basis.add(mode);
            }
        }

        for (double[] vector : standardBasis(n)) {
            if (MatrixUtil.rank(concat(basis, vector)) == basis.size() + 1) {
                basis.add(vector);
            }
        }

        List<Integer> sigmaPositions = new ArrayList<>();
        List<Integer> freePositions = new ArrayList<>();
        List<Integer> periodicPositions = new ArrayList<>();
        List<Integer> frozenPositions = new ArrayList<>();
        List<Integer> restPositions = new ArrayList<>();
        for (int i = 0; i < basis.size(); i++) {
            double[] vector = basis.get(i);
            if (!network.isGrounded() && ModeCandidates.containsExactly(List.of(candidates.sigma()), vector)) {
                sigmaPositions.add(i);
            } else if (ModeCandidates.containsExactly(candidates.free(), vector)) {
                freePositions.add(i);
            } else if (ModeCandidates.containsExactly(candidates.periodic(), vector)) {
                periodicPositions.add(i);
            } else if (ModeCandidates.containsExactly(candidates.frozen(), vector)) {
                frozenPositions.add(i);
            } else {
                restPositions.add(i);
            }
        }

        List<double[]> columns = new ArrayList<>(basis.size());
        VariableCategories categories = new VariableCategories();
        appendColumns(basis, periodicPositions, VariableCategory.PERIODIC, columns, categories);
        appendColumns(basis, restPositions, VariableCategory.EXTENDED, columns, categories);
        appendColumns(basis, freePositions, VariableCategory.FREE, columns, categories);
        appendColumns(basis, frozenPositions, VariableCategory.FROZEN, columns, categories);
        appendColumns(basis, sigmaPositions, null, columns, categories);

        VariableTransformation transformation = new VariableTransformation(MatrixUtil.fromColumns(columns, n), categories);
        LOGGER.info("Variable transformation of {} variables built: {}", n, categories);
        LOGGER.debug(PERFORMANCE_MARKER, "Variable transformation built in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return transformation;
    }

    private static void appendColumns(List<double[]> basis, List<Integer> positions, VariableCategory category,
                                      List<double[]> columns, VariableCategories categories) {
        for (int position : positions) {
            columns.add(basis.get(position));
            if (category != null) {
                categories.add(category, columns.size());
            }
        }
    }

    private static List<double[]> concat(List<double[]> vectors, double[] vector) {
        List<double[]> all = new ArrayList<>(vectors);
        all.add(vector);
        return all;
    }

    List<double[]> standardBasis(int n) {
        List<double[]> standard = new ArrayList<>();
        if (basisCompletion == BasisCompletion.CANONICAL) {
            for (int i = 0; i < n; i++) {
                double[] unit = new double[n];
                unit[i] = 1;
                standard.add(unit);
            }
            return standard;
        }
        if (n == 0) {
            return standard;
        }
        double[] ones = new double[n];
        Arrays.fill(ones, 1);
        standard.add(ones);
        int oneCount = n > 2 ? n - 2 : n - 1;
        int[] positions = new int[oneCount];
        for (int i = 0; i < oneCount; i++) {
            positions[i] = i;
        }
        // combinations of positions holding a one, in lexicographic order
        while (MatrixUtil.rank(standard) < n) {
            double[] vector = new double[n];
            for (int p : positions) {
                vector[p] = 1;
            }
            if (MatrixUtil.rank(concat(standard, vector)) == standard.size() + 1) {
                standard.add(vector);
            }
            if (!nextCombination(positions, n)) {
                break;
            }
        }
        return standard;
    }

    private static boolean nextCombination(int[] positions, int n) {
        int k = positions.length;
        int i = k - 1;
        while (i >= 0 && positions[i] == n - k + i) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        positions[i]++;
        for (int j = i + 1; j < k; j++) {
            positions[j] = positions[j - 1] + 1;
        }
        return true;
    }
}
