/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static org.openqc.circuit.util.Markers.CLASSIFICATION_MARKER;

/**
 * Classifies the columns of a user supplied transformation matrix and reports, as warnings, categories for which
 * the circuit has more modes than the matrix exposes.
 *
 * @author open-qcircuit contributors
 */
public class TransformationMatrixChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationMatrixChecker.class);

    private static final VariableCategory[] REPORT_ORDER = {
        VariableCategory.PERIODIC, VariableCategory.EXTENDED, VariableCategory.FREE, VariableCategory.FROZEN
    };

    private final CircuitNetwork network;

    public TransformationMatrixChecker(CircuitNetwork network) {
        this.network = Objects.requireNonNull(network);
    }

    public VariableCategories check(DenseMatrix matrix, boolean warningsEnabled) {
        Objects.requireNonNull(matrix);
        int n = network.getNodeCount();
        if (matrix.getRowCount() != n || matrix.getColumnCount() != n) {
            throw new PowsyblException("Transformation matrix must be " + n + "x" + n + ", got "
                    + matrix.getRowCount() + "x" + matrix.getColumnCount());
        }
        if (MatrixUtil.rank(matrix) < n) {
            throw new PowsyblException("The transformation matrix provided is not invertible");
        }

        ModeCandidates candidates = ModeCandidates.find(network, true, 1, 0);
        List<double[]> modes = new ArrayList<>();
        List<double[]> identified = new ArrayList<>();
        identified.addAll(candidates.frozen());
        identified.addAll(candidates.free());
        identified.addAll(candidates.periodic());
        identified.addAll(candidates.lc());
        for (double[] mode : identified) {
            if (!MatrixUtil.inSubspace(mode, modes)) {
                modes.add(mode);
            }
        }

        VariableCategories circuitCategories = classify(modes, candidates);
        VariableCategories userCategories = classify(MatrixUtil.getColumns(matrix), candidates);

        if (warningsEnabled) {
            for (VariableCategory category : REPORT_ORDER) {
                int extra = circuitCategories.get(category).size() - userCategories.get(category).size();
                if (extra > 0) {
                    LOGGER.warn(CLASSIFICATION_MARKER, "Number of extra {} modes found: {}", category.getLabel(), extra);
                }
            }
        }
        return userCategories;
    }

    private VariableCategories classify(List<double[]> modes, ModeCandidates candidates) {
        VariableCategories categories = new VariableCategories();
        for (int i = 0; i < modes.size(); i++) {
            double[] mode = modes.get(i);
            if (!network.isGrounded() && MatrixUtil.inSubspace(candidates.sigma(), List.of(mode))) {
                continue;
            }
            VariableCategory category;
            if (MatrixUtil.inSubspace(mode, candidates.frozen())) {
                category = VariableCategory.FROZEN;
            } else if (MatrixUtil.inSubspace(mode, candidates.free())) {
                category = VariableCategory.FREE;
            } else if (MatrixUtil.inSubspace(mode, candidates.periodic())) {
                category = VariableCategory.PERIODIC;
            } else {
                category = VariableCategory.EXTENDED;
            }
            categories.add(category, i + 1);
        }
        return categories;
    }
}
