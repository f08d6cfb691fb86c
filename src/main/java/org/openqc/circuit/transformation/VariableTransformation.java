/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.math.matrix.DenseMatrix;

import java.util.Objects;

/**
 * Node-to-variable transformation: column j of the matrix gives the node coordinates of variable j + 1.
 *
 * @author open-qcircuit contributors
 */
public record VariableTransformation(DenseMatrix matrix, VariableCategories categories) {

    public VariableTransformation {
        Objects.requireNonNull(matrix);
        Objects.requireNonNull(categories);
    }
}
