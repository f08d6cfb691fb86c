/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.math.matrix.DenseMatrix;

import java.util.List;
import java.util.Map;

/**
 * Transformation with orthogonalized free, frozen and periodic columns, and for each of these categories the node
 * islands of its variables. The first island of a non-empty category holds the nodes no variable covers.
 *
 * @author open-qcircuit contributors
 */
public record IslandDecomposition(DenseMatrix matrix, Map<VariableCategory, List<List<Integer>>> islands) {
}
