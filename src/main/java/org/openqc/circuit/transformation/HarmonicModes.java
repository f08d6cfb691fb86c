/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.math.matrix.DenseMatrix;

/**
 * Normal modes of a circuit without junctions.
 *
 * @param frequencies square roots of the finite non-zero generalized eigenvalues, ascending
 * @param transformationMatrix transformation whose leading columns are the normal mode vectors
 *
 * @author open-qcircuit contributors
 */
public record HarmonicModes(double[] frequencies, DenseMatrix transformationMatrix) {
}
