/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

/**
 * Vectors used to complete the identified modes into a full basis.
 *
 * @author open-qcircuit contributors
 */
public enum BasisCompletion {
    /**
     * The all-ones vector followed by 0/1 vectors with all but two entries set.
     */
    HEURISTIC,
    /**
     * Identity vectors.
     */
    CANONICAL
}
