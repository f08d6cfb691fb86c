/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

/**
 * Classification of a transformed variable.
 *
 * @author open-qcircuit contributors
 */
public enum VariableCategory {
    /**
     * Compact variable, appears only through junction cosines.
     */
    PERIODIC("periodic"),
    EXTENDED("extended"),
    /**
     * Cyclic variable with no potential energy, its charge is conserved.
     */
    FREE("free"),
    /**
     * Variable with no kinetic energy, eliminated by its stationarity condition.
     */
    FROZEN("frozen");

    private final String label;

    VariableCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
