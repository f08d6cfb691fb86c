/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import com.powsybl.commons.PowsyblException;

/**
 * Kinds of two-terminal circuit elements.
 *
 * @author open-qcircuit contributors
 */
public enum BranchType {
    CAPACITOR("C", 1),
    INDUCTOR("L", 1),
    JUNCTION("JJ", 2),
    DOUBLE_JUNCTION("JJ2", 2);

    private final String code;

    private final int parameterCount;

    BranchType(String code, int parameterCount) {
        this.code = code;
        this.parameterCount = parameterCount;
    }

    public String getCode() {
        return code;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public boolean isJunction() {
        return this == JUNCTION || this == DOUBLE_JUNCTION;
    }

    public boolean isInductive() {
        return this != CAPACITOR;
    }

    public boolean isCapacitive() {
        return this != INDUCTOR;
    }

    public static BranchType fromCode(String code) {
        for (BranchType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new PowsyblException("Unknown branch type '" + code + "'");
    }
}
