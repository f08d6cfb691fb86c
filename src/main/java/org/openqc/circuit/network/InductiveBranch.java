/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import java.util.List;
import java.util.Objects;

/**
 * @author open-qcircuit contributors
 */
public class InductiveBranch extends Branch {

    private final BranchParameter inductiveEnergy;

    public InductiveBranch(String id, Node node1, Node node2, BranchParameter inductiveEnergy) {
        super(id, node1, node2);
        this.inductiveEnergy = Objects.requireNonNull(inductiveEnergy);
    }

    @Override
    public BranchType getType() {
        return BranchType.INDUCTOR;
    }

    public BranchParameter getInductiveEnergy() {
        return inductiveEnergy;
    }

    @Override
    public List<BranchParameter> getParameters() {
        return List.of(inductiveEnergy);
    }
}
