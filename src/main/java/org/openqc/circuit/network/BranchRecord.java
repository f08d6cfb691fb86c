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
 * Raw description of a branch as provided to {@link CircuitNetwork#create}.
 *
 * @author open-qcircuit contributors
 */
public record BranchRecord(BranchType type, int node1, int node2, List<BranchParameter> parameters) {

    public BranchRecord {
        Objects.requireNonNull(type);
        parameters = List.copyOf(parameters);
    }

    public static BranchRecord capacitor(int node1, int node2, BranchParameter chargingEnergy) {
        return new BranchRecord(BranchType.CAPACITOR, node1, node2, List.of(chargingEnergy));
    }

    public static BranchRecord inductor(int node1, int node2, BranchParameter inductiveEnergy) {
        return new BranchRecord(BranchType.INDUCTOR, node1, node2, List.of(inductiveEnergy));
    }

    public static BranchRecord junction(int node1, int node2, BranchParameter josephsonEnergy, BranchParameter chargingEnergy) {
        return new BranchRecord(BranchType.JUNCTION, node1, node2, List.of(josephsonEnergy, chargingEnergy));
    }

    public static BranchRecord doubleJunction(int node1, int node2, BranchParameter josephsonEnergy, BranchParameter chargingEnergy) {
        return new BranchRecord(BranchType.DOUBLE_JUNCTION, node1, node2, List.of(josephsonEnergy, chargingEnergy));
    }
}
