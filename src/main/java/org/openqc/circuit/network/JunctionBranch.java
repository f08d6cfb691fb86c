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
import java.util.Optional;

/**
 * Josephson junction with its own charging energy. A doubled junction carries a {@code cos(2 * phase)} potential.
 *
 * @author open-qcircuit contributors
 */
public class JunctionBranch extends Branch {

    private final BranchParameter josephsonEnergy;

    private final BranchParameter chargingEnergy;

    private final boolean doubled;

    public JunctionBranch(String id, Node node1, Node node2, BranchParameter josephsonEnergy, BranchParameter chargingEnergy,
                          boolean doubled) {
        super(id, node1, node2);
        this.josephsonEnergy = Objects.requireNonNull(josephsonEnergy);
        this.chargingEnergy = Objects.requireNonNull(chargingEnergy);
        this.doubled = doubled;
    }

    @Override
    public BranchType getType() {
        return doubled ? BranchType.DOUBLE_JUNCTION : BranchType.JUNCTION;
    }

    public BranchParameter getJosephsonEnergy() {
        return josephsonEnergy;
    }

    public boolean isDoubled() {
        return doubled;
    }

    @Override
    public List<BranchParameter> getParameters() {
        return List.of(josephsonEnergy, chargingEnergy);
    }

    @Override
    public Optional<BranchParameter> getChargingEnergy() {
        return Optional.of(chargingEnergy);
    }
}
