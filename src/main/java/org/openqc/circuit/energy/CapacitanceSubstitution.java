/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.energy;

import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Reciprocal;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.BranchParameter;
import org.openqc.circuit.network.CircuitNetwork;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites symbolic charging energies {@code EC} as {@code 1 / (8 Ck)}, k numbering the distinct symbolic charging
 * energies of non-shorted branches in branch order.
 *
 * @author open-qcircuit contributors
 */
public final class CapacitanceSubstitution {

    private CapacitanceSubstitution() {
    }

    public static Map<Symbol, Expression> create(CircuitNetwork network) {
        List<Symbol> chargingEnergies = new ArrayList<>();
        for (Branch branch : network.getBranches()) {
            if (!branch.isShorted()) {
                branch.getChargingEnergy()
                        .flatMap(BranchParameter::getSymbol)
                        .filter(symbol -> !chargingEnergies.contains(symbol))
                        .ifPresent(chargingEnergies::add);
            }
        }
        Map<Symbol, Expression> substitutions = new LinkedHashMap<>();
        for (int k = 0; k < chargingEnergies.size(); k++) {
            substitutions.put(chargingEnergies.get(k), Reciprocal.of(EnergySymbols.capacitance(k + 1).toExpression().multiply(8)));
        }
        return substitutions;
    }
}
