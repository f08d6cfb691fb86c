/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.flux;

import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.BranchType;
import org.openqc.circuit.network.CircuitNetwork;

import java.util.ArrayList;
import java.util.List;

/**
 * External flux symbols {@code Φ1..ΦK}, one per non-capacitive closure branch.
 *
 * @author open-qcircuit contributors
 */
public final class ClosureFluxes {

    public static final String FLUX_PREFIX = "Φ";

    private static final ClosureFluxes NONE = new ClosureFluxes(List.of());

    private final List<Branch> closureBranches;

    private final List<Symbol> fluxes;

    private ClosureFluxes(List<Branch> closureBranches) {
        this.closureBranches = List.copyOf(closureBranches);
        List<Symbol> symbols = new ArrayList<>(closureBranches.size());
        for (int k = 1; k <= closureBranches.size(); k++) {
            symbols.add(Symbol.indexed(FLUX_PREFIX, k));
        }
        this.fluxes = List.copyOf(symbols);
    }

    public static ClosureFluxes none() {
        return NONE;
    }

    /**
     * Capacitive branches never carry an external flux and are dropped.
     */
    public static ClosureFluxes of(List<Branch> closureBranches) {
        return new ClosureFluxes(closureBranches.stream().filter(b -> b.getType() != BranchType.CAPACITOR).toList());
    }

    public List<Branch> getClosureBranches() {
        return closureBranches;
    }

    public List<Symbol> getFluxes() {
        return fluxes;
    }

    public boolean isEmpty() {
        return closureBranches.isEmpty();
    }

    /**
     * Each closure branch carries the whole flux of its loop, other branches none. Indexed by branch position.
     */
    public List<Expression> staticAllocation(CircuitNetwork network) {
        List<Expression> allocation = new ArrayList<>(network.getBranches().size());
        for (Branch branch : network.getBranches()) {
            int k = indexOf(branch);
            allocation.add(k >= 0 ? fluxes.get(k).toExpression() : Expression.ZERO);
        }
        return allocation;
    }

    int indexOf(Branch branch) {
        for (int k = 0; k < closureBranches.size(); k++) {
            if (closureBranches.get(k).getId().equals(branch.getId())) {
                return k;
            }
        }
        return -1;
    }
}
