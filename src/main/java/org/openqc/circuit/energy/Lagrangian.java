/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.energy;

import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;

import java.util.Map;
import java.util.Objects;

/**
 * Lagrangian and potential energy, in transformed variables {@code θi, vθi} with frozen variables eliminated, and
 * in node variables {@code φi, vφi}.
 *
 * @author open-qcircuit contributors
 */
public record Lagrangian(Expression lagrangian, Expression potential, Expression nodeLagrangian, Expression nodePotential) {

    public Lagrangian {
        Objects.requireNonNull(lagrangian);
        Objects.requireNonNull(potential);
        Objects.requireNonNull(nodeLagrangian);
        Objects.requireNonNull(nodePotential);
    }

    /**
     * Same energies with symbols substituted in both Lagrangians. Potentials are kept.
     */
    public Lagrangian substituteLagrangians(Map<Symbol, Expression> substitutions) {
        return new Lagrangian(lagrangian.substitute(substitutions), potential, nodeLagrangian.substitute(substitutions), nodePotential);
    }
}
