/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.energy;

import com.google.common.base.Stopwatch;
import com.powsybl.math.matrix.DenseMatrix;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.equations.SymbolicMatrix;
import org.openqc.circuit.network.CircuitMatrices;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.transformation.VariableCategories;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.openqc.circuit.util.Markers.PERFORMANCE_MARKER;

/**
 * Legendre transform of the Lagrangian: {@code H = 1/2 Q^T Cθ^-1 Q + V(θ)} where {@code Cθ} is the transformed
 * capacitance matrix restricted to the leading non-frozen variables. Free charges are conserved and set to zero;
 * the charge of a periodic variable i becomes {@code ni + ngi}.
 *
 * @author open-qcircuit contributors
 */
public class HamiltonianAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(HamiltonianAssembler.class);

    private final CircuitNetwork network;

    private final DenseMatrix transformationMatrix;

    private final VariableCategories categories;

    private final Expression potential;

    public HamiltonianAssembler(CircuitNetwork network, DenseMatrix transformationMatrix, VariableCategories categories,
                                Expression potential) {
        this.network = Objects.requireNonNull(network);
        this.transformationMatrix = Objects.requireNonNull(transformationMatrix);
        this.categories = Objects.requireNonNull(categories);
        this.potential = Objects.requireNonNull(potential);
    }

    public Expression assemble(boolean substituteParameters) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        int n = network.getNodeCount();
        int frozenCount = categories.getFrozen().size() + (network.isGrounded() ? 0 : 1);
        int m = n - frozenCount;

        Expression kinetic = Expression.ZERO;
        if (m > 0) {
            boolean symbolic = network.hasSymbolicParameters() && !substituteParameters;
            SymbolicMatrix transformed = CircuitMatrices.capacitance(network, !symbolic)
                    .congruence(transformationMatrix)
                    .block(0, 0, m, m);
            SymbolicMatrix inverse;
            if (transformed.isConstant()) {
                inverse = SymbolicMatrix.of(MatrixUtil.inverse(transformed.toDenseMatrix()));
            } else {
                inverse = transformed.map(e -> e.clean(LagrangianAssembler.EPSILON)).inverse();
            }
            List<Expression> charges = new ArrayList<>(m);
            for (int i = 1; i <= m; i++) {
                charges.add(categories.getFree().contains(i) ? Expression.ZERO : EnergySymbols.charge(i).toExpression());
            }
            kinetic = inverse.quadraticForm(charges).multiply(0.5);
        }

        Map<Symbol, Expression> offsetCharges = new HashMap<>();
        for (int periodic : categories.getPeriodic()) {
            offsetCharges.put(EnergySymbols.charge(periodic),
                    EnergySymbols.chargeNumber(periodic).toExpression().add(EnergySymbols.offsetCharge(periodic).toExpression()));
        }
        Expression hamiltonian = kinetic.add(potential).substitute(offsetCharges).clean(LagrangianAssembler.EPSILON);
        LOGGER.debug(PERFORMANCE_MARKER, "Hamiltonian assembled in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return hamiltonian;
    }
}
