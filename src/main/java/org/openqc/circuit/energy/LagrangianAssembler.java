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
import org.openqc.circuit.equations.Cosine;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.equations.SymbolicMatrix;
import org.openqc.circuit.network.*;
import org.openqc.circuit.transformation.VariableCategories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.openqc.circuit.util.Markers.PERFORMANCE_MARKER;

/**
 * Assembles the circuit Lagrangian from branch energies:
 * <ul>
 *     <li>kinetic {@code 1/2 v^T C v} from the capacitance matrix,</li>
 *     <li>inductors {@code 1/2 EL (φb - φa + Φext)^2},</li>
 *     <li>junctions {@code -EJ cos(φb - φa + Φext)}, doubled junctions {@code -EJ cos(2 (φb - φa + Φext))}.</li>
 * </ul>
 * The potential is rewritten in transformed variables and every frozen variable is replaced by the solution of
 * its stationarity condition.
 *
 * @author open-qcircuit contributors
 */
public class LagrangianAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(LagrangianAssembler.class);

    public static final double EPSILON = 1e-10;

    private final CircuitNetwork network;

    private final DenseMatrix transformationMatrix;

    private final VariableCategories categories;

    private final List<Expression> branchFluxes;

    /**
     * @param branchFluxes external flux carried by each branch, indexed by branch position
     */
    public LagrangianAssembler(CircuitNetwork network, DenseMatrix transformationMatrix, VariableCategories categories,
                               List<Expression> branchFluxes) {
        this.network = Objects.requireNonNull(network);
        this.transformationMatrix = Objects.requireNonNull(transformationMatrix);
        this.categories = Objects.requireNonNull(categories);
        this.branchFluxes = Objects.requireNonNull(branchFluxes);
        if (branchFluxes.size() != network.getBranches().size()) {
            throw new IllegalArgumentException("Expected one flux per branch");
        }
    }

    public Lagrangian assemble() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        int n = network.getNodeCount();
        SymbolicMatrix capacitance = CircuitMatrices.capacitance(network, false);

        List<Expression> nodeVelocities = new ArrayList<>(n);
        List<Expression> velocities = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            nodeVelocities.add(EnergySymbols.nodeVelocity(i).toExpression());
            velocities.add(EnergySymbols.velocity(i).toExpression());
        }
        Expression nodeKinetic = capacitance.quadraticForm(nodeVelocities).multiply(0.5).clean(EPSILON);
        Expression kinetic = capacitance.congruence(transformationMatrix).quadraticForm(velocities).multiply(0.5).clean(EPSILON);

        Expression nodePotential = buildNodePotential();
        Expression potential = nodePotential.substitute(nodeToVariables()).clean(EPSILON);
        for (int frozen : categories.getFrozen()) {
            Symbol variable = EnergySymbols.variable(frozen);
            Expression stationarity = potential.derivative(variable).clean(EPSILON);
            if (stationarity.isZero()) {
                LOGGER.debug("Frozen variable {} does not appear in the potential", variable);
                continue;
            }
            Expression solution = stationarity.solveLinear(variable).clean(EPSILON);
            LOGGER.debug("Frozen variable {} eliminated: {} = {}", variable, variable, solution);
            potential = potential.substitute(variable, solution).clean(EPSILON);
        }

        Lagrangian lagrangian = new Lagrangian(kinetic.subtract(potential), potential,
                nodeKinetic.subtract(nodePotential), nodePotential);
        LOGGER.debug(PERFORMANCE_MARKER, "Lagrangian assembled in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return lagrangian;
    }

    private Map<Symbol, Expression> nodeToVariables() {
        Map<Symbol, Expression> substitutions = new HashMap<>();
        int n = network.getNodeCount();
        for (int i = 0; i < n; i++) {
            Expression value = Expression.ZERO;
            for (int j = 0; j < n; j++) {
                double tij = transformationMatrix.get(i, j);
                if (tij != 0) {
                    value = value.add(EnergySymbols.variable(j + 1).toExpression().multiply(tij));
                }
            }
            substitutions.put(EnergySymbols.nodeFlux(i + 1), value);
        }
        return substitutions;
    }

    private static Expression flux(Node node) {
        return node.isGround() ? Expression.ZERO : EnergySymbols.nodeFlux(node.getIndex()).toExpression();
    }

    private Expression buildNodePotential() {
        Expression potential = Expression.ZERO;
        List<Branch> branches = network.getBranches();
        for (int b = 0; b < branches.size(); b++) {
            Branch branch = branches.get(b);
            Expression drop = flux(branch.getNode2()).subtract(flux(branch.getNode1())).add(branchFluxes.get(b));
            if (branch instanceof InductiveBranch inductor) {
                potential = potential.add(inductor.getInductiveEnergy().toExpression().multiply(drop.pow(2)).multiply(0.5));
            } else if (branch instanceof JunctionBranch junction) {
                Expression argument = junction.isDoubled() ? drop.multiply(2) : drop;
                potential = potential.subtract(junction.getJosephsonEnergy().toExpression().multiply(Cosine.of(argument)));
            }
        }
        return potential;
    }
}
