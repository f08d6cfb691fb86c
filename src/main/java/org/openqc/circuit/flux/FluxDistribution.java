/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.flux;

import com.powsybl.math.matrix.DenseMatrix;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.graph.SpanningTree;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.network.Node;
import org.openqc.circuit.network.SymbolicParameters;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Spreads each external flux over the branches of its loop so that no node charge is induced by a flux change
 * ({@code W^T C x = 0}) while the fluxes around every loop add up to the loop flux ({@code R^T x = Φ}). The
 * minimum norm solution is taken through a pseudo-inverse.
 *
 * @author open-qcircuit contributors
 */
public class FluxDistribution {

    private static final Logger LOGGER = LoggerFactory.getLogger(FluxDistribution.class);

    public static final int ROUNDING_DIGITS = 10;

    private final CircuitNetwork network;

    private final SpanningTree spanningTree;

    private final ClosureFluxes closureFluxes;

    public FluxDistribution(CircuitNetwork network, SpanningTree spanningTree, ClosureFluxes closureFluxes) {
        this.network = Objects.requireNonNull(network);
        this.spanningTree = Objects.requireNonNull(spanningTree);
        this.closureFluxes = Objects.requireNonNull(closureFluxes);
    }

    /**
     * Loop incidence matrix: entry (b, k) is +1 or -1 when branch b is walked forward or backward around loop k,
     * the closure branch of the loop being walked forward.
     */
    public DenseMatrix buildLoopMatrix() {
        List<Branch> branches = network.getBranches();
        List<Branch> closureBranches = closureFluxes.getClosureBranches();
        DenseMatrix r = new DenseMatrix(branches.size(), closureBranches.size());
        for (int k = 0; k < closureBranches.size(); k++) {
            Branch closureBranch = closureBranches.get(k);
            List<Branch> loop = spanningTree.findLoop(closureBranch);
            double[] signs = new double[loop.size()];
            // the walk leaves the first branch through its first node
            int current = loop.get(0).getNode1().getIndex();
            signs[0] = -1;
            double closureSign = loop.get(0).getId().equals(closureBranch.getId()) ? -1 : 0;
            for (int i = 1; i < loop.size(); i++) {
                Branch branch = loop.get(i);
                if (branch.getNode1().getIndex() == current) {
                    signs[i] = 1;
                    current = branch.getNode2().getIndex();
                } else {
                    signs[i] = -1;
                    current = branch.getNode1().getIndex();
                }
                if (branch.getId().equals(closureBranch.getId())) {
                    closureSign = signs[i];
                }
            }
            for (int i = 0; i < loop.size(); i++) {
                r.set(network.getBranchPosition(loop.get(i)), k, signs[i] * closureSign);
            }
        }
        return r;
    }

    /**
     * Flux allocation matrix, branches by closure branches, rounded to {@value #ROUNDING_DIGITS} digits.
     */
    public DenseMatrix computeAllocationMatrix() {
        List<Branch> branches = network.getBranches();
        int branchCount = branches.size();
        int nodeCount = network.getNodeCount();
        int loopCount = closureFluxes.getClosureBranches().size();
        SymbolicParameters parameters = network.getSymbolicParameters();

        DenseMatrix r = buildLoopMatrix();
        double[] inverseCapacitance = new double[branchCount];
        DenseMatrix w = new DenseMatrix(branchCount, nodeCount);
        for (int b = 0; b < branchCount; b++) {
            Branch branch = branches.get(b);
            Optional<Double> ec = branch.getChargingEnergy().map(p -> p.getValue(parameters));
            inverseCapacitance[b] = ec.map(value -> 1 / (8 * value)).orElse(0.0);
            setIncidence(w, b, branch.getNode1(), 1);
            setIncidence(w, b, branch.getNode2(), -1);
        }

        DenseMatrix m = new DenseMatrix(nodeCount + loopCount, branchCount);
        for (int b = 0; b < branchCount; b++) {
            for (int i = 0; i < nodeCount; i++) {
                m.set(i, b, w.get(b, i) * inverseCapacitance[b]);
            }
            for (int k = 0; k < loopCount; k++) {
                m.set(nodeCount + k, b, r.get(b, k));
            }
        }
        DenseMatrix target = new DenseMatrix(nodeCount + loopCount, loopCount);
        for (int k = 0; k < loopCount; k++) {
            target.set(nodeCount + k, k, 1);
        }
        DenseMatrix allocation = MatrixUtil.pseudoInverse(m).times(target);
        MatrixUtil.round(allocation, ROUNDING_DIGITS);
        return allocation;
    }

    private static void setIncidence(DenseMatrix w, int branchIndex, Node node, double value) {
        if (!node.isGround()) {
            w.set(branchIndex, node.getIndex() - 1, value);
        }
    }

    /**
     * External flux expression carried by each branch, indexed by branch position.
     */
    public List<Expression> distribute() {
        int branchCount = network.getBranches().size();
        List<Expression> allocation = new ArrayList<>(branchCount);
        if (closureFluxes.isEmpty()) {
            for (int b = 0; b < branchCount; b++) {
                allocation.add(Expression.ZERO);
            }
            return allocation;
        }
        DenseMatrix matrix = computeAllocationMatrix();
        for (int b = 0; b < branchCount; b++) {
            Expression flux = Expression.ZERO;
            for (int k = 0; k < matrix.getColumnCount(); k++) {
                flux = flux.add(closureFluxes.getFluxes().get(k).toExpression().multiply(matrix.get(b, k)));
            }
            allocation.add(flux);
        }
        LOGGER.debug("Flux allocation over {} branches for {} loops: {}", branchCount, matrix.getColumnCount(), allocation);
        return allocation;
    }
}
