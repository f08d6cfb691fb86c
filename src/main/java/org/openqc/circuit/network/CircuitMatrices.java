/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import com.powsybl.math.matrix.DenseMatrix;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Reciprocal;
import org.openqc.circuit.equations.SymbolicMatrix;

import java.util.Optional;
import java.util.function.Function;

/**
 * Node capacitance and inductance matrices, indexed by non-ground node ({@code index - 1}). A branch of weight w
 * between nodes a and b contributes -w off diagonal and w on both diagonal entries; shorted branches contribute
 * nothing.
 *
 * @author open-qcircuit contributors
 */
public final class CircuitMatrices {

    private CircuitMatrices() {
    }

    /**
     * Capacitance matrix with branch weight {@code 1 / (8 * EC)} for capacitors and junctions.
     */
    public static SymbolicMatrix capacitance(CircuitNetwork network, boolean substituteParameters) {
        SymbolicParameters parameters = network.getSymbolicParameters();
        return laplacian(network, branch -> branch.getChargingEnergy().map(ec -> {
            if (substituteParameters || !ec.isSymbolic()) {
                return Expression.constant(1 / (8 * ec.getValue(parameters)));
            }
            return Reciprocal.of(ec.toExpression().multiply(8));
        }));
    }

    /**
     * Inductance matrix with branch weight {@code EL} for inductors.
     */
    public static SymbolicMatrix inductance(CircuitNetwork network, boolean substituteParameters) {
        SymbolicParameters parameters = network.getSymbolicParameters();
        return laplacian(network, branch -> branch instanceof InductiveBranch inductor
                ? Optional.of(inductor.getInductiveEnergy().toExpression(parameters, substituteParameters))
                : Optional.empty());
    }

    public static DenseMatrix numericCapacitance(CircuitNetwork network) {
        return capacitance(network, true).toDenseMatrix();
    }

    public static DenseMatrix numericInductance(CircuitNetwork network) {
        return inductance(network, true).toDenseMatrix();
    }

    private static SymbolicMatrix laplacian(CircuitNetwork network, Function<Branch, Optional<Expression>> weight) {
        boolean grounded = network.isGrounded();
        int size = network.getNodeCount() + (grounded ? 1 : 0);
        SymbolicMatrix m = new SymbolicMatrix(size, size);
        for (Branch branch : network.getBranches()) {
            if (branch.isShorted()) {
                continue;
            }
            Optional<Expression> w = weight.apply(branch);
            if (w.isPresent()) {
                int a = position(branch.getNode1(), grounded);
                int b = position(branch.getNode2(), grounded);
                m.add(a, b, w.get().negate());
                m.add(b, a, w.get().negate());
            }
        }
        for (int i = 0; i < size; i++) {
            Expression rowSum = Expression.ZERO;
            for (int j = 0; j < size; j++) {
                if (j != i) {
                    rowSum = rowSum.add(m.get(i, j));
                }
            }
            m.set(i, i, rowSum.negate());
        }
        return grounded ? m.withoutRowAndColumn(0) : m;
    }

    private static int position(Node node, boolean grounded) {
        return grounded ? node.getIndex() : node.getIndex() - 1;
    }
}
