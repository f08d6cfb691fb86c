/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.energy;

import org.junit.jupiter.api.Test;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Monomial;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.network.CircuitFixtures;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.transformation.BasisCompletion;
import org.openqc.circuit.transformation.TransformationMatrixBuilder;
import org.openqc.circuit.transformation.VariableTransformation;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.openqc.circuit.energy.EnergySymbols.*;

/**
 * @author open-qcircuit contributors
 */
class HamiltonianAssemblerTest {

    private static final double DELTA = 1e-9;

    private static Monomial product(Symbol a, Symbol b) {
        return a.toExpression().multiply(b.toExpression()).getTerms().keySet().iterator().next();
    }

    private static HamiltonianAssembler createAssembler(CircuitNetwork network) {
        VariableTransformation transformation = new TransformationMatrixBuilder(network, BasisCompletion.HEURISTIC).build(true);
        List<Expression> fluxes = Collections.nCopies(network.getBranches().size(), Expression.ZERO);
        Lagrangian lagrangian = new LagrangianAssembler(network, transformation.matrix(), transformation.categories(), fluxes)
                .assemble();
        return new HamiltonianAssembler(network, transformation.matrix(), transformation.categories(), lagrangian.potential());
    }

    @Test
    void testTransmon() {
        Expression hamiltonian = createAssembler(CircuitFixtures.transmon()).assemble(false);
        assertEquals(0.5 / 0.875, hamiltonian.getCoefficient(Monomial.of(chargeNumber(1), 2)), DELTA);
        assertEquals(1 / 0.875, hamiltonian.getCoefficient(product(chargeNumber(1), offsetCharge(1))), DELTA);
        assertFalse(hamiltonian.contains(charge(1)));
        assertFalse(hamiltonian.contains(charge(2)));
        assertEquals(0.5 / 0.875 - 10, hamiltonian.evaluate(Map.of(chargeNumber(1), 1.0, offsetCharge(1), 0.0, variable(1), 0.0)), DELTA);
    }

    @Test
    void testFrozenVariablesHaveNoCharge() {
        Expression hamiltonian = createAssembler(CircuitFixtures.fluxQubit()).assemble(false);
        assertEquals(2, hamiltonian.getCoefficient(Monomial.of(chargeNumber(1), 2)), DELTA);
        assertEquals(-4, hamiltonian.getCoefficient(product(chargeNumber(1), charge(2))), DELTA);
        assertEquals(4, hamiltonian.getCoefficient(Monomial.of(charge(2), 2)), DELTA);
        assertFalse(hamiltonian.contains(charge(3)));
        assertFalse(hamiltonian.contains(variable(3)));
    }

    @Test
    void testSymbolicInversion() {
        CircuitNetwork network = CircuitFixtures.symbolicTransmon();
        HamiltonianAssembler assembler = createAssembler(network);
        Map<Symbol, Double> values = Map.of(chargeNumber(1), 1.0, offsetCharge(1), 0.0, variable(1), 0.0,
                Symbol.of("EC"), 0.2, Symbol.of("ECJ"), 0.5, Symbol.of("EJ"), 10.0);

        Expression symbolic = assembler.assemble(false);
        assertTrue(symbolic.contains(Symbol.of("EC")));
        assertEquals(0.5 / 0.875 - 10, symbolic.evaluate(values), DELTA);

        Expression substituted = assembler.assemble(true);
        assertFalse(substituted.contains(Symbol.of("EC")));
        assertTrue(substituted.contains(Symbol.of("EJ")));
        assertEquals(0.5 / 0.875 - 10, substituted.evaluate(values), DELTA);
    }

    @Test
    void testCapacitanceSubstitution() {
        Map<Symbol, Expression> substitutions = CapacitanceSubstitution.create(CircuitFixtures.symbolicTransmon());
        assertEquals(List.of(Symbol.of("EC"), Symbol.of("ECJ")), List.copyOf(substitutions.keySet()));
        assertEquals(Expression.of(Monomial.of(capacitance(1), -1), 0.125), substitutions.get(Symbol.of("EC")));
        assertEquals(Expression.of(Monomial.of(capacitance(2), -1), 0.125), substitutions.get(Symbol.of("ECJ")));
        assertTrue(CapacitanceSubstitution.create(CircuitFixtures.transmon()).isEmpty());
    }
}
