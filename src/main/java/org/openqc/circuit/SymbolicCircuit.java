/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.apache.commons.lang3.tuple.Pair;
import org.openqc.circuit.energy.CapacitanceSubstitution;
import org.openqc.circuit.energy.EnergySymbols;
import org.openqc.circuit.energy.HamiltonianAssembler;
import org.openqc.circuit.energy.Lagrangian;
import org.openqc.circuit.energy.LagrangianAssembler;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;
import org.openqc.circuit.flux.ClosureFluxes;
import org.openqc.circuit.flux.FluxDistribution;
import org.openqc.circuit.graph.SpanningTree;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.transformation.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static org.openqc.circuit.util.Markers.PERFORMANCE_MARKER;

/**
 * Entry point of the analysis: from a circuit network, builds the variable transformation, distributes the
 * external fluxes and derives the Lagrangian and the Hamiltonian of the circuit.
 * <p>
 * The Hamiltonian is generated together with the Lagrangian for small circuits only (see
 * {@link CircuitParameters#getSymbolicInversionMaxNodes()}); for larger ones it is computed on first access.
 *
 * @author open-qcircuit contributors
 */
public class SymbolicCircuit {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolicCircuit.class);

    private final CircuitNetwork network;

    private final CircuitParameters parameters;

    private DenseMatrix userTransformationMatrix;

    private List<Branch> userClosureBranches;

    private DenseMatrix transformationMatrix;

    private VariableCategories categories;

    private double[] normalModeFrequencies;

    private SpanningTree spanningTree;

    private ClosureFluxes closureFluxes = ClosureFluxes.none();

    private List<Expression> branchFluxes;

    private List<Symbol> offsetCharges = Collections.emptyList();

    private Lagrangian lagrangian;

    private Expression hamiltonian;

    private IslandDecomposition islandDecomposition;

    public SymbolicCircuit(CircuitNetwork network, CircuitParameters parameters) {
        this.network = Objects.requireNonNull(network);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public static SymbolicCircuit create(CircuitNetwork network) {
        return create(network, new CircuitParameters());
    }

    public static SymbolicCircuit create(CircuitNetwork network, CircuitParameters parameters) {
        SymbolicCircuit circuit = new SymbolicCircuit(network, parameters);
        circuit.configure();
        return circuit;
    }

    public SymbolicCircuit configure() {
        return configure(userTransformationMatrix, userClosureBranches);
    }

    /**
     * Runs the whole analysis.
     *
     * @param transformationMatrix variable transformation to use instead of the generated one, may be null
     * @param closureBranches closure branches carrying the external fluxes instead of the ones of the spanning
     *                        tree, may be null
     */
    public SymbolicCircuit configure(DenseMatrix transformationMatrix, List<Branch> closureBranches) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        this.userTransformationMatrix = transformationMatrix;
        this.userClosureBranches = closureBranches != null ? List.copyOf(closureBranches) : null;

        boolean harmonic = network.isPurelyHarmonic();
        DenseMatrix t = transformationMatrix;
        normalModeFrequencies = null;
        if (harmonic) {
            HarmonicModes modes = new HarmonicTransformation(network, parameters.getBasisCompletion()).compute();
            normalModeFrequencies = modes.frequencies();
            if (t == null) {
                t = modes.transformationMatrix();
            }
        }

        if (t != null) {
            categories = new TransformationMatrixChecker(network)
                    .check(t, parameters.isWarningsEnabled() && !harmonic);
            this.transformationMatrix = t;
        } else {
            VariableTransformation transformation = new TransformationMatrixBuilder(network, parameters.getBasisCompletion())
                    .build(parameters.isIdentifyLcVariables());
            this.transformationMatrix = transformation.matrix();
            categories = transformation.categories();
        }
        islandDecomposition = new IslandOrthogonalizer(network).orthogonalize(this.transformationMatrix, categories);

        spanningTree = SpanningTree.build(network);
        if (harmonic) {
            closureFluxes = ClosureFluxes.none();
        } else if (closureBranches != null) {
            closureFluxes = ClosureFluxes.of(closureBranches);
        } else {
            closureFluxes = ClosureFluxes.of(spanningTree.getClosureBranches());
        }

        if (closureFluxes.isEmpty()) {
            branchFluxes = closureFluxes.staticAllocation(network);
        } else if (parameters.isFluxDynamic()) {
            branchFluxes = new FluxDistribution(network, spanningTree, closureFluxes).distribute();
        } else {
            branchFluxes = closureFluxes.staticAllocation(network);
        }

        List<Symbol> charges = new ArrayList<>(categories.getPeriodic().size());
        for (int p : categories.getPeriodic()) {
            charges.add(EnergySymbols.offsetCharge(p));
        }
        offsetCharges = Collections.unmodifiableList(charges);

        Lagrangian assembled = new LagrangianAssembler(network, this.transformationMatrix, categories, branchFluxes).assemble();
        if (network.hasSymbolicParameters()) {
            assembled = assembled.substituteLagrangians(CapacitanceSubstitution.create(network));
        }
        lagrangian = assembled;

        hamiltonian = null;
        if (network.getAllNodes().size() <= parameters.getSymbolicInversionMaxNodes()) {
            hamiltonian = hamiltonian(false);
        }

        LOGGER.info("Circuit configured: {} periodic, {} extended, {} free, {} frozen variables, {} external fluxes",
                categories.getPeriodic().size(), categories.getExtended().size(), categories.getFree().size(),
                categories.getFrozen().size(), closureFluxes.getFluxes().size());
        LOGGER.debug(PERFORMANCE_MARKER, "Circuit configured in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return this;
    }

    public CircuitNetwork getNetwork() {
        return network;
    }

    public CircuitParameters getParameters() {
        return parameters;
    }

    private void checkConfigured() {
        if (lagrangian == null) {
            throw new PowsyblException("Circuit has not been configured");
        }
    }

    public DenseMatrix getTransformationMatrix() {
        checkConfigured();
        return transformationMatrix;
    }

    public VariableCategories getVariableCategories() {
        checkConfigured();
        return categories;
    }

    public SpanningTree getSpanningTree() {
        checkConfigured();
        return spanningTree;
    }

    public List<Branch> getClosureBranches() {
        checkConfigured();
        return closureFluxes.getClosureBranches();
    }

    public List<Symbol> getExternalFluxes() {
        checkConfigured();
        return closureFluxes.getFluxes();
    }

    /**
     * External flux expression carried by each branch, indexed by branch position.
     */
    public List<Expression> getBranchFluxes() {
        checkConfigured();
        return branchFluxes;
    }

    public boolean isTimeDependentFluxDistribution() {
        return parameters.isFluxDynamic();
    }

    public List<Symbol> getOffsetCharges() {
        checkConfigured();
        return offsetCharges;
    }

    public Expression getLagrangian() {
        checkConfigured();
        return lagrangian.lagrangian();
    }

    public Expression getPotential() {
        checkConfigured();
        return lagrangian.potential();
    }

    public Expression getNodeLagrangian() {
        checkConfigured();
        return lagrangian.nodeLagrangian();
    }

    public Expression getNodePotential() {
        checkConfigured();
        return lagrangian.nodePotential();
    }

    public Expression getHamiltonian() {
        checkConfigured();
        if (hamiltonian == null) {
            hamiltonian = hamiltonian(false);
        }
        return hamiltonian;
    }

    /**
     * Computes the Hamiltonian, inverting the capacitance matrix with parameter values instead of symbols when
     * {@code substituteParameters} is true.
     */
    public Expression hamiltonian(boolean substituteParameters) {
        checkConfigured();
        return new HamiltonianAssembler(network, transformationMatrix, categories, lagrangian.potential())
                .assemble(substituteParameters);
    }

    /**
     * Angular frequencies of the normal modes, only defined for circuits without junctions.
     */
    public Optional<double[]> getNormalModeFrequencies() {
        checkConfigured();
        return Optional.ofNullable(normalModeFrequencies).map(double[]::clone);
    }

    public IslandDecomposition getIslandDecomposition() {
        checkConfigured();
        return islandDecomposition;
    }

    public List<Pair<Integer, Integer>> getJunctionNodePairs() {
        return network.getJunctionNodePairs();
    }

    public void updateParameterValue(String name, double value) {
        network.getSymbolicParameters().setValue(name, value);
        if (network.isPurelyHarmonic()) {
            configure();
        } else {
            hamiltonian = null;
        }
    }

    /**
     * Rounds the numeric coefficients of the Lagrangian and Hamiltonian expressions.
     */
    public void roundCoefficients(int digits) {
        checkConfigured();
        lagrangian = new Lagrangian(lagrangian.lagrangian().round(digits), lagrangian.potential().round(digits),
                lagrangian.nodeLagrangian().round(digits), lagrangian.nodePotential().round(digits));
        if (hamiltonian != null) {
            hamiltonian = hamiltonian.round(digits);
        }
    }
}
